/*
 * trad Route Database
 *
 * Copyright 2025 trad contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.trad.routedb;

/**
 * Thrown when a storage file could be opened but is not a route database,
 * i.e. its metadata table is missing or malformed.
 */
public final class InvalidStorageFormatException extends StorageStartingException {

	private static final long serialVersionUID = 1L;

	/**
	 * Create exception with a description of the format problem.
	 *
	 * @param connectionString The database file path.
	 * @param reason           What is wrong with the file (not meant for
	 *                         users).
	 */
	public InvalidStorageFormatException(String connectionString, String reason) {
		super(connectionString, reason + " (" + connectionString + ")");
	}

	/**
	 * Create exception with a description of the format problem and the error
	 * that revealed it.
	 *
	 * @param connectionString The database file path.
	 * @param reason           What is wrong with the file (not meant for
	 *                         users).
	 * @param ex               The underlying error.
	 */
	public InvalidStorageFormatException(String connectionString, String reason, Exception ex) {
		super(connectionString, reason + " (" + connectionString + ")", ex);
	}

	@Override
	public Reason getReason() {
		return Reason.INVALID_FORMAT;
	}
}
