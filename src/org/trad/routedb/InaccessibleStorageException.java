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
 * Thrown when starting a storage fails because it is not accessible, e.g.
 * because the file does not exist, cannot be read or is locked.
 */
public final class InaccessibleStorageException extends StorageStartingException {

	private static final long serialVersionUID = 1L;

	/**
	 * Create exception for the storage at the given location.
	 *
	 * @param connectionString The database file path.
	 * @param accessError      The error raised while opening the storage.
	 */
	public InaccessibleStorageException(String connectionString, Exception accessError) {
		super(connectionString, "Unable to open route database " + connectionString + ": " + accessError.getMessage(), accessError); //NON-NLS
	}

	@Override
	public Reason getReason() {
		return Reason.INACCESSIBLE;
	}
}
