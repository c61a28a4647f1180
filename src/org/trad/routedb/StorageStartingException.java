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
 * Thrown when a route database cannot be started. The concrete problem is
 * identified by {@link #getReason()}; each reason has exactly one subclass
 * carrying the details.
 */
public abstract class StorageStartingException extends RouteDbException {

	private static final long serialVersionUID = 1L;

	/**
	 * The closed set of reasons why starting a storage can fail.
	 */
	public enum Reason {
		/**
		 * The storage file could not be opened at all (missing file,
		 * permission problem, driver refused to open it).
		 */
		INACCESSIBLE,
		/**
		 * The storage could be opened but does not contain the expected
		 * metadata.
		 */
		INVALID_FORMAT,
		/**
		 * The storage metadata is present but its schema version is not
		 * accepted by this application.
		 */
		INCOMPATIBLE
	}

	private final String connectionString;

	StorageStartingException(String connectionString, String msg) {
		super(msg);
		this.connectionString = connectionString;
	}

	StorageStartingException(String connectionString, String msg, Exception ex) {
		super(msg, ex);
		this.connectionString = connectionString;
	}

	/**
	 * Gets the connection string (the database file path) of the storage that
	 * failed to start.
	 *
	 * @return The connection string.
	 */
	public String getConnectionString() {
		return connectionString;
	}

	/**
	 * Gets the reason of the failure.
	 *
	 * @return The reason.
	 */
	public abstract Reason getReason();
}
