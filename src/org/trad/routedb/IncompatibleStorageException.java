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
 * Thrown when a route database uses a schema version that this application
 * cannot read. This typically happens after the application has been up- or
 * downgraded to a version that requires a different schema.
 *
 * @see SchemaVersionNumber#isCompatible(SchemaVersionNumber)
 */
public final class IncompatibleStorageException extends StorageStartingException {

	private static final long serialVersionUID = 1L;

	private final SchemaVersionNumber foundVersion;
	private final SchemaVersionNumber requiredVersion;

	/**
	 * Create exception for a storage with an unsupported schema version.
	 *
	 * @param connectionString The database file path.
	 * @param foundVersion     The schema version embedded in the database.
	 * @param requiredVersion  The schema version supported by this
	 *                         application.
	 */
	public IncompatibleStorageException(String connectionString, SchemaVersionNumber foundVersion, SchemaVersionNumber requiredVersion) {
		super(connectionString, "Unsupported route database schema version " + foundVersion
				+ ", the supported schema version is " + requiredVersion + " (" + connectionString + ")"); //NON-NLS
		this.foundVersion = foundVersion;
		this.requiredVersion = requiredVersion;
	}

	public SchemaVersionNumber getFoundVersion() {
		return foundVersion;
	}

	public SchemaVersionNumber getRequiredVersion() {
		return requiredVersion;
	}

	@Override
	public Reason getReason() {
		return Reason.INCOMPATIBLE;
	}
}
