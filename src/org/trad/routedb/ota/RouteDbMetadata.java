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
package org.trad.routedb.ota;

import com.google.gson.JsonParseException;
import java.time.Instant;
import org.trad.routedb.TimeUtilities;

/**
 * A single route database as described by the update service, deserialized
 * by Gson. All fields are mandatory. The schema version parts are kept as
 * sent, records of other schema lines may use any numbers.
 */
class RouteDbMetadata {

	private String downloadUrl;
	private Integer schemaVersionMajor;
	private Integer schemaVersionMinor;
	private String creationDate;

	/**
	 * Ensures that all fields are present and the creation date is valid.
	 *
	 * @throws JsonParseException if a field is missing or malformed.
	 */
	void validate() throws JsonParseException {
		requireField(downloadUrl, "downloadUrl"); //NON-NLS
		requireField(schemaVersionMajor, "schemaVersionMajor"); //NON-NLS
		requireField(schemaVersionMinor, "schemaVersionMinor"); //NON-NLS
		requireField(creationDate, "creationDate"); //NON-NLS
		try {
			getCreationDate();
		} catch (IllegalArgumentException ex) {
			throw new JsonParseException("Invalid route database metadata: " + ex.getMessage(), ex); //NON-NLS
		}
	}

	private static void requireField(Object value, String name) {
		if (value == null) {
			throw new JsonParseException("Missing field " + name + " in route database metadata"); //NON-NLS
		}
	}

	String getDownloadUrl() {
		return downloadUrl;
	}

	int getSchemaVersionMajor() {
		return schemaVersionMajor;
	}

	int getSchemaVersionMinor() {
		return schemaVersionMinor;
	}

	Instant getCreationDate() {
		return TimeUtilities.isoTimeToInstant(creationDate);
	}
}
