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
 * Thrown when a database file cannot be imported as the new route database.
 * The previous route database file (if any) is left untouched in this case.
 */
public class RouteDbImportException extends RouteDbException {

	private static final long serialVersionUID = 1L;

	/**
	 * Why an import failed.
	 */
	public enum Reason {
		/**
		 * The file to import does not exist or is not a regular file.
		 */
		SOURCE_NOT_FOUND,
		/**
		 * Copying the file into place failed.
		 */
		COPY_FAILED
	}

	private final Reason reason;

	public RouteDbImportException(Reason reason, String msg) {
		super(msg);
		this.reason = reason;
	}

	public RouteDbImportException(Reason reason, String msg, Exception ex) {
		super(msg, ex);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}
}
