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
 * Table and column names of the route database, and the schema version this
 * application is built for. Always use these constants when referring to the
 * database structure.
 */
public final class RouteDbSchema {

	/**
	 * The schema version currently supported (and required) by this
	 * application.
	 */
	public static final SchemaVersionNumber SUPPORTED_SCHEMA_VERSION = new SchemaVersionNumber(1, 0);

	/**
	 * The file name of the route database within the application data
	 * directory.
	 */
	static final String DB_FILE_NAME = "peaks.sqlite"; //NON-NLS

	/**
	 * Static metadata about the database itself, exactly one row.
	 */
	static final String METADATA_TABLE = "database_metadata"; //NON-NLS
	static final String METADATA_SCHEMA_MAJOR = "schema_version_major"; //NON-NLS
	static final String METADATA_SCHEMA_MINOR = "schema_version_minor"; //NON-NLS
	static final String METADATA_COMPILE_TIME = "compile_time"; //NON-NLS
	static final String METADATA_VENDOR = "vendor"; //NON-NLS

	static final String SUMMITS_TABLE = "summits"; //NON-NLS
	static final String SUMMITS_ID = "id"; //NON-NLS
	static final String SUMMITS_NAME = "summit_name"; //NON-NLS

	static final String ROUTES_TABLE = "routes"; //NON-NLS
	static final String ROUTES_ID = "id"; //NON-NLS
	static final String ROUTES_SUMMIT_ID = "summit_id"; //NON-NLS
	static final String ROUTES_NAME = "route_name"; //NON-NLS
	static final String ROUTES_GRADE = "route_grade"; //NON-NLS

	static final String POSTS_TABLE = "posts"; //NON-NLS
	static final String POSTS_ID = "id"; //NON-NLS
	static final String POSTS_ROUTE_ID = "route_id"; //NON-NLS
	static final String POSTS_USER_NAME = "user_name"; //NON-NLS
	static final String POSTS_DATE = "post_date"; //NON-NLS
	static final String POSTS_COMMENT = "comment"; //NON-NLS
	static final String POSTS_RATING = "rating"; //NON-NLS

	private RouteDbSchema() {
	}
}
