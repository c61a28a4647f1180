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

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * The local, read-only route database.
 *
 * A route database is either STOPPED (initial state, no open connection) or
 * STARTED (connected, schema version verified). {@link #start()} and
 * {@link #stop()} switch between the two states. All query methods require a
 * STARTED database and throw an IllegalStateException otherwise, while
 * {@link #importDatabaseFile(Path)} is only allowed on a STOPPED one.
 */
public interface RouteDatabase {

	/**
	 * Opens the route database file read-only and verifies its schema
	 * version, changing the state to STARTED. Does nothing if the database is
	 * already started. If this fails the database stays STOPPED.
	 *
	 * @throws InaccessibleStorageException  if the file cannot be opened.
	 * @throws InvalidStorageFormatException if the file lacks valid metadata.
	 * @throws IncompatibleStorageException  if the schema version is not
	 *                                       supported.
	 */
	void start() throws StorageStartingException;

	/**
	 * Closes the connection to the route database, changing the state to
	 * STOPPED. Does nothing if the database is already stopped.
	 */
	void stop();

	/**
	 * @return true if the database is STARTED.
	 */
	boolean isStarted();

	/**
	 * Replaces the route database file by a copy of the given file. Either
	 * the new file is completely in place afterwards, or the previous file is
	 * left unchanged. The schema version of the new file is not checked before
	 * the next {@link #start()}.
	 *
	 * @param sourceFile The database file to import.
	 *
	 * @throws RouteDbImportException if the file cannot be imported.
	 * @throws IllegalStateException  if the database is STARTED.
	 */
	void importDatabaseFile(Path sourceFile) throws RouteDbImportException;

	/**
	 * Gets the point in time the started route database was created.
	 *
	 * @return The creation date.
	 *
	 * @throws RouteDbException if the date cannot be determined.
	 */
	Instant getCreationDate() throws RouteDbException;

	/**
	 * @return The schema version embedded in the started route database.
	 */
	SchemaVersionNumber getSchemaVersion();

	/**
	 * Gets a single summit.
	 *
	 * @param summitId The row id of the summit.
	 *
	 * @return The summit.
	 *
	 * @throws RouteDbException if there is no such summit or the query fails.
	 */
	Summit getSummit(long summitId) throws RouteDbException;

	/**
	 * Gets all summits whose name contains the given filter text, ordered by
	 * name.
	 *
	 * @param nameFilter The text to search for, or null to get all summits.
	 *
	 * @return The matching summits, possibly empty.
	 *
	 * @throws RouteDbException if the query fails.
	 */
	List<Summit> getSummits(String nameFilter) throws RouteDbException;

	/**
	 * Gets all routes onto the given summit, together with their average
	 * rating.
	 *
	 * @param summitId  The row id of the summit.
	 * @param sortOrder How to order the result.
	 *
	 * @return The routes, empty for unknown summits.
	 *
	 * @throws RouteDbException if the query fails.
	 */
	List<Route> getRoutesOfSummit(long summitId, RoutesSortOrder sortOrder) throws RouteDbException;

	/**
	 * Gets a single route. The rating of the returned route is not set.
	 *
	 * @param routeId The row id of the route.
	 *
	 * @return The route.
	 *
	 * @throws RouteDbException if there is no such route or the query fails.
	 */
	Route getRoute(long routeId) throws RouteDbException;

	/**
	 * Gets all posts of the given route.
	 *
	 * @param routeId   The row id of the route.
	 * @param sortOrder How to order the result.
	 *
	 * @return The posts, empty for unknown routes.
	 *
	 * @throws RouteDbException if the query fails.
	 */
	List<Post> getPostsOfRoute(long routeId, PostsSortOrder sortOrder) throws RouteDbException;
}
