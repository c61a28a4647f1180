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

import static com.google.common.base.Preconditions.checkState;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import static org.trad.routedb.RouteDbSchema.*;

/**
 * Route database stored in a single SQLite file within the application data
 * directory. The file is always opened read-only.
 *
 * Instances are not thread safe, callers have to serialize access (see
 * {@link RouteDbUseCases}).
 */
public final class SQLiteRouteDatabase implements RouteDatabase {

	private static final Logger logger = Logger.getLogger(SQLiteRouteDatabase.class.getName());

	private final Path dataDirectory;
	private final Path dbFile;
	private final SchemaVersionNumber supportedSchemaVersion;

	private Connection connection;
	private SchemaVersionNumber schemaVersion;

	/**
	 * Create a route database for the given application data directory. The
	 * database is STOPPED initially.
	 *
	 * @param dataDirectory The directory containing the route database file.
	 */
	public SQLiteRouteDatabase(Path dataDirectory) {
		this(dataDirectory, SUPPORTED_SCHEMA_VERSION);
	}

	SQLiteRouteDatabase(Path dataDirectory, SchemaVersionNumber supportedSchemaVersion) {
		this.dataDirectory = dataDirectory;
		this.dbFile = dataDirectory.resolve(DB_FILE_NAME);
		this.supportedSchemaVersion = supportedSchemaVersion;
	}

	/**
	 * Gets the path of the live route database file.
	 *
	 * @return The database file path.
	 */
	public Path getDatabasePath() {
		return dbFile;
	}

	@Override
	public void start() throws StorageStartingException {
		if (connection != null) {
			return;
		}
		final String connectionString = dbFile.toString();
		logger.log(Level.INFO, "Connecting to route database at {0}", connectionString); //NON-NLS

		// The driver reports a missing read-only file only with a generic
		// error code, so check it up front.
		if (!Files.isRegularFile(dbFile)) {
			throw new InaccessibleStorageException(connectionString, new NoSuchFileException(connectionString));
		}

		Connection newConnection;
		try {
			SQLiteConfig config = new SQLiteConfig();
			config.setReadOnly(true);
			SQLiteDataSource dataSource = new SQLiteDataSource(config);
			dataSource.setUrl("jdbc:sqlite:" + connectionString); //NON-NLS
			newConnection = dataSource.getConnection();
		} catch (SQLException ex) {
			throw new InaccessibleStorageException(connectionString, ex);
		}

		try {
			SchemaVersionNumber foundVersion = readSchemaVersion(newConnection, connectionString);
			if (false == supportedSchemaVersion.isCompatible(foundVersion)) {
				throw new IncompatibleStorageException(connectionString, foundVersion, supportedSchemaVersion);
			}
			connection = newConnection;
			schemaVersion = foundVersion;
			newConnection = null;
			logger.log(Level.INFO, "Route database started, schema version {0}", foundVersion); //NON-NLS
		} finally {
			if (newConnection != null) {
				closeConnection(newConnection);
			}
		}
	}

	/**
	 * Reads the schema version from the metadata table.
	 */
	private static SchemaVersionNumber readSchemaVersion(Connection dbConnection, String connectionString) throws InvalidStorageFormatException {
		final String query = "SELECT " + METADATA_SCHEMA_MAJOR + ", " + METADATA_SCHEMA_MINOR
				+ " FROM " + METADATA_TABLE + " LIMIT 1"; //NON-NLS
		try (PreparedStatement statement = dbConnection.prepareStatement(query);
				ResultSet resultSet = statement.executeQuery()) {
			if (!resultSet.next()) {
				throw new InvalidStorageFormatException(connectionString, "The metadata table is empty"); //NON-NLS
			}
			int major = resultSet.getInt(METADATA_SCHEMA_MAJOR);
			boolean majorMissing = resultSet.wasNull();
			int minor = resultSet.getInt(METADATA_SCHEMA_MINOR);
			boolean minorMissing = resultSet.wasNull();
			if (majorMissing || minorMissing) {
				throw new InvalidStorageFormatException(connectionString, "The schema version is not set"); //NON-NLS
			}
			return new SchemaVersionNumber(major, minor);
		} catch (SQLException ex) {
			throw new InvalidStorageFormatException(connectionString, "Unable to read the route database metadata", ex); //NON-NLS
		} catch (IllegalArgumentException ex) {
			throw new InvalidStorageFormatException(connectionString, "Invalid schema version", ex); //NON-NLS
		}
	}

	@Override
	public void stop() {
		if (connection == null) {
			return;
		}
		logger.log(Level.INFO, "Disconnecting from route database at {0}", dbFile); //NON-NLS
		closeConnection(connection);
		connection = null;
		schemaVersion = null;
	}

	private static void closeConnection(Connection dbConnection) {
		try {
			dbConnection.close();
		} catch (SQLException ex) {
			logger.log(Level.WARNING, "Error closing route database connection", ex); //NON-NLS
		}
	}

	@Override
	public boolean isStarted() {
		return connection != null;
	}

	@Override
	public void importDatabaseFile(Path sourceFile) throws RouteDbImportException {
		checkState(connection == null, "The route database must be stopped before importing a new file");
		if (!Files.isRegularFile(sourceFile)) {
			throw new RouteDbImportException(RouteDbImportException.Reason.SOURCE_NOT_FOUND,
					"Route database file to import not found: " + sourceFile); //NON-NLS
		}
		logger.log(Level.INFO, "Importing route database file {0}", sourceFile); //NON-NLS

		// Copy next to the live file first, then move it into place. A failing
		// copy never touches the previous database.
		Path tempFile = null;
		try {
			Files.createDirectories(dataDirectory);
			tempFile = Files.createTempFile(dataDirectory, DB_FILE_NAME, ".import"); //NON-NLS
			Files.copy(sourceFile, tempFile, StandardCopyOption.REPLACE_EXISTING);
			try {
				Files.move(tempFile, dbFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException ex) {
				logger.log(Level.FINE, "Atomic move not supported, replacing route database file", ex); //NON-NLS
				Files.move(tempFile, dbFile, StandardCopyOption.REPLACE_EXISTING);
			}
			tempFile = null;
		} catch (IOException ex) {
			RouteDbImportException importEx = new RouteDbImportException(RouteDbImportException.Reason.COPY_FAILED,
					"Unable to import route database file " + sourceFile, ex); //NON-NLS
			if (tempFile != null) {
				try {
					Files.deleteIfExists(tempFile);
				} catch (IOException deleteEx) {
					importEx.addSuppressed(deleteEx);
				}
			}
			throw importEx;
		}
	}

	@Override
	public Instant getCreationDate() throws RouteDbException {
		ensureStarted();
		final String query = "SELECT " + METADATA_COMPILE_TIME + " FROM " + METADATA_TABLE + " LIMIT 1"; //NON-NLS
		try (PreparedStatement statement = connection.prepareStatement(query);
				ResultSet resultSet = statement.executeQuery()) {
			if (resultSet.next()) {
				return TimeUtilities.isoTimeToInstant(resultSet.getString(METADATA_COMPILE_TIME));
			}
		} catch (SQLException | IllegalArgumentException ex) {
			logger.log(Level.FINE, "No valid compile time in route database metadata, using the file time", ex); //NON-NLS
		}

		try {
			return Files.getLastModifiedTime(dbFile).toInstant();
		} catch (IOException ex) {
			throw new RouteDbException("Unable to determine the route database creation date", ex); //NON-NLS
		}
	}

	@Override
	public SchemaVersionNumber getSchemaVersion() {
		ensureStarted();
		return schemaVersion;
	}

	@Override
	public Summit getSummit(long summitId) throws RouteDbException {
		ensureStarted();
		final String query = "SELECT " + SUMMITS_ID + ", " + SUMMITS_NAME
				+ " FROM " + SUMMITS_TABLE + " WHERE " + SUMMITS_ID + " = ?"; //NON-NLS
		try (PreparedStatement statement = connection.prepareStatement(query)) {
			statement.setLong(1, summitId);
			try (ResultSet resultSet = statement.executeQuery()) {
				if (resultSet.next()) {
					return new Summit(resultSet.getLong(SUMMITS_ID), resultSet.getString(SUMMITS_NAME));
				}
			}
		} catch (SQLException ex) {
			throw new RouteDbException("Error getting summit " + summitId, ex); //NON-NLS
		}
		throw new RouteDbException("No summit with id " + summitId); //NON-NLS
	}

	@Override
	public List<Summit> getSummits(String nameFilter) throws RouteDbException {
		ensureStarted();
		String query = "SELECT " + SUMMITS_ID + ", " + SUMMITS_NAME + " FROM " + SUMMITS_TABLE; //NON-NLS
		if (nameFilter != null) {
			logger.log(Level.FINE, "Retrieving summit list filtered by \"{0}\"", nameFilter); //NON-NLS
			query += " WHERE " + SUMMITS_NAME + " LIKE ?"; //NON-NLS
		}
		query += " ORDER BY " + SUMMITS_NAME; //NON-NLS

		List<Summit> summits = new ArrayList<>();
		try (PreparedStatement statement = connection.prepareStatement(query)) {
			if (nameFilter != null) {
				statement.setString(1, "%" + nameFilter + "%");
			}
			try (ResultSet resultSet = statement.executeQuery()) {
				while (resultSet.next()) {
					summits.add(new Summit(resultSet.getLong(SUMMITS_ID), resultSet.getString(SUMMITS_NAME)));
				}
			}
		} catch (SQLException ex) {
			throw new RouteDbException("Error getting summits", ex); //NON-NLS
		}
		return summits;
	}

	@Override
	public List<Route> getRoutesOfSummit(long summitId, RoutesSortOrder sortOrder) throws RouteDbException {
		ensureStarted();
		final String ratingColumn = "avg_rating"; //NON-NLS
		String orderBy;
		switch (sortOrder) {
			case NAME:
				orderBy = ROUTES_TABLE + "." + ROUTES_NAME + " ASC"; //NON-NLS
				break;
			case GRADE:
				orderBy = ROUTES_TABLE + "." + ROUTES_GRADE + " ASC"; //NON-NLS
				break;
			case RATING:
				orderBy = ratingColumn + " DESC"; //NON-NLS
				break;
			default:
				throw new IllegalArgumentException("Unknown sort order " + sortOrder);
		}

		final String query = "SELECT " + ROUTES_TABLE + "." + ROUTES_ID + " AS " + ROUTES_ID
				+ ", " + ROUTES_TABLE + "." + ROUTES_NAME + " AS " + ROUTES_NAME
				+ ", " + ROUTES_TABLE + "." + ROUTES_GRADE + " AS " + ROUTES_GRADE
				+ ", AVG(" + POSTS_TABLE + "." + POSTS_RATING + ") AS " + ratingColumn
				+ " FROM " + ROUTES_TABLE
				+ " LEFT JOIN " + POSTS_TABLE + " ON " + ROUTES_TABLE + "." + ROUTES_ID + " = " + POSTS_TABLE + "." + POSTS_ROUTE_ID
				+ " WHERE " + ROUTES_TABLE + "." + ROUTES_SUMMIT_ID + " = ?"
				+ " GROUP BY " + ROUTES_TABLE + "." + ROUTES_ID + ", " + ROUTES_TABLE + "." + ROUTES_NAME + ", " + ROUTES_TABLE + "." + ROUTES_GRADE
				+ " ORDER BY " + orderBy + ", " + ROUTES_TABLE + "." + ROUTES_ID; //NON-NLS
		logger.log(Level.FINE, "Executing SQL statement: {0}", query); //NON-NLS

		List<Route> routes = new ArrayList<>();
		try (PreparedStatement statement = connection.prepareStatement(query)) {
			statement.setLong(1, summitId);
			try (ResultSet resultSet = statement.executeQuery()) {
				while (resultSet.next()) {
					double rating = resultSet.getDouble(ratingColumn);
					Double avgRating = resultSet.wasNull() ? null : rating;
					routes.add(new Route(resultSet.getLong(ROUTES_ID), resultSet.getString(ROUTES_NAME),
							resultSet.getString(ROUTES_GRADE), avgRating));
				}
			}
		} catch (SQLException ex) {
			throw new RouteDbException("Error getting routes of summit " + summitId, ex); //NON-NLS
		}
		return routes;
	}

	@Override
	public Route getRoute(long routeId) throws RouteDbException {
		ensureStarted();
		final String query = "SELECT " + ROUTES_ID + ", " + ROUTES_NAME + ", " + ROUTES_GRADE
				+ " FROM " + ROUTES_TABLE + " WHERE " + ROUTES_ID + " = ?"; //NON-NLS
		try (PreparedStatement statement = connection.prepareStatement(query)) {
			statement.setLong(1, routeId);
			try (ResultSet resultSet = statement.executeQuery()) {
				if (resultSet.next()) {
					return new Route(resultSet.getLong(ROUTES_ID), resultSet.getString(ROUTES_NAME),
							resultSet.getString(ROUTES_GRADE), null);
				}
			}
		} catch (SQLException ex) {
			throw new RouteDbException("Error getting route " + routeId, ex); //NON-NLS
		}
		throw new RouteDbException("No route with id " + routeId); //NON-NLS
	}

	@Override
	public List<Post> getPostsOfRoute(long routeId, PostsSortOrder sortOrder) throws RouteDbException {
		ensureStarted();
		logger.log(Level.FINE, "Retrieving posts for route {0}, sorted by {1}", new Object[]{routeId, sortOrder}); //NON-NLS
		final String direction = sortOrder == PostsSortOrder.NEWEST_FIRST ? "DESC" : "ASC"; //NON-NLS
		final String query = "SELECT " + POSTS_USER_NAME + ", " + POSTS_DATE + ", " + POSTS_COMMENT + ", " + POSTS_RATING
				+ " FROM " + POSTS_TABLE + " WHERE " + POSTS_ROUTE_ID + " = ?"
				+ " ORDER BY " + POSTS_DATE + " " + direction + ", " + POSTS_ID + " " + direction; //NON-NLS

		List<Post> posts = new ArrayList<>();
		try (PreparedStatement statement = connection.prepareStatement(query)) {
			statement.setLong(1, routeId);
			try (ResultSet resultSet = statement.executeQuery()) {
				while (resultSet.next()) {
					posts.add(new Post(resultSet.getString(POSTS_USER_NAME),
							TimeUtilities.isoTimeToInstant(resultSet.getString(POSTS_DATE)),
							resultSet.getString(POSTS_COMMENT),
							resultSet.getInt(POSTS_RATING)));
				}
			}
		} catch (SQLException | IllegalArgumentException ex) {
			throw new RouteDbException("Error getting posts of route " + routeId, ex); //NON-NLS
		}
		return posts;
	}

	private void ensureStarted() {
		checkState(connection != null, "The route database has not been started");
	}
}
