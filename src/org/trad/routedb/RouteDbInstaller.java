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
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.trad.routedb.ota.RouteDbDownloadService;
import org.trad.routedb.ota.UpdateCandidate;
import org.trad.routedb.ota.UpdateCandidateSelector;
import org.trad.routedb.ota.UpdateFetchException;

/**
 * Replaces the route database, either by a local file or by the best update
 * the update service offers. None of the operations throws: every failure is
 * logged and ends in a status notification, and a previously working route
 * database is kept whenever the replacement cannot be installed.
 */
public final class RouteDbInstaller {

	private static final Logger logger = Logger.getLogger(RouteDbInstaller.class.getName());

	private final RouteDatabase routeDatabase;
	private final RouteDbDownloadService downloadService;
	private final RouteDbStatusListener statusListener;

	/**
	 * Create an installer.
	 *
	 * @param routeDatabase   The route database to manage.
	 * @param downloadService The source of route database updates.
	 * @param statusListener  Receives the route database status after every
	 *                        installation attempt.
	 */
	public RouteDbInstaller(RouteDatabase routeDatabase, RouteDbDownloadService downloadService, RouteDbStatusListener statusListener) {
		this.routeDatabase = routeDatabase;
		this.downloadService = downloadService;
		this.statusListener = statusListener;
	}

	/**
	 * Starts the route database if necessary and publishes its status.
	 */
	public void activateRouteDatabase() {
		Instant creationDate = null;
		try {
			routeDatabase.start();
			creationDate = routeDatabase.getCreationDate();
			logger.log(Level.INFO, "Route database from {0} is active", creationDate); //NON-NLS
		} catch (StorageStartingException ex) {
			logStartFailure(ex);
		} catch (RouteDbException ex) {
			logger.log(Level.WARNING, "Unable to read the creation date of the route database", ex); //NON-NLS
			routeDatabase.stop();
		}
		statusListener.updateRouteDbStatus(creationDate);
	}

	/**
	 * Installs the given file as new route database. If the file cannot be
	 * imported the previous route database is started again.
	 *
	 * @param databaseFile The route database file to install.
	 */
	public void installFromLocalFile(Path databaseFile) {
		logger.log(Level.INFO, "Installing route database file {0}", databaseFile); //NON-NLS
		if (routeDatabase.isStarted()) {
			routeDatabase.stop();
		}
		try {
			routeDatabase.importDatabaseFile(databaseFile);
		} catch (RouteDbImportException ex) {
			switch (ex.getReason()) {
				case SOURCE_NOT_FOUND:
					logger.log(Level.WARNING, "Route database file to install does not exist: {0}", databaseFile); //NON-NLS
					break;
				case COPY_FAILED:
					logger.log(Level.WARNING, "Unable to import route database file " + databaseFile, ex); //NON-NLS
					break;
				default:
					logger.log(Level.WARNING, "Route database import failed", ex); //NON-NLS
			}
		}
		// Also restarts the previous database if the import failed
		activateRouteDatabase();
	}

	/**
	 * Downloads and installs the best available route database update, if
	 * there is one that is newer than the active route database. Failing to
	 * retrieve updates is treated as "no update available".
	 */
	public void updateFromRemote() {
		List<UpdateCandidate> candidates;
		try {
			candidates = downloadService.getAvailableUpdateCandidates();
		} catch (UpdateFetchException ex) {
			logFetchFailure(ex);
			return;
		}

		Instant currentCreationDate = null;
		if (routeDatabase.isStarted()) {
			try {
				currentCreationDate = routeDatabase.getCreationDate();
			} catch (RouteDbException ex) {
				// Without the date any candidate would look newer
				logger.log(Level.WARNING, "Unable to read the creation date of the route database, skipping update", ex); //NON-NLS
				return;
			}
		}

		Optional<UpdateCandidate> selected = UpdateCandidateSelector.selectBestCandidate(currentCreationDate, candidates);
		if (!selected.isPresent()) {
			logger.log(Level.INFO, "No route database update available"); //NON-NLS
			return;
		}

		logger.log(Level.INFO, "Installing route database update {0}", selected.get()); //NON-NLS
		try {
			Path downloadedFile = downloadService.downloadRouteDatabase(selected.get());
			installFromLocalFile(downloadedFile);
		} catch (UpdateFetchException ex) {
			logFetchFailure(ex);
		} finally {
			downloadService.cleanupResources();
		}
	}

	private static void logStartFailure(StorageStartingException ex) {
		switch (ex.getReason()) {
			case INACCESSIBLE:
				logger.log(Level.INFO, "No route database available: {0}", ex.getMessage()); //NON-NLS
				break;
			case INVALID_FORMAT:
				logger.log(Level.WARNING, "The route database file is invalid", ex); //NON-NLS
				break;
			case INCOMPATIBLE:
				IncompatibleStorageException incompatibleEx = (IncompatibleStorageException) ex;
				logger.log(Level.WARNING, "The route database has schema version {0}, but {1} is required", //NON-NLS
						new Object[]{incompatibleEx.getFoundVersion(), incompatibleEx.getRequiredVersion()});
				break;
			default:
				logger.log(Level.WARNING, "Unable to start the route database", ex); //NON-NLS
		}
	}

	private static void logFetchFailure(UpdateFetchException ex) {
		switch (ex.getReason()) {
			case NETWORK:
				logger.log(Level.WARNING, "Route database update service not reachable: {0}", ex.getMessage()); //NON-NLS
				break;
			case INVALID_FORMAT:
				logger.log(Level.WARNING, "Route database update service sent invalid data", ex); //NON-NLS
				break;
			default:
				logger.log(Level.WARNING, "Unable to fetch route database update", ex); //NON-NLS
		}
	}
}
