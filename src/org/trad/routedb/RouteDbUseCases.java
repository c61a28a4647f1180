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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.trad.routedb.ota.RouteDbDownloadService;

/**
 * Entry point for the route database use cases. All use cases run one after
 * the other on a dedicated background thread, so the calling thread is never
 * blocked by network or file operations. Callers may wait for completion
 * using the returned futures.
 */
public final class RouteDbUseCases implements AutoCloseable {

	private static final Logger logger = Logger.getLogger(RouteDbUseCases.class.getName());

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

	private final RouteDatabase routeDatabase;
	private final RouteDbInstaller installer;
	private final ExecutorService executor;

	/**
	 * Create the use cases for the given collaborators.
	 *
	 * @param routeDatabase   The route database.
	 * @param downloadService The source of route database updates.
	 * @param statusListener  Receives the route database status changes.
	 */
	public RouteDbUseCases(RouteDatabase routeDatabase, RouteDbDownloadService downloadService, RouteDbStatusListener statusListener) {
		this(routeDatabase, new RouteDbInstaller(routeDatabase, downloadService, statusListener));
	}

	RouteDbUseCases(RouteDatabase routeDatabase, RouteDbInstaller installer) {
		this.routeDatabase = routeDatabase;
		this.installer = installer;
		this.executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
				.setNameFormat("routedb-usecases-%d") //NON-NLS
				.setDaemon(true)
				.build());
	}

	/**
	 * Use Case: Connect the route database on application start and publish
	 * whether it is available.
	 *
	 * @return Completes when the status has been published.
	 */
	public Future<?> startRouteDatabase() {
		logger.log(Level.FINE, "Scheduling use case startRouteDatabase()"); //NON-NLS
		return executor.submit(installer::activateRouteDatabase);
	}

	/**
	 * Use Case: Replace the route database by the given file.
	 *
	 * @param databaseFile The file to import.
	 *
	 * @return Completes when the new status has been published.
	 */
	public Future<?> importRouteDbFile(Path databaseFile) {
		logger.log(Level.FINE, "Scheduling use case importRouteDbFile({0})", databaseFile); //NON-NLS
		return executor.submit(() -> installer.installFromLocalFile(databaseFile));
	}

	/**
	 * Use Case: Install the newest route database offered by the update
	 * service, if it is newer than the current one.
	 *
	 * @return Completes when the update check (and installation) is done.
	 */
	public Future<?> updateRouteDatabase() {
		logger.log(Level.FINE, "Scheduling use case updateRouteDatabase()"); //NON-NLS
		return executor.submit(installer::updateFromRemote);
	}

	/**
	 * Waits for pending use cases, then stops the route database.
	 */
	@Override
	public void close() {
		if (executor.isShutdown()) {
			return;
		}
		executor.execute(routeDatabase::stop);
		executor.shutdown();
		try {
			if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				logger.log(Level.WARNING, "Route database use cases did not finish in time"); //NON-NLS
				executor.shutdownNow();
			}
		} catch (InterruptedException ex) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
