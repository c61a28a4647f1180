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

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.trad.routedb.ota.CompatibilityMode;
import org.trad.routedb.ota.UpdateCandidate;
import org.trad.routedb.ota.UpdateFetchException;

/**
 * Tests that RouteDbInstaller drives the route database lifecycle correctly
 * and turns every failure into a status update.
 */
public class RouteDbInstallerTest {

	private static final Instant OLD_DATE = Instant.parse("2023-01-01T00:00:00Z");
	private static final Instant NEW_DATE = Instant.parse("2024-06-01T00:00:00Z");
	private static final Path NEW_FILE = Paths.get("new.sqlite");

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	private FakeRouteDatabase routeDb;
	private FakeDownloadService downloadService;
	private RecordingStatusListener listener;
	private RouteDbInstaller installer;

	@Before
	public void setUp() {
		routeDb = new FakeRouteDatabase();
		downloadService = new FakeDownloadService();
		listener = new RecordingStatusListener();
		installer = new RouteDbInstaller(routeDb, downloadService, listener);
	}

	@Test
	public void testInstallStopsBeforeImport() {
		routeDb.setStarted(true);
		routeDb.creationDate = OLD_DATE;
		routeDb.importedCreationDate = NEW_DATE;

		installer.installFromLocalFile(NEW_FILE);

		assertEquals(Arrays.asList("stop", "import", "start"), routeDb.calls);
		assertEquals(Collections.singletonList(NEW_FILE), routeDb.importedFiles);
		assertTrue(routeDb.isStarted());
		assertEquals(Collections.singletonList(NEW_DATE), listener.updates);
	}

	@Test
	public void testInstallWithoutRunningDatabase() {
		routeDb.importedCreationDate = NEW_DATE;

		installer.installFromLocalFile(NEW_FILE);

		assertEquals(Arrays.asList("import", "start"), routeDb.calls);
		assertEquals(Collections.singletonList(NEW_DATE), listener.updates);
	}

	@Test
	public void testFailedImportRestartsPreviousDatabase() {
		routeDb.setStarted(true);
		routeDb.creationDate = OLD_DATE;
		routeDb.importFailure = new RouteDbImportException(RouteDbImportException.Reason.COPY_FAILED,
				"disk full", new IOException("No space left on device"));

		installer.installFromLocalFile(NEW_FILE);

		assertEquals(Arrays.asList("stop", "import", "start"), routeDb.calls);
		assertEquals(Collections.singletonList(OLD_DATE), listener.updates);
	}

	@Test
	public void testInstallMissingFileWithoutPreviousDatabase() {
		routeDb.importFailure = new RouteDbImportException(RouteDbImportException.Reason.SOURCE_NOT_FOUND, "missing");
		routeDb.startFailure = new InaccessibleStorageException("peaks.sqlite", new NoSuchFileException("peaks.sqlite"));

		installer.installFromLocalFile(NEW_FILE);

		assertFalse(routeDb.isStarted());
		assertEquals(Collections.singletonList((Instant) null), listener.updates);
	}

	@Test
	public void testInstallIncompatibleDatabase() {
		routeDb.startFailure = new IncompatibleStorageException("peaks.sqlite",
				new SchemaVersionNumber(2, 0), new SchemaVersionNumber(1, 0));

		installer.installFromLocalFile(NEW_FILE);

		assertFalse(routeDb.isStarted());
		assertEquals(Collections.singletonList((Instant) null), listener.updates);
	}

	@Test
	public void testInstallInvalidDatabase() {
		routeDb.startFailure = new InvalidStorageFormatException("peaks.sqlite", "no metadata");

		installer.installFromLocalFile(NEW_FILE);

		assertEquals(Collections.singletonList((Instant) null), listener.updates);
	}

	@Test
	public void testUnreadableCreationDateMeansNoDatabase() {
		routeDb.creationDateFailure = new RouteDbException("broken");

		installer.activateRouteDatabase();

		assertFalse(routeDb.isStarted());
		assertEquals(Collections.singletonList((Instant) null), listener.updates);
	}

	/**
	 * Uses a real route database to make sure nothing escapes the installer
	 * when the file to install does not exist.
	 */
	@Test
	public void testInstallMissingFileIntoEmptyDataDirectory() throws IOException {
		SQLiteRouteDatabase sqliteDb = new SQLiteRouteDatabase(tempFolder.newFolder("data").toPath());
		RouteDbInstaller realInstaller = new RouteDbInstaller(sqliteDb, downloadService, listener);

		realInstaller.installFromLocalFile(tempFolder.getRoot().toPath().resolve("does-not-exist.sqlite"));

		assertFalse(sqliteDb.isStarted());
		assertEquals(Collections.singletonList((Instant) null), listener.updates);
	}

	@Test
	public void testUpdateFetchFailureIsSilent() {
		routeDb.setStarted(true);
		routeDb.creationDate = OLD_DATE;
		downloadService.listFailure = new UpdateFetchException(UpdateFetchException.Reason.NETWORK,
				"offline", new IOException("Connection refused"));

		installer.updateFromRemote();

		assertTrue(routeDb.calls.isEmpty());
		assertTrue(routeDb.isStarted());
		assertTrue(listener.updates.isEmpty());
		assertEquals(0, downloadService.cleanupCalls);
	}

	@Test
	public void testUpdateWithoutNewerCandidate() {
		routeDb.setStarted(true);
		routeDb.creationDate = NEW_DATE;
		downloadService.candidates.add(new UpdateCandidate("old.sqlite", OLD_DATE, CompatibilityMode.EXACT_MATCH));
		downloadService.candidates.add(new UpdateCandidate("same.sqlite", NEW_DATE, CompatibilityMode.EXACT_MATCH));

		installer.updateFromRemote();

		assertTrue(downloadService.downloaded.isEmpty());
		assertTrue(routeDb.calls.isEmpty());
		assertTrue(listener.updates.isEmpty());
	}

	@Test
	public void testUpdateInstallsBestCandidate() {
		routeDb.setStarted(true);
		routeDb.creationDate = OLD_DATE;
		routeDb.importedCreationDate = NEW_DATE;
		UpdateCandidate best = new UpdateCandidate("new.sqlite", NEW_DATE, CompatibilityMode.EXACT_MATCH);
		downloadService.candidates.add(new UpdateCandidate("older.sqlite", OLD_DATE.plusSeconds(60), CompatibilityMode.EXACT_MATCH));
		downloadService.candidates.add(best);
		downloadService.downloadedFile = NEW_FILE;

		installer.updateFromRemote();

		assertEquals(Collections.singletonList(best), downloadService.downloaded);
		assertEquals(Arrays.asList("stop", "import", "start"), routeDb.calls);
		assertEquals(Collections.singletonList(NEW_FILE), routeDb.importedFiles);
		assertEquals(Collections.singletonList(NEW_DATE), listener.updates);
		assertEquals(1, downloadService.cleanupCalls);
	}

	@Test
	public void testUpdateWithoutInstalledDatabase() {
		routeDb.importedCreationDate = OLD_DATE;
		downloadService.candidates.add(new UpdateCandidate("first.sqlite", OLD_DATE, CompatibilityMode.BACKWARD_COMPATIBLE));
		downloadService.downloadedFile = NEW_FILE;

		installer.updateFromRemote();

		assertEquals(1, downloadService.downloaded.size());
		assertEquals(Collections.singletonList(OLD_DATE), listener.updates);
		assertEquals(1, downloadService.cleanupCalls);
	}

	@Test
	public void testUpdateSkippedWhenCreationDateUnreadable() {
		routeDb.setStarted(true);
		routeDb.creationDateFailure = new RouteDbException("broken metadata");
		downloadService.candidates.add(new UpdateCandidate("old.sqlite", OLD_DATE, CompatibilityMode.EXACT_MATCH));
		downloadService.downloadedFile = NEW_FILE;

		installer.updateFromRemote();

		assertTrue(downloadService.downloaded.isEmpty());
		assertTrue(routeDb.calls.isEmpty());
		assertTrue(routeDb.isStarted());
		assertTrue(listener.updates.isEmpty());
		assertEquals(0, downloadService.cleanupCalls);
	}

	/**
	 * The installed database reports the same creation date the update
	 * service published for it, so it is not offered again.
	 */
	@Test
	public void testInstalledUpdateIsNotInstalledAgain() {
		routeDb.setStarted(true);
		routeDb.creationDate = OLD_DATE;
		routeDb.importedCreationDate = NEW_DATE;
		downloadService.candidates.add(new UpdateCandidate("new.sqlite", NEW_DATE, CompatibilityMode.EXACT_MATCH));
		downloadService.downloadedFile = NEW_FILE;

		installer.updateFromRemote();
		installer.updateFromRemote();

		assertEquals(1, downloadService.downloaded.size());
		assertEquals(Collections.singletonList(NEW_FILE), routeDb.importedFiles);
		assertEquals(Collections.singletonList(NEW_DATE), listener.updates);
		assertEquals(1, downloadService.cleanupCalls);
	}

	@Test
	public void testFailedDownloadKeepsDatabaseAndCleansUp() {
		routeDb.setStarted(true);
		routeDb.creationDate = OLD_DATE;
		downloadService.candidates.add(new UpdateCandidate("new.sqlite", NEW_DATE, CompatibilityMode.EXACT_MATCH));
		downloadService.downloadFailure = new UpdateFetchException(UpdateFetchException.Reason.NETWORK,
				"timeout", new IOException("Read timed out"));

		installer.updateFromRemote();

		assertTrue(routeDb.calls.isEmpty());
		assertTrue(routeDb.isStarted());
		assertTrue(listener.updates.isEmpty());
		assertEquals(1, downloadService.cleanupCalls);
	}

	@Test
	public void testStatusAfterActivation() {
		routeDb.creationDate = OLD_DATE;

		installer.activateRouteDatabase();

		assertTrue(routeDb.isStarted());
		assertEquals(Collections.singletonList(OLD_DATE), listener.updates);
		assertEquals(Collections.singletonList("start"), routeDb.calls);
	}
}
