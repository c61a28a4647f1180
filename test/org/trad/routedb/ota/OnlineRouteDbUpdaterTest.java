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

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.trad.routedb.SchemaVersionNumber;

public class OnlineRouteDbUpdaterTest {

	private static final URI BASE_URL = URI.create("https://example.org/trad/ota/");

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	private FakeHttpNetworking networking;
	private Path tempRoot;
	private OnlineRouteDbUpdater updater;

	@Before
	public void setUp() throws IOException {
		networking = new FakeHttpNetworking();
		tempRoot = tempFolder.newFolder("downloads").toPath();
		updater = new OnlineRouteDbUpdater(networking, new UpdateServiceSettings(BASE_URL, "api.php", 1000, 1000),
				tempRoot, new SchemaVersionNumber(1, 1));
	}

	private static String entry(String url, int major, int minor, String creationDate) {
		return String.format("{\"downloadUrl\": \"%s\", \"schemaVersionMajor\": %d, "
				+ "\"schemaVersionMinor\": %d, \"creationDate\": \"%s\"}", url, major, minor, creationDate);
	}

	@Test
	public void testCandidatesAreFilteredAndTagged() throws Exception {
		networking.jsonResponse = "["
				+ entry("db/v1.0.sqlite", 1, 0, "2024-01-01T00:00:00Z") + ", "
				+ entry("db/v1.2.sqlite", 1, 2, "2024-03-01T00:00:00Z") + ", "
				+ entry("db/v2.0.sqlite", 2, 0, "2024-02-01T00:00:00Z") + "]";

		List<UpdateCandidate> candidates = updater.getAvailableUpdateCandidates();

		assertEquals(Collections.singletonList(new UpdateCandidate("db/v1.2.sqlite",
				Instant.parse("2024-03-01T00:00:00Z"), CompatibilityMode.BACKWARD_COMPATIBLE)), candidates);
		assertEquals(Collections.singletonList(BASE_URL.resolve("api.php")), networking.requests);

		// End to end: nothing installed yet, so the only candidate is selected
		assertEquals(candidates.get(0), UpdateCandidateSelector.selectBestCandidate(null, candidates).get());
	}

	@Test
	public void testExactMatch() throws Exception {
		networking.jsonResponse = "[" + entry("db/v1.1.sqlite", 1, 1, "2024-03-01 10:00:00") + "]";

		List<UpdateCandidate> candidates = updater.getAvailableUpdateCandidates();

		assertEquals(1, candidates.size());
		assertEquals(CompatibilityMode.EXACT_MATCH, candidates.get(0).getCompatibilityMode());
		assertEquals(Instant.parse("2024-03-01T10:00:00Z"), candidates.get(0).getCreationDate());
	}

	@Test
	public void testRecordsOfOtherSchemaLinesAreDroppedWhateverTheirVersion() throws Exception {
		networking.jsonResponse = "["
				+ entry("db/v1.1.sqlite", 1, 1, "2024-03-01T00:00:00Z") + ", "
				+ entry("db/v2.1000.sqlite", 2, 1000, "2024-04-01T00:00:00Z") + ", "
				+ entry("db/v-1.0.sqlite", -1, 0, "2024-05-01T00:00:00Z") + ", "
				+ entry("db/v1.-1.sqlite", 1, -1, "2024-06-01T00:00:00Z") + "]";

		List<UpdateCandidate> candidates = updater.getAvailableUpdateCandidates();

		assertEquals(Collections.singletonList(new UpdateCandidate("db/v1.1.sqlite",
				Instant.parse("2024-03-01T00:00:00Z"), CompatibilityMode.EXACT_MATCH)), candidates);
	}

	@Test
	public void testUnrepresentableMinorOfOwnSchemaLineIsDropped() throws Exception {
		networking.jsonResponse = "["
				+ entry("db/v1.1000.sqlite", 1, 1000, "2024-04-01T00:00:00Z") + ", "
				+ entry("db/v1.2.sqlite", 1, 2, "2024-03-01T00:00:00Z") + "]";

		List<UpdateCandidate> candidates = updater.getAvailableUpdateCandidates();

		assertEquals(1, candidates.size());
		assertEquals("db/v1.2.sqlite", candidates.get(0).getIdentifier());
	}

	@Test
	public void testEmptyList() throws Exception {
		networking.jsonResponse = "[]";
		assertTrue(updater.getAvailableUpdateCandidates().isEmpty());
	}

	@Test
	public void testMissingFieldInvalidatesWholeList() {
		networking.jsonResponse = "[" + entry("db/ok.sqlite", 1, 1, "2024-03-01T00:00:00Z") + ", "
				+ "{\"downloadUrl\": \"db/bad.sqlite\", \"schemaVersionMajor\": 1, \"schemaVersionMinor\": 1}]";
		assertFetchFails(UpdateFetchException.Reason.INVALID_FORMAT);
	}

	@Test
	public void testInvalidDateInvalidatesWholeList() {
		networking.jsonResponse = "[" + entry("db/ok.sqlite", 1, 1, "2024-03-01T00:00:00Z") + ", "
				+ entry("db/bad.sqlite", 1, 1, "yesterday") + "]";
		assertFetchFails(UpdateFetchException.Reason.INVALID_FORMAT);
	}

	@Test
	public void testNoArray() {
		networking.jsonResponse = entry("db/ok.sqlite", 1, 1, "2024-03-01T00:00:00Z");
		assertFetchFails(UpdateFetchException.Reason.INVALID_FORMAT);
	}

	@Test
	public void testMalformedJson() {
		networking.jsonResponse = "[{\"downloadUrl\": ";
		assertFetchFails(UpdateFetchException.Reason.INVALID_FORMAT);
	}

	@Test
	public void testNetworkFailure() {
		networking.failure = new HttpRequestException(BASE_URL.resolve("api.php"), 503);
		assertFetchFails(UpdateFetchException.Reason.NETWORK);
	}

	private void assertFetchFails(UpdateFetchException.Reason expectedReason) {
		try {
			updater.getAvailableUpdateCandidates();
			fail("Fetching candidates did not fail");
		} catch (UpdateFetchException ex) {
			assertEquals(expectedReason, ex.getReason());
		}
	}

	@Test
	public void testDownloadAndCleanup() throws Exception {
		byte[] content = "route database content".getBytes(StandardCharsets.UTF_8);
		networking.binaryResources.put(URI.create("https://example.org/trad/ota/db/routes.sqlite"), content);
		UpdateCandidate candidate = new UpdateCandidate("db/routes.sqlite",
				Instant.parse("2024-03-01T00:00:00Z"), CompatibilityMode.EXACT_MATCH);

		Path first = updater.downloadRouteDatabase(candidate);
		Path second = updater.downloadRouteDatabase(candidate);

		assertEquals(OnlineRouteDbUpdater.DOWNLOAD_FILE_NAME, first.getFileName().toString());
		assertTrue(first.startsWith(tempRoot));
		assertArrayEquals(content, Files.readAllBytes(first));
		assertNotEquals(first.getParent(), second.getParent());

		updater.cleanupResources();

		assertFalse(Files.exists(first.getParent()));
		assertFalse(Files.exists(second.getParent()));
		assertTrue(Files.exists(tempRoot));

		// Nothing left to delete
		updater.cleanupResources();
	}

	@Test
	public void testFailedDownloadIsCleanedUp() throws Exception {
		UpdateCandidate candidate = new UpdateCandidate("db/missing.sqlite",
				Instant.parse("2024-03-01T00:00:00Z"), CompatibilityMode.EXACT_MATCH);
		try {
			updater.downloadRouteDatabase(candidate);
			fail("Downloaded a missing resource");
		} catch (UpdateFetchException ex) {
			assertEquals(UpdateFetchException.Reason.NETWORK, ex.getReason());
			assertTrue(ex.getCause() instanceof HttpRequestException);
		}

		updater.cleanupResources();

		try (Stream<Path> content = Files.list(tempRoot)) {
			assertEquals(0, content.count());
		}
	}
}
