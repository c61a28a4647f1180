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
import java.util.ArrayList;
import java.util.List;
import org.trad.routedb.ota.RouteDbDownloadService;
import org.trad.routedb.ota.UpdateCandidate;
import org.trad.routedb.ota.UpdateFetchException;

/**
 * Download service returning canned candidates.
 */
final class FakeDownloadService implements RouteDbDownloadService {

	final List<UpdateCandidate> candidates = new ArrayList<>();
	final List<UpdateCandidate> downloaded = new ArrayList<>();

	UpdateFetchException listFailure;
	UpdateFetchException downloadFailure;
	Path downloadedFile;
	int cleanupCalls;

	@Override
	public List<UpdateCandidate> getAvailableUpdateCandidates() throws UpdateFetchException {
		if (listFailure != null) {
			throw listFailure;
		}
		return new ArrayList<>(candidates);
	}

	@Override
	public Path downloadRouteDatabase(UpdateCandidate candidate) throws UpdateFetchException {
		downloaded.add(candidate);
		if (downloadFailure != null) {
			throw downloadFailure;
		}
		return downloadedFile;
	}

	@Override
	public void cleanupResources() {
		cleanupCalls++;
	}
}
