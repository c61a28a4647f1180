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

import java.nio.file.Path;
import java.util.List;

/**
 * Source of route database updates.
 */
public interface RouteDbDownloadService {

	/**
	 * Gets the route databases that are offered and can be used by this
	 * application. The order of the returned list is unspecified.
	 *
	 * @return The installable candidates, possibly empty.
	 *
	 * @throws UpdateFetchException if the offered databases cannot be
	 *                              retrieved.
	 */
	List<UpdateCandidate> getAvailableUpdateCandidates() throws UpdateFetchException;

	/**
	 * Downloads the given candidate into a new temporary file. The file stays
	 * available until the next call of {@link #cleanupResources()}.
	 *
	 * @param candidate The database to download.
	 *
	 * @return The path of the downloaded file.
	 *
	 * @throws UpdateFetchException if the download fails.
	 */
	Path downloadRouteDatabase(UpdateCandidate candidate) throws UpdateFetchException;

	/**
	 * Deletes all files downloaded since the last call. Never fails.
	 */
	void cleanupResources();
}
