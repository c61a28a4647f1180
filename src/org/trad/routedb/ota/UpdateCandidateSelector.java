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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Decides which update candidate to install.
 */
public final class UpdateCandidateSelector {

	private UpdateCandidateSelector() {
	}

	/**
	 * Selects the best route database update. Only candidates newer than the
	 * current database are considered, the newest one wins. For equal dates
	 * an exact schema match is preferred, remaining ties go to the candidate
	 * that comes first in the list.
	 *
	 * @param currentCreationDate Creation date of the installed route
	 *                            database, or null if there is none.
	 * @param candidates          The available candidates.
	 *
	 * @return The candidate to install, empty if none is better than the
	 *         installed database.
	 */
	public static Optional<UpdateCandidate> selectBestCandidate(Instant currentCreationDate, List<UpdateCandidate> candidates) {
		UpdateCandidate best = null;
		for (UpdateCandidate candidate : candidates) {
			if (currentCreationDate != null && !candidate.getCreationDate().isAfter(currentCreationDate)) {
				continue;
			}
			if (best == null || isBetter(candidate, best)) {
				best = candidate;
			}
		}
		return Optional.ofNullable(best);
	}

	private static boolean isBetter(UpdateCandidate candidate, UpdateCandidate other) {
		int dateOrder = candidate.getCreationDate().compareTo(other.getCreationDate());
		if (dateOrder != 0) {
			return dateOrder > 0;
		}
		return candidate.getCompatibilityMode() == CompatibilityMode.EXACT_MATCH
				&& other.getCompatibilityMode() != CompatibilityMode.EXACT_MATCH;
	}
}
