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

import com.google.common.base.MoreObjects;
import static com.google.common.base.Preconditions.checkNotNull;
import java.time.Instant;
import java.util.Objects;

/**
 * A route database offered by the update service that this application can
 * install.
 */
public final class UpdateCandidate {

	private final String identifier;
	private final Instant creationDate;
	private final CompatibilityMode compatibilityMode;

	/**
	 * Create an update candidate.
	 *
	 * @param identifier        The download location, relative to the update
	 *                          service base URL.
	 * @param creationDate      When the offered database has been created.
	 * @param compatibilityMode How well the database's schema fits.
	 */
	public UpdateCandidate(String identifier, Instant creationDate, CompatibilityMode compatibilityMode) {
		this.identifier = checkNotNull(identifier);
		this.creationDate = checkNotNull(creationDate);
		this.compatibilityMode = checkNotNull(compatibilityMode);
	}

	public String getIdentifier() {
		return identifier;
	}

	public Instant getCreationDate() {
		return creationDate;
	}

	public CompatibilityMode getCompatibilityMode() {
		return compatibilityMode;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		final UpdateCandidate other = (UpdateCandidate) obj;
		return identifier.equals(other.identifier)
				&& creationDate.equals(other.creationDate)
				&& compatibilityMode == other.compatibilityMode;
	}

	@Override
	public int hashCode() {
		return Objects.hash(identifier, creationDate, compatibilityMode);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("identifier", identifier)
				.add("creationDate", creationDate)
				.add("compatibilityMode", compatibilityMode)
				.toString();
	}
}
