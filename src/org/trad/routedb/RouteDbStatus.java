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

import com.google.common.base.MoreObjects;
import java.util.Objects;

/**
 * Displayable state of the route database.
 */
public final class RouteDbStatus {

	private final boolean activated;
	private final String label;
	private final String statusMessage;

	/**
	 * Create a route database status.
	 *
	 * @param activated     Whether the route database can be used.
	 * @param label         Short label identifying the active database.
	 * @param statusMessage Explanation for the user, may be null.
	 */
	public RouteDbStatus(boolean activated, String label, String statusMessage) {
		this.activated = activated;
		this.label = label;
		this.statusMessage = statusMessage;
	}

	public boolean isActivated() {
		return activated;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * Gets the message explaining the status to the user.
	 *
	 * @return The message, or null if there is nothing to explain.
	 */
	public String getStatusMessage() {
		return statusMessage;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		final RouteDbStatus other = (RouteDbStatus) obj;
		return activated == other.activated
				&& Objects.equals(label, other.label)
				&& Objects.equals(statusMessage, other.statusMessage);
	}

	@Override
	public int hashCode() {
		return Objects.hash(activated, label, statusMessage);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("activated", activated)
				.add("label", label)
				.add("statusMessage", statusMessage)
				.toString();
	}
}
