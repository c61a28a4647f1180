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

import java.util.Objects;

/**
 * Encapsulates a summit of the route database.
 */
public final class Summit {

	private final long id;
	private final String name;

	Summit(long id, String name) {
		this.id = id;
		this.name = name;
	}

	/**
	 * Gets the row id for the summit.
	 *
	 * @return Row id.
	 */
	public long getId() {
		return id;
	}

	/**
	 * Gets the name of the summit.
	 *
	 * @return Summit name.
	 */
	public String getName() {
		return name;
	}

	@Override
	public int hashCode() {
		int hash = 5;
		hash = 67 * hash + (int) (this.id ^ (this.id >>> 32));
		hash = 67 * hash + Objects.hashCode(this.name);
		return hash;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}

		final Summit other = (Summit) obj;
		return this.id == other.id && Objects.equals(this.name, other.name);
	}

	@Override
	public String toString() {
		return "Summit{" + "id=" + id + ", name=" + name + '}';
	}
}
