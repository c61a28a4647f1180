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
import java.util.OptionalDouble;

/**
 * A single climbing route onto a summit.
 */
public final class Route {

	private final long id;
	private final String name;
	private final String grade;
	private final Double rating;

	Route(long id, String name, String grade, Double rating) {
		this.id = id;
		this.name = name;
		this.grade = grade;
		this.rating = rating;
	}

	/**
	 * Gets the row id for the route.
	 *
	 * @return Row id.
	 */
	public long getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	/**
	 * Gets the difficulty grade of the route, as printed in the climbing
	 * guide.
	 *
	 * @return The grade label.
	 */
	public String getGrade() {
		return grade;
	}

	/**
	 * Gets the average user rating of the route. Empty if nobody has rated
	 * the route yet or the rating was not requested.
	 *
	 * @return The average rating.
	 */
	public OptionalDouble getRating() {
		return rating == null ? OptionalDouble.empty() : OptionalDouble.of(rating);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, name, grade, rating);
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
		final Route other = (Route) obj;
		return this.id == other.id
				&& Objects.equals(this.name, other.name)
				&& Objects.equals(this.grade, other.grade)
				&& Objects.equals(this.rating, other.rating);
	}

	@Override
	public String toString() {
		return "Route{" + "id=" + id + ", name=" + name + ", grade=" + grade + ", rating=" + rating + '}';
	}
}
