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

import java.time.Instant;
import java.util.Objects;

/**
 * A user comment about a route, with a rating.
 */
public final class Post {

	private final String userName;
	private final Instant postDate;
	private final String comment;
	private final int rating;

	Post(String userName, Instant postDate, String comment, int rating) {
		this.userName = userName;
		this.postDate = postDate;
		this.comment = comment;
		this.rating = rating;
	}

	public String getUserName() {
		return userName;
	}

	public Instant getPostDate() {
		return postDate;
	}

	public String getComment() {
		return comment;
	}

	/**
	 * Gets the rating given by the user. Ratings range from -3 (worst) to 3
	 * (best).
	 *
	 * @return The rating.
	 */
	public int getRating() {
		return rating;
	}

	@Override
	public int hashCode() {
		return Objects.hash(userName, postDate, comment, rating);
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
		final Post other = (Post) obj;
		return this.rating == other.rating
				&& Objects.equals(this.userName, other.userName)
				&& Objects.equals(this.postDate, other.postDate)
				&& Objects.equals(this.comment, other.comment);
	}
}
