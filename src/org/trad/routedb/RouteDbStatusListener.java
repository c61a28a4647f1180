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

/**
 * Receives the availability of the route database after every start or
 * installation attempt.
 */
public interface RouteDbStatusListener {

	/**
	 * Called whenever the route database has been (re)started.
	 *
	 * @param creationDate The creation date of the now active route database,
	 *                     or null if no usable route database is available.
	 */
	void updateRouteDbStatus(Instant creationDate);
}
