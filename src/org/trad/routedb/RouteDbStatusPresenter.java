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
import java.util.ResourceBundle;

/**
 * Turns route database status changes into displayable texts.
 */
public final class RouteDbStatusPresenter implements RouteDbStatusListener {

	private static final ResourceBundle bundle = ResourceBundle.getBundle("org.trad.routedb.Bundle");

	private final RouteDbStatusDisplay display;

	public RouteDbStatusPresenter(RouteDbStatusDisplay display) {
		this.display = display;
	}

	@Override
	public void updateRouteDbStatus(Instant creationDate) {
		if (creationDate != null) {
			display.showRouteDbStatus(new RouteDbStatus(true, TimeUtilities.instantToIsoTime(creationDate), null));
		} else {
			display.showRouteDbStatus(new RouteDbStatus(false,
					bundle.getString("RouteDbStatusPresenter.noDatabase.label"),
					bundle.getString("RouteDbStatusPresenter.noDatabase.message")));
		}
	}
}
