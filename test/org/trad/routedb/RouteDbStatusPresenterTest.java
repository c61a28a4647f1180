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
import java.util.ArrayList;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.Before;
import org.junit.Test;

public class RouteDbStatusPresenterTest {

	private final List<RouteDbStatus> shown = new ArrayList<>();
	private RouteDbStatusPresenter presenter;

	@Before
	public void setUp() {
		presenter = new RouteDbStatusPresenter(shown::add);
	}

	@Test
	public void testDatabaseAvailable() {
		Instant creationDate = Instant.parse("2024-03-01T12:30:00Z");

		presenter.updateRouteDbStatus(creationDate);

		assertEquals(1, shown.size());
		RouteDbStatus status = shown.get(0);
		assertTrue(status.isActivated());
		assertTrue(status.getLabel(), status.getLabel().contains("2024-03-01T12:30:00Z"));
		assertNull(status.getStatusMessage());
	}

	@Test
	public void testNoDatabase() {
		presenter.updateRouteDbStatus(null);

		assertEquals(1, shown.size());
		RouteDbStatus status = shown.get(0);
		assertFalse(status.isActivated());
		assertEquals("None", status.getLabel());
		assertFalse(status.getStatusMessage().isEmpty());
		assertNotEquals(status.getLabel(), status.getStatusMessage());
	}
}
