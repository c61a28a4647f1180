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

import org.trad.routedb.RouteDbException;

/**
 * Thrown when the list of available route databases or one of them cannot be
 * retrieved from the update service.
 */
public class UpdateFetchException extends RouteDbException {

	private static final long serialVersionUID = 1L;

	/**
	 * Why a fetch failed.
	 */
	public enum Reason {
		/**
		 * The service could not be reached or answered with an error.
		 */
		NETWORK,
		/**
		 * The service answered with data that is not understood.
		 */
		INVALID_FORMAT
	}

	private final Reason reason;

	public UpdateFetchException(Reason reason, String msg, Exception ex) {
		super(msg, ex);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}
}
