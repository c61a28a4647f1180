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

/**
 * Base type of all checked exceptions thrown by the route database classes.
 */
public class RouteDbException extends Exception {

	private static final long serialVersionUID = 1L;

	/**
	 * Default constructor when error message is not available
	 */
	public RouteDbException() {
		super("No error message available.");
	}

	/**
	 * Create exception containing the error message
	 *
	 * @param msg the message
	 */
	public RouteDbException(String msg) {
		super(msg);
	}

	/**
	 * Create exception containing the error message and cause exception
	 *
	 * @param msg the message
	 * @param ex  cause exception
	 */
	public RouteDbException(String msg, Exception ex) {
		super(msg, ex);
	}
}
