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

import java.io.IOException;
import java.net.URI;

/**
 * Thrown when an HTTP request is answered with a status other than 200.
 */
public class HttpRequestException extends IOException {

	private static final long serialVersionUID = 1L;

	private final URI uri;
	private final int statusCode;

	public HttpRequestException(URI uri, int statusCode) {
		super(String.format("Request to %s failed with status code %d", uri, statusCode)); //NON-NLS
		this.uri = uri;
		this.statusCode = statusCode;
	}

	public URI getUri() {
		return uri;
	}

	public int getStatusCode() {
		return statusCode;
	}
}
