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
 * Thrown when a response carries a different content type than requested.
 */
public class UnexpectedContentTypeException extends IOException {

	private static final long serialVersionUID = 1L;

	private final String contentType;

	/**
	 * @param uri          The requested resource.
	 * @param expectedType The MIME type that was expected.
	 * @param contentType  The received content type, may be null if the
	 *                     response did not declare one.
	 */
	public UnexpectedContentTypeException(URI uri, String expectedType, String contentType) {
		super(String.format("Expected %s from %s but received %s", expectedType, uri, contentType)); //NON-NLS
		this.contentType = contentType;
	}

	public String getContentType() {
		return contentType;
	}
}
