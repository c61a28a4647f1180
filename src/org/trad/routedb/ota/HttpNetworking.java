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
import java.nio.file.Path;

/**
 * Plain HTTP GET access used to talk to the update service.
 */
public interface HttpNetworking {

	/**
	 * Retrieves a JSON document.
	 *
	 * @param uri The document location.
	 *
	 * @return The response body.
	 *
	 * @throws HttpRequestException           if the server does not answer
	 *                                        with status 200.
	 * @throws UnexpectedContentTypeException if the response is not
	 *                                        application/json.
	 * @throws IOException                    on transport errors.
	 */
	String retrieveJsonResource(URI uri) throws IOException;

	/**
	 * Downloads a binary resource and writes it verbatim into a file.
	 *
	 * @param uri         The resource location.
	 * @param destination The file to write, replaced if it exists.
	 *
	 * @throws HttpRequestException if the server does not answer with status
	 *                              200.
	 * @throws IOException          on transport or file errors.
	 */
	void downloadBinaryResource(URI uri, Path destination) throws IOException;
}
