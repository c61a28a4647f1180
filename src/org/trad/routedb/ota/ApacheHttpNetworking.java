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
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;

/**
 * HTTP access through the Apache HTTP client. Every request uses its own
 * client, so instances can be shared freely.
 */
public final class ApacheHttpNetworking implements HttpNetworking {

	private static final Logger logger = Logger.getLogger(ApacheHttpNetworking.class.getName());

	private final RequestConfig requestConfig;

	public ApacheHttpNetworking(UpdateServiceSettings settings) {
		this.requestConfig = RequestConfig.custom()
				.setConnectTimeout(settings.getConnectTimeoutMillis())
				.setConnectionRequestTimeout(settings.getConnectTimeoutMillis())
				.setSocketTimeout(settings.getSocketTimeoutMillis())
				.build();
	}

	@Override
	public String retrieveJsonResource(URI uri) throws IOException {
		logger.log(Level.FINE, "Retrieving JSON resource {0}", uri); //NON-NLS
		try (CloseableHttpClient httpClient = createClient();
				CloseableHttpResponse response = httpClient.execute(createRequest(uri, ContentType.APPLICATION_JSON))) {
			checkSuccess(uri, response);

			final HttpEntity entity = response.getEntity();
			final ContentType contentType = entity != null ? ContentType.getLenient(entity) : null;
			if (contentType == null
					|| !ContentType.APPLICATION_JSON.getMimeType().equalsIgnoreCase(contentType.getMimeType())) {
				throw new UnexpectedContentTypeException(uri, ContentType.APPLICATION_JSON.getMimeType(),
						contentType != null ? contentType.getMimeType() : null);
			}
			return EntityUtils.toString(entity, StandardCharsets.UTF_8);
		}
	}

	@Override
	public void downloadBinaryResource(URI uri, Path destination) throws IOException {
		logger.log(Level.FINE, "Downloading {0} to {1}", new Object[]{uri, destination}); //NON-NLS
		try (CloseableHttpClient httpClient = createClient();
				CloseableHttpResponse response = httpClient.execute(createRequest(uri, ContentType.APPLICATION_OCTET_STREAM))) {
			checkSuccess(uri, response);

			final HttpEntity entity = response.getEntity();
			if (entity == null) {
				throw new IOException("Response from " + uri + " has no body"); //NON-NLS
			}
			try (InputStream content = entity.getContent()) {
				Files.copy(content, destination, StandardCopyOption.REPLACE_EXISTING);
			}
		}
	}

	private CloseableHttpClient createClient() {
		return HttpClients.custom()
				.setDefaultRequestConfig(requestConfig)
				.build();
	}

	private static HttpGet createRequest(URI uri, ContentType accepted) {
		final HttpGet request = new HttpGet(uri);
		request.setHeader("Accept", accepted.getMimeType()); //NON-NLS
		return request;
	}

	/**
	 * Checks the status code of the response and throws if it's not the
	 * expected 200 code.
	 */
	private static void checkSuccess(URI uri, CloseableHttpResponse response) throws HttpRequestException {
		final int statusCode = response.getStatusLine().getStatusCode();
		if (statusCode != HttpStatus.SC_OK) {
			throw new HttpRequestException(uri, statusCode);
		}
	}
}
