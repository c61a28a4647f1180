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

import static com.google.common.base.Preconditions.checkArgument;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility class to hold the update service settings.
 */
public final class UpdateServiceSettings {

	static final String BASE_URL_PROPERTY = "trad.ota.baseUrl"; //NON-NLS
	static final String API_PATH_PROPERTY = "trad.ota.apiPath"; //NON-NLS
	static final String CONNECT_TIMEOUT_PROPERTY = "trad.ota.connectTimeoutMillis"; //NON-NLS
	static final String SOCKET_TIMEOUT_PROPERTY = "trad.ota.socketTimeoutMillis"; //NON-NLS

	private static final String SETTINGS_RESOURCE = "UpdateService.properties"; //NON-NLS

	private final URI baseUrl;
	private final String apiPath;
	private final int connectTimeoutMillis;
	private final int socketTimeoutMillis;

	/**
	 * Create an UpdateServiceSettings instance for the service.
	 *
	 * @param baseUrl              The base URL of the service, download
	 *                             locations are resolved against it. Must end
	 *                             with a slash to be usable as directory.
	 * @param apiPath              The metadata endpoint, relative to the base
	 *                             URL.
	 * @param connectTimeoutMillis Connection timeout in milliseconds, 0 for
	 *                             none.
	 * @param socketTimeoutMillis  Read timeout in milliseconds, 0 for none.
	 */
	public UpdateServiceSettings(URI baseUrl, String apiPath, int connectTimeoutMillis, int socketTimeoutMillis) {
		checkArgument(baseUrl.isAbsolute(), "The base URL must be absolute: %s", baseUrl);
		checkArgument(connectTimeoutMillis >= 0 && socketTimeoutMillis >= 0, "Timeouts must not be negative");
		this.baseUrl = baseUrl;
		this.apiPath = apiPath;
		this.connectTimeoutMillis = connectTimeoutMillis;
		this.socketTimeoutMillis = socketTimeoutMillis;
	}

	/**
	 * Loads the bundled default settings. The system properties
	 * trad.ota.baseUrl, trad.ota.apiPath, trad.ota.connectTimeoutMillis and
	 * trad.ota.socketTimeoutMillis override them.
	 *
	 * @return The settings.
	 *
	 * @throws IOException if the bundled settings cannot be read.
	 */
	public static UpdateServiceSettings loadDefaults() throws IOException {
		Properties defaults = new Properties();
		try (InputStream stream = Resources.getResource(UpdateServiceSettings.class, SETTINGS_RESOURCE).openStream()) {
			defaults.load(stream);
		} catch (IllegalArgumentException ex) {
			throw new IOException("Missing update service settings " + SETTINGS_RESOURCE, ex); //NON-NLS
		}
		try {
			return new UpdateServiceSettings(
					URI.create(lookup(defaults, BASE_URL_PROPERTY)),
					lookup(defaults, API_PATH_PROPERTY),
					Integer.parseInt(lookup(defaults, CONNECT_TIMEOUT_PROPERTY)),
					Integer.parseInt(lookup(defaults, SOCKET_TIMEOUT_PROPERTY)));
		} catch (IllegalArgumentException ex) {
			throw new IOException("Invalid update service settings", ex); //NON-NLS
		}
	}

	private static String lookup(Properties defaults, String key) {
		String value = System.getProperty(key);
		if (StringUtils.isBlank(value)) {
			value = defaults.getProperty(key);
		}
		if (StringUtils.isBlank(value)) {
			throw new IllegalArgumentException("No value for " + key); //NON-NLS
		}
		return value.trim();
	}

	public URI getBaseUrl() {
		return baseUrl;
	}

	/**
	 * Gets the full URL of the metadata endpoint.
	 *
	 * @return The endpoint URL.
	 */
	public URI getApiEndpoint() {
		return baseUrl.resolve(apiPath);
	}

	/**
	 * Resolves a download location against the base URL.
	 */
	URI resolve(String location) {
		return baseUrl.resolve(location);
	}

	public int getConnectTimeoutMillis() {
		return connectTimeoutMillis;
	}

	public int getSocketTimeoutMillis() {
		return socketTimeoutMillis;
	}
}
