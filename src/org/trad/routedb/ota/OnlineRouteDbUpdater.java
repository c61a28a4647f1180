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

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.lang.reflect.Type;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.trad.routedb.RouteDbSchema;
import org.trad.routedb.SchemaVersionNumber;

/**
 * Downloads route databases from the trad update web service. The service
 * provides a JSON list of all available route databases, which is filtered
 * for the ones this application can use.
 */
public final class OnlineRouteDbUpdater implements RouteDbDownloadService {

	private static final Logger logger = Logger.getLogger(OnlineRouteDbUpdater.class.getName());

	/**
	 * Name of the downloaded file within its temporary directory.
	 */
	static final String DOWNLOAD_FILE_NAME = "routedb.sqlite"; //NON-NLS

	private static final String TEMP_DIR_PREFIX = "routedb"; //NON-NLS
	private static final Type METADATA_LIST_TYPE = new TypeToken<List<RouteDbMetadata>>() {
	}.getType();

	private final HttpNetworking networking;
	private final UpdateServiceSettings settings;
	private final Path tempRoot;
	private final SchemaVersionNumber supportedVersion;
	private final Gson gson;
	private final List<Path> directoriesToDelete = new ArrayList<>();

	/**
	 * Create an updater for the schema version supported by this
	 * application.
	 *
	 * @param networking The HTTP access to use.
	 * @param settings   The update service location.
	 * @param tempRoot   Directory below which downloads are stored.
	 */
	public OnlineRouteDbUpdater(HttpNetworking networking, UpdateServiceSettings settings, Path tempRoot) {
		this(networking, settings, tempRoot, RouteDbSchema.SUPPORTED_SCHEMA_VERSION);
	}

	OnlineRouteDbUpdater(HttpNetworking networking, UpdateServiceSettings settings, Path tempRoot, SchemaVersionNumber supportedVersion) {
		this.networking = networking;
		this.settings = settings;
		this.tempRoot = tempRoot;
		this.supportedVersion = supportedVersion;
		this.gson = new Gson();
	}

	@Override
	public List<UpdateCandidate> getAvailableUpdateCandidates() throws UpdateFetchException {
		final URI endpoint = settings.getApiEndpoint();
		String jsonData;
		try {
			jsonData = networking.retrieveJsonResource(endpoint);
		} catch (IOException ex) {
			throw new UpdateFetchException(UpdateFetchException.Reason.NETWORK,
					"Unable to retrieve the route database list from " + endpoint, ex); //NON-NLS
		}

		List<UpdateCandidate> candidates = new ArrayList<>();
		for (RouteDbMetadata metadata : deserialize(jsonData)) {
			final int major = metadata.getSchemaVersionMajor();
			final int minor = metadata.getSchemaVersionMinor();
			if (isInstallable(major, minor)) {
				candidates.add(new UpdateCandidate(metadata.getDownloadUrl(), metadata.getCreationDate(),
						minor == supportedVersion.getMinor()
						? CompatibilityMode.EXACT_MATCH : CompatibilityMode.BACKWARD_COMPATIBLE));
			} else {
				logger.log(Level.FINE, "Ignoring route database {0} with schema version {1}.{2}", //NON-NLS
						new Object[]{metadata.getDownloadUrl(), major, minor});
			}
		}
		logger.log(Level.INFO, "{0} installable route databases available", candidates.size()); //NON-NLS
		return candidates;
	}

	/**
	 * Parses the service response, any invalid entry invalidates all of them.
	 */
	private List<RouteDbMetadata> deserialize(String jsonData) throws UpdateFetchException {
		try {
			List<RouteDbMetadata> entries = gson.fromJson(jsonData, METADATA_LIST_TYPE);
			if (entries == null) {
				throw new JsonParseException("Empty route database list"); //NON-NLS
			}
			for (RouteDbMetadata entry : entries) {
				if (entry == null) {
					throw new JsonParseException("Null entry in route database list"); //NON-NLS
				}
				entry.validate();
			}
			return entries;
		} catch (JsonParseException ex) {
			throw new UpdateFetchException(UpdateFetchException.Reason.INVALID_FORMAT,
					"Invalid route database list received", ex); //NON-NLS
		}
	}

	/**
	 * Same major version and at least the supported minor version. The parts
	 * are checked as sent, so records of foreign schema lines are dropped
	 * whatever their numbers are.
	 */
	private boolean isInstallable(int major, int minor) {
		if (major != supportedVersion.getMajor() || minor < supportedVersion.getMinor()) {
			return false;
		}
		try {
			return new SchemaVersionNumber(major, minor).isCompatible(supportedVersion);
		} catch (IllegalArgumentException ex) {
			logger.log(Level.FINE, "Unusable schema version in route database list", ex); //NON-NLS
			return false;
		}
	}

	@Override
	public Path downloadRouteDatabase(UpdateCandidate candidate) throws UpdateFetchException {
		final URI databaseUri;
		try {
			databaseUri = settings.resolve(candidate.getIdentifier());
		} catch (IllegalArgumentException ex) {
			throw new UpdateFetchException(UpdateFetchException.Reason.INVALID_FORMAT,
					"Invalid route database location " + candidate.getIdentifier(), ex); //NON-NLS
		}
		logger.log(Level.INFO, "Downloading route database from {0}", databaseUri); //NON-NLS

		try {
			Files.createDirectories(tempRoot);
			Path tempDir = Files.createTempDirectory(tempRoot, TEMP_DIR_PREFIX);
			directoriesToDelete.add(tempDir);
			Path tempFile = tempDir.resolve(DOWNLOAD_FILE_NAME);
			networking.downloadBinaryResource(databaseUri, tempFile);
			return tempFile;
		} catch (IOException ex) {
			throw new UpdateFetchException(UpdateFetchException.Reason.NETWORK,
					"Unable to download route database from " + databaseUri, ex); //NON-NLS
		}
	}

	@Override
	public void cleanupResources() {
		for (Path directory : directoriesToDelete) {
			try {
				MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
			} catch (IOException ex) {
				logger.log(Level.WARNING, "Unable to delete temporary directory " + directory, ex); //NON-NLS
			}
		}
		directoriesToDelete.clear();
	}
}
