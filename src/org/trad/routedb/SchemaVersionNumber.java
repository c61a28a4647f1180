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

import static com.google.common.base.Preconditions.checkArgument;
import java.util.Comparator;

/**
 * Route database schema versions are two part: Major.Minor. This versioning
 * schema is based on semantic versioning, but without using the patch number.
 *
 * The major part is incremented for incompatible changes, i.e., a database of
 * a different major version is not usable by this application at all. For
 * example, the major number is incremented if tables and/or columns are
 * removed or the meanings of values change.
 *
 * The minor part is incremented for backward compatible changes, e.g. adding
 * a column or an index. The compareTo method orders versions numerically with
 * decreasing precedence from left to right, e.g., 1.0 &lt; 1.2 &lt; 2.0.
 */
public final class SchemaVersionNumber implements Comparable<SchemaVersionNumber> {

	/**
	 * Minor parts must be smaller than this limit, which keeps
	 * {@link #hashCode()} free of collisions.
	 */
	static final int MINOR_NUMBER_LIMIT = 1000;

	private static final Comparator<SchemaVersionNumber> VERSION_COMPARATOR
			= Comparator.comparingInt(SchemaVersionNumber::getMajor).thenComparingInt(SchemaVersionNumber::getMinor);

	private final int major;
	private final int minor;

	/**
	 * Constructor for SchemaVersionNumber.
	 *
	 * @param majorVersion The major version part, must not be negative.
	 * @param minorVersion The minor version part, must not be negative and
	 *                     must be smaller than 1000.
	 *
	 * @throws IllegalArgumentException If one of the parts is out of range.
	 */
	public SchemaVersionNumber(int majorVersion, int minorVersion) {
		checkArgument(majorVersion >= 0, "Major version parts must not be negative values: %s", majorVersion);
		checkArgument(minorVersion >= 0, "Minor version parts must not be negative values: %s", minorVersion);
		checkArgument(minorVersion < MINOR_NUMBER_LIMIT, "Minor version parts must be smaller than %s: %s", MINOR_NUMBER_LIMIT, minorVersion);
		major = majorVersion;
		minor = minorVersion;
	}

	public int getMajor() {
		return major;
	}

	public int getMinor() {
		return minor;
	}

	/**
	 * Is a database with the given schema version openable by an application
	 * supporting this version?
	 *
	 * This is the case if both major parts are equal and the minor part of
	 * the given version is not greater than this one's. The check is not
	 * commutative.
	 *
	 * @param dbSchemaVersion The schema version of the db to check for
	 *                        compatibility.
	 *
	 * @return true if the db schema version is compatible with this version.
	 */
	public boolean isCompatible(SchemaVersionNumber dbSchemaVersion) {
		return major == dbSchemaVersion.getMajor() && minor >= dbSchemaVersion.getMinor();
	}

	/**
	 * @param other The version to compare with.
	 *
	 * @return true if this version is strictly lower than the other one.
	 */
	public boolean isOlderThan(SchemaVersionNumber other) {
		return compareTo(other) < 0;
	}

	/**
	 * @param other The version to compare with.
	 *
	 * @return true if this version is strictly greater than the other one.
	 */
	public boolean isNewerThan(SchemaVersionNumber other) {
		return compareTo(other) > 0;
	}

	@Override
	public int compareTo(SchemaVersionNumber vs) {
		return VERSION_COMPARATOR.compare(this, vs);
	}

	@Override
	public String toString() {
		return major + "." + minor;
	}

	@Override
	public int hashCode() {
		return major * MINOR_NUMBER_LIMIT + minor;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		final SchemaVersionNumber other = (SchemaVersionNumber) obj;
		return this.major == other.getMajor()
				&& this.minor == other.getMinor();
	}
}
