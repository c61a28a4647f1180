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
import org.apache.commons.lang3.StringUtils;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

/**
 * Time related utility methods
 *
 */
public final class TimeUtilities {

	/**
	 * Lenient ISO 8601 parser: accepts a date with optional time, fraction and
	 * offset. Timestamps without an offset are interpreted as UTC.
	 */
	private static final DateTimeFormatter ISO_PARSER = ISODateTimeFormat.dateTimeParser().withZoneUTC();

	private TimeUtilities() {
	}

	/**
	 * Convert from an ISO 8601 formatted date time string to an Instant. Both
	 * "T" and a single space are accepted as date/time separator, e.g.
	 * "2025-01-02", "2025-01-02T10:20:30.123456+01:00" or
	 * "2025-01-02 10:20:30".
	 *
	 * @param time formatted date time string
	 *
	 * @return the parsed point in time, with millisecond precision
	 *
	 * @throws IllegalArgumentException if the string is not a valid ISO 8601
	 *                                  timestamp
	 */
	public static Instant isoTimeToInstant(String time) {
		if (StringUtils.isBlank(time)) {
			throw new IllegalArgumentException("Empty timestamp"); //NON-NLS
		}
		String normalized = time.trim();
		if (normalized.length() > 10 && normalized.charAt(10) == ' ') {
			normalized = normalized.substring(0, 10) + 'T' + normalized.substring(11);
		}
		return Instant.ofEpochMilli(ISO_PARSER.parseMillis(normalized));
	}

	/**
	 * Return the instant as ISO 8601 dateTime string in UTC
	 *
	 * @param time the point in time
	 *
	 * @return formatted date time string, e.g. "2025-01-02T10:20:30Z"
	 */
	public static String instantToIsoTime(Instant time) {
		return time.toString();
	}
}
