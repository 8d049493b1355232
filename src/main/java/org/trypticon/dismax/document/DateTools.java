/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
*/
package org.trypticon.dismax.document;

import java.text.ParseException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Date;
import java.util.Locale;

/**
 * Provides support for converting dates to strings and vice-versa.
 * The strings are structured so that lexicographic sorting orders
 * them by date, which makes them suitable for use as field values
 * and search terms.
 *
 * <P>This class also helps you to limit the resolution of your dates. Do not
 * save dates with a finer resolution than you really need, as then
 * range queries will require more memory and become slower.
 *
 * <P>All conversions happen in UTC. Date strings consist of
 * {@code yyyyMMddHHmmssSSS} cut down to the resolution's length; when parsed,
 * missing month and day default to 1 and missing time fields to 0.
 *
 * <P>The formatters are immutable, so every method here is safe to call
 * from several threads at once.
 */
public class DateTools {

  private static final long MIN_TIME =
      LocalDateTime.of(0, 1, 1, 0, 0).toInstant(ZoneOffset.UTC).toEpochMilli();
  private static final long MAX_TIME =
      LocalDateTime.of(10000, 1, 1, 0, 0).toInstant(ZoneOffset.UTC).toEpochMilli() - 1;

  // cannot create, the class has static methods only
  private DateTools() {}

  /**
   * Converts a Date to a string suitable for indexing.
   *
   * @param date the date to be converted
   * @param resolution the desired resolution, see
   *  {@link #round(Date, DateTools.Resolution)}
   * @return a string in format <code>yyyyMMddHHmmssSSS</code> or shorter,
   *  depending on <code>resolution</code>; using UTC as timezone
   */
  public static String dateToString(Date date, Resolution resolution) {
    return timeToString(date.getTime(), resolution);
  }

  /**
   * Converts a millisecond time to a string suitable for indexing.
   *
   * @param time the date expressed as milliseconds since January 1, 1970, 00:00:00 UTC
   * @param resolution the desired resolution, see
   *  {@link #round(long, DateTools.Resolution)}
   * @return a string in format <code>yyyyMMddHHmmssSSS</code> or shorter,
   *  depending on <code>resolution</code>; using UTC as timezone
   * @throws IllegalArgumentException if the year of <code>time</code> is
   *  outside 0 to 9999, which a four digit year cannot hold
   */
  public static String timeToString(long time, Resolution resolution) {
    if (time < MIN_TIME || time > MAX_TIME) {
      throw new IllegalArgumentException("Year out of range 0 to 9999: " + Instant.ofEpochMilli(time));
    }
    return resolution.format.format(Instant.ofEpochMilli(round(time, resolution)));
  }

  /**
   * Converts a string produced by <code>timeToString</code> or
   * <code>dateToString</code> back to a time, represented as the
   * number of milliseconds since January 1, 1970, 00:00:00 UTC.
   *
   * @param dateString the date string to be converted
   * @return the number of milliseconds since January 1, 1970, 00:00:00 UTC
   * @throws ParseException if <code>dateString</code> is not in the
   *  expected format
   */
  public static long stringToTime(String dateString) throws ParseException {
    Resolution resolution = Resolution.forLength(dateString);
    try {
      return LocalDateTime.parse(dateString, resolution.format)
          .toInstant(ZoneOffset.UTC)
          .toEpochMilli();
    } catch (DateTimeParseException e) {
      ParseException pe = new ParseException("Input is not a valid date string: " + dateString,
          e.getErrorIndex());
      pe.initCause(e);
      throw pe;
    }
  }

  /**
   * Converts a string produced by <code>timeToString</code> or
   * <code>dateToString</code> back to a time, represented as a
   * Date object.
   *
   * @param dateString the date string to be converted
   * @return the parsed time as a Date object
   * @throws ParseException if <code>dateString</code> is not in the
   *  expected format
   */
  public static Date stringToDate(String dateString) throws ParseException {
    return new Date(stringToTime(dateString));
  }

  /**
   * Limit a date's resolution. For example, the date <code>2004-09-21 13:50:11</code>
   * will be changed to <code>2004-09-01 00:00:00</code> when using
   * <code>Resolution.MONTH</code>.
   *
   * @param resolution The desired resolution of the date to be returned
   * @return the date with all values more precise than <code>resolution</code>
   *  set to 0 or 1
   */
  public static Date round(Date date, Resolution resolution) {
    return new Date(round(date.getTime(), resolution));
  }

  /**
   * Limit a date's resolution. For example, the date <code>1095774611000</code>
   * (which represents 2004-09-21 13:50:11) will be changed to
   * <code>1093996800000</code> (2004-09-01 00:00:00) when using
   * <code>Resolution.MONTH</code>.
   *
   * @param resolution The desired resolution of the date to be returned
   * @return the date with all values more precise than <code>resolution</code>
   *  set to 0 or 1, expressed as milliseconds since January 1, 1970, 00:00:00 UTC
   */
  @SuppressWarnings("fallthrough")
  public static long round(long time, Resolution resolution) {
    LocalDateTime dateTime = LocalDateTime.ofInstant(Instant.ofEpochMilli(time), ZoneOffset.UTC);

    switch (resolution) {
      //NOTE: switch statement fall-through is deliberate
      case YEAR:
        dateTime = dateTime.withMonth(1);
      case MONTH:
        dateTime = dateTime.withDayOfMonth(1);
      case DAY:
        dateTime = dateTime.withHour(0);
      case HOUR:
        dateTime = dateTime.withMinute(0);
      case MINUTE:
        dateTime = dateTime.withSecond(0);
      case SECOND:
        dateTime = dateTime.with(ChronoField.MILLI_OF_SECOND, 0);
      case MILLISECOND:
        // don't cut off anything
        break;
      default:
        throw new IllegalArgumentException("unknown resolution " + resolution);
    }
    return dateTime.toInstant(ZoneOffset.UTC).toEpochMilli();
  }

  /** Specifies the time granularity. */
  public static enum Resolution {

    /** Limit a date's resolution to year granularity. */
    YEAR(4),
    /** Limit a date's resolution to month granularity. */
    MONTH(6),
    /** Limit a date's resolution to day granularity. */
    DAY(8),
    /** Limit a date's resolution to hour granularity. */
    HOUR(10),
    /** Limit a date's resolution to minute granularity. */
    MINUTE(12),
    /** Limit a date's resolution to second granularity. */
    SECOND(14),
    /** Limit a date's resolution to millisecond granularity. */
    MILLISECOND(17);

    final int formatLen;
    final DateTimeFormatter format;

    Resolution(int formatLen) {
      this.formatLen = formatLen;
      this.format = buildFormat(formatLen);
    }

    // yyyyMMddHHmmssSSS cut to formatLen, with the missing fields defaulted when parsing
    private static DateTimeFormatter buildFormat(int formatLen) {
      DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
          .appendValue(ChronoField.YEAR, 4);
      if (formatLen >= 6) {
        builder.appendValue(ChronoField.MONTH_OF_YEAR, 2);
      } else {
        builder.parseDefaulting(ChronoField.MONTH_OF_YEAR, 1);
      }
      if (formatLen >= 8) {
        builder.appendValue(ChronoField.DAY_OF_MONTH, 2);
      } else {
        builder.parseDefaulting(ChronoField.DAY_OF_MONTH, 1);
      }
      if (formatLen >= 10) {
        builder.appendValue(ChronoField.HOUR_OF_DAY, 2);
      } else {
        builder.parseDefaulting(ChronoField.HOUR_OF_DAY, 0);
      }
      if (formatLen >= 12) {
        builder.appendValue(ChronoField.MINUTE_OF_HOUR, 2);
      } else {
        builder.parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0);
      }
      if (formatLen >= 14) {
        builder.appendValue(ChronoField.SECOND_OF_MINUTE, 2);
      } else {
        builder.parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0);
      }
      if (formatLen >= 17) {
        builder.appendValue(ChronoField.MILLI_OF_SECOND, 3);
      } else {
        builder.parseDefaulting(ChronoField.MILLI_OF_SECOND, 0);
      }
      return builder.toFormatter(Locale.ROOT)
          .withResolverStyle(ResolverStyle.STRICT)
          .withZone(ZoneOffset.UTC);
    }

    /** Returns the length of the date strings at this resolution. */
    public int getFormatLength() {
      return formatLen;
    }

    /**
     * Finds a resolution by its name, ignoring case, e.g. {@code "day"}.
     *
     * @throws ParseException if no resolution has that name
     */
    public static Resolution parse(String name) throws ParseException {
      for (Resolution resolution : values()) {
        if (resolution.name().equalsIgnoreCase(name)) {
          return resolution;
        }
      }
      throw new ParseException("Unknown resolution: " + name, 0);
    }

    // the resolution whose strings are as long as dateString
    static Resolution forLength(String dateString) throws ParseException {
      for (Resolution resolution : values()) {
        if (resolution.formatLen == dateString.length()) {
          return resolution;
        }
      }
      throw new ParseException("Input is not a valid date string: " + dateString, 0);
    }

    /** this method returns the name of the resolution
     * in lowercase (for backwards compatibility) */
    @Override
    public String toString() {
      return super.toString().toLowerCase(Locale.ROOT);
    }

  }

}
