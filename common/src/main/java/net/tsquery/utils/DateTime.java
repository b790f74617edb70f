// This file is part of tsquery.
// Copyright (C) 2024  The tsquery Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsquery.utils;

import com.google.common.base.Strings;

/**
 * Utility class for parsing the relative durations used in function
 * arguments and settings, e.g. "10m", "3h" or "-1d".
 *
 * @since 3.0
 */
public final class DateTime {

  private DateTime() { }

  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into
   * milliseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m} or {@code min}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li>
   * <li>{@code n} or {@code mon}: month (30 days)</li>
   * <li>{@code y}: years (365 days)</li></ul>
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of milliseconds.
   * @throws IllegalArgumentException if the interval was malformed.
   */
  public static final long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    final String lower = duration.trim().toLowerCase();
    int unit = 0;
    while (unit < lower.length() && Character.isDigit(lower.charAt(unit))) {
      unit++;
    }
    if (unit == 0 || unit >= lower.length()) {
      throw new IllegalArgumentException("Invalid duration, must have an "
          + "integer and unit: " + duration);
    }
    final long interval;
    try {
      interval = Long.parseLong(lower.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): "
          + duration, e);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: "
          + duration);
    }
    final long multiplier;
    switch (lower.substring(unit)) {
      case "ms": return interval;
      case "s": multiplier = 1; break;
      case "m":
      case "min": multiplier = 60; break;
      case "h": multiplier = 3600; break;
      case "d": multiplier = 3600 * 24; break;
      case "w": multiplier = 3600 * 24 * 7; break;
      case "n":
      case "mon": multiplier = 3600 * 24 * 30; break;
      case "y": multiplier = 3600 * 24 * 365; break;
      default: throw new IllegalArgumentException("Invalid duration (suffix): "
          + duration);
    }
    if ((double) interval * multiplier * 1000 > Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration must be < Long.MAX_VALUE ms: "
          + duration);
    }
    return interval * multiplier * 1000;
  }

  /**
   * Parses a duration into whole seconds.
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of seconds.
   * @throws IllegalArgumentException if the duration was malformed or
   * shorter than a second.
   */
  public static final long parseDurationSeconds(final String duration) {
    final long ms = parseDuration(duration);
    if (ms < 1000) {
      throw new IllegalArgumentException("Duration must be at least one "
          + "second: " + duration);
    }
    return ms / 1000;
  }

  /**
   * Parses a signed offset such as "-1d" or "+2h" into seconds. A missing
   * sign means the past, so "1d" is the same as "-1d".
   * @param offset The offset to parse.
   * @return The signed offset in seconds.
   * @throws IllegalArgumentException if the offset was malformed.
   */
  public static final long parseOffsetSeconds(final String offset) {
    if (Strings.isNullOrEmpty(offset)) {
      throw new IllegalArgumentException("Offset cannot be null or empty.");
    }
    final String trimmed = offset.trim();
    if (trimmed.startsWith("+")) {
      return parseDurationSeconds(trimmed.substring(1));
    }
    if (trimmed.startsWith("-")) {
      return -parseDurationSeconds(trimmed.substring(1));
    }
    return -parseDurationSeconds(trimmed);
  }
}
