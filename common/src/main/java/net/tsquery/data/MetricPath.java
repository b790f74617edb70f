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
package net.tsquery.data;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * An immutable, dot delimited metric path such as {@code servers.web1.cpu}.
 * Segments may carry glob syntax, see {@link #isPattern()}. The split is
 * a plain split on '.', so dots inside braces are not supported.
 *
 * @since 3.0
 */
public final class MetricPath {

  private static final Splitter SPLITTER = Splitter.on('.');

  /** Characters that make a segment a pattern. */
  private static final String GLOB_CHARS = "*?[]{}\\";

  /** The full path. */
  private final String path;

  /** The split segments. */
  private final List<String> segments;

  /**
   * Private ctor.
   * @param path The non-empty path.
   */
  private MetricPath(final String path) {
    this.path = path;
    segments = ImmutableList.copyOf(SPLITTER.split(path));
  }

  /**
   * @param path A non-null and non-empty path.
   * @return The parsed path.
   * @throws IllegalArgumentException if the path was null or empty.
   */
  public static MetricPath of(final String path) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    return new MetricPath(path);
  }

  /** @return The immutable list of segments. */
  public List<String> segments() {
    return segments;
  }

  /** @return The number of segments. */
  public int segmentCount() {
    return segments.size();
  }

  /**
   * @param index A zero based index.
   * @return The segment at the index.
   */
  public String segment(final int index) {
    return segments.get(index);
  }

  /** @return The last segment. */
  public String name() {
    return segments.get(segments.size() - 1);
  }

  /** @return True if any segment carries glob syntax. */
  public boolean isPattern() {
    return isPattern(path);
  }

  /**
   * @param path A non-null path.
   * @return True if the string has any glob characters.
   */
  public static boolean isPattern(final String path) {
    for (int i = 0; i < path.length(); i++) {
      if (GLOB_CHARS.indexOf(path.charAt(i)) >= 0) {
        return true;
      }
    }
    return false;
  }

  @JsonValue
  @Override
  public String toString() {
    return path;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricPath)) {
      return false;
    }
    return path.equals(((MetricPath) o).path);
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }
}
