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
package net.tsquery.exceptions;

/**
 * Thrown when a glob pattern fails to compile. Raised before any backend
 * is contacted.
 *
 * @since 3.0
 */
public class InvalidPatternException extends QueryExecutionException {
  private static final long serialVersionUID = 1623950411790207514L;

  private final String pattern;
  private final int position;

  /**
   * Default ctor.
   * @param pattern The pattern that failed.
   * @param position The character offset of the problem or -1.
   * @param reason A description of the problem.
   */
  public InvalidPatternException(final String pattern,
                                 final int position,
                                 final String reason) {
    super("Invalid pattern '" + pattern + "'"
        + (position >= 0 ? " at position " + position : "")
        + ": " + reason, 400);
    this.pattern = pattern;
    this.position = position;
  }

  /** @return The offending pattern. */
  public String pattern() {
    return pattern;
  }

  /** @return The character offset or -1. */
  public int position() {
    return position;
  }
}
