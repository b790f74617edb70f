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
 * Recorded when a reader returned a number of values that does not match
 * the point count of the time info it reported. The series is replaced
 * with gaps.
 *
 * @since 3.0
 */
public class ProtocolViolationException extends QueryExecutionException {
  private static final long serialVersionUID = 7359181620368094551L;

  private final String path;
  private final int expected;
  private final int actual;

  /**
   * Default ctor.
   * @param path The offending path.
   * @param expected The number of values required by the time info.
   * @param actual The number of values returned.
   */
  public ProtocolViolationException(final String path,
                                    final int expected,
                                    final int actual) {
    super("Backend returned " + actual + " values for " + path
        + " but the time info requires " + expected, 502);
    this.path = path;
    this.expected = expected;
    this.actual = actual;
  }

  /**
   * Ctor for malformed responses other than a count mismatch.
   * @param path The offending path.
   * @param msg A descriptive message.
   */
  public ProtocolViolationException(final String path, final String msg) {
    super(msg, 502);
    this.path = path;
    expected = -1;
    actual = -1;
  }

  /** @return The offending path. */
  public String path() {
    return path;
  }

  /** @return The expected count or -1 if not a count mismatch. */
  public int expected() {
    return expected;
  }

  /** @return The actual count or -1 if not a count mismatch. */
  public int actual() {
    return actual;
  }
}
