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
package net.tsquery.query.expression;

import com.google.common.base.Strings;

/**
 * A leaf of the call graph that resolves to the series matching a glob.
 *
 * @since 3.0
 */
public class PathExpression extends ExpressionNode {

  private final String pattern;

  /**
   * Default ctor.
   * @param pattern A non-null and non-empty glob.
   */
  public PathExpression(final String pattern) {
    if (Strings.isNullOrEmpty(pattern)) {
      throw new IllegalArgumentException("Pattern cannot be null or empty.");
    }
    this.pattern = pattern;
  }

  /** @return The glob. */
  public String pattern() {
    return pattern;
  }

  @Override
  public String toString() {
    return pattern;
  }
}
