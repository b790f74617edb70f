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

import java.util.Arrays;

/**
 * A node of an already parsed call graph: a {@link PathExpression}, a
 * {@link FunctionCall} or a {@link Literal}. Nodes are immutable and
 * their {@link #toString()} is the canonical form used as the output key
 * of a target.
 *
 * @since 3.0
 */
public abstract class ExpressionNode {

  /**
   * @param pattern A glob pattern.
   * @return A path expression node.
   */
  public static PathExpression path(final String pattern) {
    return new PathExpression(pattern);
  }

  /**
   * @param name A function name.
   * @param args The arguments.
   * @return A function call node.
   */
  public static FunctionCall call(final String name,
                                  final ExpressionNode... args) {
    return new FunctionCall(name, Arrays.asList(args));
  }

  /**
   * @param value A number, string, boolean or null.
   * @return A literal node.
   */
  public static Literal literal(final Object value) {
    return new Literal(value);
  }

  /** @return The canonical string form. */
  @Override
  public abstract String toString();

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || o.getClass() != getClass()) {
      return false;
    }
    return toString().equals(o.toString());
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }
}
