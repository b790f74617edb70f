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

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A named function applied to zero or more argument nodes.
 *
 * @since 3.0
 */
public class FunctionCall extends ExpressionNode {

  private final String name;
  private final List<ExpressionNode> arguments;

  /**
   * Default ctor.
   * @param name A non-null and non-empty function name.
   * @param arguments The non-null arguments.
   */
  public FunctionCall(final String name, final List<ExpressionNode> arguments) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    if (arguments == null) {
      throw new IllegalArgumentException("Arguments cannot be null.");
    }
    for (final ExpressionNode argument : arguments) {
      if (argument == null) {
        throw new IllegalArgumentException("Null argument to " + name);
      }
    }
    this.name = name;
    this.arguments = ImmutableList.copyOf(arguments);
  }

  /** @return The function name. */
  public String name() {
    return name;
  }

  /** @return The argument nodes. */
  public List<ExpressionNode> arguments() {
    return arguments;
  }

  @Override
  public String toString() {
    return name + "(" + Joiner.on(',').join(arguments) + ")";
  }
}
