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
 * Thrown when a function is unknown or receives arguments violating its
 * arity or type contract. Fails the whole request.
 *
 * @since 3.0
 */
public class EvaluationException extends QueryExecutionException {
  private static final long serialVersionUID = -5502930447188306817L;

  /** The name of the function that failed. */
  private final String function;

  /**
   * Default ctor.
   * @param function The function name.
   * @param msg A descriptive message.
   */
  public EvaluationException(final String function, final String msg) {
    super(function + ": " + msg, 400);
    this.function = function;
  }

  /**
   * Ctor with a cause.
   * @param function The function name.
   * @param msg A descriptive message.
   * @param cause The cause.
   */
  public EvaluationException(final String function,
                             final String msg,
                             final Throwable cause) {
    super(function + ": " + msg, 400, cause);
    this.function = function;
  }

  /** @return The function name. */
  public String function() {
    return function;
  }
}
