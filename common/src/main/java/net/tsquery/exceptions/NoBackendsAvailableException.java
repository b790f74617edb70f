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

import java.util.List;

/**
 * Thrown when every configured finder failed for a find query. The
 * individual failures are available via {@link #getExceptions()}.
 *
 * @since 3.0
 */
public class NoBackendsAvailableException extends QueryExecutionException {
  private static final long serialVersionUID = -4170523651880239745L;

  /**
   * Default ctor.
   * @param msg A descriptive message.
   * @param exceptions The failures from each finder.
   */
  public NoBackendsAvailableException(final String msg,
                                      final List<Exception> exceptions) {
    super(msg, 503, exceptions);
  }
}
