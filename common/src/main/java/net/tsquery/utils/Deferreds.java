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

import java.util.concurrent.TimeUnit;

import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

/**
 * Utility class for handling common tasks related to Deferreds.
 *
 * @since 3.0
 */
public final class Deferreds {

  private Deferreds() { }

  /**
   * Joins on the deferred until the deadline. A deadline that already
   * passed still waits one millisecond as {@code join(0)} would block
   * forever.
   * @param deferred A non-null deferred.
   * @param deadline_ns The deadline from {@link System#nanoTime()}.
   * @return The result of the deferred.
   * @throws TimeoutException if the deadline passed first.
   * @throws InterruptedException if the thread was interrupted.
   * @throws Exception if the deferred resolved to an exception.
   */
  public static <T> T joinWithin(final Deferred<T> deferred,
                                 final long deadline_ns) throws Exception {
    final long remaining = TimeUnit.NANOSECONDS.toMillis(
        deadline_ns - System.nanoTime());
    return deferred.join(Math.max(1, remaining));
  }

  /**
   * @param deadline_ns The deadline from {@link System#nanoTime()}.
   * @return True if the deadline has passed.
   */
  public static boolean expired(final long deadline_ns) {
    return deadline_ns - System.nanoTime() <= 0;
  }

  /**
   * @param e An exception from a join.
   * @return True if it was a timeout from the async library.
   */
  public static boolean isTimeout(final Throwable e) {
    return e instanceof TimeoutException
        || e instanceof java.util.concurrent.TimeoutException;
  }
}
