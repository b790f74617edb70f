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
 * Thrown or recorded when a single finder or reader call failed or timed
 * out. The engine recovers from these locally by treating the backend's
 * contribution as empty or all-gap.
 *
 * @since 3.0
 */
public class BackendUnavailableException extends QueryExecutionException {
  private static final long serialVersionUID = 2210587409563360722L;

  /** The ID of the backend that failed. */
  private final String backend;

  /** An optional path being fetched. */
  private final String path;

  /**
   * Ctor for a finder level failure.
   * @param backend The ID of the backend.
   * @param msg A descriptive message.
   * @param cause An optional cause.
   */
  public BackendUnavailableException(final String backend,
                                     final String msg,
                                     final Throwable cause) {
    this(backend, null, msg, cause);
  }

  /**
   * Ctor for a failure fetching a path.
   * @param backend The ID of the backend, may be null for composites.
   * @param path The path being fetched, may be null.
   * @param msg A descriptive message.
   * @param cause An optional cause.
   */
  public BackendUnavailableException(final String backend,
                                     final String path,
                                     final String msg,
                                     final Throwable cause) {
    super(msg, 502, cause);
    this.backend = backend;
    this.path = path;
  }

  /** @return The backend ID, may be null. */
  public String backend() {
    return backend;
  }

  /** @return The path, may be null. */
  public String path() {
    return path;
  }
}
