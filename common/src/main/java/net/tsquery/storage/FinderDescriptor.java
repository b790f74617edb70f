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
package net.tsquery.storage;

import com.google.common.base.Strings;

/**
 * The registration record of a {@link Finder}. Capabilities are resolved
 * once when the descriptor is built and never probed per call.
 *
 * @since 3.0
 */
public final class FinderDescriptor {

  /** A unique ID used in logs and errors. */
  private final String id;

  /** The declaration order, used as the tie breaker. */
  private final int order;

  /** The finder. */
  private final Finder finder;

  /** The batching tag, may be null. */
  private final String batching_tag;

  /** Whether the finder can fetch many leaves in one call. */
  private final boolean multi_fetch;

  /** Whether the finder pre-aggregates. */
  private final boolean aggregating;

  /**
   * Default ctor.
   * @param id A non-null and non-empty ID.
   * @param order The declaration order.
   * @param finder A non-null finder.
   * @throws IllegalArgumentException if the ID or finder were null.
   */
  public FinderDescriptor(final String id,
                          final int order,
                          final Finder finder) {
    if (Strings.isNullOrEmpty(id)) {
      throw new IllegalArgumentException("ID cannot be null or empty.");
    }
    if (finder == null) {
      throw new IllegalArgumentException("Finder cannot be null.");
    }
    this.id = id;
    this.order = order;
    this.finder = finder;
    batching_tag = Strings.emptyToNull(finder.batchingTag());
    multi_fetch = finder instanceof MultiFetchFinder;
    aggregating = finder.isAggregating();
  }

  /** @return The ID. */
  public String id() {
    return id;
  }

  /** @return The declaration order. */
  public int order() {
    return order;
  }

  /** @return The finder. */
  public Finder finder() {
    return finder;
  }

  /** @return The batching tag or null. */
  public String batchingTag() {
    return batching_tag;
  }

  /** @return True if the finder implements {@link MultiFetchFinder}. */
  public boolean isMultiFetch() {
    return multi_fetch;
  }

  /** @return True if the finder pre-aggregates. */
  public boolean isAggregating() {
    return aggregating;
  }

  @Override
  public String toString() {
    return "FinderDescriptor{id=" + id + ", order=" + order
        + ", batchingTag=" + batching_tag + ", multiFetch=" + multi_fetch
        + ", aggregating=" + aggregating + "}";
  }
}
