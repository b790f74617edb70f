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

import java.util.List;

/**
 * A pluggable storage backend's view of the metric namespace. Finders
 * are read only and must tolerate concurrent calls.
 * <p>
 * Optional capabilities are declared here and resolved once into a
 * {@link FinderDescriptor} when the finder is registered. To support
 * batched fetches implement {@link MultiFetchFinder}.
 *
 * @since 3.0
 */
public interface Finder {

  /**
   * Resolves the pattern against this backend's namespace. When the query
   * carries a time window, leaves whose data cannot overlap it may be
   * omitted. The engine filters again so finders need not.
   * @param query A non-null query.
   * @return A non-null list of nodes, may be empty.
   */
  public List<Node> findNodes(final FindQuery query);

  /**
   * @return A tag shared by leaves that can be fetched in one call, or
   * null if the finder does not batch.
   */
  public default String batchingTag() {
    return null;
  }

  /**
   * @return Whether the backend can pre-aggregate to a target point
   * count when fetching.
   */
  public default boolean isAggregating() {
    return false;
  }
}
