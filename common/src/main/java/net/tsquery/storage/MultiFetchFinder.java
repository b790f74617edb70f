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

import net.tsquery.data.MultiFetchResult;

/**
 * A {@link Finder} that can retrieve many leaves in a single backend call.
 *
 * @since 3.0
 */
public interface MultiFetchFinder extends Finder {

  /**
   * Fetches every leaf at once.
   * @param leaves The non-null and non-empty list of leaves from this
   * finder.
   * @param start The inclusive start in seconds.
   * @param end The exclusive end in seconds.
   * @param max_points The target point count for aggregating finders or 0.
   * @return A non-null result keyed by leaf path.
   */
  public MultiFetchResult fetchMulti(final List<LeafNode> leaves,
                                     final long start,
                                     final long end,
                                     final int max_points);
}
