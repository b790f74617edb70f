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
package net.tsquery.query.fetch;

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.tsquery.storage.FinderDescriptor;
import net.tsquery.storage.LeafNode;

/**
 * A set of leaves fetched with one backend call. Groups with more than
 * one leaf always come from a single multi-fetch finder sharing a
 * batching tag, every other leaf forms a singleton group.
 *
 * @since 3.0
 */
public class FetchGroup {

  /** The finder for batched groups, null for singletons. */
  private final FinderDescriptor finder;

  /** The leaves. */
  private final List<LeafNode> leaves;

  /**
   * Default ctor.
   * @param finder The multi-fetch finder or null for a singleton.
   * @param leaves The non-empty leaves.
   */
  public FetchGroup(final FinderDescriptor finder, final List<LeafNode> leaves) {
    if (leaves == null || leaves.isEmpty()) {
      throw new IllegalArgumentException("Leaves cannot be null or empty.");
    }
    if (finder == null && leaves.size() > 1) {
      throw new IllegalArgumentException("A group of " + leaves.size()
          + " leaves requires a multi-fetch finder.");
    }
    this.finder = finder;
    this.leaves = ImmutableList.copyOf(leaves);
  }

  /** @return True if served by one multi-fetch call. */
  public boolean isBatched() {
    return finder != null;
  }

  /** @return The multi-fetch finder or null. */
  public FinderDescriptor finder() {
    return finder;
  }

  /** @return The leaves. */
  public List<LeafNode> leaves() {
    return leaves;
  }

  @Override
  public String toString() {
    return "FetchGroup{finder=" + (finder == null ? null : finder.id())
        + ", leaves=" + leaves.size() + "}";
  }
}
