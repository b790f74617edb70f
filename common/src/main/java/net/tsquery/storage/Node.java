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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;

/**
 * A node in the metric namespace tree. Either a {@link BranchNode} that
 * only contains other nodes or a {@link LeafNode} that owns a
 * {@link Reader} for its data. Nodes sort by path.
 *
 * @since 3.0
 */
public abstract class Node implements Comparable<Node> {

  /** The full dotted path. */
  protected final String path;

  /**
   * Default ctor.
   * @param path A non-null and non-empty path.
   * @throws IllegalArgumentException if the path was null or empty.
   */
  protected Node(final String path) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    this.path = path;
  }

  /** @return The full dotted path. */
  @JsonProperty("path")
  public String path() {
    return path;
  }

  /** @return The last segment of the path. */
  @JsonProperty("name")
  public String name() {
    final int idx = path.lastIndexOf('.');
    return idx < 0 ? path : path.substring(idx + 1);
  }

  /** @return True if this is a leaf with data. */
  @JsonProperty("leaf")
  public abstract boolean isLeaf();

  @Override
  public int compareTo(final Node other) {
    return path.compareTo(other.path);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || o.getClass() != getClass()) {
      return false;
    }
    return path.equals(((Node) o).path);
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + path + "}";
  }
}
