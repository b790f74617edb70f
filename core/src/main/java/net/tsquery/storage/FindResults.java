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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The merged nodes of a federated find, sorted by path, along with the
 * non-fatal errors raised by individual finders.
 *
 * @since 3.0
 */
public class FindResults {

  private final List<Node> nodes;
  private final List<Exception> errors;

  /**
   * Default ctor.
   * @param nodes The merged, sorted nodes.
   * @param errors The finder errors, may be empty.
   */
  public FindResults(final List<Node> nodes, final List<Exception> errors) {
    this.nodes = ImmutableList.copyOf(nodes);
    this.errors = errors == null ? Collections.<Exception>emptyList()
        : ImmutableList.copyOf(errors);
  }

  /** @return The nodes sorted by path. */
  public List<Node> nodes() {
    return nodes;
  }

  /** @return Only the leaves, sorted by path. */
  public List<LeafNode> leaves() {
    final ImmutableList.Builder<LeafNode> leaves = ImmutableList.builder();
    for (final Node node : nodes) {
      if (node.isLeaf()) {
        leaves.add((LeafNode) node);
      }
    }
    return leaves.build();
  }

  /** @return The non-fatal errors. */
  public List<Exception> errors() {
    return errors;
  }
}
