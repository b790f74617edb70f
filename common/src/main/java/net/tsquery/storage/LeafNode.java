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

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A resolvable metric that owns exactly one {@link Reader}. Finders
 * create leaves without a source; the federation re-creates them with the
 * {@link FinderDescriptor} they came from via {@link #withSource}. A leaf
 * merged from several finders owns a composite reader and has no source.
 *
 * @since 3.0
 */
public class LeafNode extends Node {

  /** The reader for this leaf. */
  private final Reader reader;

  /** The finder this leaf came from, null for composites. */
  private final FinderDescriptor source;

  /**
   * Ctor used by finders.
   * @param path A non-null and non-empty path.
   * @param reader A non-null reader.
   */
  public LeafNode(final String path, final Reader reader) {
    this(path, reader, null);
  }

  /**
   * Full ctor.
   * @param path A non-null and non-empty path.
   * @param reader A non-null reader.
   * @param source The finder the leaf came from, may be null.
   * @throws IllegalArgumentException if the reader was null.
   */
  public LeafNode(final String path,
                  final Reader reader,
                  final FinderDescriptor source) {
    super(path);
    if (reader == null) {
      throw new IllegalArgumentException("Reader cannot be null for leaf "
          + path);
    }
    this.reader = reader;
    this.source = source;
  }

  /** @return The reader. */
  @JsonIgnore
  public Reader reader() {
    return reader;
  }

  /** @return The source finder or null for composite leaves. */
  @JsonIgnore
  public FinderDescriptor source() {
    return source;
  }

  /**
   * @param source The finder descriptor.
   * @return A copy of this leaf tagged with the source.
   */
  public LeafNode withSource(final FinderDescriptor source) {
    return new LeafNode(path, reader, source);
  }

  @Override
  public boolean isLeaf() {
    return true;
  }
}
