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
package net.tsquery.data;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;

/**
 * A {@link RawSeries} ready for function evaluation. Adds the display
 * name, the path expression that produced the series (kept for naming
 * function output) and the consolidation function applied whenever the
 * series resolution is lowered.
 * <p>
 * Functions never mutate a series, they build a new one via
 * {@link #newBuilder(NormalizedSeries)}.
 *
 * @since 3.0
 */
public class NormalizedSeries extends RawSeries {

  /** The display name. */
  private final String name;

  /** The original expression. */
  private final String path_expression;

  /** How to reduce this series. */
  private final ConsolidationFunction consolidation_function;

  /**
   * Protected ctor, use the builder.
   * @param builder A non-null builder.
   */
  protected NormalizedSeries(final Builder builder) {
    super(builder.path, builder.time_info, builder.values);
    name = Strings.isNullOrEmpty(builder.name) ? builder.path : builder.name;
    path_expression = Strings.isNullOrEmpty(builder.path_expression)
        ? builder.path : builder.path_expression;
    consolidation_function = builder.consolidation_function == null
        ? ConsolidationFunction.AVG : builder.consolidation_function;
  }

  /** @return The display name. */
  @JsonProperty("name")
  public String name() {
    return name;
  }

  /** @return The path expression this series came from. */
  @JsonProperty("pathExpression")
  public String pathExpression() {
    return path_expression;
  }

  /** @return The consolidation function. */
  @JsonProperty("consolidationFunction")
  public ConsolidationFunction consolidationFunction() {
    return consolidation_function;
  }

  /**
   * Wraps a raw series.
   * @param raw A non-null raw series.
   * @param path_expression The expression that resolved to the series.
   * @param function The consolidation function.
   * @return A non-null series named after its path.
   */
  public static NormalizedSeries fromRaw(final RawSeries raw,
                                         final String path_expression,
                                         final ConsolidationFunction function) {
    return newBuilder()
        .setPath(raw.path())
        .setTimeInfo(raw.timeInfo())
        .setValues(raw.values())
        .setPathExpression(path_expression)
        .setConsolidationFunction(function)
        .build();
  }

  @Override
  public boolean equals(final Object o) {
    if (!super.equals(o)) {
      return false;
    }
    final NormalizedSeries other = (NormalizedSeries) o;
    return name.equals(other.name)
        && path_expression.equals(other.path_expression)
        && consolidation_function == other.consolidation_function;
  }

  @Override
  public int hashCode() {
    return super.hashCode() * 31 + name.hashCode();
  }

  @Override
  public String toString() {
    return "NormalizedSeries{name=" + name + ", path=" + path
        + ", pathExpression=" + path_expression + ", cf="
        + consolidation_function + ", " + time_info + ", values=" + values
        + "}";
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * @param series A non-null series to copy from.
   * @return A builder populated with every field of the series.
   */
  public static Builder newBuilder(final NormalizedSeries series) {
    return new Builder()
        .setPath(series.path)
        .setTimeInfo(series.time_info)
        .setValues(series.values)
        .setName(series.name)
        .setPathExpression(series.path_expression)
        .setConsolidationFunction(series.consolidation_function);
  }

  public static class Builder {
    private String path;
    private TimeInfo time_info;
    private List<Double> values;
    private String name;
    private String path_expression;
    private ConsolidationFunction consolidation_function;

    public Builder setPath(final String path) {
      this.path = path;
      return this;
    }

    public Builder setTimeInfo(final TimeInfo time_info) {
      this.time_info = time_info;
      return this;
    }

    public Builder setValues(final List<Double> values) {
      this.values = values;
      return this;
    }

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setPathExpression(final String path_expression) {
      this.path_expression = path_expression;
      return this;
    }

    public Builder setConsolidationFunction(
        final ConsolidationFunction consolidation_function) {
      this.consolidation_function = consolidation_function;
      return this;
    }

    public NormalizedSeries build() {
      return new NormalizedSeries(this);
    }
  }
}
