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
package net.tsquery.query.expression.functions;

import net.tsquery.data.ConsolidationFunction;
import net.tsquery.query.expression.FunctionRegistry;
import net.tsquery.query.expression.functions.AliasFunction.Mode;
import net.tsquery.query.expression.functions.SeriesFilterFunction.Selection;
import net.tsquery.query.expression.functions.SeriesFilterFunction.Statistic;
import net.tsquery.query.expression.functions.SeriesListFunction.Operation;
import net.tsquery.query.expression.functions.SeriesWalkFunction.Walk;
import net.tsquery.query.processor.align.SeriesAligner;

/**
 * The built in function library.
 *
 * @since 3.0
 */
public final class BuiltinFunctions {

  private BuiltinFunctions() {
    // static registration
  }

  /**
   * Registers every built in function.
   * @param builder A non-null registry builder.
   * @param aligner The aligner used by functions combining series.
   * @return The builder.
   */
  public static FunctionRegistry.Builder register(final FunctionRegistry.Builder builder,
                                                  final SeriesAligner aligner) {
    // combine
    for (final Combiner combiner : Combiner.values()) {
      builder.register(combiner.function(),
          new CombineSeriesFunction(combiner, aligner));
    }
    builder.register("sum", new CombineSeriesFunction(Combiner.SUM, aligner))
        .register("avg", new CombineSeriesFunction(Combiner.AVERAGE, aligner))
        .register("divideSeries", new DivideSeriesFunction(aligner))
        .register("asPercent", new AsPercentFunction(aligner))
        .register("sumSeriesWithWildcards",
            new CombineWithWildcardsFunction(Combiner.SUM, aligner))
        .register("averageSeriesWithWildcards",
            new CombineWithWildcardsFunction(Combiner.AVERAGE, aligner))
        .register("groupByNode", new GroupByNodeFunction(aligner))
        .register("group", new GroupFunction());

    // per point
    builder.register("scale", new PointTransformFunction(2, 2,
        PointTransformFunction.callNamer("scale"),
        (v, series, args) -> v == null ? null : v * args.number(1)));
    builder.register("offset", new PointTransformFunction(2, 2,
        PointTransformFunction.callNamer("offset"),
        (v, series, args) -> v == null ? null : v + args.number(1)));
    builder.register("absolute", new PointTransformFunction(1, 1,
        PointTransformFunction.callNamer("absolute"),
        (v, series, args) -> v == null ? null : Math.abs(v)));
    builder.register("invert", new PointTransformFunction(1, 1,
        PointTransformFunction.callNamer("invert"),
        (v, series, args) -> DivideSeriesFunction.divide(1.0, v)));
    builder.register("scaleToSeconds", new PointTransformFunction(2, 2,
        PointTransformFunction.callNamer("scaleToSeconds"),
        (v, series, args) -> v == null ? null
            : v * args.number(1) / series.timeInfo().step()));
    final PointTransformFunction log = new PointTransformFunction(1, 2,
        PointTransformFunction.callNamer("log"),
        (v, series, args) -> v == null || v <= 0 ? null
            : Math.log(v) / Math.log(args.number(1, 10.0)));
    builder.register("log", log)
        .register("logarithm", log);
    builder.register("transformNull", new PointTransformFunction(1, 2,
        PointTransformFunction.callNamer("transformNull"),
        (v, series, args) -> v == null ? args.number(1, 0.0) : v));
    builder.register("isNonNull", new PointTransformFunction(1, 1,
        PointTransformFunction.callNamer("isNonNull"),
        (v, series, args) -> v == null ? 0.0 : 1.0));
    builder.register("removeBelowValue", new PointTransformFunction(2, 2,
        PointTransformFunction.callNamer("removeBelowValue"),
        (v, series, args) -> v == null || v < args.number(1) ? null : v));
    builder.register("removeAboveValue", new PointTransformFunction(2, 2,
        PointTransformFunction.callNamer("removeAboveValue"),
        (v, series, args) -> v == null || v > args.number(1) ? null : v));

    // per series
    for (final Walk walk : Walk.values()) {
      builder.register(walk.function(), new SeriesWalkFunction(walk));
    }
    builder.register("movingAverage", new MovingAverageFunction())
        .register("consolidateBy", new ConsolidateByFunction())
        .register("cumulative", new ConsolidateByFunction(ConsolidationFunction.SUM))
        .register("timeShift", new TimeShiftFunction())
        .register("summarize", new SummarizeFunction());

    // naming
    builder.register("alias", new AliasFunction(Mode.ALIAS))
        .register("aliasByNode", new AliasFunction(Mode.BY_NODE))
        .register("aliasByMetric", new AliasFunction(Mode.BY_METRIC))
        .register("aliasSub", new AliasFunction(Mode.SUB));

    // filters
    builder.register("highestMax", new SeriesFilterFunction(Statistic.MAX, Selection.HIGHEST))
        .register("highestCurrent", new SeriesFilterFunction(Statistic.CURRENT, Selection.HIGHEST))
        .register("highestAverage", new SeriesFilterFunction(Statistic.AVERAGE, Selection.HIGHEST))
        .register("lowestCurrent", new SeriesFilterFunction(Statistic.CURRENT, Selection.LOWEST))
        .register("lowestAverage", new SeriesFilterFunction(Statistic.AVERAGE, Selection.LOWEST))
        .register("maximumAbove", new SeriesFilterFunction(Statistic.MAX, Selection.ABOVE))
        .register("maximumBelow", new SeriesFilterFunction(Statistic.MAX, Selection.BELOW))
        .register("averageAbove", new SeriesFilterFunction(Statistic.AVERAGE, Selection.ABOVE))
        .register("averageBelow", new SeriesFilterFunction(Statistic.AVERAGE, Selection.BELOW))
        .register("currentAbove", new SeriesFilterFunction(Statistic.CURRENT, Selection.ABOVE))
        .register("currentBelow", new SeriesFilterFunction(Statistic.CURRENT, Selection.BELOW));

    // lists
    builder.register("limit", new SeriesListFunction(Operation.LIMIT))
        .register("exclude", new SeriesListFunction(Operation.EXCLUDE))
        .register("grep", new SeriesListFunction(Operation.GREP))
        .register("removeEmptySeries", new SeriesListFunction(Operation.REMOVE_EMPTY))
        .register("sortByName", new SeriesListFunction(Operation.SORT_BY_NAME))
        .register("sortByMaxima", new SeriesListFunction(Operation.SORT_BY_MAXIMA));

    // generators
    builder.register("constantLine", new ConstantLineFunction());
    return builder;
  }
}
