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
package net.tsquery.query;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsquery.configuration.Configuration;
import net.tsquery.configuration.ConfigurationEntrySchema;
import net.tsquery.data.ConsolidationFunction;
import net.tsquery.data.NormalizedSeries;
import net.tsquery.query.expression.EvaluationContext;
import net.tsquery.query.expression.ExpressionEvaluator;
import net.tsquery.query.expression.ExpressionNode;
import net.tsquery.query.expression.FunctionRegistry;
import net.tsquery.query.expression.functions.BuiltinFunctions;
import net.tsquery.query.fetch.FetchPlanner;
import net.tsquery.query.processor.align.SeriesAligner;
import net.tsquery.query.processor.downsample.ConsolidationRules;
import net.tsquery.query.processor.downsample.Consolidator;
import net.tsquery.storage.FindQuery;
import net.tsquery.storage.FindResults;
import net.tsquery.storage.FinderDescriptor;
import net.tsquery.storage.FinderFederation;
import net.tsquery.threadpools.BackendExecutor;

/**
 * The entry point of the read path. Wires the finder federation, the
 * fetch planner, the aligner and the function library from the
 * configuration and serves find and render requests. Requests are
 * independent and may be served concurrently.
 *
 * @since 3.0
 */
public class QueryEngine implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(QueryEngine.class);

  public static final String TIMEOUT_KEY = "tsquery.query.timeout";
  public static final String THREADS_KEY = "tsquery.executor.threads";
  public static final String MAX_STEP_KEY = "tsquery.align.max_step";
  public static final String DEFAULT_STEP_KEY = "tsquery.fetch.default_step";
  public static final String CONSOLIDATION_KEY = "tsquery.consolidation.default";
  public static final String RULES_KEY = "tsquery.consolidation.rules";
  public static final String DISABLED_KEY = "tsquery.functions.disabled";

  private static final TypeReference<Map<String, String>> RULES_TYPE =
      new TypeReference<Map<String, String>>() { };

  /** The request timeout in milliseconds. */
  private final long timeout_ms;

  private final BackendExecutor executor;
  private final FinderFederation federation;
  private final FederatedSeriesSource source;
  private final FunctionRegistry registry;
  private final ExpressionEvaluator evaluator;

  /**
   * Default ctor. Registers the engine's keys if they are missing.
   * @param config A non-null configuration.
   * @param finders The finders in declaration order.
   * @throws IllegalArgumentException if a configured value was invalid.
   */
  public QueryEngine(final Configuration config,
                     final List<FinderDescriptor> finders) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (finders == null) {
      throw new IllegalArgumentException("Finders cannot be null.");
    }
    registerConfigs(config);

    timeout_ms = config.getLong(TIMEOUT_KEY);
    if (timeout_ms <= 0) {
      throw new IllegalArgumentException(TIMEOUT_KEY
          + " must be greater than zero: " + timeout_ms);
    }
    int threads = config.getInt(THREADS_KEY);
    if (threads <= 0) {
      threads = Math.max(1, finders.size());
    }
    final Map<String, String> rules = config.getTyped(RULES_KEY, RULES_TYPE);
    final SeriesAligner aligner = new SeriesAligner(config.getLong(MAX_STEP_KEY));
    final ConsolidationRules consolidation = new ConsolidationRules(
        ConsolidationFunction.fromString(config.getString(CONSOLIDATION_KEY)),
        rules);

    final FunctionRegistry.Builder functions =
        BuiltinFunctions.register(FunctionRegistry.newBuilder(), aligner);
    final String disabled = config.getString(DISABLED_KEY);
    if (!Strings.isNullOrEmpty(disabled)) {
      functions.disable(Splitter.on(',').trimResults().omitEmptyStrings()
          .splitToList(disabled));
    }
    registry = functions.build();

    executor = new BackendExecutor(threads);
    federation = new FinderFederation(finders, executor);
    source = new FederatedSeriesSource(federation,
        new FetchPlanner(executor, config.getLong(DEFAULT_STEP_KEY)),
        aligner, consolidation);
    evaluator = new ExpressionEvaluator(registry);
    LOG.info("Started query engine with " + finders.size() + " finders, "
        + threads + " threads and " + registry.names().size() + " functions");
  }

  /**
   * Resolves, fetches and evaluates the targets of one render request.
   * Every path expression referenced by the targets is fetched in one
   * batch up front, then each target is evaluated and its series reduced
   * to the window's point target.
   * @param targets The parsed targets.
   * @param window The window and point target.
   * @return The series per target, keyed by the target's canonical string.
   * @throws net.tsquery.exceptions.QueryExecutionException if a pattern
   * was invalid, every finder failed or a function rejected its
   * arguments.
   */
  public EvaluationResult resolveAndEvaluate(final List<ExpressionNode> targets,
                                             final QueryWindow window) {
    final long started = System.nanoTime();
    final EvaluationContext context = new EvaluationContext(window,
        started + TimeUnit.MILLISECONDS.toNanos(timeout_ms), source);
    context.prefetch(ExpressionEvaluator.collectPaths(targets));

    final Map<String, List<NormalizedSeries>> results = Maps.newLinkedHashMap();
    for (final ExpressionNode target : targets) {
      final List<NormalizedSeries> series = evaluator.evaluate(target, context);
      final List<NormalizedSeries> consolidated =
          Lists.newArrayListWithCapacity(series.size());
      for (final NormalizedSeries s : series) {
        consolidated.add(Consolidator.consolidate(s, window.maxPoints()));
      }
      results.put(target.toString(), consolidated);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Evaluated " + targets.size() + " targets over " + window
          + " in " + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)
          + "ms with " + context.fetchCycles() + " fetch cycles and "
          + context.errors().size() + " errors");
    }
    return new EvaluationResult(results, context.errors(), context.fetchCycles());
  }

  /**
   * Runs a find query against every finder.
   * @param query A non-null query.
   * @return The merged nodes and the finder errors.
   * @throws net.tsquery.exceptions.QueryExecutionException if the pattern
   * was invalid or every finder failed.
   */
  public FindResults find(final FindQuery query) {
    return federation.find(query, System.nanoTime()
        + TimeUnit.MILLISECONDS.toNanos(timeout_ms));
  }

  /** @return The function registry. */
  public FunctionRegistry registry() {
    return registry;
  }

  @Override
  public void close() {
    executor.close();
  }

  /**
   * Registers the engine's keys on the config if missing.
   * @param config A non-null config.
   */
  public static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(TIMEOUT_KEY)) {
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey(TIMEOUT_KEY)
          .setType(long.class)
          .setDefaultValue(30000L)
          .setDescription("The deadline for a request in milliseconds."));
    }
    if (!config.hasProperty(THREADS_KEY)) {
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey(THREADS_KEY)
          .setType(int.class)
          .setDefaultValue(0)
          .setDescription("The number of threads calling backends. 0 to "
              + "use one per finder."));
    }
    if (!config.hasProperty(MAX_STEP_KEY)) {
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey(MAX_STEP_KEY)
          .setType(long.class)
          .setDefaultValue(86400L)
          .setDescription("The largest common step in seconds when aligning "
              + "series. Over this the largest input step is used."));
    }
    if (!config.hasProperty(DEFAULT_STEP_KEY)) {
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey(DEFAULT_STEP_KEY)
          .setType(long.class)
          .setDefaultValue(60L)
          .setDescription("The step in seconds of the gaps returned for a "
              + "series whose backend failed or reported no time info."));
    }
    if (!config.hasProperty(CONSOLIDATION_KEY)) {
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey(CONSOLIDATION_KEY)
          .setType(String.class)
          .setDefaultValue("avg")
          .setDescription("The default consolidation function."));
    }
    if (!config.hasProperty(RULES_KEY)) {
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey(RULES_KEY)
          .setType(RULES_TYPE)
          .setDefaultValue(Maps.newLinkedHashMap())
          .setDescription("A map of metric globs to consolidation functions, "
              + "the first matching glob wins."));
    }
    if (!config.hasProperty(DISABLED_KEY)) {
      config.register(DISABLED_KEY, String.class, null,
          "A comma separated list of functions to remove from the registry.");
    }
  }
}
