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
package net.tsquery.query.expression;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.query.QueryWindow;

/**
 * The request scoped state of an evaluation: the window, the deadline,
 * the cache of fetched path expressions and the non-fatal errors. The
 * cache is keyed by expression and window so each key triggers at most
 * one fetch cycle per request. A context is owned by one request and is
 * not thread safe.
 *
 * @since 3.0
 */
public class EvaluationContext {
  private static final Logger LOG = LoggerFactory.getLogger(EvaluationContext.class);

  /** The window for this view of the request. */
  private final QueryWindow window;

  /** The request deadline from System.nanoTime(). */
  private final long deadline_ns;

  /** Where to fetch from on a cache miss. */
  private final SeriesSource source;

  /** Shared by every view of the request. */
  private final Map<CacheKey, List<NormalizedSeries>> cache;

  /** Shared by every view of the request. */
  private final List<Exception> errors;

  /** Shared counter of fetch cycles. */
  private final int[] fetch_cycles;

  /**
   * Default ctor.
   * @param window The non-null window.
   * @param deadline_ns The request deadline from {@link System#nanoTime()}.
   * @param source The non-null series source.
   */
  public EvaluationContext(final QueryWindow window,
                           final long deadline_ns,
                           final SeriesSource source) {
    this(window, deadline_ns, source,
        Maps.<CacheKey, List<NormalizedSeries>>newHashMap(),
        Lists.<Exception>newArrayList(), new int[1]);
  }

  private EvaluationContext(final QueryWindow window,
                            final long deadline_ns,
                            final SeriesSource source,
                            final Map<CacheKey, List<NormalizedSeries>> cache,
                            final List<Exception> errors,
                            final int[] fetch_cycles) {
    if (window == null) {
      throw new IllegalArgumentException("Window cannot be null.");
    }
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    this.window = window;
    this.deadline_ns = deadline_ns;
    this.source = source;
    this.cache = cache;
    this.errors = errors;
    this.fetch_cycles = fetch_cycles;
  }

  /** @return The window. */
  public QueryWindow window() {
    return window;
  }

  /** @return The start in seconds. */
  public long start() {
    return window.start();
  }

  /** @return The end in seconds. */
  public long end() {
    return window.end();
  }

  /** @return The target point count or 0. */
  public int maxPoints() {
    return window.maxPoints();
  }

  /** @return The deadline from {@link System#nanoTime()}. */
  public long deadline() {
    return deadline_ns;
  }

  /**
   * @param offset Seconds to shift the window by.
   * @return A view of the same request over a shifted window, sharing the
   * cache and errors.
   */
  public EvaluationContext shifted(final long offset) {
    return withWindow(window.shift(offset));
  }

  /**
   * @param window A non-null window, e.g. extended backwards to bootstrap
   * a moving window.
   * @return A view of the same request over the window, sharing the cache
   * and errors.
   */
  public EvaluationContext withWindow(final QueryWindow window) {
    return new EvaluationContext(window, deadline_ns, source, cache, errors,
        fetch_cycles);
  }

  /**
   * Returns the series for the expression over this window, fetching on
   * the first reference only.
   * @param path_expression A non-null glob.
   * @return The series, sorted by path.
   */
  public List<NormalizedSeries> fetch(final String path_expression) {
    final CacheKey key = new CacheKey(path_expression, window);
    List<NormalizedSeries> series = cache.get(key);
    if (series == null) {
      prefetch(Collections.singleton(path_expression));
      series = cache.get(key);
    } else if (LOG.isTraceEnabled()) {
      LOG.trace("Cache hit for " + key);
    }
    return series == null ? ImmutableList.<NormalizedSeries>of() : series;
  }

  /**
   * Fetches every expression not yet cached for this window in one
   * batch.
   * @param path_expressions The expressions.
   */
  public void prefetch(final Collection<String> path_expressions) {
    final Set<String> missing = Sets.newLinkedHashSet();
    for (final String expression : path_expressions) {
      if (!cache.containsKey(new CacheKey(expression, window))) {
        missing.add(expression);
      }
    }
    if (missing.isEmpty()) {
      return;
    }
    fetch_cycles[0]++;
    final Map<String, List<NormalizedSeries>> fetched =
        source.fetch(missing, window, deadline_ns, errors);
    for (final String expression : missing) {
      final List<NormalizedSeries> series = fetched.get(expression);
      cache.put(new CacheKey(expression, window), series == null
          ? ImmutableList.<NormalizedSeries>of()
          : ImmutableList.copyOf(series));
    }
  }

  /** @param error A non-fatal error to surface with the results. */
  public void addError(final Exception error) {
    errors.add(error);
  }

  /** @return The non-fatal errors so far. */
  public List<Exception> errors() {
    return Collections.unmodifiableList(errors);
  }

  /** @return The number of batched fetch cycles issued so far. */
  public int fetchCycles() {
    return fetch_cycles[0];
  }

  /** The cache key, expression plus window. */
  static final class CacheKey {
    private final String path_expression;
    private final long start;
    private final long end;

    CacheKey(final String path_expression, final QueryWindow window) {
      this.path_expression = path_expression;
      start = window.start();
      end = window.end();
    }

    @Override
    public boolean equals(final Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof CacheKey)) {
        return false;
      }
      final CacheKey other = (CacheKey) o;
      return start == other.start && end == other.end
          && path_expression.equals(other.path_expression);
    }

    @Override
    public int hashCode() {
      return (path_expression.hashCode() * 31 + Long.hashCode(start)) * 31
          + Long.hashCode(end);
    }

    @Override
    public String toString() {
      return path_expression + "@[" + start + ", " + end + ")";
    }
  }
}
