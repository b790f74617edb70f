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
package net.tsquery.threadpools;

import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.stumbleupon.async.Deferred;

/**
 * A fixed pool of daemon threads that runs the blocking finder and reader
 * calls. Each task is exposed as a {@link Deferred} that is called back
 * with the result or the exception thrown by the task. Callers join with
 * the remaining request deadline and abandon tasks that run over.
 *
 * @since 3.0
 */
public class BackendExecutor implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(BackendExecutor.class);

  /** The pool. */
  private final ExecutorService pool;

  /** The number of threads. */
  private final int threads;

  /**
   * Default ctor.
   * @param threads The number of threads, at least 1.
   * @throws IllegalArgumentException if the thread count was less than 1.
   */
  public BackendExecutor(final int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("Thread count must be at least 1: "
          + threads);
    }
    this.threads = threads;
    pool = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<Runnable>(),
        new ThreadFactoryBuilder()
          .setNameFormat("tsquery-backend-%d")
          .setDaemon(true)
          .build());
    LOG.info("Initialized new BackendExecutor with {} threads", threads);
  }

  /**
   * Runs the task on the pool.
   * @param task A non-null task.
   * @return A deferred called back with the result or the exception.
   */
  public <T> Deferred<T> submit(final Callable<T> task) {
    final Deferred<T> deferred = new Deferred<T>();
    try {
      pool.execute(new Runnable() {
        @Override
        public void run() {
          final T result;
          try {
            result = task.call();
          } catch (Exception e) {
            deferred.callback(e);
            return;
          } catch (Throwable t) {
            deferred.callback(new RuntimeException(t));
            return;
          }
          deferred.callback(result);
        }
      });
    } catch (RejectedExecutionException e) {
      return Deferred.fromError(e);
    }
    return deferred;
  }

  /** @return The number of threads. */
  public int threads() {
    return threads;
  }

  /** @return True once shut down. */
  public boolean isShutdown() {
    return pool.isShutdown();
  }

  @Override
  public void close() {
    if (!pool.isShutdown()) {
      pool.shutdownNow();
      LOG.info("Shutting down BackendExecutor, no more tasks will be executed.");
    }
  }
}
