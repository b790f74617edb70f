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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.concurrent.Callable;

import org.junit.Test;

import com.stumbleupon.async.Deferred;

public class TestBackendExecutor {

  @Test
  public void ctor() throws Exception {
    try {
      new BackendExecutor(0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void submit() throws Exception {
    final BackendExecutor executor = new BackendExecutor(2);
    try {
      assertEquals(2, executor.threads());
      final Deferred<String> deferred = executor.submit(new Callable<String>() {
        @Override
        public String call() throws Exception {
          return Thread.currentThread().getName();
        }
      });
      assertTrue(deferred.join(5000).startsWith("tsquery-backend-"));
    } finally {
      executor.close();
    }
  }

  @Test
  public void submitThrows() throws Exception {
    final BackendExecutor executor = new BackendExecutor(1);
    try {
      final Deferred<String> deferred = executor.submit(new Callable<String>() {
        @Override
        public String call() throws Exception {
          throw new IllegalStateException("Boo!");
        }
      });
      try {
        deferred.join(5000);
        fail("Expected IllegalStateException");
      } catch (IllegalStateException e) { }
    } finally {
      executor.close();
    }
  }

  @Test
  public void closeRejects() throws Exception {
    final BackendExecutor executor = new BackendExecutor(1);
    assertFalse(executor.isShutdown());
    executor.close();
    assertTrue(executor.isShutdown());
    final Deferred<String> deferred = executor.submit(new Callable<String>() {
      @Override
      public String call() throws Exception {
        return "never";
      }
    });
    try {
      deferred.join(1000);
      fail("Expected Exception");
    } catch (Exception e) { }
  }
}
