/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package logstream.util;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.jetlang.fibers.Fiber;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Helpers joining Guava futures and Jetlang fibers.
 */
public class FiberFutures {

  private FiberFutures() {
  }

  /**
   * Run success or failure on the fiber once the future completes. The failure consumer receives
   * the ExecutionException (or unchecked throwable) exactly as thrown by {@link Future#get()}.
   */
  public static <V> void addCallback(ListenableFuture<V> future,
                                     Consumer<? super V> success,
                                     Consumer<Throwable> failure,
                                     Fiber fiber) {
    Runnable callbackListener = () -> {
      final V value;
      try {
        value = getUninterruptibly(future);
      } catch (ExecutionException | RuntimeException | Error e) {
        failure.accept(e);
        return;
      }
      success.accept(value);
    };
    future.addListener(callbackListener, fiber);
  }

  /**
   * Execute the task on the fiber, returning a future for its outcome. Exceptions thrown by the
   * task complete the future exceptionally rather than reaching the fiber's throwable handler.
   */
  public static <T> ListenableFuture<T> submit(Fiber fiber, CheckedSupplier<T, ? extends Exception> task) {
    SettableFuture<T> future = SettableFuture.create();
    fiber.execute(() -> {
      try {
        future.set(task.get());
      } catch (Exception e) {
        future.setException(e);
      }
    });
    return future;
  }

  public static <V> V getUninterruptibly(Future<V> future)
      throws ExecutionException {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return future.get();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * The root cause for logging: unwraps the ExecutionException layer added by future retrieval.
   */
  public static Throwable unwrap(Throwable throwable) {
    if (throwable instanceof ExecutionException && throwable.getCause() != null) {
      return throwable.getCause();
    }
    return throwable;
  }
}
