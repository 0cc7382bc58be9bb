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

import org.jetlang.core.BatchExecutor;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.PoolFiberFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * FiberSupplier backed by a Jetlang {@link PoolFiberFactory}: many fibers share one thread pool,
 * while each fiber still executes its own tasks strictly one at a time, in submission order.
 * <p>
 * A task that throws does not stop its fiber. The throwable goes to the handler given when the
 * fiber was created, on the fiber itself, and the remaining tasks still run.
 */
public class PoolFiberSupplier implements FiberSupplier {
  private final ExecutorService executorService;
  private final PoolFiberFactory fiberFactory;

  public PoolFiberSupplier(ExecutorService executorService) {
    this.executorService = executorService;
    this.fiberFactory = new PoolFiberFactory(executorService);
  }

  @Override
  public Fiber getFiber(Consumer<Throwable> throwableHandler) {
    return fiberFactory.create(reportingFailuresTo(throwableHandler));
  }

  private static BatchExecutor reportingFailuresTo(Consumer<Throwable> throwableHandler) {
    return batch -> {
      int size = batch.size();
      for (int i = 0; i < size; i++) {
        Runnable task = batch.get(i);
        try {
          task.run();
        } catch (Throwable t) {
          throwableHandler.accept(t);
        }
      }
    };
  }

  /**
   * Stop the shared pool. Fibers still holding tasks when the timeout expires are abandoned:
   * the pool threads are interrupted.
   *
   * @return true if the pool terminated within the timeout
   */
  public boolean shutdown(long timeout, TimeUnit unit) throws InterruptedException {
    fiberFactory.dispose();
    executorService.shutdown();
    if (executorService.awaitTermination(timeout, unit)) {
      return true;
    }
    executorService.shutdownNow();
    return false;
  }
}
