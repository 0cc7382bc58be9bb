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

import org.jetlang.fibers.Fiber;

import java.util.function.Consumer;

/**
 * Source of fibers for services that serialize their work through a single actor.
 */
public interface FiberSupplier {
  /**
   * Create a new, unstarted fiber. Any throwable escaping a task executed by the fiber will be
   * passed to the given handler, in the context of the fiber, instead of killing the pool thread.
   *
   * @param throwableHandler receives uncaught throwables from the fiber's tasks
   * @return a fiber which the caller is responsible for starting and disposing
   */
  Fiber getFiber(Consumer<Throwable> throwableHandler);
}
