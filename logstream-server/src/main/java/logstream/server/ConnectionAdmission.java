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

package logstream.server;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * The live-connection limit. A connection that would exceed it is refused rather than queued.
 */
public class ConnectionAdmission {
  private final int maxConnections;
  private final AtomicInteger liveConnections = new AtomicInteger();

  public ConnectionAdmission(int maxConnections) {
    this.maxConnections = maxConnections;
  }

  public boolean tryAcquire() {
    while (true) {
      int current = liveConnections.get();
      if (current >= maxConnections) {
        return false;
      }
      if (liveConnections.compareAndSet(current, current + 1)) {
        return true;
      }
    }
  }

  public void release() {
    liveConnections.decrementAndGet();
  }

  public int liveConnections() {
    return liveConnections.get();
  }

  public int maxConnections() {
    return maxConnections;
  }
}
