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

package logstream.client;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Reconnection delays that start at an initial value, double with each consecutive failure and
 * saturate at a cap. Not thread safe; owned by the client's fiber.
 */
public class ExponentialBackoff {
  private final long initialMillis;
  private final long maxMillis;

  private long nextMillis;

  public ExponentialBackoff(long initialMillis, long maxMillis) {
    checkArgument(initialMillis > 0, "initial delay must be positive");
    checkArgument(maxMillis >= initialMillis, "maximum delay must not be below the initial delay");
    this.initialMillis = initialMillis;
    this.maxMillis = maxMillis;
    this.nextMillis = initialMillis;
  }

  /**
   * The delay before the next attempt; each call advances the sequence.
   */
  public long nextDelayMillis() {
    long delay = nextMillis;
    nextMillis = nextMillis > maxMillis / 2 ? maxMillis : nextMillis * 2;
    return delay;
  }

  public void reset() {
    nextMillis = initialMillis;
  }
}
