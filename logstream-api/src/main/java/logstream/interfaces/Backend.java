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

package logstream.interfaces;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.Service;
import logstream.entry.LogEntry;

/**
 * A destination for entries, started and stopped as a Guava service.
 */
public interface Backend extends Service {
  BackendKind kind();

  /**
   * Submit one entry. Entries submitted from a single thread are written in submission order.
   * Failures, including a backend that is not running, are reported through the returned future
   * and never thrown.
   */
  ListenableFuture<Void> write(LogEntry entry);
}
