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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals of what the server has accepted, rejected and routed. Safe to update from any
 * thread.
 */
public class ServerCounters {
  private final AtomicLong connectionsAccepted = new AtomicLong();
  private final AtomicLong connectionsRejected = new AtomicLong();
  private final AtomicLong emptyHandshakes = new AtomicLong();
  private final AtomicLong malformedLines = new AtomicLong();
  private final AtomicLong oversizedLines = new AtomicLong();
  private final AtomicLong entriesRouted = new AtomicLong();
  private final AtomicLong fileWriteFailures = new AtomicLong();
  private final AtomicLong auxiliaryWriteFailures = new AtomicLong();

  public long connectionAccepted() {
    return connectionsAccepted.incrementAndGet();
  }

  public long connectionRejected() {
    return connectionsRejected.incrementAndGet();
  }

  public long emptyHandshake() {
    return emptyHandshakes.incrementAndGet();
  }

  public long malformedLine() {
    return malformedLines.incrementAndGet();
  }

  public long oversizedLine() {
    return oversizedLines.incrementAndGet();
  }

  public long entryRouted() {
    return entriesRouted.incrementAndGet();
  }

  public long fileWriteFailed() {
    return fileWriteFailures.incrementAndGet();
  }

  public long auxiliaryWriteFailed() {
    return auxiliaryWriteFailures.incrementAndGet();
  }

  public long getConnectionsAccepted() {
    return connectionsAccepted.get();
  }

  public long getConnectionsRejected() {
    return connectionsRejected.get();
  }

  public long getEmptyHandshakes() {
    return emptyHandshakes.get();
  }

  public long getMalformedLines() {
    return malformedLines.get();
  }

  public long getOversizedLines() {
    return oversizedLines.get();
  }

  public long getEntriesRouted() {
    return entriesRouted.get();
  }

  public long getFileWriteFailures() {
    return fileWriteFailures.get();
  }

  public long getAuxiliaryWriteFailures() {
    return auxiliaryWriteFailures.get();
  }

  @Override
  public String toString() {
    return "ServerCounters{" +
        "connectionsAccepted=" + connectionsAccepted +
        ", connectionsRejected=" + connectionsRejected +
        ", emptyHandshakes=" + emptyHandshakes +
        ", malformedLines=" + malformedLines +
        ", oversizedLines=" + oversizedLines +
        ", entriesRouted=" + entriesRouted +
        ", fileWriteFailures=" + fileWriteFailures +
        ", auxiliaryWriteFailures=" + auxiliaryWriteFailures +
        '}';
  }
}
