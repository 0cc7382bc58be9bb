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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Transport whose connection attempts are completed by the test.
 */
class FakeTransport implements ClientTransport {
  private final BlockingQueue<SettableFuture<ClientConnection>> attempts = new LinkedBlockingQueue<>();
  private volatile boolean shutdown = false;

  @Override
  public ListenableFuture<ClientConnection> connect(Path socketPath) {
    SettableFuture<ClientConnection> attempt = SettableFuture.create();
    attempts.add(attempt);
    return attempt;
  }

  @Override
  public void shutdown() {
    shutdown = true;
  }

  boolean isShutdown() {
    return shutdown;
  }

  /**
   * The next connection attempt, or null if none is made within the timeout.
   */
  SettableFuture<ClientConnection> nextAttempt(long timeout, TimeUnit unit) throws InterruptedException {
    return attempts.poll(timeout, unit);
  }

  static class FakeConnection implements ClientConnection {
    private final List<String> lines = Collections.synchronizedList(new ArrayList<>());
    private final SettableFuture<Void> closed = SettableFuture.create();
    private boolean writable = true;
    private SettableFuture<Void> pendingWritable = null;

    @Override
    public ListenableFuture<Void> sendLine(String line) {
      if (closed.isDone()) {
        return Futures.immediateFailedFuture(new IOException("Broken pipe"));
      }
      lines.add(line);
      return Futures.immediateVoidFuture();
    }

    @Override
    public synchronized boolean isWritable() {
      return writable;
    }

    @Override
    public synchronized ListenableFuture<Void> whenWritable() {
      if (writable) {
        return Futures.immediateVoidFuture();
      }
      pendingWritable = SettableFuture.create();
      return pendingWritable;
    }

    /**
     * The outbound buffer fills up or drains.
     */
    synchronized void setWritable(boolean writable) {
      this.writable = writable;
      if (writable && pendingWritable != null) {
        pendingWritable.set(null);
        pendingWritable = null;
      }
    }

    @Override
    public ListenableFuture<Void> closeFuture() {
      return closed;
    }

    @Override
    public void close() {
      closed.set(null);
    }

    /**
     * The server side hangs up.
     */
    void drop() {
      closed.set(null);
    }

    boolean isClosed() {
      return closed.isDone();
    }

    List<String> getLines() {
      synchronized (lines) {
        return new ArrayList<>(lines);
      }
    }
  }
}
