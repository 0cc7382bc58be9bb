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

package logstream.router;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import logstream.entry.LogEntry;
import logstream.interfaces.Backend;
import logstream.server.ServerCounters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans each entry out to every enabled backend. The outcome of routing is the outcome of the
 * durable writes; best-effort backends are written independently and their failures only
 * counted and logged.
 */
public class MessageRouter {
  private static final Logger LOG = LoggerFactory.getLogger(MessageRouter.class);

  private final ImmutableList<Backend> backends;
  private final ServerCounters counters;

  public MessageRouter(ImmutableList<Backend> backends, ServerCounters counters) {
    this.backends = backends;
    this.counters = counters;
  }

  public ImmutableList<Backend> getBackends() {
    return backends;
  }

  /**
   * Called from a session's event loop; per session, backends see entries in call order.
   */
  public ListenableFuture<Void> route(LogEntry entry) {
    List<ListenableFuture<Void>> durableWrites = new ArrayList<>(1);
    for (Backend backend : backends) {
      ListenableFuture<Void> write = writeTo(backend, entry);
      if (backend.kind().isDurable()) {
        Futures.addCallback(write, new DurableWriteCallback(backend, entry), MoreExecutors.directExecutor());
        durableWrites.add(write);
      } else {
        Futures.addCallback(write, new BestEffortWriteCallback(backend), MoreExecutors.directExecutor());
      }
    }
    counters.entryRouted();

    if (durableWrites.isEmpty()) {
      return Futures.immediateVoidFuture();
    } else if (durableWrites.size() == 1) {
      return durableWrites.get(0);
    }
    return Futures.transform(Futures.allAsList(durableWrites), ignore -> null, MoreExecutors.directExecutor());
  }

  private static ListenableFuture<Void> writeTo(Backend backend, LogEntry entry) {
    try {
      return backend.write(entry);
    } catch (RuntimeException e) {
      return Futures.immediateFailedFuture(e);
    }
  }

  private class DurableWriteCallback implements FutureCallback<Void> {
    private final Backend backend;
    private final LogEntry entry;

    DurableWriteCallback(Backend backend, LogEntry entry) {
      this.backend = backend;
      this.entry = entry;
    }

    @Override
    public void onSuccess(Void result) {
    }

    @Override
    public void onFailure(Throwable t) {
      long failures = counters.fileWriteFailed();
      LOG.error("{} backend failed to write entry {} from {} ({} failures so far)",
          backend.kind(), entry.getId(), entry.getDaemon(), failures, t);
    }
  }

  private class BestEffortWriteCallback implements FutureCallback<Void> {
    private final Backend backend;

    BestEffortWriteCallback(Backend backend) {
      this.backend = backend;
    }

    @Override
    public void onSuccess(Void result) {
    }

    @Override
    public void onFailure(Throwable t) {
      long failures = counters.auxiliaryWriteFailed();
      if (failures == 1) {
        LOG.warn("{} backend failed to write an entry; further failures are logged at debug", backend.kind(), t);
      } else {
        LOG.debug("{} backend write failed ({} failures so far)", backend.kind(), failures, t);
      }
    }
  }
}
