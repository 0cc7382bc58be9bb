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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import io.netty.channel.Channel;
import logstream.util.FiberFutures;
import logstream.util.FiberOnly;
import logstream.util.FiberSupplier;
import logstream.util.NettyFutures;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Live sessions, keyed by their channel. Sessions announce themselves after the handshake and
 * leave when their channel closes; both arrive as messages on the registry's fiber, which alone
 * touches the map.
 */
public class SessionRegistry extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

  private final FiberSupplier fiberSupplier;
  private final org.jetlang.channels.Channel<SessionOpened> openedSessions = new MemoryChannel<>();
  private final org.jetlang.channels.Channel<Channel> closedSessions = new MemoryChannel<>();

  // This map may only be read or written from tasks running on the fiber.
  private final Map<Channel, SessionDescriptor> sessions = new HashMap<>();

  private Fiber fiber;

  private static class SessionOpened {
    final Channel channel;
    final SessionDescriptor descriptor;

    SessionOpened(Channel channel, SessionDescriptor descriptor) {
      this.channel = channel;
      this.descriptor = descriptor;
    }
  }

  public SessionRegistry(FiberSupplier fiberSupplier) {
    this.fiberSupplier = fiberSupplier;
  }

  public void register(Channel channel, SessionDescriptor descriptor) {
    openedSessions.publish(new SessionOpened(channel, descriptor));
  }

  public void unregister(Channel channel) {
    closedSessions.publish(channel);
  }

  public ListenableFuture<ImmutableMap<Channel, SessionDescriptor>> getSessions() {
    return FiberFutures.submit(fiber, () -> ImmutableMap.copyOf(sessions));
  }

  /**
   * Close every live session's channel; completes once all of them are closed.
   */
  public ListenableFuture<Void> closeAll() {
    ListenableFuture<List<Void>> closing = Futures.transformAsync(
        FiberFutures.submit(fiber, this::closeLiveChannels),
        futures -> Futures.allAsList(futures),
        MoreExecutors.directExecutor());
    return Futures.transform(closing, ignore -> null, MoreExecutors.directExecutor());
  }

  @FiberOnly
  private ImmutableList<ListenableFuture<Void>> closeLiveChannels() {
    LOG.info("Closing {} live sessions", sessions.size());
    List<ListenableFuture<Void>> closeFutures = new ArrayList<>();
    for (Channel channel : sessions.keySet()) {
      closeFutures.add(NettyFutures.toListenableFuture(channel.close()));
    }
    return ImmutableList.copyOf(closeFutures);
  }

  @FiberOnly
  private void handleOpened(SessionOpened opened) {
    if (!opened.channel.isOpen()) {
      return;
    }
    sessions.put(opened.channel, opened.descriptor);
    LOG.debug("Session registered: {}", opened.descriptor);
  }

  @FiberOnly
  private void handleClosed(Channel channel) {
    SessionDescriptor descriptor = sessions.remove(channel);
    if (descriptor != null) {
      LOG.debug("Session closed: {}", descriptor);
    }
  }

  @Override
  protected void doStart() {
    fiber = fiberSupplier.getFiber(this::failModule);
    openedSessions.subscribe(fiber, this::handleOpened);
    closedSessions.subscribe(fiber, this::handleClosed);
    fiber.start();
    notifyStarted();
  }

  @Override
  protected void doStop() {
    fiber.dispose();
    notifyStopped();
  }

  private void failModule(Throwable t) {
    LOG.error("Session registry failed", t);
    fiber.dispose();
    if (isRunning()) {
      notifyFailed(t);
    }
  }
}
