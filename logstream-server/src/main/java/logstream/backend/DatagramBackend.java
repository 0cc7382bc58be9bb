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

package logstream.backend;

import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoopGroup;
import logstream.entry.LogEntry;
import logstream.interfaces.Backend;
import logstream.util.NettyFutures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A best-effort backend that sends one datagram per entry. Subclasses choose the channel type
 * and destination and encode entries into messages that channel accepts.
 */
public abstract class DatagramBackend extends AbstractService implements Backend {
  private static final Logger LOG = LoggerFactory.getLogger(DatagramBackend.class);

  private final EventLoopGroup eventLoopGroup;

  private volatile Channel channel;

  protected DatagramBackend(EventLoopGroup eventLoopGroup) {
    this.eventLoopGroup = eventLoopGroup;
  }

  /**
   * Bind or connect a channel configured on the given bootstrap.
   */
  protected abstract ChannelFuture open(Bootstrap bootstrap) throws Exception;

  /**
   * The outbound message for one entry.
   */
  protected abstract Object encode(LogEntry entry);

  @Override
  public ListenableFuture<Void> write(LogEntry entry) {
    Channel current = channel;
    if (current == null || state() != State.RUNNING) {
      return Futures.immediateFailedFuture(new IllegalStateException(kind() + " backend is " + state()));
    }
    return NettyFutures.toListenableFuture(current.writeAndFlush(encode(entry)));
  }

  @Override
  protected void doStart() {
    Bootstrap bootstrap = new Bootstrap()
        .group(eventLoopGroup)
        .handler(new ChannelInboundHandlerAdapter());
    ChannelFuture opening;
    try {
      opening = open(bootstrap);
    } catch (Exception e) {
      LOG.warn("Unable to open {} backend", kind(), e);
      notifyFailed(e);
      return;
    }
    //noinspection RedundantCast
    opening.addListener((ChannelFutureListener) future -> {
      if (future.isSuccess()) {
        channel = future.channel();
        LOG.info("{} backend ready on {}", kind(), channel);
        notifyStarted();
      } else {
        LOG.warn("Unable to open {} backend", kind(), future.cause());
        notifyFailed(future.cause());
      }
    });
  }

  @Override
  protected void doStop() {
    Channel current = channel;
    if (current == null) {
      notifyStopped();
      return;
    }
    current.close().addListener((ChannelFutureListener) future -> notifyStopped());
  }
}
