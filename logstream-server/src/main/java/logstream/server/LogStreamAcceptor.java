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

import com.google.common.util.concurrent.AbstractService;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.AdaptiveRecvByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.netty.channel.unix.DomainSocketAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Listens on the Unix domain socket and hands each accepted connection to the session pipeline.
 * Stopping closes the listening socket and removes the socket file; live sessions are closed
 * through the {@link SessionRegistry}.
 */
public class LogStreamAcceptor extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(LogStreamAcceptor.class);
  private static final int MIN_READ_BUFFER = 64;

  private final Path socketPath;
  private final int readBufferSize;
  private final EventLoopGroup acceptGroup;
  private final EventLoopGroup workerGroup;
  private final ChannelInitializer<Channel> sessionInitializer;

  private Channel listenChannel;

  public LogStreamAcceptor(Path socketPath,
                           int readBufferSize,
                           EventLoopGroup acceptGroup,
                           EventLoopGroup workerGroup,
                           ChannelInitializer<Channel> sessionInitializer) {
    this.socketPath = socketPath;
    this.readBufferSize = readBufferSize;
    this.acceptGroup = acceptGroup;
    this.workerGroup = workerGroup;
    this.sessionInitializer = sessionInitializer;
  }

  public Path getSocketPath() {
    return socketPath;
  }

  @Override
  protected void doStart() {
    try {
      removeStaleSocket();
    } catch (IOException e) {
      LOG.error("Unable to remove stale socket {}", socketPath, e);
      notifyFailed(e);
      return;
    }

    ServerBootstrap bootstrap = new ServerBootstrap()
        .group(acceptGroup, workerGroup)
        .channel(EpollServerDomainSocketChannel.class)
        .childOption(ChannelOption.RCVBUF_ALLOCATOR,
            new AdaptiveRecvByteBufAllocator(Math.min(MIN_READ_BUFFER, readBufferSize), readBufferSize, Math.max(readBufferSize, 65536)))
        .childHandler(sessionInitializer);

    //noinspection RedundantCast
    bootstrap.bind(new DomainSocketAddress(socketPath.toFile())).addListener((ChannelFutureListener) future -> {
      if (future.isSuccess()) {
        listenChannel = future.channel();
        LOG.info("Listening on {}", socketPath);
        notifyStarted();
      } else {
        LOG.error("Unable to bind {}", socketPath, future.cause());
        notifyFailed(future.cause());
      }
    });
  }

  @Override
  protected void doStop() {
    if (listenChannel == null) {
      notifyStopped();
      return;
    }
    listenChannel.close().addListener((ChannelFutureListener) future -> {
      try {
        Files.deleteIfExists(socketPath);
      } catch (IOException e) {
        LOG.warn("Unable to remove socket file {}", socketPath, e);
      }
      notifyStopped();
    });
  }

  private void removeStaleSocket() throws IOException {
    if (Files.exists(socketPath)) {
      LOG.info("Removing stale socket file {}", socketPath);
      Files.delete(socketPath);
    }
    Path parent = socketPath.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }
}
