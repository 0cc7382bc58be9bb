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

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.util.ReferenceCountUtil;
import logstream.util.NettyFutures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Connects to the server's Unix domain socket through Netty.
 */
public class NettyClientTransport implements ClientTransport {
  private static final Logger LOG = LoggerFactory.getLogger(NettyClientTransport.class);

  static final int WRITE_BUFFER_LOW_WATER_MARK = 32 * 1024;
  static final int WRITE_BUFFER_HIGH_WATER_MARK = 64 * 1024;

  private final EventLoopGroup eventLoopGroup;
  private final boolean ownsEventLoopGroup;
  private final Bootstrap bootstrap;

  /**
   * A transport on its own single-threaded epoll event loop, shut down with the transport.
   */
  public static NettyClientTransport epoll() {
    EventLoopGroup group = new EpollEventLoopGroup(1,
        new ThreadFactoryBuilder().setNameFormat("logstream-client-%d").setDaemon(true).build());
    return new NettyClientTransport(group, EpollDomainSocketChannel.class, true);
  }

  public NettyClientTransport(EventLoopGroup eventLoopGroup, Class<? extends Channel> channelClass) {
    this(eventLoopGroup, channelClass, false);
  }

  private NettyClientTransport(EventLoopGroup eventLoopGroup,
                               Class<? extends Channel> channelClass,
                               boolean ownsEventLoopGroup) {
    this.eventLoopGroup = eventLoopGroup;
    this.ownsEventLoopGroup = ownsEventLoopGroup;
    this.bootstrap = new Bootstrap()
        .group(eventLoopGroup)
        .channel(channelClass)
        .option(ChannelOption.WRITE_BUFFER_WATER_MARK,
            new WriteBufferWaterMark(WRITE_BUFFER_LOW_WATER_MARK, WRITE_BUFFER_HIGH_WATER_MARK))
        .handler(InboundDiscarder.INSTANCE);
  }

  @Override
  public ListenableFuture<ClientConnection> connect(Path socketPath) {
    SettableFuture<ClientConnection> connection = SettableFuture.create();
    ChannelFuture connecting = bootstrap.connect(new DomainSocketAddress(socketPath.toFile()));
    connecting.addListener((ChannelFutureListener) future -> {
      if (future.isSuccess()) {
        NettyClientConnection opened = new NettyClientConnection(future.channel());
        future.channel().pipeline().addLast("writabilityWatcher", new WritabilityWatcher(opened));
        connection.set(opened);
      } else {
        connection.setException(future.cause());
      }
    });
    return connection;
  }

  @Override
  public void shutdown() {
    if (ownsEventLoopGroup) {
      eventLoopGroup.shutdownGracefully();
    }
  }

  /**
   * The server never writes to clients; anything received is dropped and errors close the channel.
   */
  @ChannelHandler.Sharable
  private static class InboundDiscarder extends ChannelInboundHandlerAdapter {
    static final InboundDiscarder INSTANCE = new InboundDiscarder();

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
      ReferenceCountUtil.release(msg);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
      LOG.debug("Closing connection {} after error", ctx.channel(), cause);
      ctx.close();
    }
  }

  private static class WritabilityWatcher extends ChannelInboundHandlerAdapter {
    private final NettyClientConnection connection;

    WritabilityWatcher(NettyClientConnection connection) {
      this.connection = connection;
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
      if (ctx.channel().isWritable()) {
        connection.becameWritable();
      }
      super.channelWritabilityChanged(ctx);
    }
  }

  private static class NettyClientConnection implements ClientConnection {
    private final Channel channel;
    private final AtomicReference<SettableFuture<Void>> pendingWritable = new AtomicReference<>();

    NettyClientConnection(Channel channel) {
      this.channel = channel;
    }

    @Override
    public ListenableFuture<Void> sendLine(String line) {
      return NettyFutures.toListenableFuture(channel.writeAndFlush(Unpooled.copiedBuffer(line + "\n", UTF_8)));
    }

    @Override
    public boolean isWritable() {
      return channel.isWritable();
    }

    @Override
    public ListenableFuture<Void> whenWritable() {
      SettableFuture<Void> writable = SettableFuture.create();
      pendingWritable.set(writable);
      // Writability may have changed before the future was published.
      if (channel.isWritable()) {
        becameWritable();
      }
      return writable;
    }

    void becameWritable() {
      SettableFuture<Void> writable = pendingWritable.getAndSet(null);
      if (writable != null) {
        writable.set(null);
      }
    }

    @Override
    public ListenableFuture<Void> closeFuture() {
      return NettyFutures.toListenableFuture(channel.closeFuture());
    }

    @Override
    public void close() {
      // Queued behind every earlier write, so those are flushed before the close.
      channel.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public String toString() {
      return channel.toString();
    }
  }
}
