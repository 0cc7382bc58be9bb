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

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import logstream.entry.EntryCodec;
import logstream.entry.LogEntry;
import logstream.entry.MalformedEntryException;
import logstream.router.MessageRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * One client connection. The first line names the daemon; every later line is a JSON entry
 * routed to the backends. Nothing is ever written back to the client.
 * <p>
 * State is confined to the channel's event loop.
 */
public class SessionHandler extends SimpleChannelInboundHandler<String> {
  private static final Logger LOG = LoggerFactory.getLogger(SessionHandler.class);

  private final MessageRouter router;
  private final EntryCodec codec;
  private final SessionRegistry registry;
  private final ServerCounters counters;
  private final Clock clock;
  private final String defaultHostname;
  private final int maxInFlight;
  private final int resumeReadingAt;

  private String daemon = null;
  private boolean rejected = false;
  private Instant lastTimestamp = Instant.EPOCH;
  private int inFlight = 0;

  public SessionHandler(MessageRouter router,
                        EntryCodec codec,
                        SessionRegistry registry,
                        ServerCounters counters,
                        Clock clock,
                        String defaultHostname,
                        int maxInFlight,
                        int resumeReadingAt) {
    this.router = router;
    this.codec = codec;
    this.registry = registry;
    this.counters = counters;
    this.clock = clock;
    this.defaultHostname = defaultHostname;
    this.maxInFlight = maxInFlight;
    this.resumeReadingAt = resumeReadingAt;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, String line) throws Exception {
    if (rejected) {
      return;
    }
    if (daemon == null) {
      handshake(ctx, line);
      return;
    }
    if (line.trim().isEmpty()) {
      return;
    }

    LogEntry entry;
    try {
      entry = codec.decodeSubmission(line, daemon, UUID.randomUUID(), nextTimestamp(), defaultHostname);
    } catch (MalformedEntryException e) {
      counters.malformedLine();
      LOG.warn("Discarding malformed line from {}: {}", daemon, e.getMessage());
      return;
    }

    inFlight++;
    if (inFlight >= maxInFlight && ctx.channel().config().isAutoRead()) {
      LOG.debug("Session {} has {} entries in flight, pausing reads", daemon, inFlight);
      ctx.channel().config().setAutoRead(false);
    }
    router.route(entry).addListener(() -> entryCompleted(ctx), ctx.executor());
  }

  private void handshake(ChannelHandlerContext ctx, String line) {
    if (line.trim().isEmpty()) {
      counters.emptyHandshake();
      rejected = true;
      LOG.warn("Closing connection {}: empty daemon name in handshake", ctx.channel());
      ctx.close();
      return;
    }
    daemon = line;
    registry.register(ctx.channel(), new SessionDescriptor(daemon, clock.instant()));
    LOG.debug("Session established for {}", daemon);
  }

  private Instant nextTimestamp() {
    Instant now = clock.instant();
    if (now.isBefore(lastTimestamp)) {
      now = lastTimestamp;
    }
    lastTimestamp = now;
    return now;
  }

  private void entryCompleted(ChannelHandlerContext ctx) {
    inFlight--;
    if (inFlight <= resumeReadingAt && !ctx.channel().config().isAutoRead()) {
      LOG.debug("Session {} drained to {} entries in flight, resuming reads", daemon, inFlight);
      ctx.channel().config().setAutoRead(true);
    }
  }

  public String getDaemon() {
    return daemon;
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    if (daemon != null) {
      registry.unregister(ctx.channel());
    }
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
    if (cause instanceof TooLongFrameException) {
      counters.oversizedLine();
      LOG.warn("Closing session {}: {}", describe(ctx), cause.getMessage());
    } else if (cause instanceof IOException) {
      LOG.debug("Closing session {} after I/O error", describe(ctx), cause);
    } else {
      LOG.warn("Closing session {} after unexpected error", describe(ctx), cause);
    }
    ctx.close();
  }

  private String describe(ChannelHandlerContext ctx) {
    return daemon == null ? ctx.channel().toString() : daemon;
  }
}
