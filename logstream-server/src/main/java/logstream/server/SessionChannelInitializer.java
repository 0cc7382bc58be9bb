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

import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.string.StringDecoder;
import logstream.LogStreamConstants;
import logstream.entry.EntryCodec;
import logstream.router.MessageRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Admits or refuses each accepted connection, then sets up line framing and the session.
 */
public class SessionChannelInitializer extends ChannelInitializer<Channel> {
  private static final Logger LOG = LoggerFactory.getLogger(SessionChannelInitializer.class);

  private final ConnectionAdmission admission;
  private final ServerCounters counters;
  private final MessageRouter router;
  private final SessionRegistry registry;
  private final EntryCodec codec;
  private final Clock clock;
  private final String defaultHostname;
  private final int maxLineLength;

  public SessionChannelInitializer(ConnectionAdmission admission,
                                   ServerCounters counters,
                                   MessageRouter router,
                                   SessionRegistry registry,
                                   EntryCodec codec,
                                   Clock clock,
                                   String defaultHostname,
                                   int readBufferSize) {
    this.admission = admission;
    this.counters = counters;
    this.router = router;
    this.registry = registry;
    this.codec = codec;
    this.clock = clock;
    this.defaultHostname = defaultHostname;
    this.maxLineLength = readBufferSize * LogStreamConstants.LINE_LENGTH_MULTIPLIER;
  }

  @Override
  protected void initChannel(Channel ch) throws Exception {
    if (!admission.tryAcquire()) {
      counters.connectionRejected();
      LOG.warn("Refusing connection: {} connections already live", admission.maxConnections());
      ch.close();
      return;
    }
    counters.connectionAccepted();
    ch.closeFuture().addListener(future -> admission.release());

    ChannelPipeline p = ch.pipeline();
    p.addLast("lineFrameDecoder", new SessionLineDecoder(maxLineLength));
    p.addLast("stringDecoder", new StringDecoder(UTF_8));
    p.addLast("sessionHandler", new SessionHandler(router, codec, registry, counters, clock, defaultHostname,
        LogStreamConstants.MAX_IN_FLIGHT_PER_SESSION, LogStreamConstants.RESUME_READING_IN_FLIGHT));
  }
}
