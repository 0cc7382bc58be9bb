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

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.EpollDomainDatagramChannel;
import io.netty.channel.unix.DomainSocketAddress;
import logstream.entry.LogEntry;
import logstream.interfaces.BackendKind;

import java.nio.file.Path;

/**
 * Forwards entries to the local systemd journal over its native datagram socket. Requires the
 * epoll transport.
 */
public class JournaldBackend extends DatagramBackend {
  private final Path journalSocket;
  private final JournalRecordEncoder encoder;

  public JournaldBackend(EventLoopGroup epollGroup, Path journalSocket, String syslogIdentifier) {
    super(epollGroup);
    this.journalSocket = journalSocket;
    this.encoder = new JournalRecordEncoder(syslogIdentifier);
  }

  @Override
  public BackendKind kind() {
    return BackendKind.JOURNALD;
  }

  @Override
  protected ChannelFuture open(Bootstrap bootstrap) {
    return bootstrap
        .channel(EpollDomainDatagramChannel.class)
        .connect(new DomainSocketAddress(journalSocket.toFile()));
  }

  @Override
  protected Object encode(LogEntry entry) {
    return Unpooled.wrappedBuffer(encoder.encode(entry));
  }

  @Override
  public String toString() {
    return "JournaldBackend{" + journalSocket + '}';
  }
}
