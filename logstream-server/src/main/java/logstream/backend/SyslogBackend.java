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
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.DatagramPacket;
import logstream.entry.EntryFormat;
import logstream.entry.LogEntry;
import logstream.entry.SyslogFacility;
import logstream.interfaces.BackendKind;

import java.net.InetSocketAddress;
import java.net.UnknownHostException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Forwards entries as RFC 3164 datagrams over UDP, tagged with the submitting daemon's name.
 */
public class SyslogBackend extends DatagramBackend {
  private final Class<? extends DatagramChannel> channelClass;
  private final SyslogFacility facility;
  private final String host;
  private final int port;

  private InetSocketAddress target;

  public SyslogBackend(EventLoopGroup eventLoopGroup,
                       Class<? extends DatagramChannel> channelClass,
                       SyslogFacility facility,
                       String host,
                       int port) {
    super(eventLoopGroup);
    this.channelClass = channelClass;
    this.facility = facility;
    this.host = host;
    this.port = port;
  }

  @Override
  public BackendKind kind() {
    return BackendKind.SYSLOG;
  }

  @Override
  protected ChannelFuture open(Bootstrap bootstrap) throws Exception {
    target = new InetSocketAddress(host, port);
    if (target.isUnresolved()) {
      throw new UnknownHostException("syslog server " + host);
    }
    return bootstrap.channel(channelClass).bind(0);
  }

  @Override
  protected Object encode(LogEntry entry) {
    String line = EntryFormat.syslogLine(entry, facility, entry.getDaemon());
    return new DatagramPacket(Unpooled.copiedBuffer(line, UTF_8), target);
  }

  @Override
  public String toString() {
    return "SyslogBackend{" + host + ":" + port + ", facility=" + facility + '}';
  }
}
