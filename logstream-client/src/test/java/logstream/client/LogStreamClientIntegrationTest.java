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

import com.google.common.collect.ImmutableMap;
import io.netty.channel.epoll.Epoll;
import logstream.config.ServerConfig;
import logstream.entry.EntryCodec;
import logstream.entry.LogEntry;
import logstream.entry.LogLevel;
import logstream.entry.MalformedEntryException;
import logstream.server.LogStreamServer;
import logstream.util.HostIdentity;
import logstream.util.LogStreamTestUtil;
import org.junit.After;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;
import static logstream.util.LogStreamTestUtil.waitUntil;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

/**
 * A real client against a real server over a Unix socket. Linux only.
 */
public class LogStreamClientIntegrationTest {
  private final LogStreamTestUtil testUtil = new LogStreamTestUtil();
  private final EntryCodec codec = new EntryCodec();
  private Path socketPath;
  private LogStreamServer server;
  private LogStreamClient client;

  @Before
  public void before() throws Exception {
    Assume.assumeTrue("native epoll transport unavailable", Epoll.isAvailable());
    socketPath = LogStreamTestUtil.newSocketPath();
  }

  @After
  public void after() throws Exception {
    if (client != null) {
      client.close();
    }
    if (server != null) {
      server.stopAsync().awaitTerminated(10, TimeUnit.SECONDS);
    }
    testUtil.cleanupTestDir();
  }

  private void startServer() throws Exception {
    ServerConfig config = ServerConfig.builder()
        .setSocketPath(socketPath)
        .setOutputDirectory(testUtil.getDataTestDir("logs"))
        .setShutdownGraceSeconds(2)
        .build();
    server = new LogStreamServer(config);
    server.startAsync().awaitRunning(10, TimeUnit.SECONDS);
  }

  private ClientConfig.Builder clientConfig() {
    return ClientConfig.builder("svc-A")
        .setSocketPath(socketPath)
        .setBackoff(Duration.ofMillis(50), Duration.ofMillis(200));
  }

  private List<LogEntry> persistedEntries() throws IOException, MalformedEntryException {
    Path active = server.getFileBackend().getActivePath();
    if (!Files.exists(active)) {
      return new ArrayList<>();
    }
    String content = new String(Files.readAllBytes(active), UTF_8);
    String complete = content.substring(0, content.lastIndexOf('\n') + 1);
    List<LogEntry> entries = new ArrayList<>();
    for (String line : complete.split("\n")) {
      if (!line.isEmpty()) {
        entries.add(codec.fromJson(line));
      }
    }
    return entries;
  }

  private List<String> waitForMessages(int count) throws Exception {
    waitUntil(() -> persistedEntries().size() >= count, 10, TimeUnit.SECONDS);
    return persistedEntries().stream().map(LogEntry::getMessage).collect(Collectors.toList());
  }

  @Test
  public void deliversEntriesStampedWithTheClientsIdentity() throws Exception {
    startServer();
    client = LogStreamClient.connect(clientConfig().build());

    client.info("started");
    client.error("request failed", ImmutableMap.of("status", "503"));
    client.debug("filtered out by the default minimum level");
    client.warning("slow response");

    assertThat(waitForMessages(3), contains("started", "request failed", "slow response"));
    LogEntry failed = persistedEntries().get(1);
    assertThat(failed.getDaemon(), is(equalTo("svc-A")));
    assertThat(failed.getLevel(), is(LogLevel.ERROR));
    assertThat(failed.getFields(), is(equalTo(ImmutableMap.of("status", "503"))));
    assertThat(failed.getPid(), is(HostIdentity.pid()));
    assertThat(failed.getHostname(), is(equalTo(HostIdentity.hostname())));
  }

  @Test
  public void buffersWhileTheServerIsDownAndDeliversOnceItIsUp() throws Exception {
    client = LogStreamClient.connect(clientConfig().build());
    client.info("logged before the server started");
    client.info("this one too");
    waitUntil(() -> client.getBufferedCount().get() == 2, 4, TimeUnit.SECONDS);

    startServer();

    assertThat(waitForMessages(2), contains("logged before the server started", "this one too"));
    assertThat(client.getState().get(), is(ClientState.CONNECTED));
  }
}
