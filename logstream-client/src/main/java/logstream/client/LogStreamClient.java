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
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import logstream.entry.EntryCodec;
import logstream.entry.LogLevel;
import logstream.util.FiberFutures;
import logstream.util.FiberOnly;
import logstream.util.FiberSupplier;
import logstream.util.HostIdentity;
import logstream.util.PoolFiberSupplier;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends log entries for one daemon to a LogStream server.
 * <p>
 * The connection is a state machine driven by the client's fiber (see {@link ClientState}).
 * Logging never blocks: entries logged while the client is not connected, or while the connection
 * is not writable because the server has stopped reading, are held in a bounded buffer, which
 * drops its oldest line when full. They are sent in order once the connection has completed its
 * handshake and can take more writes. Failed connections are retried with exponential backoff.
 */
public class LogStreamClient implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(LogStreamClient.class);

  private final ClientConfig config;
  private final ClientTransport transport;
  private final EntryCodec codec;
  private final Integer pid;
  private final String hostname;
  private final ExponentialBackoff backoff;
  private final Fiber fiber;
  private final Runnable onClosed;
  private final AtomicLong droppedCount = new AtomicLong();

  private volatile boolean closeRequested = false;

  // The fields below may only be read or written from tasks running on the fiber.
  private final Deque<String> buffer = new ArrayDeque<>();
  private ClientState state = ClientState.DISCONNECTED;
  private ClientConnection connection = null;
  private Disposable connectTimeout = null;
  private Disposable scheduledReconnect = null;
  private long attempt = 0;
  private boolean awaitingWritable = false;

  /**
   * A client on the native epoll transport with its own fiber. Connecting begins immediately.
   */
  public static LogStreamClient connect(ClientConfig config) {
    ExecutorService fiberPool = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "logstream-client-fiber");
      thread.setDaemon(true);
      return thread;
    });
    PoolFiberSupplier fiberSupplier = new PoolFiberSupplier(fiberPool);
    ClientTransport transport = NettyClientTransport.epoll();
    LogStreamClient client = new LogStreamClient(config, transport, fiberSupplier, new EntryCodec(),
        HostIdentity.pid(), HostIdentity.hostname(), () -> {
          transport.shutdown();
          fiberPool.shutdown();
        });
    client.start();
    return client;
  }

  public LogStreamClient(ClientConfig config,
                         ClientTransport transport,
                         FiberSupplier fiberSupplier,
                         EntryCodec codec,
                         Integer pid,
                         String hostname,
                         Runnable onClosed) {
    this.config = config;
    this.transport = transport;
    this.codec = codec;
    this.pid = pid;
    this.hostname = hostname;
    this.onClosed = onClosed;
    this.backoff = new ExponentialBackoff(config.getInitialBackoff().toMillis(), config.getMaxBackoff().toMillis());
    this.fiber = fiberSupplier.getFiber(this::handleFiberException);
  }

  public void start() {
    fiber.start();
    fiber.execute(this::beginConnecting);
  }

  public void emergency(String message) {
    log(LogLevel.EMERGENCY, message, ImmutableMap.of());
  }

  public void emergency(String message, Map<String, String> fields) {
    log(LogLevel.EMERGENCY, message, fields);
  }

  public void alert(String message) {
    log(LogLevel.ALERT, message, ImmutableMap.of());
  }

  public void alert(String message, Map<String, String> fields) {
    log(LogLevel.ALERT, message, fields);
  }

  public void critical(String message) {
    log(LogLevel.CRITICAL, message, ImmutableMap.of());
  }

  public void critical(String message, Map<String, String> fields) {
    log(LogLevel.CRITICAL, message, fields);
  }

  public void error(String message) {
    log(LogLevel.ERROR, message, ImmutableMap.of());
  }

  public void error(String message, Map<String, String> fields) {
    log(LogLevel.ERROR, message, fields);
  }

  public void warning(String message) {
    log(LogLevel.WARNING, message, ImmutableMap.of());
  }

  public void warning(String message, Map<String, String> fields) {
    log(LogLevel.WARNING, message, fields);
  }

  public void notice(String message) {
    log(LogLevel.NOTICE, message, ImmutableMap.of());
  }

  public void notice(String message, Map<String, String> fields) {
    log(LogLevel.NOTICE, message, fields);
  }

  public void info(String message) {
    log(LogLevel.INFO, message, ImmutableMap.of());
  }

  public void info(String message, Map<String, String> fields) {
    log(LogLevel.INFO, message, fields);
  }

  public void debug(String message) {
    log(LogLevel.DEBUG, message, ImmutableMap.of());
  }

  public void debug(String message, Map<String, String> fields) {
    log(LogLevel.DEBUG, message, fields);
  }

  /**
   * Queue one entry for the server. Entries below the configured minimum level, and all entries
   * after {@link #close()}, are ignored.
   */
  public void log(LogLevel level, String message, Map<String, String> fields) {
    if (closeRequested || !level.isAtLeastAsSevereAs(config.getMinLevel())) {
      return;
    }
    String line = codec.encodeSubmission(level, message, fields, pid, hostname);
    fiber.execute(() -> submit(line));
  }

  /**
   * Lines discarded because the buffer was full.
   */
  public long getDroppedCount() {
    return droppedCount.get();
  }

  public ListenableFuture<ClientState> getState() {
    return FiberFutures.submit(fiber, () -> state);
  }

  public ListenableFuture<Integer> getBufferedCount() {
    return FiberFutures.submit(fiber, buffer::size);
  }

  /**
   * Move to {@link ClientState#CLOSED}: the connection is closed after lines already handed to
   * it are written, and lines still buffered are discarded.
   */
  @Override
  public void close() {
    if (closeRequested) {
      return;
    }
    closeRequested = true;
    fiber.execute(this::closeOnFiber);
  }

  @FiberOnly
  private void submit(String line) {
    switch (state) {
      case CLOSED:
        return;
      case CONNECTED:
        if (buffer.isEmpty() && connection.isWritable()) {
          transmit(line);
        } else {
          buffer(line);
          awaitWritable();
        }
        return;
      default:
        buffer(line);
        if (state == ClientState.DISCONNECTED && !config.isAutoReconnect() && scheduledReconnect == null) {
          beginConnecting();
        }
    }
  }

  @FiberOnly
  private void buffer(String line) {
    if (buffer.size() >= config.getBufferSize()) {
      buffer.poll();
      long dropped = droppedCount.incrementAndGet();
      if (dropped == 1) {
        LOG.warn("Client buffer for {} is full ({} lines); dropping the oldest lines",
            config.getDaemonName(), config.getBufferSize());
      }
    }
    buffer.add(line);
  }

  @FiberOnly
  private void transmit(String line) {
    ClientConnection current = connection;
    FiberFutures.addCallback(current.sendLine(line),
        ignore -> {
        },
        cause -> connectionFailed(current, cause),
        fiber);
  }

  @FiberOnly
  private void flushBuffer() {
    while (!buffer.isEmpty()) {
      if (!connection.isWritable()) {
        awaitWritable();
        return;
      }
      transmit(buffer.poll());
    }
  }

  @FiberOnly
  private void awaitWritable() {
    if (awaitingWritable) {
      return;
    }
    awaitingWritable = true;
    ClientConnection current = connection;
    FiberFutures.addCallback(current.whenWritable(),
        ignore -> connectionWritable(current),
        cause -> connectionFailed(current, cause),
        fiber);
  }

  @FiberOnly
  private void connectionWritable(ClientConnection current) {
    if (current != connection || state != ClientState.CONNECTED) {
      return;
    }
    awaitingWritable = false;
    flushBuffer();
  }

  @FiberOnly
  private void beginConnecting() {
    scheduledReconnect = null;
    if (state != ClientState.DISCONNECTED) {
      return;
    }
    state = ClientState.CONNECTING;
    long thisAttempt = ++attempt;
    LOG.debug("Connecting to {} (attempt {})", config.getSocketPath(), thisAttempt);
    connectTimeout = fiber.schedule(() -> connectTimedOut(thisAttempt),
        config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
    FiberFutures.addCallback(transport.connect(config.getSocketPath()),
        opened -> connectionOpened(thisAttempt, opened),
        cause -> connectAttemptFailed(thisAttempt, cause),
        fiber);
  }

  @FiberOnly
  private void connectionOpened(long thisAttempt, ClientConnection opened) {
    if (thisAttempt != attempt || state != ClientState.CONNECTING) {
      opened.close();
      return;
    }
    state = ClientState.HANDSHAKING;
    connection = opened;
    FiberFutures.addCallback(opened.closeFuture(),
        ignore -> connectionFailed(opened, null),
        cause -> connectionFailed(opened, cause),
        fiber);
    FiberFutures.addCallback(opened.sendLine(config.getDaemonName()),
        ignore -> handshakeCompleted(opened),
        cause -> connectionFailed(opened, cause),
        fiber);
  }

  @FiberOnly
  private void handshakeCompleted(ClientConnection handshaken) {
    if (handshaken != connection || state != ClientState.HANDSHAKING) {
      return;
    }
    cancelConnectTimeout();
    state = ClientState.CONNECTED;
    backoff.reset();
    LOG.info("Connected to {} as {}; sending {} buffered lines",
        config.getSocketPath(), config.getDaemonName(), buffer.size());
    flushBuffer();
  }

  @FiberOnly
  private void connectAttemptFailed(long thisAttempt, Throwable cause) {
    if (thisAttempt != attempt || state != ClientState.CONNECTING) {
      return;
    }
    disconnected("connect failed: " + FiberFutures.unwrap(cause).getMessage());
  }

  @FiberOnly
  private void connectTimedOut(long thisAttempt) {
    if (thisAttempt != attempt
        || (state != ClientState.CONNECTING && state != ClientState.HANDSHAKING)) {
      return;
    }
    if (connection != null) {
      connection.close();
      connection = null;
    }
    // A connect that completes after this point belongs to a stale attempt and is closed.
    attempt++;
    disconnected("no handshake within " + config.getConnectTimeout().toMillis() + " ms");
  }

  /**
   * @param cause the failure, or null when the connection simply closed
   */
  @FiberOnly
  private void connectionFailed(ClientConnection failed, Throwable cause) {
    if (failed != connection) {
      return;
    }
    connection = null;
    failed.close();
    disconnected(cause == null ? "connection closed" : FiberFutures.unwrap(cause).toString());
  }

  @FiberOnly
  private void disconnected(String reason) {
    if (state == ClientState.CLOSED) {
      return;
    }
    cancelConnectTimeout();
    awaitingWritable = false;
    state = ClientState.DISCONNECTED;
    if (!config.isAutoReconnect()) {
      LOG.warn("Disconnected from {} ({}); reconnecting on the next entry", config.getSocketPath(), reason);
      return;
    }
    long delay = backoff.nextDelayMillis();
    LOG.warn("Disconnected from {} ({}); retrying in {} ms", config.getSocketPath(), reason, delay);
    scheduledReconnect = fiber.schedule(this::beginConnecting, delay, TimeUnit.MILLISECONDS);
  }

  @FiberOnly
  private void cancelConnectTimeout() {
    if (connectTimeout != null) {
      connectTimeout.dispose();
      connectTimeout = null;
    }
  }

  @FiberOnly
  private void closeOnFiber() {
    if (state == ClientState.CLOSED) {
      return;
    }
    state = ClientState.CLOSED;
    cancelConnectTimeout();
    if (scheduledReconnect != null) {
      scheduledReconnect.dispose();
      scheduledReconnect = null;
    }
    if (!buffer.isEmpty()) {
      LOG.info("Discarding {} buffered lines on close", buffer.size());
      buffer.clear();
    }
    if (connection != null) {
      ClientConnection closing = connection;
      connection = null;
      closing.close();
      closing.closeFuture().addListener(onClosed, MoreExecutors.directExecutor());
    } else {
      onClosed.run();
    }
    LOG.debug("Client for {} closed", config.getDaemonName());
  }

  private void handleFiberException(Throwable t) {
    LOG.error("Unexpected error in client for {}", config.getDaemonName(), t);
  }

  @Override
  public String toString() {
    return "LogStreamClient{" + config.getDaemonName() + " -> " + config.getSocketPath() + '}';
  }
}
