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

import logstream.LogStreamConstants;
import logstream.entry.LogLevel;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Settings for a {@link LogStreamClient}.
 */
public final class ClientConfig {
  private final Path socketPath;
  private final String daemonName;
  private final LogLevel minLevel;
  private final Duration connectTimeout;
  private final boolean autoReconnect;
  private final int bufferSize;
  private final Duration initialBackoff;
  private final Duration maxBackoff;

  private ClientConfig(Builder builder) {
    this.socketPath = builder.socketPath;
    this.daemonName = builder.daemonName;
    this.minLevel = builder.minLevel;
    this.connectTimeout = builder.connectTimeout;
    this.autoReconnect = builder.autoReconnect;
    this.bufferSize = builder.bufferSize;
    this.initialBackoff = builder.initialBackoff;
    this.maxBackoff = builder.maxBackoff;
  }

  public static Builder builder(String daemonName) {
    return new Builder(daemonName);
  }

  public Path getSocketPath() {
    return socketPath;
  }

  public String getDaemonName() {
    return daemonName;
  }

  /**
   * Entries less severe than this are discarded by the client.
   */
  public LogLevel getMinLevel() {
    return minLevel;
  }

  /**
   * Bound on connecting plus handshaking; exceeding it counts as a failed connection.
   */
  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public boolean isAutoReconnect() {
    return autoReconnect;
  }

  /**
   * Number of lines held while disconnected.
   */
  public int getBufferSize() {
    return bufferSize;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  @Override
  public String toString() {
    return "ClientConfig{" +
        "socketPath=" + socketPath +
        ", daemonName='" + daemonName + '\'' +
        ", minLevel=" + minLevel +
        ", connectTimeout=" + connectTimeout +
        ", autoReconnect=" + autoReconnect +
        ", bufferSize=" + bufferSize +
        '}';
  }

  public static final class Builder {
    private final String daemonName;
    private Path socketPath = Paths.get(LogStreamConstants.DEFAULT_SOCKET_PATH);
    private LogLevel minLevel = LogLevel.INFO;
    private Duration connectTimeout = Duration.ofMillis(LogStreamConstants.CLIENT_DEFAULT_TIMEOUT_MILLIS);
    private boolean autoReconnect = true;
    private int bufferSize = LogStreamConstants.CLIENT_DEFAULT_BUFFER_SIZE;
    private Duration initialBackoff = Duration.ofMillis(LogStreamConstants.CLIENT_INITIAL_BACKOFF_MILLIS);
    private Duration maxBackoff = Duration.ofMillis(LogStreamConstants.CLIENT_MAX_BACKOFF_MILLIS);

    private Builder(String daemonName) {
      this.daemonName = daemonName;
    }

    public Builder setSocketPath(Path socketPath) {
      this.socketPath = socketPath;
      return this;
    }

    public Builder setMinLevel(LogLevel minLevel) {
      this.minLevel = minLevel;
      return this;
    }

    public Builder setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder setAutoReconnect(boolean autoReconnect) {
      this.autoReconnect = autoReconnect;
      return this;
    }

    public Builder setBufferSize(int bufferSize) {
      this.bufferSize = bufferSize;
      return this;
    }

    public Builder setBackoff(Duration initialBackoff, Duration maxBackoff) {
      this.initialBackoff = initialBackoff;
      this.maxBackoff = maxBackoff;
      return this;
    }

    /**
     * @throws IllegalArgumentException if a setting is out of range
     */
    public ClientConfig build() {
      checkNotNull(daemonName, "daemon name");
      checkArgument(!daemonName.trim().isEmpty(), "daemon name must not be empty");
      checkArgument(daemonName.indexOf('\n') < 0 && daemonName.indexOf('\r') < 0,
          "daemon name must be a single line");
      checkArgument(socketPath != null && !socketPath.toString().isEmpty(), "socket path must not be empty");
      checkNotNull(minLevel, "minimum level");
      checkArgument(connectTimeout != null && !connectTimeout.isNegative() && !connectTimeout.isZero(),
          "connect timeout must be positive");
      checkArgument(bufferSize > 0, "buffer size must be positive");
      checkArgument(initialBackoff != null && initialBackoff.toMillis() > 0, "initial backoff must be positive");
      checkArgument(maxBackoff != null && maxBackoff.compareTo(initialBackoff) >= 0,
          "maximum backoff must not be below the initial backoff");
      return new ClientConfig(this);
    }
  }
}
