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

package logstream.entry;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One structured log record. The id, timestamp and daemon are assigned by the server; everything
 * else comes from the submitting client.
 */
public final class LogEntry {
  private final UUID id;
  private final Instant timestamp;
  private final LogLevel level;
  private final String daemon;
  private final String message;
  private final ImmutableMap<String, String> fields;
  @Nullable
  private final Integer pid;
  @Nullable
  private final String hostname;

  private LogEntry(Builder builder) {
    this.id = checkNotNull(builder.id, "id");
    this.timestamp = checkNotNull(builder.timestamp, "timestamp");
    this.level = checkNotNull(builder.level, "level");
    this.daemon = checkNotNull(builder.daemon, "daemon");
    this.message = checkNotNull(builder.message, "message");
    this.fields = builder.fields.build();
    this.pid = builder.pid;
    this.hostname = builder.hostname;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setId(id)
        .setTimestamp(timestamp)
        .setLevel(level)
        .setDaemon(daemon)
        .setMessage(message)
        .putAllFields(fields)
        .setPid(pid)
        .setHostname(hostname);
  }

  @NotNull
  public UUID getId() {
    return id;
  }

  @NotNull
  public Instant getTimestamp() {
    return timestamp;
  }

  @NotNull
  public LogLevel getLevel() {
    return level;
  }

  @NotNull
  public String getDaemon() {
    return daemon;
  }

  @NotNull
  public String getMessage() {
    return message;
  }

  @NotNull
  public ImmutableMap<String, String> getFields() {
    return fields;
  }

  @Nullable
  public Integer getPid() {
    return pid;
  }

  @Nullable
  public String getHostname() {
    return hostname;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    LogEntry that = (LogEntry) o;
    return id.equals(that.id)
        && timestamp.equals(that.timestamp)
        && level == that.level
        && daemon.equals(that.daemon)
        && message.equals(that.message)
        && fields.equals(that.fields)
        && Objects.equals(pid, that.pid)
        && Objects.equals(hostname, that.hostname);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, timestamp, level, daemon, message, fields, pid, hostname);
  }

  @Override
  public String toString() {
    return "LogEntry{" +
        "id=" + id +
        ", timestamp=" + timestamp +
        ", level=" + level +
        ", daemon='" + daemon + '\'' +
        ", message='" + message + '\'' +
        ", fields=" + fields +
        ", pid=" + pid +
        ", hostname='" + hostname + '\'' +
        '}';
  }

  public static final class Builder {
    private UUID id;
    private Instant timestamp;
    private LogLevel level;
    private String daemon;
    private String message;
    private final ImmutableMap.Builder<String, String> fields = ImmutableMap.builder();
    private Integer pid;
    private String hostname;

    private Builder() {
    }

    public Builder setId(UUID id) {
      this.id = id;
      return this;
    }

    public Builder setTimestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder setLevel(LogLevel level) {
      this.level = level;
      return this;
    }

    public Builder setDaemon(String daemon) {
      this.daemon = daemon;
      return this;
    }

    public Builder setMessage(String message) {
      this.message = message;
      return this;
    }

    public Builder putField(String key, String value) {
      fields.put(key, value);
      return this;
    }

    public Builder putAllFields(Map<String, String> fields) {
      this.fields.putAll(fields);
      return this;
    }

    public Builder setPid(@Nullable Integer pid) {
      this.pid = pid;
      return this;
    }

    public Builder setHostname(@Nullable String hostname) {
      this.hostname = hostname;
      return this;
    }

    public LogEntry build() {
      return new LogEntry(this);
    }
  }
}
