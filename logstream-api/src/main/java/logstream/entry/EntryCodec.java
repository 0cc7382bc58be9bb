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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;

/**
 * JSON encoding of entries: the line clients submit over the socket, and the full record the file
 * backend persists. Instances are thread safe.
 */
public class EntryCodec {
  private static final String LEVEL = "level";
  private static final String MESSAGE = "message";
  private static final String FIELDS = "fields";
  private static final String PID = "pid";
  private static final String HOSTNAME = "hostname";

  private final ObjectMapper mapper = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  /**
   * Decode one submitted line. Any id, timestamp or daemon present on the wire is ignored in
   * favour of the server-assigned values passed in.
   */
  public LogEntry decodeSubmission(String line,
                                   String daemon,
                                   UUID id,
                                   Instant timestamp,
                                   @Nullable String defaultHostname) throws MalformedEntryException {
    JsonNode root;
    try {
      root = mapper.readTree(line);
    } catch (JsonProcessingException e) {
      throw new MalformedEntryException("invalid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedEntryException("entry must be a JSON object");
    }

    LogEntry.Builder builder = LogEntry.builder()
        .setId(id)
        .setTimestamp(timestamp)
        .setDaemon(daemon)
        .setLevel(decodeLevel(root.get(LEVEL)))
        .setMessage(decodeMessage(root.get(MESSAGE)));

    JsonNode fields = root.get(FIELDS);
    if (fields != null && !fields.isNull()) {
      if (!fields.isObject()) {
        throw new MalformedEntryException("'fields' must be an object");
      }
      Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> field = it.next();
        if (!field.getValue().isValueNode() || field.getValue().isNull()) {
          throw new MalformedEntryException("field '" + field.getKey() + "' must be a scalar value");
        }
        builder.putField(field.getKey(), field.getValue().asText());
      }
    }

    JsonNode pid = root.get(PID);
    if (pid != null && !pid.isNull()) {
      if (!pid.canConvertToInt() || !pid.isIntegralNumber() || pid.intValue() < 0) {
        throw new MalformedEntryException("'pid' must be a non-negative integer");
      }
      builder.setPid(pid.intValue());
    }

    JsonNode hostname = root.get(HOSTNAME);
    if (hostname != null && !hostname.isNull()) {
      if (!hostname.isTextual()) {
        throw new MalformedEntryException("'hostname' must be a string");
      }
      builder.setHostname(hostname.textValue());
    } else {
      builder.setHostname(defaultHostname);
    }
    return builder.build();
  }

  private static LogLevel decodeLevel(@Nullable JsonNode level) throws MalformedEntryException {
    if (level == null || level.isNull()) {
      throw new MalformedEntryException("missing 'level'");
    }
    if (level.isIntegralNumber()) {
      if (!LogLevel.isValidSeverity(level.longValue())) {
        throw new MalformedEntryException("'level' out of range: " + level);
      }
      return LogLevel.fromSeverity(level.intValue());
    }
    if (level.isTextual()) {
      try {
        return LogLevel.fromName(level.textValue());
      } catch (IllegalArgumentException e) {
        throw new MalformedEntryException(e.getMessage(), e);
      }
    }
    throw new MalformedEntryException("'level' must be an integer between 0 and 7");
  }

  private static String decodeMessage(@Nullable JsonNode message) throws MalformedEntryException {
    if (message == null || message.isNull()) {
      throw new MalformedEntryException("missing 'message'");
    }
    if (!message.isTextual()) {
      throw new MalformedEntryException("'message' must be a string");
    }
    return message.textValue();
  }

  /**
   * The client side of the wire format: one JSON object, no trailing newline.
   */
  public String encodeSubmission(LogLevel level,
                                 String message,
                                 Map<String, String> fields,
                                 @Nullable Integer pid,
                                 @Nullable String hostname) {
    ObjectNode node = mapper.createObjectNode();
    node.put(LEVEL, level.severity());
    node.put(MESSAGE, message);
    if (!fields.isEmpty()) {
      ObjectNode fieldsNode = node.putObject(FIELDS);
      fields.forEach(fieldsNode::put);
    }
    if (pid != null) {
      node.put(PID, pid);
    }
    if (hostname != null) {
      node.put(HOSTNAME, hostname);
    }
    return write(node);
  }

  public String toJson(LogEntry entry) {
    return write(PersistedRecord.of(entry));
  }

  public LogEntry fromJson(String json) throws MalformedEntryException {
    try {
      return mapper.readValue(json, PersistedRecord.class).toEntry();
    } catch (IOException | RuntimeException e) {
      throw new MalformedEntryException("invalid persisted record: " + e.getMessage(), e);
    }
  }

  private String write(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * On-disk shape of an entry. The level is stored numerically.
   */
  static final class PersistedRecord {
    @JsonProperty("id")
    final UUID id;
    @JsonProperty("timestamp")
    final Instant timestamp;
    @JsonProperty("level")
    final int level;
    @JsonProperty("daemon")
    final String daemon;
    @JsonProperty("message")
    final String message;
    @JsonProperty("fields")
    final Map<String, String> fields;
    @JsonProperty("pid")
    final Integer pid;
    @JsonProperty("hostname")
    final String hostname;

    @JsonCreator
    PersistedRecord(@JsonProperty("id") UUID id,
                    @JsonProperty("timestamp") Instant timestamp,
                    @JsonProperty("level") int level,
                    @JsonProperty("daemon") String daemon,
                    @JsonProperty("message") String message,
                    @JsonProperty("fields") Map<String, String> fields,
                    @JsonProperty("pid") Integer pid,
                    @JsonProperty("hostname") String hostname) {
      this.id = id;
      this.timestamp = timestamp;
      this.level = level;
      this.daemon = daemon;
      this.message = message;
      this.fields = fields;
      this.pid = pid;
      this.hostname = hostname;
    }

    static PersistedRecord of(LogEntry entry) {
      return new PersistedRecord(
          entry.getId(),
          entry.getTimestamp(),
          entry.getLevel().severity(),
          entry.getDaemon(),
          entry.getMessage(),
          entry.getFields(),
          entry.getPid(),
          entry.getHostname());
    }

    LogEntry toEntry() {
      LogEntry.Builder builder = LogEntry.builder()
          .setId(id)
          .setTimestamp(timestamp)
          .setLevel(LogLevel.fromSeverity(level))
          .setDaemon(daemon)
          .setMessage(message)
          .setPid(pid)
          .setHostname(hostname);
      if (fields != null) {
        builder.putAllFields(fields);
      }
      return builder.build();
    }
  }
}
