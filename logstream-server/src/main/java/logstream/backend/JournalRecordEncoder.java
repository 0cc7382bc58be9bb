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

import logstream.entry.LogEntry;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Locale;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Encodes entries in the systemd journal's native datagram protocol. Values without newlines are
 * sent as {@code KEY=value}; others as the key, a newline, the value length as a little-endian
 * 64-bit integer and the raw value.
 */
public class JournalRecordEncoder {
  private final String syslogIdentifier;

  public JournalRecordEncoder(String syslogIdentifier) {
    this.syslogIdentifier = syslogIdentifier;
  }

  public byte[] encode(LogEntry entry) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    appendField(out, "MESSAGE", entry.getMessage());
    appendField(out, "PRIORITY", Integer.toString(entry.getLevel().severity()));
    appendField(out, "SYSLOG_IDENTIFIER", syslogIdentifier);
    if (entry.getPid() != null) {
      appendField(out, "SYSLOG_PID", entry.getPid().toString());
    }
    appendField(out, "LOGSTREAM_DAEMON", entry.getDaemon());
    appendField(out, "LOGSTREAM_ID", entry.getId().toString());
    if (entry.getHostname() != null) {
      appendField(out, "LOGSTREAM_HOSTNAME", entry.getHostname());
    }
    for (Map.Entry<String, String> field : entry.getFields().entrySet()) {
      String name = fieldName(field.getKey());
      if (!name.isEmpty()) {
        appendField(out, name, field.getValue());
      }
    }
    return out.toByteArray();
  }

  /**
   * Journal field names are upper-case letters, digits and underscores, not starting with an
   * underscore (reserved for trusted fields) or a digit.
   */
  static String fieldName(String key) {
    StringBuilder name = new StringBuilder(key.length());
    for (char c : key.toUpperCase(Locale.ROOT).toCharArray()) {
      boolean valid = (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
      name.append(valid ? c : '_');
    }
    int start = 0;
    while (start < name.length() && name.charAt(start) == '_') {
      start++;
    }
    String trimmed = name.substring(start);
    if (!trimmed.isEmpty() && Character.isDigit(trimmed.charAt(0))) {
      return "F_" + trimmed;
    }
    return trimmed;
  }

  private static void appendField(ByteArrayOutputStream out, String name, String value) {
    byte[] nameBytes = name.getBytes(UTF_8);
    byte[] valueBytes = value.getBytes(UTF_8);
    out.write(nameBytes, 0, nameBytes.length);
    if (value.indexOf('\n') < 0) {
      out.write('=');
      out.write(valueBytes, 0, valueBytes.length);
    } else {
      out.write('\n');
      byte[] length = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(valueBytes.length).array();
      out.write(length, 0, length.length);
      out.write(valueBytes, 0, valueBytes.length);
    }
    out.write('\n');
  }
}
