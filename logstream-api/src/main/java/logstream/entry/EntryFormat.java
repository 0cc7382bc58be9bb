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

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Line formats for persisted entries. Each produces exactly one line per entry, without the
 * terminating newline.
 */
public enum EntryFormat {
  JSON {
    @Override
    public String format(LogEntry entry) {
      return CODEC.toJson(entry);
    }
  },
  HUMAN {
    @Override
    public String format(LogEntry entry) {
      StringBuilder line = new StringBuilder()
          .append(HUMAN_TIMESTAMP.format(entry.getTimestamp()))
          .append(' ')
          .append(entry.getLevel().label())
          .append(' ')
          .append(escapeLineBreaks(entry.getDaemon()))
          .append(": ")
          .append(escapeLineBreaks(entry.getMessage()));
      if (!entry.getFields().isEmpty()) {
        line.append(" [");
        boolean first = true;
        for (Map.Entry<String, String> field : new TreeMap<>(entry.getFields()).entrySet()) {
          if (!first) {
            line.append(' ');
          }
          first = false;
          line.append(escapeLineBreaks(field.getKey()))
              .append('=')
              .append(escapeLineBreaks(field.getValue()));
        }
        line.append(']');
      }
      return line.toString();
    }
  },
  SYSLOG {
    @Override
    public String format(LogEntry entry) {
      return syslogLine(entry, SyslogFacility.LOG_USER, entry.getDaemon());
    }
  };

  private static final EntryCodec CODEC = new EntryCodec();
  private static final DateTimeFormatter HUMAN_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS", Locale.ROOT).withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter SYSLOG_TIMESTAMP =
      DateTimeFormatter.ofPattern("MMM ppd HH:mm:ss", Locale.US).withZone(ZoneOffset.UTC);

  public abstract String format(LogEntry entry);

  public static EntryFormat fromName(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }

  /**
   * {@code <PRI>MMM dd HH:mm:ss hostname tag[pid]: message}, timestamp in UTC.
   */
  public static String syslogLine(LogEntry entry, SyslogFacility facility, String tag) {
    StringBuilder line = new StringBuilder()
        .append('<').append(facility.priority(entry.getLevel())).append('>')
        .append(SYSLOG_TIMESTAMP.format(entry.getTimestamp()))
        .append(' ')
        .append(entry.getHostname() == null ? "-" : escapeLineBreaks(entry.getHostname()))
        .append(' ')
        .append(escapeLineBreaks(tag));
    if (entry.getPid() != null) {
      line.append('[').append(entry.getPid()).append(']');
    }
    return line.append(": ").append(escapeLineBreaks(entry.getMessage())).toString();
  }

  static String escapeLineBreaks(String text) {
    if (text.indexOf('\n') < 0 && text.indexOf('\r') < 0) {
      return text;
    }
    return text.replace("\r", "\\r").replace("\n", "\\n");
  }
}
