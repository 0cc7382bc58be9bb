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

import java.util.Locale;

/**
 * Entry severity with syslog numbering. A lower numeric severity is more severe.
 */
public enum LogLevel {
  EMERGENCY(0, "EMERG"),
  ALERT(1, "ALERT"),
  CRITICAL(2, "CRIT"),
  ERROR(3, "ERROR"),
  WARNING(4, "WARN"),
  NOTICE(5, "NOTICE"),
  INFO(6, "INFO"),
  DEBUG(7, "DEBUG");

  private static final LogLevel[] BY_SEVERITY = values();

  private final int severity;
  private final String label;

  LogLevel(int severity, String label) {
    this.severity = severity;
    this.label = label;
  }

  public int severity() {
    return severity;
  }

  /**
   * Fixed display label used by the human and console formats.
   */
  public String label() {
    return label;
  }

  public boolean isAtLeastAsSevereAs(LogLevel other) {
    return severity <= other.severity;
  }

  public boolean isMoreSevereThan(LogLevel other) {
    return severity < other.severity;
  }

  public static boolean isValidSeverity(long severity) {
    return severity >= 0 && severity < BY_SEVERITY.length;
  }

  public static LogLevel fromSeverity(int severity) {
    if (!isValidSeverity(severity)) {
      throw new IllegalArgumentException("severity must be between 0 and 7, got " + severity);
    }
    return BY_SEVERITY[severity];
  }

  /**
   * Case-insensitive lookup accepting the constant name ("WARNING", "Warning") or the display
   * label ("WARN").
   */
  public static LogLevel fromName(String name) {
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (LogLevel level : BY_SEVERITY) {
      if (level.name().equals(normalized) || level.label.equals(normalized)) {
        return level;
      }
    }
    throw new IllegalArgumentException("unknown log level: " + name);
  }
}
