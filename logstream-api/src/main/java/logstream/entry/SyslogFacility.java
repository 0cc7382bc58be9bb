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
 * RFC 3164 facility codes, named the way syslog.h names them.
 */
public enum SyslogFacility {
  LOG_KERN(0),
  LOG_USER(1),
  LOG_MAIL(2),
  LOG_DAEMON(3),
  LOG_AUTH(4),
  LOG_SYSLOG(5),
  LOG_LPR(6),
  LOG_NEWS(7),
  LOG_UUCP(8),
  LOG_CRON(9),
  LOG_AUTHPRIV(10),
  LOG_FTP(11),
  LOG_LOCAL0(16),
  LOG_LOCAL1(17),
  LOG_LOCAL2(18),
  LOG_LOCAL3(19),
  LOG_LOCAL4(20),
  LOG_LOCAL5(21),
  LOG_LOCAL6(22),
  LOG_LOCAL7(23);

  private final int code;

  SyslogFacility(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public int priority(LogLevel level) {
    return code * 8 + level.severity();
  }

  /**
   * Accepts "LOG_USER", "log_user" or "user".
   */
  public static SyslogFacility fromName(String name) {
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    if (!normalized.startsWith("LOG_")) {
      normalized = "LOG_" + normalized;
    }
    return valueOf(normalized);
  }
}
