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

package logstream;

import java.nio.file.Path;
import java.nio.file.Paths;

public class LogStreamConstants {
  public static final String DEFAULT_SOCKET_PATH = "/tmp/logstream.sock";
  public static final int DEFAULT_MAX_CONNECTIONS = 1000;
  public static final int DEFAULT_READ_BUFFER_SIZE = 8192;
  public static final int LINE_LENGTH_MULTIPLIER = 8;

  public static final Path DEFAULT_OUTPUT_DIRECTORY = Paths.get("/var/log/logstream");
  public static final String DEFAULT_ACTIVE_FILE_NAME = "logstream.log";
  public static final long DEFAULT_MAX_FILE_SIZE = 100L * 1024 * 1024;
  public static final int DEFAULT_MAX_AGE_HOURS = 24;
  public static final int DEFAULT_KEEP_FILES = 7;
  public static final long DEFAULT_RETENTION_INTERVAL_SECONDS = 3600;
  public static final String ARCHIVE_TIMESTAMP_PATTERN = "yyyyMMdd'T'HHmmss.SSS'Z'";
  public static final String COMPRESSION_TEMPORARY_SUFFIX = ".tmp";

  public static final String DEFAULT_JOURNALD_SOCKET_PATH = "/run/systemd/journal/socket";
  public static final String DEFAULT_SYSLOG_IDENTIFIER = "logstream";
  public static final String DEFAULT_SYSLOG_SERVER = "localhost:514";
  public static final int DEFAULT_SYSLOG_PORT = 514;

  public static final int MAX_IN_FLIGHT_PER_SESSION = 1024;
  public static final int RESUME_READING_IN_FLIGHT = MAX_IN_FLIGHT_PER_SESSION / 2;

  public static final int DEFAULT_SHUTDOWN_GRACE_SECONDS = 5;
  public static final int SERVER_THREAD_POOL_SIZE = 4;
  public static final int COMPRESSION_THREAD_POOL_SIZE = 1;

  public static final long CLIENT_INITIAL_BACKOFF_MILLIS = 100;
  public static final long CLIENT_MAX_BACKOFF_MILLIS = 5000;
  public static final long CLIENT_DEFAULT_TIMEOUT_MILLIS = 5000;
  public static final int CLIENT_DEFAULT_BUFFER_SIZE = 4096;
}
