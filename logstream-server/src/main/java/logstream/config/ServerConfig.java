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

package logstream.config;

import com.google.common.net.HostAndPort;
import logstream.LogStreamConstants;
import logstream.entry.EntryFormat;
import logstream.entry.SyslogFacility;
import logstream.storage.CompressionAlgorithm;
import logstream.storage.FileBackendConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Everything the server needs to start. Immutable; {@link #builder()} starts from the defaults.
 */
public final class ServerConfig {
  private final Path socketPath;
  private final int maxConnections;
  private final int bufferSize;
  private final int shutdownGraceSeconds;

  private final Path outputDirectory;
  private final String activeFileName;
  private final long maxFileSize;
  private final boolean rotationEnabled;
  private final int maxAgeHours;
  private final int keepFiles;
  private final long retentionIntervalSeconds;

  private final boolean fileEnabled;
  private final EntryFormat format;
  private final boolean compressionEnabled;
  private final CompressionAlgorithm compressionAlgorithm;

  private final boolean journaldEnabled;
  private final String journaldIdentifier;
  private final Path journaldSocketPath;

  private final boolean syslogEnabled;
  private final SyslogFacility syslogFacility;
  private final String syslogServer;

  private ServerConfig(Builder builder) {
    this.socketPath = builder.socketPath;
    this.maxConnections = builder.maxConnections;
    this.bufferSize = builder.bufferSize;
    this.shutdownGraceSeconds = builder.shutdownGraceSeconds;
    this.outputDirectory = builder.outputDirectory;
    this.activeFileName = builder.activeFileName;
    this.maxFileSize = builder.maxFileSize;
    this.rotationEnabled = builder.rotationEnabled;
    this.maxAgeHours = builder.maxAgeHours;
    this.keepFiles = builder.keepFiles;
    this.retentionIntervalSeconds = builder.retentionIntervalSeconds;
    this.fileEnabled = builder.fileEnabled;
    this.format = builder.format;
    this.compressionEnabled = builder.compressionEnabled;
    this.compressionAlgorithm = builder.compressionAlgorithm;
    this.journaldEnabled = builder.journaldEnabled;
    this.journaldIdentifier = builder.journaldIdentifier;
    this.journaldSocketPath = builder.journaldSocketPath;
    this.syslogEnabled = builder.syslogEnabled;
    this.syslogFacility = builder.syslogFacility;
    this.syslogServer = builder.syslogServer;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setSocketPath(socketPath)
        .setMaxConnections(maxConnections)
        .setBufferSize(bufferSize)
        .setShutdownGraceSeconds(shutdownGraceSeconds)
        .setOutputDirectory(outputDirectory)
        .setActiveFileName(activeFileName)
        .setMaxFileSize(maxFileSize)
        .setRotationEnabled(rotationEnabled)
        .setMaxAgeHours(maxAgeHours)
        .setKeepFiles(keepFiles)
        .setRetentionIntervalSeconds(retentionIntervalSeconds)
        .setFileEnabled(fileEnabled)
        .setFormat(format)
        .setCompressionEnabled(compressionEnabled)
        .setCompressionAlgorithm(compressionAlgorithm)
        .setJournaldEnabled(journaldEnabled)
        .setJournaldIdentifier(journaldIdentifier)
        .setJournaldSocketPath(journaldSocketPath)
        .setSyslogEnabled(syslogEnabled)
        .setSyslogFacility(syslogFacility)
        .setSyslogServer(syslogServer);
  }

  public Path getSocketPath() {
    return socketPath;
  }

  public int getMaxConnections() {
    return maxConnections;
  }

  public int getBufferSize() {
    return bufferSize;
  }

  public int getShutdownGraceSeconds() {
    return shutdownGraceSeconds;
  }

  public Path getOutputDirectory() {
    return outputDirectory;
  }

  public String getActiveFileName() {
    return activeFileName;
  }

  public long getMaxFileSize() {
    return maxFileSize;
  }

  public boolean isRotationEnabled() {
    return rotationEnabled;
  }

  public int getMaxAgeHours() {
    return maxAgeHours;
  }

  public int getKeepFiles() {
    return keepFiles;
  }

  public long getRetentionIntervalSeconds() {
    return retentionIntervalSeconds;
  }

  public boolean isFileEnabled() {
    return fileEnabled;
  }

  public EntryFormat getFormat() {
    return format;
  }

  public boolean isCompressionEnabled() {
    return compressionEnabled;
  }

  public CompressionAlgorithm getCompressionAlgorithm() {
    return compressionAlgorithm;
  }

  public boolean isJournaldEnabled() {
    return journaldEnabled;
  }

  public String getJournaldIdentifier() {
    return journaldIdentifier;
  }

  public Path getJournaldSocketPath() {
    return journaldSocketPath;
  }

  public boolean isSyslogEnabled() {
    return syslogEnabled;
  }

  public SyslogFacility getSyslogFacility() {
    return syslogFacility;
  }

  public String getSyslogServer() {
    return syslogServer;
  }

  public HostAndPort getSyslogHostAndPort() {
    return HostAndPort.fromString(syslogServer).withDefaultPort(LogStreamConstants.DEFAULT_SYSLOG_PORT);
  }

  public FileBackendConfig fileBackendConfig() {
    return FileBackendConfig.builder()
        .setOutputDirectory(outputDirectory)
        .setActiveFileName(activeFileName)
        .setMaxFileSize(maxFileSize)
        .setRotationEnabled(rotationEnabled)
        .setMaxAge(Duration.ofHours(maxAgeHours))
        .setKeepFiles(keepFiles)
        .setRetentionInterval(Duration.ofSeconds(retentionIntervalSeconds))
        .setFormat(format)
        .setCompressionEnabled(compressionEnabled)
        .setCompressionAlgorithm(compressionAlgorithm)
        .build();
  }

  @Override
  public String toString() {
    return "ServerConfig{" +
        "socketPath=" + socketPath +
        ", maxConnections=" + maxConnections +
        ", bufferSize=" + bufferSize +
        ", outputDirectory=" + outputDirectory +
        ", maxFileSize=" + maxFileSize +
        ", rotationEnabled=" + rotationEnabled +
        ", maxAgeHours=" + maxAgeHours +
        ", keepFiles=" + keepFiles +
        ", fileEnabled=" + fileEnabled +
        ", format=" + format +
        ", compression=" + (compressionEnabled ? compressionAlgorithm : "off") +
        ", journaldEnabled=" + journaldEnabled +
        ", syslogEnabled=" + syslogEnabled +
        '}';
  }

  public static final class Builder {
    private Path socketPath = Paths.get(LogStreamConstants.DEFAULT_SOCKET_PATH);
    private int maxConnections = LogStreamConstants.DEFAULT_MAX_CONNECTIONS;
    private int bufferSize = LogStreamConstants.DEFAULT_READ_BUFFER_SIZE;
    private int shutdownGraceSeconds = LogStreamConstants.DEFAULT_SHUTDOWN_GRACE_SECONDS;
    private Path outputDirectory = LogStreamConstants.DEFAULT_OUTPUT_DIRECTORY;
    private String activeFileName = LogStreamConstants.DEFAULT_ACTIVE_FILE_NAME;
    private long maxFileSize = LogStreamConstants.DEFAULT_MAX_FILE_SIZE;
    private boolean rotationEnabled = true;
    private int maxAgeHours = LogStreamConstants.DEFAULT_MAX_AGE_HOURS;
    private int keepFiles = LogStreamConstants.DEFAULT_KEEP_FILES;
    private long retentionIntervalSeconds = LogStreamConstants.DEFAULT_RETENTION_INTERVAL_SECONDS;
    private boolean fileEnabled = true;
    private EntryFormat format = EntryFormat.JSON;
    private boolean compressionEnabled = false;
    private CompressionAlgorithm compressionAlgorithm = CompressionAlgorithm.GZIP;
    private boolean journaldEnabled = false;
    private String journaldIdentifier = LogStreamConstants.DEFAULT_SYSLOG_IDENTIFIER;
    private Path journaldSocketPath = Paths.get(LogStreamConstants.DEFAULT_JOURNALD_SOCKET_PATH);
    private boolean syslogEnabled = false;
    private SyslogFacility syslogFacility = SyslogFacility.LOG_USER;
    private String syslogServer = LogStreamConstants.DEFAULT_SYSLOG_SERVER;

    private Builder() {
    }

    public Builder setSocketPath(Path socketPath) {
      this.socketPath = socketPath;
      return this;
    }

    public Builder setMaxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    public Builder setBufferSize(int bufferSize) {
      this.bufferSize = bufferSize;
      return this;
    }

    public Builder setShutdownGraceSeconds(int shutdownGraceSeconds) {
      this.shutdownGraceSeconds = shutdownGraceSeconds;
      return this;
    }

    public Builder setOutputDirectory(Path outputDirectory) {
      this.outputDirectory = outputDirectory;
      return this;
    }

    public Builder setActiveFileName(String activeFileName) {
      this.activeFileName = activeFileName;
      return this;
    }

    public Builder setMaxFileSize(long maxFileSize) {
      this.maxFileSize = maxFileSize;
      return this;
    }

    public Builder setRotationEnabled(boolean rotationEnabled) {
      this.rotationEnabled = rotationEnabled;
      return this;
    }

    public Builder setMaxAgeHours(int maxAgeHours) {
      this.maxAgeHours = maxAgeHours;
      return this;
    }

    public Builder setKeepFiles(int keepFiles) {
      this.keepFiles = keepFiles;
      return this;
    }

    public Builder setRetentionIntervalSeconds(long retentionIntervalSeconds) {
      this.retentionIntervalSeconds = retentionIntervalSeconds;
      return this;
    }

    public Builder setFileEnabled(boolean fileEnabled) {
      this.fileEnabled = fileEnabled;
      return this;
    }

    public Builder setFormat(EntryFormat format) {
      this.format = format;
      return this;
    }

    public Builder setCompressionEnabled(boolean compressionEnabled) {
      this.compressionEnabled = compressionEnabled;
      return this;
    }

    public Builder setCompressionAlgorithm(CompressionAlgorithm compressionAlgorithm) {
      this.compressionAlgorithm = compressionAlgorithm;
      return this;
    }

    public Builder setJournaldEnabled(boolean journaldEnabled) {
      this.journaldEnabled = journaldEnabled;
      return this;
    }

    public Builder setJournaldIdentifier(String journaldIdentifier) {
      this.journaldIdentifier = journaldIdentifier;
      return this;
    }

    public Builder setJournaldSocketPath(Path journaldSocketPath) {
      this.journaldSocketPath = journaldSocketPath;
      return this;
    }

    public Builder setSyslogEnabled(boolean syslogEnabled) {
      this.syslogEnabled = syslogEnabled;
      return this;
    }

    public Builder setSyslogFacility(SyslogFacility syslogFacility) {
      this.syslogFacility = syslogFacility;
      return this;
    }

    public Builder setSyslogServer(String syslogServer) {
      this.syslogServer = syslogServer;
      return this;
    }

    /**
     * @throws ConfigurationException if any setting is out of range
     */
    public ServerConfig build() {
      require(socketPath != null && !socketPath.toString().isEmpty(), "socket path must not be empty");
      require(maxConnections > 0, "max_connections must be positive");
      require(bufferSize > 0, "buffer_size must be positive");
      require(shutdownGraceSeconds >= 0, "shutdown_grace_seconds must not be negative");
      require(outputDirectory != null && !outputDirectory.toString().isEmpty(), "output directory must not be empty");
      require(activeFileName != null && !activeFileName.isEmpty() && !activeFileName.contains("/"),
          "active file name must be a plain file name");
      require(maxFileSize > 0, "max_file_size must be positive");
      require(maxAgeHours > 0, "max_age_hours must be positive");
      require(keepFiles > 0, "keep_files must be positive");
      require(retentionIntervalSeconds > 0, "retention check interval must be positive");
      require(format != null, "file format must be set");
      require(compressionAlgorithm != null, "compression algorithm must be set");
      require(syslogFacility != null, "syslog facility must be set");
      require(journaldIdentifier != null && !journaldIdentifier.isEmpty(), "syslog_identifier must not be empty");
      require(journaldSocketPath != null, "journald socket path must be set");
      require(syslogServer != null && !syslogServer.isEmpty(), "syslog server must not be empty");
      try {
        HostAndPort.fromString(syslogServer);
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("invalid syslog server: " + syslogServer, e);
      }
      return new ServerConfig(this);
    }

    private static void require(boolean condition, String message) {
      if (!condition) {
        throw new ConfigurationException(message);
      }
    }
  }
}
