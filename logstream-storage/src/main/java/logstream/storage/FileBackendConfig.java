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

package logstream.storage;

import logstream.LogStreamConstants;
import logstream.entry.EntryFormat;

import java.nio.file.Path;
import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Settings of one rotating file backend. Defaults match the server's defaults.
 */
public final class FileBackendConfig {
  private final Path outputDirectory;
  private final String activeFileName;
  private final long maxFileSize;
  private final boolean rotationEnabled;
  private final Duration maxAge;
  private final int keepFiles;
  private final Duration retentionInterval;
  private final EntryFormat format;
  private final boolean compressionEnabled;
  private final CompressionAlgorithm compressionAlgorithm;
  private final boolean syncOnWrite;

  private FileBackendConfig(Builder builder) {
    this.outputDirectory = checkNotNull(builder.outputDirectory, "outputDirectory");
    this.activeFileName = checkNotNull(builder.activeFileName, "activeFileName");
    this.maxFileSize = builder.maxFileSize;
    this.rotationEnabled = builder.rotationEnabled;
    this.maxAge = checkNotNull(builder.maxAge, "maxAge");
    this.keepFiles = builder.keepFiles;
    this.retentionInterval = checkNotNull(builder.retentionInterval, "retentionInterval");
    this.format = checkNotNull(builder.format, "format");
    this.compressionEnabled = builder.compressionEnabled;
    this.compressionAlgorithm = checkNotNull(builder.compressionAlgorithm, "compressionAlgorithm");
    this.syncOnWrite = builder.syncOnWrite;

    checkArgument(!activeFileName.isEmpty(), "active file name must not be empty");
    checkArgument(maxFileSize > 0, "max file size must be positive");
    checkArgument(!maxAge.isNegative() && !maxAge.isZero(), "max age must be positive");
    checkArgument(keepFiles > 0, "keep files must be positive");
    checkArgument(!retentionInterval.isNegative() && !retentionInterval.isZero(),
        "retention interval must be positive");
  }

  public static Builder builder() {
    return new Builder();
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

  public Duration getMaxAge() {
    return maxAge;
  }

  public int getKeepFiles() {
    return keepFiles;
  }

  public Duration getRetentionInterval() {
    return retentionInterval;
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

  public boolean isSyncOnWrite() {
    return syncOnWrite;
  }

  @Override
  public String toString() {
    return "FileBackendConfig{" +
        "outputDirectory=" + outputDirectory +
        ", activeFileName='" + activeFileName + '\'' +
        ", maxFileSize=" + maxFileSize +
        ", rotationEnabled=" + rotationEnabled +
        ", maxAge=" + maxAge +
        ", keepFiles=" + keepFiles +
        ", retentionInterval=" + retentionInterval +
        ", format=" + format +
        ", compressionEnabled=" + compressionEnabled +
        ", compressionAlgorithm=" + compressionAlgorithm +
        ", syncOnWrite=" + syncOnWrite +
        '}';
  }

  public static final class Builder {
    private Path outputDirectory = LogStreamConstants.DEFAULT_OUTPUT_DIRECTORY;
    private String activeFileName = LogStreamConstants.DEFAULT_ACTIVE_FILE_NAME;
    private long maxFileSize = LogStreamConstants.DEFAULT_MAX_FILE_SIZE;
    private boolean rotationEnabled = true;
    private Duration maxAge = Duration.ofHours(LogStreamConstants.DEFAULT_MAX_AGE_HOURS);
    private int keepFiles = LogStreamConstants.DEFAULT_KEEP_FILES;
    private Duration retentionInterval = Duration.ofSeconds(LogStreamConstants.DEFAULT_RETENTION_INTERVAL_SECONDS);
    private EntryFormat format = EntryFormat.JSON;
    private boolean compressionEnabled = false;
    private CompressionAlgorithm compressionAlgorithm = CompressionAlgorithm.GZIP;
    private boolean syncOnWrite = false;

    private Builder() {
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

    public Builder setMaxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    public Builder setKeepFiles(int keepFiles) {
      this.keepFiles = keepFiles;
      return this;
    }

    public Builder setRetentionInterval(Duration retentionInterval) {
      this.retentionInterval = retentionInterval;
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

    public Builder setSyncOnWrite(boolean syncOnWrite) {
      this.syncOnWrite = syncOnWrite;
      return this;
    }

    public FileBackendConfig build() {
      return new FileBackendConfig(this);
    }
  }
}
