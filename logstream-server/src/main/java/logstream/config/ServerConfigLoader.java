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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import logstream.entry.EntryFormat;
import logstream.entry.SyslogFacility;
import logstream.storage.CompressionAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Reads the YAML configuration file. Sections mirror {@link ServerConfig}:
 * <pre>
 * server:   socket_path, max_connections, buffer_size, shutdown_grace_seconds
 * storage:  output_directory, active_file_name, max_file_size,
 *           rotation: enabled, max_age_hours, keep_files, check_interval_seconds
 * backends: file: enabled, format, compression, compression_algorithm
 *           journald: enabled, syslog_identifier, socket_path
 *           syslog: enabled, facility, server
 * </pre>
 * Absent keys keep their defaults; unknown keys are errors.
 */
public class ServerConfigLoader {
  private static final Logger LOG = LoggerFactory.getLogger(ServerConfigLoader.class);

  private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
      .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  /**
   * Load from a file; a missing file yields the defaults. The result is a builder so that command
   * line overrides can be applied before validation.
   */
  public ServerConfig.Builder load(Path path) {
    if (!Files.exists(path)) {
      LOG.info("Configuration file {} not found, using defaults", path);
      return ServerConfig.builder();
    }
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read configuration " + path + ": " + e.getMessage(), e);
    }
  }

  /**
   * Parse a YAML document onto a builder holding the defaults.
   */
  public ServerConfig.Builder load(InputStream in) throws IOException {
    ServerConfig.Builder builder = ServerConfig.builder();
    JsonNode document = mapper.readTree(in);
    if (document == null || document.isMissingNode() || document.isNull()) {
      return builder;
    }
    ConfigFile file = mapper.treeToValue(document, ConfigFile.class);
    if (file.server != null) {
      ServerSection server = file.server;
      set(server.socketPath, value -> Paths.get(value), builder::setSocketPath);
      set(server.maxConnections, builder::setMaxConnections);
      set(server.bufferSize, builder::setBufferSize);
      set(server.shutdownGraceSeconds, builder::setShutdownGraceSeconds);
    }
    if (file.storage != null) {
      StorageSection storage = file.storage;
      set(storage.outputDirectory, value -> Paths.get(value), builder::setOutputDirectory);
      set(storage.activeFileName, builder::setActiveFileName);
      set(storage.maxFileSize, builder::setMaxFileSize);
      if (storage.rotation != null) {
        RotationSection rotation = storage.rotation;
        set(rotation.enabled, builder::setRotationEnabled);
        set(rotation.maxAgeHours, builder::setMaxAgeHours);
        set(rotation.keepFiles, builder::setKeepFiles);
        set(rotation.checkIntervalSeconds, builder::setRetentionIntervalSeconds);
      }
    }
    if (file.backends != null) {
      BackendsSection backends = file.backends;
      if (backends.file != null) {
        set(backends.file.enabled, builder::setFileEnabled);
        set(backends.file.format, name -> parse("format", name, EntryFormat::fromName), builder::setFormat);
        set(backends.file.compression, builder::setCompressionEnabled);
        set(backends.file.compressionAlgorithm,
            name -> parse("compression_algorithm", name, CompressionAlgorithm::fromName),
            builder::setCompressionAlgorithm);
      }
      if (backends.journald != null) {
        set(backends.journald.enabled, builder::setJournaldEnabled);
        set(backends.journald.syslogIdentifier, builder::setJournaldIdentifier);
        set(backends.journald.socketPath, value -> Paths.get(value), builder::setJournaldSocketPath);
      }
      if (backends.syslog != null) {
        set(backends.syslog.enabled, builder::setSyslogEnabled);
        set(backends.syslog.facility, name -> parse("facility", name, SyslogFacility::fromName),
            builder::setSyslogFacility);
        set(backends.syslog.server, builder::setSyslogServer);
      }
    }
    if (file.metrics != null) {
      LOG.info("Ignoring 'metrics' section: no metrics exporter is built in");
    }
    return builder;
  }

  private static <T> T parse(String key, String value, Function<String, T> parser) {
    try {
      return parser.apply(value);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("invalid " + key + ": '" + value + "'", e);
    }
  }

  private static <T> void set(T value, Consumer<T> setter) {
    if (value != null) {
      setter.accept(value);
    }
  }

  private static <T, R> void set(T value, Function<T, R> converter, Consumer<R> setter) {
    if (value != null) {
      setter.accept(converter.apply(value));
    }
  }

  static class ConfigFile {
    public ServerSection server;
    public StorageSection storage;
    public BackendsSection backends;
    public Object metrics;
  }

  static class ServerSection {
    public String socketPath;
    public Integer maxConnections;
    public Integer bufferSize;
    public Integer shutdownGraceSeconds;
  }

  static class StorageSection {
    public String outputDirectory;
    public String activeFileName;
    public Long maxFileSize;
    public RotationSection rotation;
  }

  static class RotationSection {
    public Boolean enabled;
    public Integer maxAgeHours;
    public Integer keepFiles;
    public Long checkIntervalSeconds;
  }

  static class BackendsSection {
    public FileSection file;
    public JournaldSection journald;
    public SyslogSection syslog;
  }

  static class FileSection {
    public Boolean enabled;
    public String format;
    public Boolean compression;
    public String compressionAlgorithm;
  }

  static class JournaldSection {
    public Boolean enabled;
    public String syslogIdentifier;
    public String socketPath;
  }

  static class SyslogSection {
    public Boolean enabled;
    public String facility;
    public String server;
  }
}
