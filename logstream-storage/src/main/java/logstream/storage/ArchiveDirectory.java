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

import com.google.common.collect.ImmutableList;
import logstream.LogStreamConstants;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming and discovery of the files a backend keeps in its output directory. The active file has
 * a fixed name; a rotated file is named {@code <active>.<creation timestamp>}, with a {@code -N}
 * counter when two files share a timestamp and the compression extension once compressed.
 */
public class ArchiveDirectory {
  private static final Logger LOG = LoggerFactory.getLogger(ArchiveDirectory.class);
  private static final DateTimeFormatter SUFFIX_FORMAT =
      DateTimeFormatter.ofPattern(LogStreamConstants.ARCHIVE_TIMESTAMP_PATTERN).withZone(ZoneOffset.UTC);

  /**
   * Newest first; on equal timestamps the higher collision counter was created later.
   */
  static final Comparator<ArchivedFile> NEWEST_FIRST =
      Comparator.comparing(ArchivedFile::getCreatedAt)
          .thenComparing(file -> collisionCounter(file.getPath()))
          .reversed();

  private final Path directory;
  private final String activeFileName;
  private final Pattern archivePattern;

  public ArchiveDirectory(Path directory, String activeFileName) {
    this.directory = directory;
    this.activeFileName = activeFileName;
    this.archivePattern = Pattern.compile(
        Pattern.quote(activeFileName) + "\\.(\\d{8}T\\d{6}\\.\\d{3}Z)(?:-(\\d+))?(\\.gz|\\.lz4)?");
  }

  public Path getDirectory() {
    return directory;
  }

  public Path activePath() {
    return directory.resolve(activeFileName);
  }

  /**
   * Create the directory if needed and check that files can be created in it.
   */
  public void prepare() throws IOException {
    Files.createDirectories(directory);
    if (!Files.isDirectory(directory) || !Files.isWritable(directory)) {
      throw new IOException("Output directory is not writable: " + directory);
    }
  }

  /**
   * A name for the file rotated out at {@code createdAt} that no existing file, compressed or
   * in-progress artifact uses.
   */
  public Path archivePathFor(Instant createdAt) {
    String base = activeFileName + "." + SUFFIX_FORMAT.format(createdAt);
    Path candidate = directory.resolve(base);
    int counter = 0;
    while (isTaken(candidate)) {
      counter++;
      candidate = directory.resolve(base + "-" + counter);
    }
    return candidate;
  }

  private boolean isTaken(Path candidate) {
    if (Files.exists(candidate)) {
      return true;
    }
    for (CompressionAlgorithm algorithm : CompressionAlgorithm.values()) {
      Path compressed = algorithm.compressedPath(candidate);
      if (Files.exists(compressed)
          || Files.exists(compressed.resolveSibling(compressed.getFileName() + LogStreamConstants.COMPRESSION_TEMPORARY_SUFFIX))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Every rotated file in the directory, newest first.
   */
  public ImmutableList<ArchivedFile> scan() throws IOException {
    List<ArchivedFile> archived = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
      for (Path path : stream) {
        Instant createdAt = parseCreationTime(path);
        if (createdAt != null) {
          archived.add(new ArchivedFile(path, createdAt));
        }
      }
    }
    archived.sort(NEWEST_FIRST);
    return ImmutableList.copyOf(archived);
  }

  /**
   * Remove what an interrupted compression left behind: temporary artifacts, and originals
   * whose compressed copy was already renamed into place.
   *
   * @return the paths deleted
   */
  public ImmutableList<Path> removeCompressionLeftovers() throws IOException {
    ImmutableList.Builder<Path> removed = ImmutableList.builder();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
      for (Path path : stream) {
        String fileName = path.getFileName().toString();
        boolean leftover = false;
        if (fileName.endsWith(LogStreamConstants.COMPRESSION_TEMPORARY_SUFFIX)) {
          String artifact = fileName.substring(0, fileName.length() - LogStreamConstants.COMPRESSION_TEMPORARY_SUFFIX.length());
          leftover = parseCreationTime(path.resolveSibling(artifact)) != null;
        } else if (parseCreationTime(path) != null && CompressionAlgorithm.forPath(path) == null) {
          for (CompressionAlgorithm algorithm : CompressionAlgorithm.values()) {
            leftover |= Files.exists(algorithm.compressedPath(path));
          }
        }
        if (leftover) {
          LOG.info("Removing leftover of interrupted compression {}", path);
          Files.deleteIfExists(path);
          removed.add(path);
        }
      }
    }
    return removed.build();
  }

  /**
   * The creation time encoded in a rotated file's name, or null if the path is not one of this
   * directory's rotated files.
   */
  @Nullable
  Instant parseCreationTime(Path path) {
    Matcher matcher = archivePattern.matcher(path.getFileName().toString());
    if (!matcher.matches()) {
      return null;
    }
    try {
      return Instant.from(SUFFIX_FORMAT.parse(matcher.group(1)));
    } catch (DateTimeParseException e) {
      LOG.debug("Ignoring {}: unparseable timestamp suffix", path, e);
      return null;
    }
  }

  private static int collisionCounter(Path path) {
    String fileName = path.getFileName().toString();
    CompressionAlgorithm algorithm = CompressionAlgorithm.forPath(path);
    if (algorithm != null) {
      fileName = fileName.substring(0, fileName.length() - algorithm.extension().length());
    }
    int dash = fileName.lastIndexOf('-');
    int dot = fileName.lastIndexOf('.');
    if (dash > dot) {
      try {
        return Integer.parseInt(fileName.substring(dash + 1));
      } catch (NumberFormatException e) {
        return 0;
      }
    }
    return 0;
  }
}
