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
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import logstream.entry.EntryCodec;
import logstream.entry.EntryFormat;
import logstream.entry.LogEntry;
import logstream.entry.LogLevel;
import logstream.util.LogStreamTestUtil;
import logstream.util.PoolFiberSupplier;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static logstream.util.FutureMatchers.resultsIn;
import static logstream.util.FutureMatchers.resultsInException;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.nullValue;

public class RotatingFileBackendTest {
  private static final Instant START = Instant.parse("2024-06-01T12:00:00Z");

  private final LogStreamTestUtil testUtil = new LogStreamTestUtil();
  private final PoolFiberSupplier fiberSupplier = new PoolFiberSupplier(Executors.newFixedThreadPool(2));
  private final ListeningExecutorService compressionExecutor =
      MoreExecutors.listeningDecorator(Executors.newSingleThreadExecutor());
  private final SettableClock clock = new SettableClock(START);
  private final ArchiveReader reader = new ArchiveReader(new EntryCodec());
  private final List<RotatingFileBackend> backends = new ArrayList<>();
  private Path outputDirectory;

  @Before
  public void setUp() throws Exception {
    outputDirectory = testUtil.getDataTestDir("logs");
  }

  @After
  public void tearDown() throws Exception {
    for (RotatingFileBackend backend : backends) {
      if (backend.isRunning()) {
        backend.stopAsync().awaitTerminated(5, TimeUnit.SECONDS);
      }
    }
    compressionExecutor.shutdownNow();
    fiberSupplier.shutdown(5, TimeUnit.SECONDS);
    testUtil.cleanupTestDir();
  }

  private FileBackendConfig.Builder config() {
    return FileBackendConfig.builder()
        .setOutputDirectory(outputDirectory)
        .setActiveFileName("logstream.log");
  }

  private RotatingFileBackend startBackend(FileBackendConfig config) throws Exception {
    RotatingFileBackend backend = new RotatingFileBackend(config, fiberSupplier, compressionExecutor, clock);
    backends.add(backend);
    backend.startAsync().awaitRunning(5, TimeUnit.SECONDS);
    return backend;
  }

  private RotatingFileBackend startBackend(FileBackendConfig config, ArchiveCompressor compressor) throws Exception {
    RotatingFileBackend backend = new RotatingFileBackend(config, fiberSupplier, compressor, clock);
    backends.add(backend);
    backend.startAsync().awaitRunning(5, TimeUnit.SECONDS);
    return backend;
  }

  private List<Path> filesInOutputDirectory() throws Exception {
    try (Stream<Path> files = Files.list(outputDirectory)) {
      return files.map(outputDirectory::relativize).collect(Collectors.toList());
    }
  }

  private static LogEntry infoFromServiceA(int sequence) {
    return LogEntry.builder()
        .setId(new UUID(0, sequence))
        .setTimestamp(START.plusSeconds(sequence))
        .setLevel(LogLevel.INFO)
        .setDaemon("svc-A")
        .setMessage("message " + sequence)
        .setPid(100)
        .setHostname("box")
        .build();
  }

  private static int recordLength(LogEntry entry) {
    return EntryFormat.JSON.format(entry).length() + 1;
  }

  private static void writeAll(RotatingFileBackend backend, LogEntry... entries) throws Exception {
    List<ListenableFuture<Void>> writes = new ArrayList<>();
    for (LogEntry entry : entries) {
      writes.add(backend.write(entry));
    }
    for (ListenableFuture<Void> write : writes) {
      assertThat(write, resultsIn(nullValue()));
    }
  }

  private Path createArchive(int hoursAgo) throws Exception {
    ArchiveDirectory archiveDirectory = new ArchiveDirectory(outputDirectory, "logstream.log");
    Files.createDirectories(outputDirectory);
    return Files.createFile(archiveDirectory.archivePathFor(START.minus(Duration.ofHours(hoursAgo))));
  }

  @Test
  public void persistsEntriesInSubmissionOrder() throws Exception {
    RotatingFileBackend backend = startBackend(config().build());
    LogEntry first = infoFromServiceA(1);
    LogEntry second = infoFromServiceA(2);
    LogEntry third = infoFromServiceA(3);

    writeAll(backend, first, second, third);

    assertThat(reader.readEntries(backend.getActivePath()), contains(first, second, third));
    assertThat(backend.getArchivedFiles(), resultsIn(is(empty())));
  }

  @Test
  public void theRecordThatWouldOverflowTheActiveFileTriggersExactlyOneRotation() throws Exception {
    int recordLength = recordLength(infoFromServiceA(1));
    long maxFileSize = 3L * recordLength + recordLength / 2;
    RotatingFileBackend backend = startBackend(config().setMaxFileSize(maxFileSize).build());

    writeAll(backend, infoFromServiceA(1), infoFromServiceA(2), infoFromServiceA(3));
    assertThat(backend.getArchivedFiles(), resultsIn(is(empty())));

    writeAll(backend, infoFromServiceA(4));

    ImmutableList<ArchivedFile> archived = backend.getArchivedFiles().get();
    assertThat(archived, hasSize(1));
    assertThat(reader.readEntries(archived.get(0).getPath()),
        contains(infoFromServiceA(1), infoFromServiceA(2), infoFromServiceA(3)));
    assertThat(reader.readEntries(backend.getActivePath()), contains(infoFromServiceA(4)));
    assertThat(Files.size(archived.get(0).getPath()), is(lessThanOrEqualTo(maxFileSize)));
    assertThat(archived.get(0).getCreatedAt(), is(equalTo(START)));
  }

  @Test
  public void aRecordLargerThanTheLimitIsWrittenWholeToAnEmptyFile() throws Exception {
    RotatingFileBackend backend = startBackend(config().setMaxFileSize(16).build());

    writeAll(backend, infoFromServiceA(1));
    assertThat(backend.getArchivedFiles(), resultsIn(is(empty())));
    assertThat(reader.readEntries(backend.getActivePath()), contains(infoFromServiceA(1)));

    writeAll(backend, infoFromServiceA(2));
    assertThat(backend.getArchivedFiles(), resultsIn(hasSize(1)));
    assertThat(reader.readEntries(backend.getActivePath()), contains(infoFromServiceA(2)));
  }

  @Test
  public void neverRotatesWhenRotationIsDisabled() throws Exception {
    RotatingFileBackend backend = startBackend(config().setMaxFileSize(16).setRotationEnabled(false).build());

    writeAll(backend, infoFromServiceA(1), infoFromServiceA(2));

    assertThat(backend.getArchivedFiles(), resultsIn(is(empty())));
    assertThat(reader.readEntries(backend.getActivePath()), hasSize(2));
  }

  @Test
  public void rebuildsTheArchivedListFromTheDirectoryOnStartup() throws Exception {
    Path older = createArchive(5);
    Path newer = createArchive(1);

    RotatingFileBackend backend = startBackend(config().build());

    ImmutableList<ArchivedFile> archived = backend.getArchivedFiles().get();
    assertThat(archived, contains(
        new ArchivedFile(newer, START.minus(Duration.ofHours(1))),
        new ArchivedFile(older, START.minus(Duration.ofHours(5)))));
  }

  @Test
  public void appendsToAnExistingActiveFileAfterRestart() throws Exception {
    RotatingFileBackend first = startBackend(config().build());
    writeAll(first, infoFromServiceA(1));
    first.stopAsync().awaitTerminated(5, TimeUnit.SECONDS);

    RotatingFileBackend second = startBackend(config().build());
    writeAll(second, infoFromServiceA(2));

    assertThat(reader.readEntries(second.getActivePath()), contains(infoFromServiceA(1), infoFromServiceA(2)));
  }

  @Test
  public void retentionKeepsOnlyTheConfiguredNumberOfNewestArchives() throws Exception {
    for (int hoursAgo = 5; hoursAgo >= 1; hoursAgo--) {
      createArchive(hoursAgo);
    }
    RotatingFileBackend backend = startBackend(config().setKeepFiles(2).build());

    assertThat(backend.runRetention(), resultsIn(hasSize(3)));

    ImmutableList<ArchivedFile> remaining = backend.getArchivedFiles().get();
    assertThat(remaining, hasSize(2));
    assertThat(remaining.get(0).getCreatedAt(), is(equalTo(START.minus(Duration.ofHours(1)))));
    assertThat(remaining.get(1).getCreatedAt(), is(equalTo(START.minus(Duration.ofHours(2)))));
    try (Stream<Path> files = Files.list(outputDirectory)) {
      assertThat(files.count(), is(3L));
    }
  }

  @Test
  public void retentionRemovesArchivesOlderThanTheMaximumAge() throws Exception {
    Path recent = createArchive(1);
    createArchive(30);
    RotatingFileBackend backend = startBackend(config().setMaxAge(Duration.ofHours(24)).build());

    assertThat(backend.runRetention(), resultsIn(hasSize(1)));
    assertThat(backend.getArchivedFiles(),
        resultsIn(contains(new ArchivedFile(recent, START.minus(Duration.ofHours(1))))));

    clock.advance(Duration.ofHours(24));
    assertThat(backend.runRetention(), resultsIn(contains(recent)));
    assertThat(backend.getArchivedFiles(), resultsIn(is(empty())));
  }

  @Test
  public void compressesRotatedFilesInTheBackground() throws Exception {
    RotatingFileBackend backend = startBackend(config()
        .setMaxFileSize(recordLength(infoFromServiceA(1)))
        .setCompressionEnabled(true)
        .setCompressionAlgorithm(CompressionAlgorithm.GZIP)
        .build());

    writeAll(backend, infoFromServiceA(1), infoFromServiceA(2));

    LogStreamTestUtil.waitUntil(() -> {
      ImmutableList<ArchivedFile> archived = backend.getArchivedFiles().get();
      return archived.size() == 1 && archived.get(0).isCompressed();
    }, 5, TimeUnit.SECONDS);

    Path compressed = backend.getArchivedFiles().get().get(0).getPath();
    assertThat(compressed.getFileName().toString(), endsWith(".gz"));
    assertThat(reader.readEntries(compressed), contains(infoFromServiceA(1)));
    try (Stream<Path> files = Files.list(outputDirectory)) {
      assertThat(files.count(), is(2L));
    }
  }

  @Test
  public void deletesTheCompressedArtifactWhenRetentionRemovedItsOriginalMeanwhile() throws Exception {
    createArchive(30);
    HeldArchiveCompressor compressor = new HeldArchiveCompressor();
    RotatingFileBackend backend = startBackend(config()
        .setMaxAge(Duration.ofHours(24))
        .setCompressionEnabled(true)
        .setCompressionAlgorithm(CompressionAlgorithm.GZIP)
        .build(), compressor);

    HeldArchiveCompressor.Request request = compressor.nextRequest();
    Path compressed = request.compressFile();
    assertThat(Files.exists(compressed), is(true));

    assertThat(backend.runRetention(), resultsIn(contains(request.getSource())));
    request.complete(compressed);

    assertThat(backend.getArchivedFiles(), resultsIn(is(empty())));
    assertThat(Files.exists(compressed), is(false));
    assertThat(filesInOutputDirectory(), contains(outputDirectory.relativize(backend.getActivePath())));
  }

  @Test
  public void keepsTrackingTheUncompressedArchiveWhenCompressionFails() throws Exception {
    Path original = createArchive(1);
    HeldArchiveCompressor compressor = new HeldArchiveCompressor();
    RotatingFileBackend backend = startBackend(config()
        .setCompressionEnabled(true)
        .setCompressionAlgorithm(CompressionAlgorithm.LZ4)
        .build(), compressor);

    compressor.nextRequest().fail(new IOException("No space left on device"));

    assertThat(backend.getArchivedFiles(),
        resultsIn(contains(new ArchivedFile(original, START.minus(Duration.ofHours(1))))));
    assertThat(Files.exists(original), is(true));
    assertThat(backend.isRunning(), is(true));
    writeAll(backend, infoFromServiceA(1));
    assertThat(filesInOutputDirectory(), containsInAnyOrder(
        outputDirectory.relativize(original), outputDirectory.relativize(backend.getActivePath())));
  }

  @Test
  public void writesFailOnceTheBackendIsStopped() throws Exception {
    RotatingFileBackend backend = startBackend(config().build());
    backend.stopAsync().awaitTerminated(5, TimeUnit.SECONDS);

    assertThat(backend.write(infoFromServiceA(1)), resultsInException(IllegalStateException.class));
  }

  @Test
  public void failsToStartWhenTheOutputDirectoryCannotBeCreated() throws Exception {
    Path notADirectory = testUtil.getDataTestDir("plain-file");
    Files.write(notADirectory, new byte[]{1});
    RotatingFileBackend backend = new RotatingFileBackend(
        config().setOutputDirectory(notADirectory).build(), fiberSupplier, compressionExecutor, clock);

    backend.startAsync();
    try {
      backend.awaitRunning(5, TimeUnit.SECONDS);
    } catch (IllegalStateException expected) {
      // awaitRunning reports the failure this way
    }

    assertThat(backend.state(), is(Service.State.FAILED));
  }
}
