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
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import logstream.entry.LogEntry;
import logstream.interfaces.Backend;
import logstream.interfaces.BackendKind;
import logstream.util.FiberFutures;
import logstream.util.FiberOnly;
import logstream.util.FiberSupplier;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * The durable backend: appends formatted entries to an active file, rotating it by size,
 * deleting archives by age and count, and optionally compressing what it rotates out.
 * <p>
 * All file handling happens on the backend's fiber, which owns the {@link RotationState}.
 */
public class RotatingFileBackend extends AbstractService implements Backend {
  private static final Logger LOG = LoggerFactory.getLogger(RotatingFileBackend.class);

  private final FileBackendConfig config;
  private final FiberSupplier fiberSupplier;
  private final ArchiveCompressor compressor;
  private final Clock clock;
  private final ArchiveDirectory archiveDirectory;
  private final RetentionPolicy retentionPolicy;

  private Fiber fiber;

  // These may only be read or written from tasks running on the fiber.
  private RotationState state;
  private ActiveLogFile activeFile;
  private Disposable retentionTask;

  public RotatingFileBackend(FileBackendConfig config,
                             FiberSupplier fiberSupplier,
                             ListeningExecutorService compressionExecutor,
                             Clock clock) {
    this(config, fiberSupplier, new ArchiveCompressor(compressionExecutor), clock);
  }

  RotatingFileBackend(FileBackendConfig config,
                      FiberSupplier fiberSupplier,
                      ArchiveCompressor compressor,
                      Clock clock) {
    this.config = config;
    this.fiberSupplier = fiberSupplier;
    this.compressor = compressor;
    this.clock = clock;
    this.archiveDirectory = new ArchiveDirectory(config.getOutputDirectory(), config.getActiveFileName());
    this.retentionPolicy = new RetentionPolicy(config.getMaxAge(), config.getKeepFiles());
  }

  @Override
  public BackendKind kind() {
    return BackendKind.FILE;
  }

  public Path getActivePath() {
    return archiveDirectory.activePath();
  }

  @Override
  protected void doStart() {
    fiber = fiberSupplier.getFiber(this::failModule);
    fiber.start();
    fiber.execute(() -> {
      try {
        openStorage();
      } catch (IOException | RuntimeException e) {
        LOG.error("Unable to open file backend in {}", config.getOutputDirectory(), e);
        closeActiveFile();
        fiber.dispose();
        notifyFailed(e);
        return;
      }
      notifyStarted();
    });
  }

  @Override
  protected void doStop() {
    fiber.execute(() -> {
      try {
        if (retentionTask != null) {
          retentionTask.dispose();
        }
        if (activeFile != null) {
          activeFile.sync();
          activeFile.close();
          activeFile = null;
        }
      } catch (IOException e) {
        LOG.error("Error closing active file {}", archiveDirectory.activePath(), e);
        fiber.dispose();
        notifyFailed(e);
        return;
      }
      fiber.dispose();
      notifyStopped();
    });
  }

  @Override
  public ListenableFuture<Void> write(LogEntry entry) {
    if (state() != State.RUNNING) {
      return Futures.immediateFailedFuture(new IllegalStateException("file backend is " + state()));
    }
    byte[] record = (config.getFormat().format(entry) + '\n').getBytes(UTF_8);
    return FiberFutures.submit(fiber, () -> {
      appendRecord(record);
      return null;
    });
  }

  /**
   * Run a retention pass now, in addition to the periodic ones.
   *
   * @return the archived files deleted
   */
  public ListenableFuture<ImmutableList<Path>> runRetention() {
    return FiberFutures.submit(fiber, this::applyRetention);
  }

  /**
   * The archived files currently tracked, newest first.
   */
  public ListenableFuture<ImmutableList<ArchivedFile>> getArchivedFiles() {
    return FiberFutures.submit(fiber, () -> state.getArchived());
  }

  @FiberOnly
  private void openStorage() throws IOException {
    archiveDirectory.prepare();
    archiveDirectory.removeCompressionLeftovers();

    Path activePath = archiveDirectory.activePath();
    activeFile = new ActiveLogFile(activePath);
    Instant createdAt = activeFile.isEmpty()
        ? clock.instant()
        : Files.readAttributes(activePath, BasicFileAttributes.class).creationTime().toInstant();

    ImmutableList<ArchivedFile> archived = archiveDirectory.scan();
    state = new RotationState(activePath, activeFile.size(), createdAt, archived);
    LOG.info("File backend writing to {} ({} bytes, {} archived files)",
        activePath, activeFile.size(), archived.size());

    long intervalMillis = config.getRetentionInterval().toMillis();
    retentionTask = fiber.scheduleWithFixedDelay(this::applyRetention,
        intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);

    if (config.isCompressionEnabled()) {
      for (ArchivedFile file : archived) {
        if (!file.isCompressed()) {
          compressArchive(file);
        }
      }
    }
  }

  @FiberOnly
  private void appendRecord(byte[] record) throws IOException {
    if (activeFile == null) {
      throw new IOException("file backend is closed");
    }
    if (config.isRotationEnabled()
        && !activeFile.isEmpty()
        && activeFile.size() + record.length > config.getMaxFileSize()) {
      rotate();
    }
    activeFile.append(ByteBuffer.wrap(record));
    if (config.isSyncOnWrite()) {
      activeFile.sync();
    }
    state.recordWrite(activeFile.size());
  }

  @FiberOnly
  private void rotate() throws IOException {
    Path activePath = state.getActivePath();
    Path archivePath = archiveDirectory.archivePathFor(state.getCreatedAt());
    try {
      activeFile.close();
      Files.move(activePath, archivePath, ATOMIC_MOVE);
    } finally {
      if (!activeFile.isOpen()) {
        activeFile = new ActiveLogFile(activePath);
      }
    }

    ArchivedFile archived = new ArchivedFile(archivePath, state.getCreatedAt());
    state.recordRotation(archived, clock.instant());
    LOG.info("Rotated {} to {}", activePath, archivePath.getFileName());

    if (config.isCompressionEnabled()) {
      compressArchive(archived);
    }
  }

  @FiberOnly
  private ImmutableList<Path> applyRetention() {
    ImmutableList.Builder<Path> deleted = ImmutableList.builder();
    for (ArchivedFile file : retentionPolicy.selectExpired(state.getArchived(), clock.instant())) {
      try {
        Files.deleteIfExists(file.getPath());
        state.removeArchived(file);
        deleted.add(file.getPath());
        LOG.info("Retention removed {}", file.getPath().getFileName());
      } catch (IOException e) {
        LOG.warn("Retention could not remove {}", file.getPath(), e);
      }
    }
    return deleted.build();
  }

  @FiberOnly
  private void compressArchive(ArchivedFile archived) {
    Path original = archived.getPath();
    FiberFutures.addCallback(
        compressor.compress(original, config.getCompressionAlgorithm()),
        compressed -> onCompressed(original, compressed),
        failure -> LOG.error("Compression of {} failed; keeping it uncompressed",
            original, FiberFutures.unwrap(failure)),
        fiber);
  }

  @FiberOnly
  private void onCompressed(Path original, Path compressed) {
    if (state.recordCompression(original, compressed) != null) {
      return;
    }
    // Retention removed the original while it was being compressed.
    try {
      Files.deleteIfExists(compressed);
    } catch (IOException e) {
      LOG.warn("Unable to remove {} after retention expired its original", compressed, e);
    }
  }

  @FiberOnly
  private void closeActiveFile() {
    if (activeFile == null) {
      return;
    }
    try {
      activeFile.close();
    } catch (IOException e) {
      LOG.warn("Error closing active file {}", activeFile.getPath(), e);
    }
    activeFile = null;
  }

  private void failModule(Throwable t) {
    LOG.error("File backend failed", t);
    closeActiveFile();
    fiber.dispose();
    State current = state();
    if (current == State.STARTING || current == State.RUNNING || current == State.STOPPING) {
      notifyFailed(t);
    }
  }
}
