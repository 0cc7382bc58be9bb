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

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import logstream.LogStreamConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Compresses rotated files off the writing fiber. The compressed artifact only appears under its
 * final name once complete, and the original is deleted only after that.
 */
public class ArchiveCompressor {
  private static final Logger LOG = LoggerFactory.getLogger(ArchiveCompressor.class);

  private final ListeningExecutorService executor;

  public ArchiveCompressor(ListeningExecutorService executor) {
    this.executor = executor;
  }

  /**
   * @return a future for the compressed file's path
   */
  public ListenableFuture<Path> compress(Path source, CompressionAlgorithm algorithm) {
    return executor.submit(() -> compressNow(source, algorithm));
  }

  static Path compressNow(Path source, CompressionAlgorithm algorithm) throws IOException {
    Path target = algorithm.compressedPath(source);
    Path temporary = target.resolveSibling(target.getFileName() + LogStreamConstants.COMPRESSION_TEMPORARY_SUFFIX);

    try {
      try (InputStream in = Files.newInputStream(source);
           OutputStream out = algorithm.compressing(Files.newOutputStream(temporary))) {
        in.transferTo(out);
      }
      Files.move(temporary, target, ATOMIC_MOVE);
    } catch (IOException | RuntimeException e) {
      try {
        Files.deleteIfExists(temporary);
      } catch (IOException cleanupFailure) {
        e.addSuppressed(cleanupFailure);
      }
      throw e;
    }

    Files.deleteIfExists(source);
    LOG.debug("Compressed {} to {}", source, target);
    return target;
  }
}
