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

import net.jpountz.lz4.LZ4BlockInputStream;
import net.jpountz.lz4.LZ4BlockOutputStream;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

public enum CompressionAlgorithm {
  GZIP(".gz") {
    @Override
    public OutputStream compressing(OutputStream out) throws IOException {
      return new GZIPOutputStream(out);
    }

    @Override
    public InputStream decompressing(InputStream in) throws IOException {
      return new GZIPInputStream(in);
    }
  },
  LZ4(".lz4") {
    @Override
    public OutputStream compressing(OutputStream out) {
      return new LZ4BlockOutputStream(out);
    }

    @Override
    public InputStream decompressing(InputStream in) {
      return new LZ4BlockInputStream(in);
    }
  };

  private final String extension;

  CompressionAlgorithm(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }

  public abstract OutputStream compressing(OutputStream out) throws IOException;

  public abstract InputStream decompressing(InputStream in) throws IOException;

  public Path compressedPath(Path source) {
    return source.resolveSibling(source.getFileName() + extension);
  }

  public static CompressionAlgorithm fromName(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }

  /**
   * The algorithm a file was compressed with, judged by its extension, or null for a plain file.
   */
  @Nullable
  public static CompressionAlgorithm forPath(Path path) {
    String fileName = path.getFileName().toString();
    for (CompressionAlgorithm algorithm : values()) {
      if (fileName.endsWith(algorithm.extension)) {
        return algorithm;
      }
    }
    return null;
  }
}
