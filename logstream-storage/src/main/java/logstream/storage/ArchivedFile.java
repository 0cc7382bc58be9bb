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

import java.nio.file.Path;
import java.time.Instant;

/**
 * A rotated file and the creation time encoded in its name.
 */
public final class ArchivedFile {
  private final Path path;
  private final Instant createdAt;

  public ArchivedFile(Path path, Instant createdAt) {
    this.path = path;
    this.createdAt = createdAt;
  }

  public Path getPath() {
    return path;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public ArchivedFile withPath(Path newPath) {
    return new ArchivedFile(newPath, createdAt);
  }

  public boolean isCompressed() {
    return CompressionAlgorithm.forPath(path) != null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ArchivedFile that = (ArchivedFile) o;
    return path.equals(that.path) && createdAt.equals(that.createdAt);
  }

  @Override
  public int hashCode() {
    return 31 * path.hashCode() + createdAt.hashCode();
  }

  @Override
  public String toString() {
    return path.getFileName() + "@" + createdAt;
  }
}
