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
import logstream.util.FiberOnly;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Bookkeeping for one file backend: the active file and the archived files, newest first.
 * Not thread safe; owned by the backend's fiber.
 */
class RotationState {
  private final Path activePath;
  private long activeSize;
  private Instant createdAt;
  private final List<ArchivedFile> archived = new ArrayList<>();

  RotationState(Path activePath, long activeSize, Instant createdAt, Collection<ArchivedFile> archivedNewestFirst) {
    this.activePath = activePath;
    this.activeSize = activeSize;
    this.createdAt = createdAt;
    this.archived.addAll(archivedNewestFirst);
  }

  Path getActivePath() {
    return activePath;
  }

  long getActiveSize() {
    return activeSize;
  }

  Instant getCreatedAt() {
    return createdAt;
  }

  @FiberOnly
  void recordWrite(long newActiveSize) {
    activeSize = newActiveSize;
  }

  /**
   * The active file was rotated out to {@code archivedFile} and a fresh one opened at
   * {@code now}.
   */
  @FiberOnly
  void recordRotation(ArchivedFile archivedFile, Instant now) {
    archived.add(0, archivedFile);
    activeSize = 0;
    createdAt = now;
  }

  @FiberOnly
  boolean removeArchived(ArchivedFile archivedFile) {
    return archived.remove(archivedFile);
  }

  /**
   * Replace the entry for {@code original} with its compressed counterpart.
   *
   * @return the updated entry, or null if {@code original} is no longer tracked
   */
  @FiberOnly
  @Nullable
  ArchivedFile recordCompression(Path original, Path compressed) {
    for (int i = 0; i < archived.size(); i++) {
      ArchivedFile file = archived.get(i);
      if (file.getPath().equals(original)) {
        ArchivedFile replacement = file.withPath(compressed);
        archived.set(i, replacement);
        return replacement;
      }
    }
    return null;
  }

  ImmutableList<ArchivedFile> getArchived() {
    return ImmutableList.copyOf(archived);
  }
}
