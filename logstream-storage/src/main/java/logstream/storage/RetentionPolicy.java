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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Decides which archived files to delete. A file goes if it is older than the maximum age or if
 * it ranks beyond the newest {@code keepFiles}; either limit alone is enough.
 */
public class RetentionPolicy {
  private final Duration maxAge;
  private final int keepFiles;

  public RetentionPolicy(Duration maxAge, int keepFiles) {
    this.maxAge = maxAge;
    this.keepFiles = keepFiles;
  }

  /**
   * @param newestFirst archived files ordered newest first; the active file is never included
   */
  public ImmutableList<ArchivedFile> selectExpired(List<ArchivedFile> newestFirst, Instant now) {
    Instant cutoff = now.minus(maxAge);
    ImmutableList.Builder<ArchivedFile> expired = ImmutableList.builder();
    for (int rank = 0; rank < newestFirst.size(); rank++) {
      ArchivedFile file = newestFirst.get(rank);
      if (rank >= keepFiles || file.getCreatedAt().isBefore(cutoff)) {
        expired.add(file);
      }
    }
    return expired.build();
  }
}
