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
import logstream.entry.EntryCodec;
import logstream.entry.LogEntry;
import logstream.entry.MalformedEntryException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads back active, rotated or compressed files written in the JSON format.
 */
public class ArchiveReader {
  private final EntryCodec codec;

  public ArchiveReader(EntryCodec codec) {
    this.codec = codec;
  }

  /**
   * Open a file for line reading, decompressing according to its extension.
   */
  public static BufferedReader openLines(Path path) throws IOException {
    InputStream in = Files.newInputStream(path);
    try {
      CompressionAlgorithm algorithm = CompressionAlgorithm.forPath(path);
      if (algorithm != null) {
        in = algorithm.decompressing(in);
      }
      return new BufferedReader(new InputStreamReader(in, UTF_8));
    } catch (IOException | RuntimeException e) {
      in.close();
      throw e;
    }
  }

  public ImmutableList<LogEntry> readEntries(Path path) throws IOException, MalformedEntryException {
    ImmutableList.Builder<LogEntry> entries = ImmutableList.builder();
    try (BufferedReader reader = openLines(path)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (!line.isEmpty()) {
          entries.add(codec.fromJson(line));
        }
      }
    }
    return entries.build();
  }
}
