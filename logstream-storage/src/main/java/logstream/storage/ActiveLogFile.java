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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;

/**
 * The file currently being appended to, accessed by a FileChannel.
 */
class ActiveLogFile implements Closeable {
  private final FileChannel appendChannel;
  private final Path path;
  private long filePosition;

  ActiveLogFile(Path path) throws IOException {
    this.path = path;
    appendChannel = FileChannel.open(path, CREATE, APPEND);
    filePosition = appendChannel.size();
  }

  Path getPath() {
    return path;
  }

  boolean isEmpty() {
    return filePosition == 0;
  }

  long size() {
    return filePosition;
  }

  boolean isOpen() {
    return appendChannel.isOpen();
  }

  void append(ByteBuffer record) throws IOException {
    while (record.hasRemaining()) {
      filePosition += appendChannel.write(record);
    }
  }

  void sync() throws IOException {
    appendChannel.force(true);
  }

  @Override
  public void close() throws IOException {
    appendChannel.close();
  }
}
