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

import com.google.common.util.concurrent.MoreExecutors;
import logstream.util.LogStreamTestUtil;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static logstream.util.FutureMatchers.resultsIn;
import static logstream.util.FutureMatchers.resultsInException;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static java.nio.charset.StandardCharsets.UTF_8;

public class ArchiveCompressorTest {
  private final LogStreamTestUtil testUtil = new LogStreamTestUtil();
  private final ArchiveCompressor compressor = new ArchiveCompressor(MoreExecutors.newDirectExecutorService());
  private Path original;

  @Before
  public void writeOriginal() throws Exception {
    original = testUtil.getDataTestDir().resolve("app.log.20240601T101530.250Z");
    Files.write(original, "first line\nsecond line\n".getBytes(UTF_8));
  }

  @After
  public void cleanup() {
    testUtil.cleanupTestDir();
  }

  private static List<String> readLines(Path path) throws IOException {
    try (BufferedReader reader = ArchiveReader.openLines(path)) {
      return reader.lines().collect(Collectors.toList());
    }
  }

  @Test
  public void gzipReplacesTheOriginalWithACompressedCopy() throws Exception {
    Path expected = original.resolveSibling(original.getFileName() + ".gz");

    assertThat(compressor.compress(original, CompressionAlgorithm.GZIP), resultsIn(equalTo(expected)));

    assertThat(Files.exists(original), is(false));
    assertThat(readLines(expected), contains("first line", "second line"));
  }

  @Test
  public void lz4ReplacesTheOriginalWithACompressedCopy() throws Exception {
    Path expected = original.resolveSibling(original.getFileName() + ".lz4");

    assertThat(compressor.compress(original, CompressionAlgorithm.LZ4), resultsIn(equalTo(expected)));

    assertThat(Files.exists(original), is(false));
    assertThat(readLines(expected), contains("first line", "second line"));
  }

  @Test
  public void keepsTheOriginalWhenCompressionFails() throws Exception {
    Path compressed = CompressionAlgorithm.GZIP.compressedPath(original);
    Path temporary = compressed.resolveSibling(compressed.getFileName() + ".tmp");
    Files.createDirectories(temporary.resolve("blocking"));

    assertThat(compressor.compress(original, CompressionAlgorithm.GZIP), resultsInException(IOException.class));

    assertThat(Files.exists(original), is(true));
    assertThat(Files.exists(compressed), is(false));
    assertThat(readLines(original), contains("first line", "second line"));
  }

  @Test
  public void failsWhenTheOriginalIsMissing() throws Exception {
    Files.delete(original);

    assertThat(compressor.compress(original, CompressionAlgorithm.LZ4), resultsInException(IOException.class));
    assertThat(Files.exists(CompressionAlgorithm.LZ4.compressedPath(original)), is(false));
  }
}
