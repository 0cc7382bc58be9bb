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

import logstream.util.LogStreamTestUtil;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;

public class ArchiveDirectoryTest {
  private final LogStreamTestUtil testUtil = new LogStreamTestUtil();
  private final Instant created = Instant.parse("2024-06-01T10:15:30.250Z");
  private ArchiveDirectory archiveDirectory;
  private Path directory;

  @Before
  public void createDirectory() throws Exception {
    directory = testUtil.getDataTestDir();
    archiveDirectory = new ArchiveDirectory(directory, "app.log");
  }

  @After
  public void cleanup() {
    testUtil.cleanupTestDir();
  }

  @Test
  public void namesArchivesAfterTheirCreationTime() {
    assertThat(archiveDirectory.archivePathFor(created).getFileName().toString(),
        is("app.log.20240601T101530.250Z"));
  }

  @Test
  public void addsACounterWhenTheNameIsTakenInAnyForm() throws Exception {
    Files.createFile(directory.resolve("app.log.20240601T101530.250Z"));
    Files.createFile(directory.resolve("app.log.20240601T101530.250Z-1.gz"));

    assertThat(archiveDirectory.archivePathFor(created).getFileName().toString(),
        is("app.log.20240601T101530.250Z-2"));
  }

  @Test
  public void scansRotatedFilesNewestFirstIgnoringOthers() throws Exception {
    Path older = Files.createFile(directory.resolve("app.log.20240530T000000.000Z.gz"));
    Path newest = Files.createFile(directory.resolve("app.log.20240601T101530.250Z-1"));
    Path sameTime = Files.createFile(directory.resolve("app.log.20240601T101530.250Z.lz4"));
    Files.createFile(directory.resolve("app.log"));
    Files.createFile(directory.resolve("other.log.20240601T101530.250Z"));
    Files.createFile(directory.resolve("app.log.notatimestamp"));

    assertThat(archiveDirectory.scan(), contains(
        new ArchivedFile(newest, created),
        new ArchivedFile(sameTime, created),
        new ArchivedFile(older, Instant.parse("2024-05-30T00:00:00Z"))));
  }

  @Test
  public void removesLeftoversOfInterruptedCompression() throws Exception {
    Path temporary = Files.createFile(directory.resolve("app.log.20240601T101530.250Z.gz.tmp"));
    Path original = Files.createFile(directory.resolve("app.log.20240530T000000.000Z"));
    Path compressed = Files.createFile(directory.resolve("app.log.20240530T000000.000Z.lz4"));
    Path untouched = Files.createFile(directory.resolve("app.log.20240531T000000.000Z"));

    archiveDirectory.removeCompressionLeftovers();

    assertThat(Files.exists(temporary), is(false));
    assertThat(Files.exists(original), is(false));
    assertThat(Files.exists(compressed), is(true));
    assertThat(Files.exists(untouched), is(true));
  }

  @Test
  public void parsesOnlyItsOwnArchiveNames() {
    assertThat(archiveDirectory.parseCreationTime(directory.resolve("app.log.20240601T101530.250Z-3.gz")),
        is(created));
    assertThat(archiveDirectory.parseCreationTime(directory.resolve("app.log")), is(nullValue()));
    assertThat(archiveDirectory.parseCreationTime(directory.resolve("app.log.20241301T000000.000Z")),
        is(nullValue()));
    assertThat(archiveDirectory.activePath(), is(not(nullValue())));
  }
}
