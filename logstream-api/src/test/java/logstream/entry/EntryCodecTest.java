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

package logstream.entry;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.time.Instant;
import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;

public class EntryCodecTest {
  private final EntryCodec codec = new EntryCodec();
  private final UUID id = UUID.randomUUID();
  private final Instant receivedAt = Instant.parse("2024-03-01T12:30:45.123456789Z");

  private LogEntry decode(String line) throws MalformedEntryException {
    return codec.decodeSubmission(line, "svc-A", id, receivedAt, "server-host");
  }

  @Test
  public void decodesASubmittedLineWithServerAssignedIdentity() throws Exception {
    LogEntry entry = decode(
        "{\"level\":6,\"message\":\"hello\",\"fields\":{\"k\":\"v\",\"n\":3},\"pid\":42,\"hostname\":\"box\"}");

    assertThat(entry.getId(), is(id));
    assertThat(entry.getTimestamp(), is(receivedAt));
    assertThat(entry.getDaemon(), is("svc-A"));
    assertThat(entry.getLevel(), is(LogLevel.INFO));
    assertThat(entry.getMessage(), is("hello"));
    assertThat(entry.getFields(), is(equalTo(ImmutableMap.of("k", "v", "n", "3"))));
    assertThat(entry.getPid(), is(42));
    assertThat(entry.getHostname(), is("box"));
  }

  @Test
  public void ignoresIdTimestampAndDaemonSentByTheClient() throws Exception {
    LogEntry entry = decode("{\"level\":3,\"message\":\"m\",\"id\":\"forged\","
        + "\"timestamp\":\"1999-01-01T00:00:00Z\",\"daemon\":\"impostor\"}");

    assertThat(entry.getId(), is(id));
    assertThat(entry.getTimestamp(), is(receivedAt));
    assertThat(entry.getDaemon(), is("svc-A"));
  }

  @Test
  public void fillsInTheServerHostnameWhenTheClientOmitsIt() throws Exception {
    LogEntry entry = decode("{\"level\":\"Warning\",\"message\":\"m\"}");

    assertThat(entry.getLevel(), is(LogLevel.WARNING));
    assertThat(entry.getHostname(), is("server-host"));
    assertThat(entry.getPid(), is(nullValue()));
  }

  @Test(expected = MalformedEntryException.class)
  public void rejectsInvalidJson() throws Exception {
    decode("{not json");
  }

  @Test(expected = MalformedEntryException.class)
  public void rejectsALevelOutsideTheRange() throws Exception {
    decode("{\"level\":9,\"message\":\"m\"}");
  }

  @Test(expected = MalformedEntryException.class)
  public void rejectsAMissingMessage() throws Exception {
    decode("{\"level\":6}");
  }

  @Test(expected = MalformedEntryException.class)
  public void rejectsNestedFieldValues() throws Exception {
    decode("{\"level\":6,\"message\":\"m\",\"fields\":{\"k\":{\"nested\":1}}}");
  }

  @Test(expected = MalformedEntryException.class)
  public void rejectsANegativePid() throws Exception {
    decode("{\"level\":6,\"message\":\"m\",\"pid\":-1}");
  }

  @Test(expected = MalformedEntryException.class)
  public void rejectsNonObjectLines() throws Exception {
    decode("[1,2,3]");
  }

  @Test
  public void encodesSubmissionsOnASingleLine() throws Exception {
    String line = codec.encodeSubmission(LogLevel.ERROR, "two\nlines", ImmutableMap.of("a", "b"), 7, "host");

    assertThat(line, not(containsString("\n")));
    LogEntry decoded = decode(line);
    assertThat(decoded.getMessage(), is("two\nlines"));
    assertThat(decoded.getLevel(), is(LogLevel.ERROR));
    assertThat(decoded.getFields(), is(equalTo(ImmutableMap.of("a", "b"))));
    assertThat(decoded.getPid(), is(7));
  }

  @Test
  public void persistedRecordsDecodeToAnEqualEntry() throws Exception {
    LogEntry entry = LogEntry.builder()
        .setId(id)
        .setTimestamp(receivedAt)
        .setLevel(LogLevel.NOTICE)
        .setDaemon("svc-B")
        .setMessage("disk at 91%")
        .putField("mount", "/data")
        .setPid(1234)
        .setHostname("box")
        .build();

    String json = codec.toJson(entry);

    assertThat(json, containsString("\"level\":5"));
    assertThat(json, containsString("\"timestamp\":\"2024-03-01T12:30:45.123456789Z\""));
    assertThat(codec.fromJson(json), is(equalTo(entry)));
  }

  @Test(expected = MalformedEntryException.class)
  public void rejectsPersistedRecordsWithoutAnId() throws Exception {
    codec.fromJson("{\"timestamp\":\"2024-03-01T12:30:45Z\",\"level\":6,\"daemon\":\"d\",\"message\":\"m\"}");
  }
}
