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

package logstream.backend;

import com.google.common.collect.ImmutableMap;
import logstream.entry.LogEntry;
import logstream.entry.LogLevel;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class JournalRecordEncoderTest {
  private static final UUID ID = UUID.fromString("6f1c2a3e-0000-4000-8000-000000000001");

  private final JournalRecordEncoder encoder = new JournalRecordEncoder("logstream");

  private static LogEntry.Builder entry() {
    return LogEntry.builder()
        .setId(ID)
        .setTimestamp(Instant.parse("2024-06-01T12:00:00Z"))
        .setLevel(LogLevel.WARNING)
        .setDaemon("svc-A")
        .setMessage("disk almost full");
  }

  @Test
  public void writesOneKeyValueLinePerField() throws Exception {
    LogEntry entry = entry()
        .setPid(42)
        .setHostname("web-1")
        .putField("disk", "sda")
        .build();

    String record = new String(encoder.encode(entry), UTF_8);

    assertThat(record, containsString("MESSAGE=disk almost full\n"));
    assertThat(record, containsString("PRIORITY=4\n"));
    assertThat(record, containsString("SYSLOG_IDENTIFIER=logstream\n"));
    assertThat(record, containsString("SYSLOG_PID=42\n"));
    assertThat(record, containsString("LOGSTREAM_DAEMON=svc-A\n"));
    assertThat(record, containsString("LOGSTREAM_ID=" + ID + "\n"));
    assertThat(record, containsString("LOGSTREAM_HOSTNAME=web-1\n"));
    assertThat(record, containsString("DISK=sda\n"));
  }

  @Test
  public void omitsAbsentPidAndHostname() throws Exception {
    String record = new String(encoder.encode(entry().build()), UTF_8);

    assertThat(record, not(containsString("SYSLOG_PID")));
    assertThat(record, not(containsString("LOGSTREAM_HOSTNAME")));
  }

  @Test
  public void usesTheLengthPrefixedFormForMultilineValues() throws Exception {
    LogEntry entry = entry().setMessage("line one\nline two").build();

    byte[] record = encoder.encode(entry);

    byte[] value = "line one\nline two".getBytes(UTF_8);
    ByteArrayOutputStream expected = new ByteArrayOutputStream();
    expected.write("MESSAGE\n".getBytes(UTF_8));
    expected.write(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value.length).array());
    expected.write(value);
    expected.write('\n');
    byte[] prefix = new byte[expected.size()];
    System.arraycopy(record, 0, prefix, 0, prefix.length);
    assertThat(prefix, is(equalTo(expected.toByteArray())));
  }

  @Test
  public void sanitizesFieldNamesIntoJournalFieldNames() throws Exception {
    assertThat(JournalRecordEncoder.fieldName("request-id"), is(equalTo("REQUEST_ID")));
    assertThat(JournalRecordEncoder.fieldName("_private"), is(equalTo("PRIVATE")));
    assertThat(JournalRecordEncoder.fieldName("2fa"), is(equalTo("F_2FA")));
    assertThat(JournalRecordEncoder.fieldName("___"), is(equalTo("")));
  }

  @Test
  public void dropsFieldsWhoseNamesSanitizeToNothing() throws Exception {
    LogEntry entry = entry().putField("__", "ignored").putField("ok", "kept").build();

    String record = new String(encoder.encode(entry), UTF_8);

    assertThat(record, not(containsString("ignored")));
    assertThat(record, containsString("OK=kept\n"));
  }
}
