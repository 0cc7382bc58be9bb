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

package logstream.server;

import logstream.util.LogStreamTestUtil;
import org.junit.After;
import org.junit.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class LogStreamMainTest {
  private final LogStreamTestUtil testUtil = new LogStreamTestUtil();
  private final StringWriter output = new StringWriter();

  @After
  public void after() {
    testUtil.cleanupTestDir();
  }

  private int run(String... args) {
    return LogStreamMain.run(args, new PrintWriter(output));
  }

  @Test
  public void printsHelpAndExitsCleanly() throws Exception {
    assertThat(run("--help"), is(LogStreamMain.EXIT_OK));
    assertThat(output.toString(), containsString("logstream-server"));
  }

  @Test
  public void failsOnUnknownOptions() throws Exception {
    assertThat(run("--bogus"), is(LogStreamMain.EXIT_FAILURE));
    assertThat(output.toString(), containsString("bogus"));
  }

  @Test
  public void failsOnAnInvalidConfiguration() throws Exception {
    Path dir = testUtil.getDataTestDir("main");
    Files.createDirectories(dir);
    Path config = dir.resolve("server.yaml");
    Files.write(config, "server:\n  max_connections: -1\n".getBytes(UTF_8));

    assertThat(run("-c", config.toString()), is(LogStreamMain.EXIT_FAILURE));
  }
}
