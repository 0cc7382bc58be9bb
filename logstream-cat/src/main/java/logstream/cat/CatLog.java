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

package logstream.cat;

import logstream.entry.EntryCodec;
import logstream.entry.EntryFormat;
import logstream.entry.MalformedEntryException;
import logstream.storage.ArchiveReader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Prints LogStream log files, active, rotated or compressed, one human-readable line per entry.
 * Lines that are not JSON records, as written by the human and syslog formats, are printed as
 * they are.
 */
public class CatLog {
  private static final EntryCodec CODEC = new EntryCodec();

  /**
   * @param args the log files to print, in order
   */
  public static void main(String[] args) throws IOException {
    if (args.length == 0) {
      System.err.println("Usage: CatLog filename...");
      System.exit(-1);
    }

    for (String arg : args) {
      Path inputLogFile = Paths.get(arg);
      if (!Files.isRegularFile(inputLogFile)) {
        System.err.println(arg + ": file does not exist, or is a directory");
        System.exit(-1);
      }
    }

    for (String arg : args) {
      describeLogFileToOutput(Paths.get(arg), System.out);
    }
  }

  /**
   * @return the number of lines that looked like records but could not be decoded
   */
  static int describeLogFileToOutput(Path inputLogFile, PrintStream out) throws IOException {
    int malformed = 0;
    try (BufferedReader reader = ArchiveReader.openLines(inputLogFile)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isEmpty()) {
          continue;
        }
        if (!line.startsWith("{")) {
          out.println(line);
          continue;
        }
        try {
          out.println(EntryFormat.HUMAN.format(CODEC.fromJson(line)));
        } catch (MalformedEntryException e) {
          malformed++;
          out.println("<malformed record: " + e.getMessage() + "> " + line);
        }
      }
    }
    return malformed;
  }
}
