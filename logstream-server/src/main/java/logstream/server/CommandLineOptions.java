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

import logstream.config.ServerConfig;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.jetbrains.annotations.Nullable;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses the server's command line and prints the help page.
 */
public class CommandLineOptions {
  public static final String HELP_OPTION = "help";
  public static final String CONFIG_OPTION = "config";
  public static final String SOCKET_OPTION = "socket";
  public static final String OUTPUT_OPTION = "output";
  public static final String VERBOSE_OPTION = "verbose";
  public static final String JOURNALD_OPTION = "journald";
  public static final String SYSLOG_OPTION = "syslog";
  public static final String NO_FILE_OPTION = "no-file";

  public static final String DEFAULT_CONFIG_PATH = "config/server.yaml";

  private final Options options = createOptions();

  private static Options createOptions() {
    Options options = new Options();

    options.addOption(Option.builder("h")
        .longOpt(HELP_OPTION)
        .desc("Show this help page.")
        .build());

    options.addOption(Option.builder("c")
        .longOpt(CONFIG_OPTION)
        .hasArg()
        .argName("file")
        .desc("Configuration file (default " + DEFAULT_CONFIG_PATH + ").")
        .build());

    options.addOption(Option.builder("s")
        .longOpt(SOCKET_OPTION)
        .hasArg()
        .argName("path")
        .desc("Unix socket path to listen on.")
        .build());

    options.addOption(Option.builder("o")
        .longOpt(OUTPUT_OPTION)
        .hasArg()
        .argName("dir")
        .desc("Directory log files are written to.")
        .build());

    options.addOption(Option.builder("v")
        .longOpt(VERBOSE_OPTION)
        .desc("Log debug output.")
        .build());

    options.addOption(Option.builder()
        .longOpt(JOURNALD_OPTION)
        .desc("Also forward entries to the systemd journal.")
        .build());

    options.addOption(Option.builder()
        .longOpt(SYSLOG_OPTION)
        .desc("Also forward entries to syslog.")
        .build());

    options.addOption(Option.builder()
        .longOpt(NO_FILE_OPTION)
        .desc("Disable the file backend.")
        .build());

    return options;
  }

  public void printHelp(PrintWriter out) {
    new HelpFormatter().printHelp(out, HelpFormatter.DEFAULT_WIDTH, "logstream-server [options]",
        "Centralized log aggregation over a Unix domain socket.", options,
        HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, false);
    out.flush();
  }

  /**
   * @throws IllegalArgumentException on unknown options or missing option arguments
   */
  public LaunchParameters parse(String[] args) {
    try {
      CommandLineParser parser = new DefaultParser();
      CommandLine cl = parser.parse(options, args);
      if (!cl.getArgList().isEmpty()) {
        throw new IllegalArgumentException("Unexpected arguments: " + cl.getArgList());
      }
      return new LaunchParameters(
          cl.hasOption(HELP_OPTION),
          Paths.get(cl.getOptionValue(CONFIG_OPTION, DEFAULT_CONFIG_PATH)),
          cl.getOptionValue(SOCKET_OPTION),
          cl.getOptionValue(OUTPUT_OPTION),
          cl.hasOption(VERBOSE_OPTION),
          cl.hasOption(JOURNALD_OPTION),
          cl.hasOption(SYSLOG_OPTION),
          cl.hasOption(NO_FILE_OPTION));
    } catch (ParseException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
  }

  public static final class LaunchParameters {
    private final boolean help;
    private final Path configPath;
    @Nullable
    private final String socketPath;
    @Nullable
    private final String outputDirectory;
    private final boolean verbose;
    private final boolean journald;
    private final boolean syslog;
    private final boolean noFile;

    LaunchParameters(boolean help,
                     Path configPath,
                     @Nullable String socketPath,
                     @Nullable String outputDirectory,
                     boolean verbose,
                     boolean journald,
                     boolean syslog,
                     boolean noFile) {
      this.help = help;
      this.configPath = configPath;
      this.socketPath = socketPath;
      this.outputDirectory = outputDirectory;
      this.verbose = verbose;
      this.journald = journald;
      this.syslog = syslog;
      this.noFile = noFile;
    }

    public boolean isHelp() {
      return help;
    }

    public Path getConfigPath() {
      return configPath;
    }

    public boolean isVerbose() {
      return verbose;
    }

    /**
     * Apply the options that override configuration file settings.
     */
    public ServerConfig.Builder applyTo(ServerConfig.Builder builder) {
      if (socketPath != null) {
        builder.setSocketPath(Paths.get(socketPath));
      }
      if (outputDirectory != null) {
        builder.setOutputDirectory(Paths.get(outputDirectory));
      }
      if (journald) {
        builder.setJournaldEnabled(true);
      }
      if (syslog) {
        builder.setSyslogEnabled(true);
      }
      if (noFile) {
        builder.setFileEnabled(false);
      }
      return builder;
    }
  }
}
