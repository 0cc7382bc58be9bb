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

import ch.qos.logback.classic.Level;
import logstream.config.ConfigurationException;
import logstream.config.ServerConfig;
import logstream.config.ServerConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Command line entry point of the server. Exits with status 1 when the server cannot start.
 */
public class LogStreamMain {
  private static final Logger LOG = LoggerFactory.getLogger(LogStreamMain.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;

  public static void main(String[] args) {
    int status = run(args, new PrintWriter(new OutputStreamWriter(System.out, UTF_8)));
    if (status != EXIT_OK) {
      System.exit(status);
    }
  }

  static int run(String[] args, PrintWriter out) {
    CommandLineOptions options = new CommandLineOptions();
    CommandLineOptions.LaunchParameters parameters;
    try {
      parameters = options.parse(args);
    } catch (IllegalArgumentException e) {
      out.println(e.getMessage());
      options.printHelp(out);
      return EXIT_FAILURE;
    }
    if (parameters.isHelp()) {
      options.printHelp(out);
      return EXIT_OK;
    }
    if (parameters.isVerbose()) {
      setLogstreamLogLevel(Level.DEBUG);
    }

    ServerConfig config;
    try {
      config = parameters.applyTo(new ServerConfigLoader().load(parameters.getConfigPath())).build();
    } catch (ConfigurationException e) {
      LOG.error("Invalid configuration: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }

    LogStreamServer server = new LogStreamServer(config);
    try {
      server.startAsync().awaitRunning();
    } catch (IllegalStateException e) {
      LOG.error("LogStream server failed to start", server.failureCause());
      return EXIT_FAILURE;
    }

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      LOG.info("Shutdown signal received");
      server.stopAsync().awaitTerminated();
    }, "logstream-shutdown-hook"));

    try {
      server.awaitTerminated();
    } catch (IllegalStateException e) {
      LOG.error("LogStream server failed", server.failureCause());
      return EXIT_FAILURE;
    }
    LOG.info("LogStream server stopped");
    return EXIT_OK;
  }

  private static void setLogstreamLogLevel(Level level) {
    org.slf4j.Logger logger = LoggerFactory.getLogger("logstream");
    if (logger instanceof ch.qos.logback.classic.Logger) {
      ((ch.qos.logback.classic.Logger) logger).setLevel(level);
    }
  }
}
