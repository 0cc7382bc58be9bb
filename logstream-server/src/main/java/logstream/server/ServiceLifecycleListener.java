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

import com.google.common.util.concurrent.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Logs a service's lifecycle and reports when it is running or has failed.
 */
public class ServiceLifecycleListener extends Service.Listener {
  private static final Logger LOG = LoggerFactory.getLogger(ServiceLifecycleListener.class);

  private final Service service;
  private final Runnable onRunning;
  private final Consumer<Throwable> onFailure;

  public ServiceLifecycleListener(Service service, Runnable onRunning, Consumer<Throwable> onFailure) {
    this.service = service;
    this.onRunning = onRunning;
    this.onFailure = onFailure;
  }

  @Override
  public void starting() {
    LOG.debug("Starting {}", service);
  }

  @Override
  public void running() {
    LOG.info("Running {}", service);
    onRunning.run();
  }

  @Override
  public void stopping(Service.State from) {
    LOG.debug("Stopping {}", service);
  }

  @Override
  public void terminated(Service.State from) {
    LOG.info("Terminated {}", service);
  }

  @Override
  public void failed(Service.State from, Throwable failure) {
    LOG.warn("Failed {} while {}: {}", service, from, failure.toString());
    onFailure.accept(failure);
  }
}
