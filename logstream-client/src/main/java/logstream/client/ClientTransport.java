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

package logstream.client;

import com.google.common.util.concurrent.ListenableFuture;

import java.nio.file.Path;

/**
 * Opens stream connections to the server's socket.
 */
public interface ClientTransport {
  ListenableFuture<ClientConnection> connect(Path socketPath);

  /**
   * Release the transport's threads. Connections still open are closed.
   */
  void shutdown();
}
