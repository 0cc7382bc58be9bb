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

/**
 * One open stream to the server. Lines are written in call order.
 */
public interface ClientConnection {
  /**
   * Write one line; the terminating newline is added here.
   */
  ListenableFuture<Void> sendLine(String line);

  /**
   * False while the lines already sent fill the outbound buffer past its high water mark.
   */
  boolean isWritable();

  /**
   * Completes once the connection is writable again, immediately if it already is. Only the
   * future from the latest call is completed.
   */
  ListenableFuture<Void> whenWritable();

  /**
   * Completes when the connection closes, for whatever reason.
   */
  ListenableFuture<Void> closeFuture();

  /**
   * Close once every line already sent has been written.
   */
  void close();
}
