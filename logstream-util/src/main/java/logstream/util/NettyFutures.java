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

package logstream.util;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GenericFutureListener;

import java.util.concurrent.CancellationException;

/**
 * Adapts Netty futures (channel writes, binds, closes) to Guava ListenableFutures, so callers
 * can treat socket I/O like any other asynchronous result.
 */
public class NettyFutures {

  private NettyFutures() {
  }

  public static <V> ListenableFuture<Void> toListenableFuture(Future<V> nettyFuture) {
    SettableFuture<Void> future = SettableFuture.create();
    GenericFutureListener<Future<V>> listener = completed -> {
      if (completed.isSuccess()) {
        future.set(null);
      } else if (completed.isCancelled()) {
        future.setException(new CancellationException("Netty operation cancelled"));
      } else {
        future.setException(completed.cause());
      }
    };
    nettyFuture.addListener(listener);
    return future;
  }
}
