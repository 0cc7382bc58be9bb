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
import io.netty.util.concurrent.DefaultPromise;
import io.netty.util.concurrent.ImmediateEventExecutor;
import io.netty.util.concurrent.Promise;
import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.ExecutionException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

public class NettyFuturesTest {

  @Test
  public void completesWhenTheNettyOperationSucceeds() throws Exception {
    Promise<Void> promise = new DefaultPromise<>(ImmediateEventExecutor.INSTANCE);
    ListenableFuture<Void> future = NettyFutures.toListenableFuture(promise);

    assertThat(future.isDone(), is(false));
    promise.setSuccess(null);

    assertThat(future.get(), is(nullValue()));
  }

  @Test
  public void failsWithTheCauseOfTheNettyFailure() throws Exception {
    Promise<Void> promise = new DefaultPromise<>(ImmediateEventExecutor.INSTANCE);
    IOException brokenPipe = new IOException("Broken pipe");
    promise.setFailure(brokenPipe);

    ListenableFuture<Void> future = NettyFutures.toListenableFuture(promise);

    try {
      future.get();
      throw new AssertionError("expected failure");
    } catch (ExecutionException e) {
      assertThat(e.getCause(), is(sameInstance(brokenPipe)));
    }
  }
}
