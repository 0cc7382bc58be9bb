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

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LineBasedFrameDecoder;

import java.util.List;

/**
 * Line framing for sessions. When the peer closes its end, whatever follows the last newline is
 * delivered as a final line, so a stream that does not end in a newline keeps its last entry.
 */
public class SessionLineDecoder extends LineBasedFrameDecoder {
  public SessionLineDecoder(int maxLineLength) {
    super(maxLineLength, true, true);
  }

  @Override
  protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
    super.decodeLast(ctx, in, out);
    // Anything over the maximum was already failed and skipped by the decode above.
    int length = in.readableBytes();
    if (length == 0) {
      return;
    }
    if (in.getByte(in.writerIndex() - 1) == '\r') {
      length--;
    }
    ByteBuf last = in.readRetainedSlice(length);
    in.skipBytes(in.readableBytes());
    out.add(last);
  }
}
