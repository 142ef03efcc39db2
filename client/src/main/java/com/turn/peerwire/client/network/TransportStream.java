/**
 * Copyright (C) 2011-2012 Turn, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.turn.peerwire.client.network;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;

/**
 * An ordered, reliable byte stream to one remote peer.
 *
 * <p>
 * Reads and writes block. One thread may read while another one writes;
 * {@link #close()} may be called from any thread and makes pending reads
 * and writes fail.
 * </p>
 */
public interface TransportStream extends Closeable {

  /**
   * @return the number of bytes read, or -1 at end of stream.
   */
  int read(ByteBuffer buffer) throws IOException;

  /**
   * Writes some of the remaining bytes of the buffer.
   *
   * @return the number of bytes written.
   */
  int write(ByteBuffer buffer) throws IOException;

  SocketAddress getRemoteAddress();

  boolean isOpen();
}
