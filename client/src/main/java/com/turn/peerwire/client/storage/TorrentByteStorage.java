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
package com.turn.peerwire.client.storage;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Abstract torrent byte storage.
 *
 * <p>
 * The torrent's shared data is seen as a single byte range; this interface
 * reads and writes parts of it at absolute positions.
 * </p>
 */
public interface TorrentByteStorage extends Closeable {

  String PARTIAL_FILE_NAME_SUFFIX = ".part";

  /**
   * Open the storage.
   *
   * @param seeder If true the storage is only read from and must already
   * hold the complete data.
   */
  void open(boolean seeder) throws IOException;

  boolean isOpen();

  /**
   * Fill the remaining bytes of the buffer with the bytes stored at the
   * given position.
   *
   * @return The number of bytes read from the storage.
   */
  int read(ByteBuffer buffer, long position) throws IOException;

  /**
   * Write all the remaining bytes of the block at the given position.
   *
   * @return The number of bytes written to the storage.
   */
  int write(ByteBuffer block, long position) throws IOException;

  /**
   * Finalize the byte storage when the download is complete, like moving
   * the files from a temporary location to their destination.
   */
  void finish() throws IOException;

  /**
   * Tells whether this byte storage has been finalized.
   */
  boolean isFinished();
}
