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

import com.turn.peerwire.common.TorrentLoggerFactory;
import com.turn.peerwire.common.TorrentMeta;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.BitSet;

/**
 * Reads every piece already present in the byte storage and only marks as
 * available the ones matching their expected hash.
 */
public class VerifyingPieceStorageFactory implements PieceStorageFactory {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(VerifyingPieceStorageFactory.class);

  public final static VerifyingPieceStorageFactory INSTANCE = new VerifyingPieceStorageFactory();

  private VerifyingPieceStorageFactory() {
  }

  @Override
  public PieceStorage createStorage(TorrentMeta meta, TorrentByteStorage byteStorage) throws IOException {
    BitSet availablePieces = new BitSet(meta.getPieceCount());
    byteStorage.open(false);
    try {
      for (int i = 0; i < meta.getPieceCount(); i++) {
        ByteBuffer buffer = ByteBuffer.allocate(meta.getPieceLength(i));
        byteStorage.read(buffer, (long) i * meta.getPieceLength());
        if (meta.matches(i, buffer.array())) {
          availablePieces.set(i);
        }
      }
      if (availablePieces.cardinality() == meta.getPieceCount() && !byteStorage.isFinished()) {
        byteStorage.finish();
      }
    } finally {
      byteStorage.close();
    }

    logger.info("{}: {}/{} piece(s) verified in {}", meta.getInfoHash(),
            availablePieces.cardinality(), meta.getPieceCount(), byteStorage);
    return new PieceStorageImpl(byteStorage, availablePieces, meta);
  }
}
