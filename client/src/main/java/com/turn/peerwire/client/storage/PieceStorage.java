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
import java.util.BitSet;

/**
 * Where verified pieces are persisted and served from.
 *
 * <p>
 * Only pieces whose hash was already checked are handed to
 * {@link #savePiece(int, byte[])}. Implementations must be safe to use from
 * several threads.
 * </p>
 */
public interface PieceStorage extends Closeable {

  void savePiece(int pieceIndex, byte[] pieceData) throws IOException;

  boolean hasPiece(int pieceIndex);

  /**
   * @throws IllegalArgumentException If the piece isn't available.
   */
  byte[] readPiecePart(int pieceIndex, int offset, int length) throws IOException;

  BitSet getAvailablePieces();

  boolean isFinished();

}
