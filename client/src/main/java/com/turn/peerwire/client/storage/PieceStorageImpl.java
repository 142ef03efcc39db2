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

import com.turn.peerwire.common.TorrentMeta;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.BitSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link PieceStorage} over a {@link TorrentByteStorage}, piece <em>i</em>
 * being stored at <em>i * pieceLength</em>.
 *
 * <p>
 * When the last missing piece is saved the byte storage is finished and
 * reopened read-only.
 * </p>
 */
public class PieceStorageImpl implements PieceStorage {

  private final TorrentByteStorage byteStorage;
  private final ReadWriteLock readWriteLock = new ReentrantReadWriteLock();
  private final int piecesCount;
  private final int pieceSize;
  private final long totalSize;

  private final BitSet availablePieces;

  public PieceStorageImpl(TorrentByteStorage byteStorage, BitSet availablePieces, TorrentMeta meta) {
    this.byteStorage = byteStorage;
    this.piecesCount = meta.getPieceCount();
    this.pieceSize = meta.getPieceLength();
    this.totalSize = meta.getTotalLength();
    this.availablePieces = new BitSet(this.piecesCount);
    this.availablePieces.or(availablePieces);
    this.availablePieces.clear(this.piecesCount, Math.max(this.piecesCount, availablePieces.length()));
  }

  private void checkPieceIndex(int pieceIndex) {
    if (pieceIndex < 0 || pieceIndex >= this.piecesCount) {
      throw new IllegalArgumentException("Incorrect piece index " + pieceIndex +
              ". Piece index must be positive less than " + this.piecesCount);
    }
  }

  @Override
  public void savePiece(int pieceIndex, byte[] pieceData) throws IOException {
    checkPieceIndex(pieceIndex);
    readWriteLock.writeLock().lock();
    try {
      if (this.availablePieces.get(pieceIndex)) return;

      long position = (long) pieceIndex * this.pieceSize;
      if (position + pieceData.length > this.totalSize) {
        throw new IllegalArgumentException("Piece #" + pieceIndex + " of " + pieceData.length +
                " bytes overruns the storage");
      }
      this.byteStorage.open(false);
      this.byteStorage.write(ByteBuffer.wrap(pieceData), position);

      this.availablePieces.set(pieceIndex);
      if (this.availablePieces.cardinality() == this.piecesCount) {
        this.byteStorage.finish();
        this.byteStorage.close();
        this.byteStorage.open(true);
      }
    } finally {
      readWriteLock.writeLock().unlock();
    }
  }

  @Override
  public boolean hasPiece(int pieceIndex) {
    readWriteLock.readLock().lock();
    try {
      return pieceIndex >= 0 && this.availablePieces.get(pieceIndex);
    } finally {
      readWriteLock.readLock().unlock();
    }
  }

  @Override
  public byte[] readPiecePart(int pieceIndex, int offset, int length) throws IOException {
    checkPieceIndex(pieceIndex);
    // Opening may happen here, so the write lock is needed.
    readWriteLock.writeLock().lock();
    try {
      if (!this.availablePieces.get(pieceIndex)) {
        throw new IllegalArgumentException("trying reading part of not available piece " + pieceIndex);
      }
      if (!this.byteStorage.isOpen()) {
        this.byteStorage.open(this.isFinished());
      }

      ByteBuffer buffer = ByteBuffer.allocate(length);
      this.byteStorage.read(buffer, (long) pieceIndex * this.pieceSize + offset);
      return buffer.array();
    } finally {
      readWriteLock.writeLock().unlock();
    }
  }

  @Override
  public boolean isFinished() {
    readWriteLock.readLock().lock();
    try {
      return this.availablePieces.cardinality() == this.piecesCount;
    } finally {
      readWriteLock.readLock().unlock();
    }
  }

  @Override
  public BitSet getAvailablePieces() {
    readWriteLock.readLock().lock();
    try {
      return (BitSet) this.availablePieces.clone();
    } finally {
      readWriteLock.readLock().unlock();
    }
  }

  @Override
  public void close() throws IOException {
    readWriteLock.writeLock().lock();
    try {
      this.byteStorage.close();
    } finally {
      readWriteLock.writeLock().unlock();
    }
  }
}
