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
package com.turn.peerwire.client;

import com.google.common.base.Preconditions;
import com.turn.peerwire.common.TorrentLoggerFactory;
import com.turn.peerwire.common.TorrentMeta;
import org.slf4j.Logger;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import java.nio.ByteBuffer;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Download state of every piece of a torrent.
 *
 * <p>
 * Pieces are cut into blocks of the configured block size (the last block
 * of a piece may be shorter). The table tracks which blocks were received,
 * which ones are currently requested from some peer, and which pieces are
 * {@link PieceState#VERIFIED}. It hands out the next block to request,
 * lowest piece index first.
 * </p>
 *
 * <p>
 * Not thread safe: the table belongs to the torrent actor.
 * </p>
 */
public class PieceTable {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(PieceTable.class);

  public enum Reception {
    /** Not required: unknown piece, already received or misaligned block. */
    IGNORED,
    /** Thank you, but the piece is not complete. */
    INCOMPLETE,
    /** Thank you, piece complete and matching its hash. */
    VALID,
    /** Piece complete, but its hash doesn't match. All its blocks were dropped. */
    INVALID
  }

  private static final class PieceProgress {
    private final byte[] data;
    private final BitSet receivedBlocks = new BitSet();

    private PieceProgress(int length) {
      this.data = new byte[length];
    }
  }

  private final TorrentMeta meta;
  private final int blockSize;
  private final BitSet verified;
  private final Map<Integer, PieceProgress> inProgress = new HashMap<Integer, PieceProgress>();
  private final Set<BlockRequest> assigned = new HashSet<BlockRequest>();
  private final Map<Integer, byte[]> verifiedData = new HashMap<Integer, byte[]>();

  /**
   * @param verified Pieces already available locally.
   */
  public PieceTable(@Nonnull TorrentMeta meta, @Nonnegative int blockSize, @Nonnull BitSet verified) {
    Preconditions.checkArgument(blockSize > 0, "Block size must be positive: %s", blockSize);
    this.meta = meta;
    this.blockSize = blockSize;
    this.verified = new BitSet(meta.getPieceCount());
    this.verified.or(verified);
    if (this.verified.length() > meta.getPieceCount()) {
      this.verified.clear(meta.getPieceCount(), this.verified.length());
    }
  }

  public int getPieceCount() {
    return this.meta.getPieceCount();
  }

  public int getBlockCount(int piece) {
    int length = this.meta.getPieceLength(piece);
    return (length + this.blockSize - 1) / this.blockSize;
  }

  /**
   * The request for the given block of a piece.
   */
  public BlockRequest getBlock(int piece, int block) {
    int offset = block * this.blockSize;
    int length = Math.min(this.blockSize, this.meta.getPieceLength(piece) - offset);
    return new BlockRequest(piece, offset, length);
  }

  public PieceState getState(int piece) {
    if (this.verified.get(piece)) {
      return PieceState.VERIFIED;
    }
    return this.inProgress.containsKey(piece) ? PieceState.IN_PROGRESS : PieceState.MISSING;
  }

  public boolean isVerified(int piece) {
    return piece >= 0 && this.verified.get(piece);
  }

  public BitSet getVerifiedPieces() {
    return (BitSet) this.verified.clone();
  }

  public int getVerifiedCount() {
    return this.verified.cardinality();
  }

  public boolean isComplete() {
    return this.verified.cardinality() == this.meta.getPieceCount();
  }

  public int getReceivedBlockCount(int piece) {
    PieceProgress progress = this.inProgress.get(piece);
    return progress == null ? 0 : progress.receivedBlocks.cardinality();
  }

  /**
   * Tells whether some of the given pieces are still needed.
   */
  public boolean isNeeded(@Nonnull BitSet available) {
    for (int i = available.nextSetBit(0); i >= 0 && i < this.meta.getPieceCount(); i = available.nextSetBit(i + 1)) {
      if (!this.verified.get(i)) {
        return true;
      }
    }
    return false;
  }

  public boolean isAssigned(BlockRequest request) {
    return this.assigned.contains(request);
  }

  public int getAssignedCount() {
    return this.assigned.size();
  }

  /**
   * Pick the next block to request among the given pieces, and mark it as
   * assigned.
   *
   * @return the block, or null if none of the given pieces has a block that
   * is neither received nor already assigned.
   */
  @CheckForNull
  public BlockRequest assignNext(@Nonnull BitSet available) {
    for (int piece = available.nextSetBit(0);
         piece >= 0 && piece < this.meta.getPieceCount();
         piece = available.nextSetBit(piece + 1)) {
      if (this.verified.get(piece)) {
        continue;
      }
      PieceProgress progress = this.inProgress.get(piece);
      int blocks = this.getBlockCount(piece);
      for (int block = 0; block < blocks; block++) {
        if (progress != null && progress.receivedBlocks.get(block)) {
          continue;
        }
        BlockRequest request = this.getBlock(piece, block);
        if (this.assigned.add(request)) {
          return request;
        }
      }
    }
    return null;
  }

  /**
   * Make an assigned block available for assignment again.
   */
  public void release(BlockRequest request) {
    this.assigned.remove(request);
  }

  /**
   * Record a received block.
   *
   * <p>
   * When the block completes its piece, the piece is checked against its
   * expected hash. A matching piece becomes {@link PieceState#VERIFIED} and
   * its bytes can be fetched once with {@link #takeVerifiedData(int)}; a
   * mismatching one goes back to {@link PieceState#MISSING} with no block
   * retained.
   * </p>
   */
  public Reception receive(int piece, int offset, @Nonnull ByteBuffer block) {
    if (!this.meta.isValidPieceIndex(piece) || this.verified.get(piece)) {
      return Reception.IGNORED;
    }
    if (offset < 0 || offset % this.blockSize != 0 || offset / this.blockSize >= this.getBlockCount(piece)) {
      return Reception.IGNORED;
    }
    int index = offset / this.blockSize;
    BlockRequest request = this.getBlock(piece, index);
    if (block.remaining() != request.getLength()) {
      return Reception.IGNORED;
    }

    PieceProgress progress = this.inProgress.get(piece);
    if (progress == null) {
      progress = new PieceProgress(this.meta.getPieceLength(piece));
      this.inProgress.put(piece, progress);
    }
    if (progress.receivedBlocks.get(index)) {
      return Reception.IGNORED;
    }
    this.assigned.remove(request);
    block.duplicate().get(progress.data, offset, request.getLength());
    progress.receivedBlocks.set(index);

    if (progress.receivedBlocks.cardinality() < this.getBlockCount(piece)) {
      return Reception.INCOMPLETE;
    }

    this.inProgress.remove(piece);
    if (!this.meta.matches(piece, progress.data)) {
      logger.debug("Piece #{} complete but doesn't match its hash, discarding it", piece);
      return Reception.INVALID;
    }
    this.verified.set(piece);
    this.verifiedData.put(piece, progress.data);
    return Reception.VALID;
  }

  /**
   * The bytes of a piece that was just verified. Only available once.
   */
  @CheckForNull
  public byte[] takeVerifiedData(int piece) {
    return this.verifiedData.remove(piece);
  }

  /**
   * Forget everything about a piece, verified or not. Used when a verified
   * piece couldn't be persisted.
   */
  public void reset(int piece) {
    this.verified.clear(piece);
    this.inProgress.remove(piece);
    this.verifiedData.remove(piece);
  }

  @Override
  public String toString() {
    return "PieceTable{" + this.verified.cardinality() + "/" + this.meta.getPieceCount() +
            " verified, " + this.inProgress.size() + " in progress, " +
            this.assigned.size() + " assigned}";
  }
}
