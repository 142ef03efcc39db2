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
package com.turn.peerwire.common;

import com.google.common.base.Preconditions;
import com.turn.peerwire.Constants;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable description of a torrent's shared byte range.
 *
 * <p>
 * The shared data is seen as one contiguous byte array of
 * {@link #getTotalLength()} bytes, cut into pieces of
 * {@link #getPieceLength()} bytes (the last piece may be shorter). Each
 * piece is independently verified against its expected SHA-1 hash.
 * </p>
 *
 * @author mpetazzoni
 */
public final class TorrentMeta {

  private final InfoHash infoHash;
  private final int pieceLength;
  private final long totalLength;
  private final byte[][] pieceHashes;
  @CheckForNull
  private final String name;

  private TorrentMeta(InfoHash infoHash, int pieceLength, long totalLength,
                      byte[][] pieceHashes, @CheckForNull String name) {
    this.infoHash = infoHash;
    this.pieceLength = pieceLength;
    this.totalLength = totalLength;
    this.pieceHashes = pieceHashes;
    this.name = name;
  }

  /**
   * @throws IllegalArgumentException If the hash count doesn't cover the
   * total length exactly, or a hash isn't 20 bytes long.
   */
  @Nonnull
  public static TorrentMeta create(@Nonnull InfoHash infoHash,
                                   @Nonnegative int pieceLength,
                                   @Nonnegative long totalLength,
                                   @Nonnull List<byte[]> pieceHashes,
                                   @CheckForNull String name) {
    Preconditions.checkArgument(pieceLength > 0, "Piece length must be positive: %s", pieceLength);
    Preconditions.checkArgument(totalLength >= 0, "Total length must not be negative: %s", totalLength);
    int expectedCount = TorrentUtils.chunkCount(totalLength, pieceLength);
    Preconditions.checkArgument(pieceHashes.size() == expectedCount,
            "%s bytes in pieces of %s need %s hashes, got %s",
            totalLength, pieceLength, expectedCount, pieceHashes.size());

    byte[][] hashes = new byte[pieceHashes.size()][];
    for (int i = 0; i < hashes.length; i++) {
      byte[] hash = pieceHashes.get(i);
      Preconditions.checkArgument(hash.length == Constants.PIECE_HASH_SIZE,
              "Hash of piece %s is %s bytes long", i, hash.length);
      hashes[i] = hash.clone();
    }
    return new TorrentMeta(infoHash, pieceLength, totalLength, hashes, name);
  }

  @Nonnull
  public static TorrentMeta create(@Nonnull InfoHash infoHash, int pieceLength,
                                   long totalLength, @Nonnull List<byte[]> pieceHashes) {
    return create(infoHash, pieceLength, totalLength, pieceHashes, null);
  }

  /**
   * Build the metadata of some in-memory content, hashing every piece.
   */
  @Nonnull
  public static TorrentMeta fromContent(@Nonnull InfoHash infoHash, int pieceLength, @Nonnull byte[] content) {
    Preconditions.checkArgument(pieceLength > 0, "Piece length must be positive: %s", pieceLength);
    int count = TorrentUtils.chunkCount(content.length, pieceLength);
    byte[][] hashes = new byte[count][];
    for (int i = 0; i < count; i++) {
      int from = i * pieceLength;
      int to = Math.min(content.length, from + pieceLength);
      hashes[i] = TorrentUtils.calculateSha1Hash(Arrays.copyOfRange(content, from, to));
    }
    return new TorrentMeta(infoHash, pieceLength, content.length, hashes, null);
  }

  public InfoHash getInfoHash() {
    return this.infoHash;
  }

  /**
   * The nominal piece length; every piece but the last has this size.
   */
  public int getPieceLength() {
    return this.pieceLength;
  }

  /**
   * Returns the actual size, in bytes, of the given piece.
   *
   * @throws IndexOutOfBoundsException If the index is not a piece of this torrent.
   */
  public int getPieceLength(int index) {
    this.checkIndex(index);
    if (index < this.pieceHashes.length - 1) {
      return this.pieceLength;
    }
    return (int) (this.totalLength - (long) index * this.pieceLength);
  }

  public long getTotalLength() {
    return this.totalLength;
  }

  public int getPieceCount() {
    return this.pieceHashes.length;
  }

  public boolean isValidPieceIndex(int index) {
    return index >= 0 && index < this.pieceHashes.length;
  }

  public byte[] getPieceHash(int index) {
    this.checkIndex(index);
    return this.pieceHashes[index].clone();
  }

  /**
   * Tells whether the given bytes are exactly the expected content of a
   * piece.
   */
  public boolean matches(int index, @Nonnull byte[] data) {
    this.checkIndex(index);
    return data.length == this.getPieceLength(index) &&
            Arrays.equals(TorrentUtils.calculateSha1Hash(data), this.pieceHashes[index]);
  }

  /**
   * The suggested file name, when the metadata came from a torrent file.
   */
  @CheckForNull
  public String getName() {
    return this.name;
  }

  private void checkIndex(int index) {
    if (!this.isValidPieceIndex(index)) {
      throw new IndexOutOfBoundsException("Piece #" + index + " is out of range (" +
              this.pieceHashes.length + " pieces)");
    }
  }

  @Override
  public String toString() {
    return "TorrentMeta{" +
            "infoHash=" + this.infoHash +
            ", pieces=" + this.pieceHashes.length + "x" + this.pieceLength +
            ", length=" + this.totalLength +
            '}';
  }
}
