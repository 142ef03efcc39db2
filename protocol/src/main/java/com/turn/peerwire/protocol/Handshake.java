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
package com.turn.peerwire.protocol;

import com.turn.peerwire.Constants;
import com.turn.peerwire.common.InfoHash;
import com.turn.peerwire.common.PeerId;

import javax.annotation.Nonnull;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Peer handshake message.
 *
 * <p>
 * The handshake is the first thing both sides of a connection send:
 * <code>[19]["BitTorrent protocol"][8 reserved bytes][info hash][peer id]</code>,
 * 68 bytes in total. Reserved bytes are written as zeros and ignored when
 * read.
 * </p>
 *
 * @author mpetazzoni
 */
public class Handshake {

  public static final String BITTORRENT_PROTOCOL_IDENTIFIER = "BitTorrent protocol";
  public static final int RESERVED_SIZE = 8;

  /** Length byte and protocol identifier. */
  public static final int PREFIX_SIZE = 1 + BITTORRENT_PROTOCOL_IDENTIFIER.length();
  public static final int INFO_HASH_OFFSET = PREFIX_SIZE + RESERVED_SIZE;
  public static final int PEER_ID_OFFSET = INFO_HASH_OFFSET + Constants.PIECE_HASH_SIZE;
  public static final int LENGTH = PEER_ID_OFFSET + Constants.PIECE_HASH_SIZE;

  private static final byte[] PREFIX = prefix();

  private final ByteBuffer data;
  private final InfoHash infoHash;
  private final PeerId peerId;

  private Handshake(ByteBuffer data, InfoHash infoHash, PeerId peerId) {
    this.data = data;
    this.infoHash = infoHash;
    this.peerId = peerId;
  }

  private static byte[] prefix() {
    byte[] identifier = BITTORRENT_PROTOCOL_IDENTIFIER.getBytes(StandardCharsets.US_ASCII);
    byte[] result = new byte[PREFIX_SIZE];
    result[0] = (byte) identifier.length;
    System.arraycopy(identifier, 0, result, 1, identifier.length);
    return result;
  }

  /**
   * Returns a read-only view of the 68 handshake bytes.
   */
  public ByteBuffer getData() {
    return this.data.asReadOnlyBuffer();
  }

  public InfoHash getInfoHash() {
    return this.infoHash;
  }

  public PeerId getPeerId() {
    return this.peerId;
  }

  @Nonnull
  public static Handshake craft(@Nonnull InfoHash infoHash, @Nonnull PeerId peerId) {
    ByteBuffer buffer = ByteBuffer.allocate(LENGTH);
    buffer.put(PREFIX);
    buffer.put(new byte[RESERVED_SIZE]);
    buffer.put(infoHash.getBytes());
    buffer.put(peerId.getBytes());
    buffer.rewind();
    return new Handshake(buffer, infoHash, peerId);
  }

  /**
   * Parse the handshake found in the remaining bytes of the buffer, which
   * must be exactly {@link #LENGTH} bytes long. The buffer position is
   * moved past the handshake.
   *
   * @throws MalformedHandshakeException If the size or the protocol
   * identifier are wrong.
   */
  @Nonnull
  public static Handshake parse(@Nonnull ByteBuffer buffer) throws MalformedHandshakeException {
    if (buffer.remaining() != LENGTH) {
      throw new MalformedHandshakeException("Handshake must be " + LENGTH +
              " bytes long, got " + buffer.remaining(), 0);
    }
    int mismatch = firstPrefixMismatch(buffer);
    if (mismatch >= 0) {
      throw new MalformedHandshakeException("Unexpected protocol identifier", mismatch);
    }

    byte[] raw = new byte[LENGTH];
    buffer.get(raw);
    ByteBuffer data = ByteBuffer.wrap(raw);

    byte[] infoHash = new byte[Constants.PIECE_HASH_SIZE];
    System.arraycopy(raw, INFO_HASH_OFFSET, infoHash, 0, infoHash.length);
    byte[] peerId = new byte[Constants.PIECE_HASH_SIZE];
    System.arraycopy(raw, PEER_ID_OFFSET, peerId, 0, peerId.length);
    return new Handshake(data, InfoHash.of(infoHash), PeerId.of(peerId));
  }

  /**
   * Compare the available bytes (possibly fewer than a whole handshake)
   * with the fixed protocol prefix, without moving the buffer position.
   *
   * @return the offset of the first byte that differs, or -1 if all the
   * available prefix bytes are right.
   */
  public static int firstPrefixMismatch(@Nonnull ByteBuffer buffer) {
    int available = Math.min(PREFIX_SIZE, buffer.remaining());
    for (int i = 0; i < available; i++) {
      if (buffer.get(buffer.position() + i) != PREFIX[i]) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public String toString() {
    return "HANDSHAKE " + this.infoHash + " from " + this.peerId;
  }
}
