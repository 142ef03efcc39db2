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
import com.turn.peerwire.common.TorrentMeta;

import javax.annotation.Nonnull;
import java.nio.ByteBuffer;
import java.util.BitSet;

/**
 * BitTorrent peer protocol messages representations.
 *
 * <p>
 * This class and its <em>*Message</em> subclasses provide POJO
 * representations of the peer protocol messages. Each message keeps the
 * exact frame it was crafted as or decoded from, length field included,
 * and two messages are equal when their frames are.
 * </p>
 *
 * <p>
 * Decoding only checks the framing and the payload size each type requires.
 * Checking the content against a given torrent (piece index, block range)
 * is the job of {@link #validate(TorrentMeta)}.
 * </p>
 *
 * @author mpetazzoni
 * @see <a href="http://wiki.theory.org/BitTorrentSpecification#Peer_wire_protocol_.28TCP.29">BitTorrent peer wire protocol</a>
 */
public abstract class PeerMessage {

  /** The size, in bytes, of the length field in a message (one 32-bit
   * integer). */
  public static final int MESSAGE_LENGTH_FIELD_SIZE = 4;

  /**
   * Message type.
   *
   * <p>
   * Note that the keep-alive messages don't actually have an type ID defined
   * in the protocol as they are of length 0.
   * </p>
   */
  public enum Type {
    KEEP_ALIVE(-1),
    CHOKE(0),
    UNCHOKE(1),
    INTERESTED(2),
    NOT_INTERESTED(3),
    HAVE(4),
    BITFIELD(5),
    REQUEST(6),
    PIECE(7),
    CANCEL(8);

    private final byte id;

    Type(int id) {
      this.id = (byte) id;
    }

    public byte getTypeByte() {
      return this.id;
    }

    /**
     * @return the type of the given (unsigned) tag, or null if unknown.
     */
    public static Type get(int tag) {
      for (Type t : Type.values()) {
        if (t != KEEP_ALIVE && t.id == tag) {
          return t;
        }
      }
      return null;
    }
  }

  private final Type type;
  private final ByteBuffer data;

  private PeerMessage(Type type, ByteBuffer data) {
    this.type = type;
    this.data = data;
    this.data.rewind();
  }

  public Type getType() {
    return this.type;
  }

  /**
   * Returns a read-only view of the whole frame, length field included,
   * positioned at its start.
   */
  public ByteBuffer getData() {
    return this.data.asReadOnlyBuffer();
  }

  /**
   * Validate that this message makes sense for the torrent it's related to.
   *
   * <p>
   * This method is meant to be overloaded by distinct message types, where
   * it makes sense. Otherwise, it defaults to true.
   * </p>
   *
   * @param meta The torrent this message is about.
   * @throws MalformedPayloadException If it doesn't.
   */
  public PeerMessage validate(@Nonnull TorrentMeta meta) throws MalformedPayloadException {
    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return this.data.equals(((PeerMessage) o).data);
  }

  @Override
  public int hashCode() {
    return this.data.hashCode();
  }

  @Override
  public String toString() {
    return this.getType().name();
  }

  /**
   * Decode the frame found at the current position of the buffer.
   *
   * <p>
   * The buffer itself is never modified: its position stays where it was
   * whatever the outcome, and callers advance it by
   * {@link DecodeResult#getConsumed()} once they are done with the message.
   * A frame that isn't fully available yields
   * {@link DecodeResult#needMoreBytes()}.
   * </p>
   *
   * @throws InvalidMessageTypeException If the type tag is unknown.
   * @throws MalformedPayloadException If the announced frame size is out of
   * bounds or the payload size doesn't fit the message type.
   */
  @Nonnull
  public static DecodeResult decode(@Nonnull ByteBuffer buffer) throws ProtocolException {
    if (buffer.remaining() < MESSAGE_LENGTH_FIELD_SIZE) {
      return DecodeResult.needMoreBytes();
    }

    int start = buffer.position();
    int length = buffer.getInt(start);
    if (length < 0 || length > Constants.MAX_MESSAGE_SIZE) {
      throw new MalformedPayloadException("Announced frame size " + (length & 0xFFFFFFFFL) +
              " exceeds the " + Constants.MAX_MESSAGE_SIZE + " bytes limit");
    }
    if (buffer.remaining() < MESSAGE_LENGTH_FIELD_SIZE + length) {
      return DecodeResult.needMoreBytes();
    }

    int consumed = MESSAGE_LENGTH_FIELD_SIZE + length;
    if (length == 0) {
      return DecodeResult.of(KeepAliveMessage.craft(), consumed);
    }

    int tag = buffer.get(start + MESSAGE_LENGTH_FIELD_SIZE) & 0xFF;
    Type type = Type.get(tag);
    if (type == null) {
      throw new InvalidMessageTypeException(tag);
    }

    ByteBuffer frame = buffer.duplicate();
    frame.limit(start + consumed);
    frame.position(start);
    ByteBuffer copy = ByteBuffer.allocate(consumed);
    copy.put(frame);
    copy.position(MESSAGE_LENGTH_FIELD_SIZE + 1);
    ByteBuffer payload = copy.slice();

    return DecodeResult.of(parse(type, copy, payload), consumed);
  }

  private static PeerMessage parse(Type type, ByteBuffer frame, ByteBuffer payload)
          throws MalformedPayloadException {
    switch (type) {
      case CHOKE:
        expectPayloadSize(type, payload, 0);
        return new ChokeMessage(frame);
      case UNCHOKE:
        expectPayloadSize(type, payload, 0);
        return new UnchokeMessage(frame);
      case INTERESTED:
        expectPayloadSize(type, payload, 0);
        return new InterestedMessage(frame);
      case NOT_INTERESTED:
        expectPayloadSize(type, payload, 0);
        return new NotInterestedMessage(frame);
      case HAVE:
        return HaveMessage.parse(frame, payload);
      case BITFIELD:
        return BitfieldMessage.parse(frame, payload);
      case REQUEST:
        return RequestMessage.parse(frame, payload);
      case PIECE:
        return PieceMessage.parse(frame, payload);
      case CANCEL:
        return CancelMessage.parse(frame, payload);
      default:
        throw new IllegalStateException("Message type should have " +
                "been properly defined by now.");
    }
  }

  private static void expectPayloadSize(Type type, ByteBuffer payload, int size)
          throws MalformedPayloadException {
    if (payload.remaining() != size) {
      throw new MalformedPayloadException(type + " payload must be " + size +
              " bytes, got " + payload.remaining());
    }
  }

  /**
   * Allocates a frame for the given type and payload size, positioned right
   * after the type tag.
   */
  private static ByteBuffer frame(Type type, int payloadSize) {
    ByteBuffer buffer = ByteBuffer.allocate(MESSAGE_LENGTH_FIELD_SIZE + 1 + payloadSize);
    buffer.putInt(1 + payloadSize);
    buffer.put(type.getTypeByte());
    return buffer;
  }

  private static void checkBlockRange(PeerMessage message, TorrentMeta meta, int piece, int offset, long length)
          throws MalformedPayloadException {
    if (!meta.isValidPieceIndex(piece)) {
      throw new MalformedPayloadException(message + ": piece index out of range (" +
              meta.getPieceCount() + " pieces)");
    }
    if (offset < 0 || offset + length > meta.getPieceLength(piece)) {
      throw new MalformedPayloadException(message + ": block outside of the " +
              meta.getPieceLength(piece) + " bytes of the piece");
    }
  }

  /**
   * Keep alive message.
   *
   * <code>&lt;len=0000&gt;</code>
   */
  public static class KeepAliveMessage extends PeerMessage {

    private KeepAliveMessage(ByteBuffer buffer) {
      super(Type.KEEP_ALIVE, buffer);
    }

    public static KeepAliveMessage craft() {
      ByteBuffer buffer = ByteBuffer.allocate(MESSAGE_LENGTH_FIELD_SIZE);
      buffer.putInt(0);
      return new KeepAliveMessage(buffer);
    }
  }

  /**
   * Choke message.
   *
   * <code>&lt;len=0001&gt;&lt;id=0&gt;</code>
   */
  public static class ChokeMessage extends PeerMessage {

    private ChokeMessage(ByteBuffer buffer) {
      super(Type.CHOKE, buffer);
    }

    public static ChokeMessage craft() {
      return new ChokeMessage(frame(Type.CHOKE, 0));
    }
  }

  /**
   * Unchoke message.
   *
   * <code>&lt;len=0001&gt;&lt;id=1&gt;</code>
   */
  public static class UnchokeMessage extends PeerMessage {

    private UnchokeMessage(ByteBuffer buffer) {
      super(Type.UNCHOKE, buffer);
    }

    public static UnchokeMessage craft() {
      return new UnchokeMessage(frame(Type.UNCHOKE, 0));
    }
  }

  /**
   * Interested message.
   *
   * <code>&lt;len=0001&gt;&lt;id=2&gt;</code>
   */
  public static class InterestedMessage extends PeerMessage {

    private InterestedMessage(ByteBuffer buffer) {
      super(Type.INTERESTED, buffer);
    }

    public static InterestedMessage craft() {
      return new InterestedMessage(frame(Type.INTERESTED, 0));
    }
  }

  /**
   * Not interested message.
   *
   * <code>&lt;len=0001&gt;&lt;id=3&gt;</code>
   */
  public static class NotInterestedMessage extends PeerMessage {

    private NotInterestedMessage(ByteBuffer buffer) {
      super(Type.NOT_INTERESTED, buffer);
    }

    public static NotInterestedMessage craft() {
      return new NotInterestedMessage(frame(Type.NOT_INTERESTED, 0));
    }
  }

  /**
   * Have message.
   *
   * <code>&lt;len=0005&gt;&lt;id=4&gt;&lt;piece index=xxxx&gt;</code>
   */
  public static class HaveMessage extends PeerMessage {

    private static final int PAYLOAD_SIZE = 4;

    private final int piece;

    private HaveMessage(ByteBuffer buffer, int piece) {
      super(Type.HAVE, buffer);
      this.piece = piece;
    }

    public int getPieceIndex() {
      return this.piece;
    }

    @Override
    public HaveMessage validate(@Nonnull TorrentMeta meta) throws MalformedPayloadException {
      if (!meta.isValidPieceIndex(this.piece)) {
        throw new MalformedPayloadException(this + ": piece index out of range (" +
                meta.getPieceCount() + " pieces)");
      }
      return this;
    }

    private static HaveMessage parse(ByteBuffer frame, ByteBuffer payload) throws MalformedPayloadException {
      expectPayloadSize(Type.HAVE, payload, PAYLOAD_SIZE);
      return new HaveMessage(frame, payload.getInt());
    }

    public static HaveMessage craft(int piece) {
      ByteBuffer buffer = frame(Type.HAVE, PAYLOAD_SIZE);
      buffer.putInt(piece);
      return new HaveMessage(buffer, piece);
    }

    @Override
    public String toString() {
      return super.toString() + " #" + this.getPieceIndex();
    }
  }

  /**
   * Bitfield message.
   *
   * <code>&lt;len=0001+X&gt;&lt;id=5&gt;&lt;bitfield&gt;</code>
   *
   * <p>
   * One bit per piece, high bit of the first byte for piece 0.
   * </p>
   */
  public static class BitfieldMessage extends PeerMessage {

    private final BitSet bitfield;
    private final int byteLength;

    private BitfieldMessage(ByteBuffer buffer, BitSet bitfield, int byteLength) {
      super(Type.BITFIELD, buffer);
      this.bitfield = bitfield;
      this.byteLength = byteLength;
    }

    public BitSet getBitfield() {
      return (BitSet) this.bitfield.clone();
    }

    /**
     * Checks the bitfield has exactly one bit per piece, rounded up to a
     * whole byte, and that the spare bits of the last byte are cleared.
     */
    @Override
    public BitfieldMessage validate(@Nonnull TorrentMeta meta) throws MalformedPayloadException {
      int expected = (meta.getPieceCount() + 7) / 8;
      if (this.byteLength != expected) {
        throw new MalformedPayloadException("Bitfield of " + this.byteLength +
                " bytes for " + meta.getPieceCount() + " pieces, expected " + expected);
      }
      if (this.bitfield.length() > meta.getPieceCount()) {
        throw new MalformedPayloadException("Bitfield has spare bits set beyond piece #" +
                (meta.getPieceCount() - 1));
      }
      return this;
    }

    private static BitfieldMessage parse(ByteBuffer frame, ByteBuffer payload) {
      int size = payload.remaining();
      BitSet bitfield = new BitSet(size * 8);
      for (int i = 0; i < size * 8; i++) {
        if ((payload.get(i / 8) & (1 << (7 - (i % 8)))) != 0) {
          bitfield.set(i);
        }
      }
      return new BitfieldMessage(frame, bitfield, size);
    }

    public static BitfieldMessage craft(BitSet availablePieces, int pieceCount) {
      BitSet bitfield = new BitSet();
      int bitfieldBufferSize = (pieceCount + 8 - 1) / 8;
      byte[] bitfieldBuffer = new byte[bitfieldBufferSize];

      for (int i = availablePieces.nextSetBit(0);
           0 <= i && i < pieceCount;
           i = availablePieces.nextSetBit(i + 1)) {
        bitfieldBuffer[i / 8] |= 1 << (7 - (i % 8));
        bitfield.set(i);
      }

      ByteBuffer buffer = frame(Type.BITFIELD, bitfieldBufferSize);
      buffer.put(bitfieldBuffer);
      return new BitfieldMessage(buffer, bitfield, bitfieldBufferSize);
    }

    @Override
    public String toString() {
      return super.toString() + " " + this.bitfield.cardinality();
    }
  }

  /**
   * Request message.
   *
   * <code>&lt;len=00013&gt;&lt;id=6&gt;&lt;piece index&gt;&lt;block offset&gt;&lt;block length&gt;</code>
   */
  public static class RequestMessage extends PeerMessage {

    private static final int PAYLOAD_SIZE = 12;

    private final int piece;
    private final int offset;
    private final int length;

    private RequestMessage(ByteBuffer buffer, int piece, int offset, int length) {
      super(Type.REQUEST, buffer);
      this.piece = piece;
      this.offset = offset;
      this.length = length;
    }

    public int getPiece() {
      return this.piece;
    }

    public int getOffset() {
      return this.offset;
    }

    public int getLength() {
      return this.length;
    }

    @Override
    public RequestMessage validate(@Nonnull TorrentMeta meta) throws MalformedPayloadException {
      if (this.length <= 0 || this.length > Constants.MAX_BLOCK_SIZE) {
        throw new MalformedPayloadException(this + ": request length must be within 1.." +
                Constants.MAX_BLOCK_SIZE);
      }
      checkBlockRange(this, meta, this.piece, this.offset, this.length);
      return this;
    }

    private static RequestMessage parse(ByteBuffer frame, ByteBuffer payload) throws MalformedPayloadException {
      expectPayloadSize(Type.REQUEST, payload, PAYLOAD_SIZE);
      int piece = payload.getInt();
      int offset = payload.getInt();
      int length = payload.getInt();
      return new RequestMessage(frame, piece, offset, length);
    }

    public static RequestMessage craft(int piece, int offset, int length) {
      ByteBuffer buffer = frame(Type.REQUEST, PAYLOAD_SIZE);
      buffer.putInt(piece);
      buffer.putInt(offset);
      buffer.putInt(length);
      return new RequestMessage(buffer, piece, offset, length);
    }

    @Override
    public String toString() {
      return super.toString() + " #" + this.getPiece() +
              " (" + this.getLength() + "@" + this.getOffset() + ")";
    }
  }

  /**
   * Piece message.
   *
   * <code>&lt;len=0009+X&gt;&lt;id=7&gt;&lt;piece index&gt;&lt;block offset&gt;&lt;block data&gt;</code>
   */
  public static class PieceMessage extends PeerMessage {

    private static final int HEADER_SIZE = 8;

    private final int piece;
    private final int offset;
    private final ByteBuffer block;

    private PieceMessage(ByteBuffer buffer, int piece, int offset, ByteBuffer block) {
      super(Type.PIECE, buffer);
      this.piece = piece;
      this.offset = offset;
      this.block = block;
    }

    public int getPiece() {
      return this.piece;
    }

    public int getOffset() {
      return this.offset;
    }

    public int getLength() {
      return this.block.remaining();
    }

    /**
     * Returns a read-only view of the block bytes.
     */
    public ByteBuffer getBlock() {
      return this.block.asReadOnlyBuffer();
    }

    @Override
    public PieceMessage validate(@Nonnull TorrentMeta meta) throws MalformedPayloadException {
      checkBlockRange(this, meta, this.piece, this.offset, this.getLength());
      return this;
    }

    private static PieceMessage parse(ByteBuffer frame, ByteBuffer payload) throws MalformedPayloadException {
      if (payload.remaining() < HEADER_SIZE) {
        throw new MalformedPayloadException("PIECE payload must be at least " + HEADER_SIZE +
                " bytes, got " + payload.remaining());
      }
      int piece = payload.getInt();
      int offset = payload.getInt();
      return new PieceMessage(frame, piece, offset, payload.slice());
    }

    public static PieceMessage craft(int piece, int offset, ByteBuffer block) {
      ByteBuffer buffer = frame(Type.PIECE, HEADER_SIZE + block.remaining());
      buffer.putInt(piece);
      buffer.putInt(offset);
      ByteBuffer data = buffer.slice();
      buffer.put(block.duplicate());
      return new PieceMessage(buffer, piece, offset, data);
    }

    public static PieceMessage craft(int piece, int offset, byte[] block) {
      return craft(piece, offset, ByteBuffer.wrap(block));
    }

    @Override
    public String toString() {
      return super.toString() + " #" + this.getPiece() +
              " (" + this.getLength() + "@" + this.getOffset() + ")";
    }
  }

  /**
   * Cancel message.
   *
   * <code>&lt;len=00013&gt;&lt;id=8&gt;&lt;piece index&gt;&lt;block offset&gt;&lt;block length&gt;</code>
   */
  public static class CancelMessage extends PeerMessage {

    private static final int PAYLOAD_SIZE = 12;

    private final int piece;
    private final int offset;
    private final int length;

    private CancelMessage(ByteBuffer buffer, int piece, int offset, int length) {
      super(Type.CANCEL, buffer);
      this.piece = piece;
      this.offset = offset;
      this.length = length;
    }

    public int getPiece() {
      return this.piece;
    }

    public int getOffset() {
      return this.offset;
    }

    public int getLength() {
      return this.length;
    }

    @Override
    public CancelMessage validate(@Nonnull TorrentMeta meta) throws MalformedPayloadException {
      if (this.length <= 0 || this.length > Constants.MAX_BLOCK_SIZE) {
        throw new MalformedPayloadException(this + ": cancel length must be within 1.." +
                Constants.MAX_BLOCK_SIZE);
      }
      checkBlockRange(this, meta, this.piece, this.offset, this.length);
      return this;
    }

    private static CancelMessage parse(ByteBuffer frame, ByteBuffer payload) throws MalformedPayloadException {
      expectPayloadSize(Type.CANCEL, payload, PAYLOAD_SIZE);
      int piece = payload.getInt();
      int offset = payload.getInt();
      int length = payload.getInt();
      return new CancelMessage(frame, piece, offset, length);
    }

    public static CancelMessage craft(int piece, int offset, int length) {
      ByteBuffer buffer = frame(Type.CANCEL, PAYLOAD_SIZE);
      buffer.putInt(piece);
      buffer.putInt(offset);
      buffer.putInt(length);
      return new CancelMessage(buffer, piece, offset, length);
    }

    @Override
    public String toString() {
      return super.toString() + " #" + this.getPiece() +
              " (" + this.getLength() + "@" + this.getOffset() + ")";
    }
  }
}
