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
package com.turn.peerwire.protocol.engine;

import com.turn.peerwire.common.InfoHash;
import com.turn.peerwire.common.PeerId;
import com.turn.peerwire.common.TorrentLoggerFactory;
import com.turn.peerwire.common.TorrentMeta;
import com.turn.peerwire.protocol.DecodeResult;
import com.turn.peerwire.protocol.Handshake;
import com.turn.peerwire.protocol.PeerMessage;
import com.turn.peerwire.protocol.ProtocolException;
import org.slf4j.Logger;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Peer wire protocol state machine of one connection.
 *
 * <p>
 * The engine does no I/O of its own. Its owner feeds it the bytes read from
 * the connection with {@link #receive(ByteBuffer)} and gets back the
 * resulting {@link ProtocolEvent}s, submits outgoing messages with
 * {@link #send(PeerMessage)}, and writes whatever {@link #takeOutbound()}
 * returns to the connection. How the incoming bytes are split across calls
 * doesn't change the events produced.
 * </p>
 *
 * <p>
 * An engine starts {@link EngineState#AWAITING_HANDSHAKE}. When the remote
 * handshake carries the expected info hash (and, if one was given, the
 * expected peer id) it becomes {@link EngineState#ESTABLISHED}; any protocol
 * error makes it {@link EngineState#CLOSED} for good. Instances are not
 * thread safe.
 * </p>
 */
public class ProtocolEngine {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(ProtocolEngine.class);

  private static final int INITIAL_BUFFER_SIZE = 1024;

  private final TorrentMeta meta;
  private final PeerId localPeerId;
  private final Role role;
  @CheckForNull
  private final PeerId expectedPeerId;
  private final byte[] expectedInfoHash;

  private EngineState state;
  @CheckForNull
  private PeerId remotePeerId;

  /** Bytes received but not decoded yet, in write mode. */
  private ByteBuffer inbound;
  /** Bytes waiting to be written to the connection, in write mode. */
  private ByteBuffer outbound;

  public ProtocolEngine(@Nonnull TorrentMeta meta, @Nonnull PeerId localPeerId, @Nonnull Role role) {
    this(meta, localPeerId, role, null);
  }

  /**
   * @param expectedPeerId When set, the remote handshake must carry this
   * peer id.
   */
  public ProtocolEngine(@Nonnull TorrentMeta meta, @Nonnull PeerId localPeerId, @Nonnull Role role,
                        @CheckForNull PeerId expectedPeerId) {
    this.meta = meta;
    this.localPeerId = localPeerId;
    this.role = role;
    this.expectedPeerId = expectedPeerId;
    this.expectedInfoHash = meta.getInfoHash().getBytes();
    this.state = EngineState.AWAITING_HANDSHAKE;
    this.inbound = ByteBuffer.allocate(INITIAL_BUFFER_SIZE);
    this.outbound = ByteBuffer.allocate(INITIAL_BUFFER_SIZE);

    if (role == Role.INITIATOR) {
      this.queueHandshake();
    }
  }

  public EngineState getState() {
    return this.state;
  }

  public Role getRole() {
    return this.role;
  }

  public InfoHash getInfoHash() {
    return this.meta.getInfoHash();
  }

  /**
   * The remote peer id, once the handshake completed.
   */
  @CheckForNull
  public PeerId getRemotePeerId() {
    return this.remotePeerId;
  }

  /**
   * Feed bytes read from the connection. All the remaining bytes of the
   * buffer are consumed.
   *
   * @return the events, in wire order. Empty when more bytes are needed or
   * the engine is closed.
   */
  @Nonnull
  public List<ProtocolEvent> receive(@Nonnull ByteBuffer bytes) {
    if (this.state == EngineState.CLOSED) {
      bytes.position(bytes.limit());
      return Collections.emptyList();
    }

    this.inbound = ensureCapacity(this.inbound, bytes.remaining());
    this.inbound.put(bytes);
    this.inbound.flip();

    List<ProtocolEvent> events = new ArrayList<ProtocolEvent>();
    try {
      if (this.state == EngineState.AWAITING_HANDSHAKE) {
        this.receiveHandshake(events);
      }
      while (this.state == EngineState.ESTABLISHED && this.receiveMessage(events)) {
        // Keep decoding until a frame is incomplete.
      }
    } finally {
      if (this.state == EngineState.CLOSED) {
        this.inbound.clear();
      } else {
        this.inbound.compact();
      }
    }
    return events;
  }

  private void receiveHandshake(List<ProtocolEvent> events) {
    int mismatch = Handshake.firstPrefixMismatch(this.inbound);
    if (mismatch >= 0) {
      this.violation(events, "Malformed handshake: unexpected byte at offset " + mismatch);
      return;
    }
    if (!this.infoHashMatchesSoFar()) {
      this.violation(events, "Handshake for another torrent");
      return;
    }
    if (this.inbound.remaining() < Handshake.LENGTH) {
      return;
    }

    ByteBuffer frame = this.inbound.duplicate();
    frame.limit(frame.position() + Handshake.LENGTH);
    Handshake handshake;
    try {
      handshake = Handshake.parse(frame);
    } catch (ProtocolException pe) {
      this.violation(events, "Malformed handshake: " + pe.getMessage());
      return;
    }
    this.inbound.position(this.inbound.position() + Handshake.LENGTH);

    PeerId peerId = handshake.getPeerId();
    if (this.expectedPeerId != null && !this.expectedPeerId.equals(peerId)) {
      this.violation(events, "Unexpected peer id " + peerId + ", expected " + this.expectedPeerId);
      return;
    }

    this.remotePeerId = peerId;
    this.state = EngineState.ESTABLISHED;
    if (this.role == Role.RESPONDER) {
      this.queueHandshake();
    }
    logger.trace("Handshake with {} completed ({})", peerId, this.role);
    events.add(new ProtocolEvent.HandshakeCompleted(peerId));
  }

  /**
   * Compares the info hash bytes received so far, which may be none or
   * only a part of them, with the expected info hash.
   */
  private boolean infoHashMatchesSoFar() {
    int available = this.inbound.remaining();
    int end = Math.min(available, Handshake.PEER_ID_OFFSET);
    for (int i = Handshake.INFO_HASH_OFFSET; i < end; i++) {
      if (this.inbound.get(this.inbound.position() + i) !=
              this.expectedInfoHash[i - Handshake.INFO_HASH_OFFSET]) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return true if a message was decoded and more may follow.
   */
  private boolean receiveMessage(List<ProtocolEvent> events) {
    PeerMessage message;
    try {
      DecodeResult result = PeerMessage.decode(this.inbound);
      if (!result.isComplete()) {
        return false;
      }
      message = result.getMessage().validate(this.meta);
      this.inbound.position(this.inbound.position() + result.getConsumed());
    } catch (ProtocolException pe) {
      this.violation(events, pe.getMessage());
      return false;
    }
    events.add(new ProtocolEvent.MessageReceived(message));
    return true;
  }

  private void violation(List<ProtocolEvent> events, String reason) {
    logger.debug("Protocol violation from {}: {}",
            this.remotePeerId == null ? "unidentified peer" : this.remotePeerId, reason);
    this.state = EngineState.CLOSED;
    events.add(new ProtocolEvent.ProtocolViolation(reason));
  }

  /**
   * Queue a message for sending.
   *
   * @throws NotEstablishedException If the handshake isn't complete yet, or
   * the engine is closed.
   */
  public void send(@Nonnull PeerMessage message) {
    if (this.state != EngineState.ESTABLISHED) {
      throw new NotEstablishedException(this.state);
    }
    this.queue(message.getData());
  }

  private void queueHandshake() {
    this.queue(Handshake.craft(this.meta.getInfoHash(), this.localPeerId).getData());
  }

  private void queue(ByteBuffer data) {
    this.outbound = ensureCapacity(this.outbound, data.remaining());
    this.outbound.put(data);
  }

  public boolean hasOutbound() {
    return this.outbound.position() > 0;
  }

  /**
   * Hands over the bytes waiting to be written, in a buffer ready to be
   * read. The engine forgets about them.
   */
  @Nonnull
  public ByteBuffer takeOutbound() {
    this.outbound.flip();
    ByteBuffer result = ByteBuffer.allocate(this.outbound.remaining());
    result.put(this.outbound);
    result.flip();
    this.outbound.clear();
    return result;
  }

  /**
   * Close the engine locally. Bytes already queued can still be taken, but
   * nothing is received or sent anymore.
   */
  public void close() {
    this.state = EngineState.CLOSED;
    this.inbound.clear();
  }

  private static ByteBuffer ensureCapacity(ByteBuffer buffer, int additional) {
    if (buffer.remaining() >= additional) {
      return buffer;
    }
    int needed = buffer.position() + additional;
    ByteBuffer grown = ByteBuffer.allocate(Math.max(needed, buffer.capacity() * 2));
    buffer.flip();
    grown.put(buffer);
    return grown;
  }

  @Override
  public String toString() {
    return "ProtocolEngine{" + this.role + ", " + this.state +
            (this.remotePeerId == null ? "" : ", peer=" + this.remotePeerId) + '}';
  }
}
