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

import com.turn.peerwire.common.PeerId;
import com.turn.peerwire.protocol.PeerMessage;

import javax.annotation.Nonnull;

/**
 * What a {@link ProtocolEngine} made of the bytes it was given.
 *
 * <p>
 * The set of events is closed: {@link HandshakeCompleted},
 * {@link MessageReceived} and {@link ProtocolViolation}.
 * </p>
 */
public abstract class ProtocolEvent {

  private ProtocolEvent() {
  }

  /**
   * The remote handshake was accepted. Always the first event of an
   * engine, and emitted at most once.
   */
  public static final class HandshakeCompleted extends ProtocolEvent {

    private final PeerId peerId;

    public HandshakeCompleted(@Nonnull PeerId peerId) {
      this.peerId = peerId;
    }

    public PeerId getPeerId() {
      return this.peerId;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof HandshakeCompleted && this.peerId.equals(((HandshakeCompleted) o).peerId);
    }

    @Override
    public int hashCode() {
      return this.peerId.hashCode();
    }

    @Override
    public String toString() {
      return "HandshakeCompleted(" + this.peerId + ")";
    }
  }

  public static final class MessageReceived extends ProtocolEvent {

    private final PeerMessage message;

    public MessageReceived(@Nonnull PeerMessage message) {
      this.message = message;
    }

    public PeerMessage getMessage() {
      return this.message;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof MessageReceived && this.message.equals(((MessageReceived) o).message);
    }

    @Override
    public int hashCode() {
      return this.message.hashCode();
    }

    @Override
    public String toString() {
      return "MessageReceived(" + this.message + ")";
    }
  }

  /**
   * The remote peer broke the protocol. Always the last event of an
   * engine: it is {@link EngineState#CLOSED} from then on.
   */
  public static final class ProtocolViolation extends ProtocolEvent {

    private final String reason;

    public ProtocolViolation(@Nonnull String reason) {
      this.reason = reason;
    }

    public String getReason() {
      return this.reason;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof ProtocolViolation && this.reason.equals(((ProtocolViolation) o).reason);
    }

    @Override
    public int hashCode() {
      return this.reason.hashCode();
    }

    @Override
    public String toString() {
      return "ProtocolViolation(" + this.reason + ")";
    }
  }
}
