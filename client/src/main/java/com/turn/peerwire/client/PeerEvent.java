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

import com.turn.peerwire.common.PeerId;
import com.turn.peerwire.protocol.PeerMessage;

import javax.annotation.Nonnull;
import java.net.SocketAddress;

/**
 * What a connection actor reports to the torrent actor. Every event is
 * tagged with the connection it comes from.
 *
 * <p>
 * A connection reports at most one {@link HandshakeCompleted}, first, then
 * its messages in wire order, and exactly one {@link Disconnected}, last.
 * </p>
 */
public abstract class PeerEvent implements TorrentActor.Input {

  private final ConnectionId connectionId;

  private PeerEvent(ConnectionId connectionId) {
    this.connectionId = connectionId;
  }

  public ConnectionId getConnectionId() {
    return this.connectionId;
  }

  public static final class HandshakeCompleted extends PeerEvent {

    private final PeerId peerId;
    private final SocketAddress remoteAddress;

    public HandshakeCompleted(@Nonnull ConnectionId connectionId, @Nonnull PeerId peerId,
                              SocketAddress remoteAddress) {
      super(connectionId);
      this.peerId = peerId;
      this.remoteAddress = remoteAddress;
    }

    public PeerId getPeerId() {
      return this.peerId;
    }

    public SocketAddress getRemoteAddress() {
      return this.remoteAddress;
    }

    @Override
    public String toString() {
      return getConnectionId() + ": handshake with " + this.peerId + " at " + this.remoteAddress;
    }
  }

  public static final class MessageReceived extends PeerEvent {

    private final PeerMessage message;

    public MessageReceived(@Nonnull ConnectionId connectionId, @Nonnull PeerMessage message) {
      super(connectionId);
      this.message = message;
    }

    public PeerMessage getMessage() {
      return this.message;
    }

    @Override
    public String toString() {
      return getConnectionId() + ": " + this.message;
    }
  }

  /**
   * Always followed by the {@link Disconnected} event of the same
   * connection.
   */
  public static final class ProtocolViolation extends PeerEvent {

    private final String reason;

    public ProtocolViolation(@Nonnull ConnectionId connectionId, @Nonnull String reason) {
      super(connectionId);
      this.reason = reason;
    }

    public String getReason() {
      return this.reason;
    }

    @Override
    public String toString() {
      return getConnectionId() + ": protocol violation, " + this.reason;
    }
  }

  public static final class Disconnected extends PeerEvent {

    private final String reason;

    public Disconnected(@Nonnull ConnectionId connectionId, @Nonnull String reason) {
      super(connectionId);
      this.reason = reason;
    }

    public String getReason() {
      return this.reason;
    }

    @Override
    public String toString() {
      return getConnectionId() + ": disconnected, " + this.reason;
    }
  }
}
