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

import com.turn.peerwire.client.network.Transport;
import com.turn.peerwire.client.network.TransportStream;
import com.turn.peerwire.common.PeerId;
import com.turn.peerwire.common.TorrentMeta;
import com.turn.peerwire.protocol.engine.ProtocolEngine;
import com.turn.peerwire.protocol.engine.Role;

import java.net.InetSocketAddress;

/**
 * Creates a {@link ConnectionActor} with a fresh {@link ProtocolEngine} per
 * connection.
 */
public class ConnectionActorFactory implements PeerConnectionFactory {

  private final TorrentMeta meta;
  private final PeerId localPeerId;
  private final Transport transport;
  private final int readBufferSize;

  public ConnectionActorFactory(TorrentMeta meta, PeerId localPeerId, Transport transport, int readBufferSize) {
    this.meta = meta;
    this.localPeerId = localPeerId;
    this.transport = transport;
    this.readBufferSize = readBufferSize;
  }

  @Override
  public PeerConnection accepted(ConnectionId id, TransportStream stream, PeerEventSink sink) {
    ProtocolEngine engine = new ProtocolEngine(this.meta, this.localPeerId, Role.RESPONDER);
    return ConnectionActor.accepted(id, stream, engine, sink, this.readBufferSize);
  }

  @Override
  public PeerConnection dial(ConnectionId id, InetSocketAddress address, PeerEventSink sink) {
    ProtocolEngine engine = new ProtocolEngine(this.meta, this.localPeerId, Role.INITIATOR);
    return ConnectionActor.dialing(id, this.transport, address, engine, sink, this.readBufferSize);
  }
}
