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

import com.turn.peerwire.client.network.TransportStream;

import java.net.InetSocketAddress;

public interface PeerConnectionFactory {

  /**
   * A connection over a stream accepted from a remote peer, which is
   * expected to send its handshake first.
   */
  PeerConnection accepted(ConnectionId id, TransportStream stream, PeerEventSink sink);

  /**
   * A connection to be dialed once started. Dial failures are reported as
   * {@link PeerEvent.Disconnected}.
   */
  PeerConnection dial(ConnectionId id, InetSocketAddress address, PeerEventSink sink);

}
