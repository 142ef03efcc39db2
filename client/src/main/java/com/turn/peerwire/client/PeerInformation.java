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

import java.net.SocketAddress;

public interface PeerInformation {

  /**
   * @return the connection this peer is reached through
   */
  ConnectionId getConnectionId();

  /**
   * @return id of current peer which the peers sent in the handshake
   */
  PeerId getPeerId();

  /**
   * @return address of remote peer
   */
  SocketAddress getRemoteAddress();

}
