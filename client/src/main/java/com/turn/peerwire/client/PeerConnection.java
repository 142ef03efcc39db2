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

/**
 * The torrent actor's handle on one connection.
 */
public interface PeerConnection {

  ConnectionId getId();

  /**
   * Start pumping bytes. Events are reported to the sink given at
   * creation.
   */
  void start();

  /**
   * Queue a command. Never blocks; commands posted after the connection
   * closed are dropped.
   */
  void post(PeerCommand command);

}
