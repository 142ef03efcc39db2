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

import com.turn.peerwire.protocol.PeerMessage;

import javax.annotation.Nonnull;

/**
 * What the torrent actor asks a connection actor to do.
 */
public abstract class PeerCommand {

  PeerCommand() {
  }

  public static final class Send extends PeerCommand {

    private final PeerMessage message;

    public Send(@Nonnull PeerMessage message) {
      this.message = message;
    }

    public PeerMessage getMessage() {
      return this.message;
    }

    @Override
    public String toString() {
      return "Send(" + this.message + ")";
    }
  }

  /**
   * Close the connection right away, without flushing pending messages.
   */
  public static final class Close extends PeerCommand {

    private final String reason;

    public Close(@Nonnull String reason) {
      this.reason = reason;
    }

    public String getReason() {
      return this.reason;
    }

    @Override
    public String toString() {
      return "Close(" + this.reason + ")";
    }
  }
}
