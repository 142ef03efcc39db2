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

import javax.annotation.Nonnull;
import java.net.InetSocketAddress;

/**
 * Requests to the torrent actor that don't come from a connection.
 */
public abstract class TorrentCommand implements TorrentActor.Input {

  private TorrentCommand() {
  }

  public static final class AddConnection extends TorrentCommand {

    private final TransportStream stream;

    public AddConnection(@Nonnull TransportStream stream) {
      this.stream = stream;
    }

    public TransportStream getStream() {
      return this.stream;
    }

    @Override
    public String toString() {
      return "AddConnection(" + this.stream.getRemoteAddress() + ")";
    }
  }

  public static final class Dial extends TorrentCommand {

    private final InetSocketAddress address;
    private final int attempt;

    public Dial(@Nonnull InetSocketAddress address) {
      this(address, 0);
    }

    /**
     * @param attempt 0 for a first dial, then the number of the redial.
     */
    public Dial(@Nonnull InetSocketAddress address, int attempt) {
      this.address = address;
      this.attempt = attempt;
    }

    public InetSocketAddress getAddress() {
      return this.address;
    }

    public int getAttempt() {
      return this.attempt;
    }

    @Override
    public String toString() {
      return "Dial(" + this.address + (this.attempt > 0 ? ", redial #" + this.attempt : "") + ")";
    }
  }

  /**
   * Periodic housekeeping: keep-alives and scheduling.
   */
  public static final class Tick extends TorrentCommand {

    @Override
    public String toString() {
      return "Tick";
    }
  }

  /**
   * Close every connection and stop the actor.
   */
  public static final class Shutdown extends TorrentCommand {

    @Override
    public String toString() {
      return "Shutdown";
    }
  }
}
