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
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What the torrent actor knows about one established peer.
 *
 * <p>
 * Both sides start choked and not interested. Not thread safe: owned by
 * the torrent actor.
 * </p>
 */
public class PeerState implements PeerInformation {

  private final ConnectionId connectionId;
  private final PeerId peerId;
  private final SocketAddress remoteAddress;
  private final PeerConnection connection;

  private final BitSet bitfield = new BitSet();
  private final Set<BlockRequest> inFlight = new LinkedHashSet<BlockRequest>();

  private boolean amChoking = true;
  private boolean amInterested = false;
  private boolean peerChoking = true;
  private boolean peerInterested = false;
  private long lastSentMillis;

  PeerState(ConnectionId connectionId, PeerId peerId, SocketAddress remoteAddress,
            PeerConnection connection, long now) {
    this.connectionId = connectionId;
    this.peerId = peerId;
    this.remoteAddress = remoteAddress;
    this.connection = connection;
    this.lastSentMillis = now;
  }

  @Override
  public ConnectionId getConnectionId() {
    return this.connectionId;
  }

  @Override
  public PeerId getPeerId() {
    return this.peerId;
  }

  @Override
  public SocketAddress getRemoteAddress() {
    return this.remoteAddress;
  }

  PeerConnection getConnection() {
    return this.connection;
  }

  /**
   * Pieces the peer claims to have. Live view.
   */
  public BitSet getBitfield() {
    return this.bitfield;
  }

  /**
   * Requests sent to this peer and not answered yet.
   */
  public Set<BlockRequest> getInFlight() {
    return Collections.unmodifiableSet(this.inFlight);
  }

  boolean addInFlight(BlockRequest request) {
    return this.inFlight.add(request);
  }

  boolean removeInFlight(BlockRequest request) {
    return this.inFlight.remove(request);
  }

  void clearInFlight() {
    this.inFlight.clear();
  }

  public boolean isAmChoking() {
    return this.amChoking;
  }

  void setAmChoking(boolean amChoking) {
    this.amChoking = amChoking;
  }

  public boolean isAmInterested() {
    return this.amInterested;
  }

  void setAmInterested(boolean amInterested) {
    this.amInterested = amInterested;
  }

  public boolean isPeerChoking() {
    return this.peerChoking;
  }

  void setPeerChoking(boolean peerChoking) {
    this.peerChoking = peerChoking;
  }

  public boolean isPeerInterested() {
    return this.peerInterested;
  }

  void setPeerInterested(boolean peerInterested) {
    this.peerInterested = peerInterested;
  }

  long getLastSentMillis() {
    return this.lastSentMillis;
  }

  void setLastSentMillis(long lastSentMillis) {
    this.lastSentMillis = lastSentMillis;
  }

  @Override
  public String toString() {
    return this.peerId + "@" + this.remoteAddress + " [" +
            (this.amChoking ? "C" : "c") + (this.amInterested ? "I" : "i") + "|" +
            (this.peerChoking ? "C" : "c") + (this.peerInterested ? "I" : "i") + "] " +
            this.inFlight.size() + " in flight";
  }
}
