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
 * Notified of what happens to a torrent. Invoked from the torrent actor's
 * thread: implementations must return quickly.
 */
public interface TorrentListener {

  /**
   * Invoked when connection with peer is established
   *
   * @param peerInformation specified information about peer
   */
  void peerConnected(PeerInformation peerInformation);

  /**
   * Invoked when connection with an established peer is closed.
   *
   * @param peerInformation specified information about peer
   */
  void peerDisconnected(PeerInformation peerInformation);

  /**
   * Invoked when piece is downloaded, validated and saved
   *
   * @param pieceIndex      index of the piece
   * @param peerInformation the peer which sent the last block
   */
  void pieceDownloaded(int pieceIndex, PeerInformation peerInformation);

  /**
   * Invoked when all the blocks of a piece were received but the piece
   * doesn't match its hash. The piece will be downloaded again.
   */
  void pieceVerificationFailed(int pieceIndex, PeerInformation peerInformation);

  /**
   * Invoked when downloading is fully downloaded (last piece is received and validated)
   */
  void downloadComplete();

  /**
   * Invoked when the last connection, established or still pending, is
   * closed and no redial is scheduled. New peers may still connect or be
   * added later.
   */
  void noPeersLeft();

}
