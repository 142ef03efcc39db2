package com.turn.peerwire.client;

/**
 * {@link TorrentListener} ignoring every notification, to extend.
 */
public class TorrentListenerAdapter implements TorrentListener {

  @Override
  public void peerConnected(PeerInformation peerInformation) {
  }

  @Override
  public void peerDisconnected(PeerInformation peerInformation) {
  }

  @Override
  public void pieceDownloaded(int pieceIndex, PeerInformation peerInformation) {
  }

  @Override
  public void pieceVerificationFailed(int pieceIndex, PeerInformation peerInformation) {
  }

  @Override
  public void downloadComplete() {
  }

  @Override
  public void noPeersLeft() {
  }
}
