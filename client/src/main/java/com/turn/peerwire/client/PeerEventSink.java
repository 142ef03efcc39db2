package com.turn.peerwire.client;

/**
 * Receives the events of connection actors. Must not block.
 */
public interface PeerEventSink {

  void onPeerEvent(PeerEvent event);

}
