package com.turn.peerwire.client;

import com.turn.peerwire.common.LoggerUtils;
import com.turn.peerwire.common.TorrentLoggerFactory;
import org.slf4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class EventDispatcher {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(EventDispatcher.class);

  private final List<TorrentListener> listeners;
  private final TorrentListener notifyer;

  public EventDispatcher() {
    this.listeners = new CopyOnWriteArrayList<TorrentListener>();
    this.notifyer = createNotifyer();
  }

  private static void failed(TorrentListener listener, RuntimeException e) {
    LoggerUtils.warnAndDebugDetails(logger, "Listener {} failed", listener, e);
  }

  private TorrentListener createNotifyer() {
    return new TorrentListener() {
      @Override
      public void peerConnected(PeerInformation peerInformation) {
        for (TorrentListener listener : listeners) {
          try {
            listener.peerConnected(peerInformation);
          } catch (RuntimeException e) {
            failed(listener, e);
          }
        }
      }

      @Override
      public void peerDisconnected(PeerInformation peerInformation) {
        for (TorrentListener listener : listeners) {
          try {
            listener.peerDisconnected(peerInformation);
          } catch (RuntimeException e) {
            failed(listener, e);
          }
        }
      }

      @Override
      public void pieceDownloaded(int pieceIndex, PeerInformation peerInformation) {
        for (TorrentListener listener : listeners) {
          try {
            listener.pieceDownloaded(pieceIndex, peerInformation);
          } catch (RuntimeException e) {
            failed(listener, e);
          }
        }
      }

      @Override
      public void pieceVerificationFailed(int pieceIndex, PeerInformation peerInformation) {
        for (TorrentListener listener : listeners) {
          try {
            listener.pieceVerificationFailed(pieceIndex, peerInformation);
          } catch (RuntimeException e) {
            failed(listener, e);
          }
        }
      }

      @Override
      public void downloadComplete() {
        for (TorrentListener listener : listeners) {
          try {
            listener.downloadComplete();
          } catch (RuntimeException e) {
            failed(listener, e);
          }
        }
      }

      @Override
      public void noPeersLeft() {
        for (TorrentListener listener : listeners) {
          try {
            listener.noPeersLeft();
          } catch (RuntimeException e) {
            failed(listener, e);
          }
        }
      }
    };
  }

  TorrentListener multicaster() {
    return notifyer;
  }

  public boolean removeListener(TorrentListener listener) {
    return listeners.remove(listener);
  }

  public void addListener(TorrentListener listener) {
    listeners.add(listener);
  }
}
