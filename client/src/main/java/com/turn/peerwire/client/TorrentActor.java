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

import com.turn.peerwire.client.storage.PieceStorage;
import com.turn.peerwire.common.LoggerUtils;
import com.turn.peerwire.common.PeerId;
import com.turn.peerwire.common.TimeService;
import com.turn.peerwire.common.TorrentLoggerFactory;
import com.turn.peerwire.common.TorrentMeta;
import com.turn.peerwire.protocol.PeerMessage;
import org.slf4j.Logger;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the swarm of one torrent: the established peers, the piece table and
 * the request schedule.
 *
 * <p>
 * Everything happens on a single thread draining one inbox, in arrival
 * order. Connection actors report through {@link #onPeerEvent(PeerEvent)};
 * everything else is a {@link TorrentCommand}. The state of the actor is
 * only ever touched from that thread, apart from the counters exposed for
 * monitoring.
 * </p>
 */
public class TorrentActor implements PeerEventSink, Runnable {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(TorrentActor.class);

  /**
   * Anything the actor's inbox accepts.
   */
  public interface Input {
  }

  private final TorrentMeta meta;
  private final PeerId localPeerId;
  private final PieceStorage storage;
  private final ClientConfig config;
  private final PeerConnectionFactory connectionFactory;
  private final TorrentListener listener;
  private final TimeService timeService;
  private final PieceTable pieceTable;

  private final BlockingQueue<Input> inbox = new LinkedBlockingQueue<Input>();

  // Every connection not reported as disconnected yet, established or not.
  private final Map<ConnectionId, PeerConnection> connections = new LinkedHashMap<ConnectionId, PeerConnection>();
  // Established peers only.
  private final Map<ConnectionId, PeerState> peers = new LinkedHashMap<ConnectionId, PeerState>();
  private final Map<PeerId, ConnectionId> connectionsByPeerId = new HashMap<PeerId, ConnectionId>();
  private final Map<ConnectionId, TorrentCommand.Dial> dials = new HashMap<ConnectionId, TorrentCommand.Dial>();

  private final AtomicInteger connectedPeers = new AtomicInteger();
  private volatile boolean complete;
  private boolean completionNotified;
  // Redials scheduled but not dialed yet.
  private int pendingRedials;
  private volatile boolean running;

  @CheckForNull
  private ScheduledExecutorService scheduler;
  @CheckForNull
  private ScheduledFuture<?> ticker;
  @CheckForNull
  private Thread thread;

  public TorrentActor(@Nonnull TorrentMeta meta,
                      @Nonnull PeerId localPeerId,
                      @Nonnull PieceStorage storage,
                      @Nonnull ClientConfig config,
                      @Nonnull PeerConnectionFactory connectionFactory,
                      @Nonnull TorrentListener listener,
                      @Nonnull TimeService timeService) {
    this.meta = meta;
    this.localPeerId = localPeerId;
    this.storage = storage;
    this.config = config;
    this.connectionFactory = connectionFactory;
    this.listener = listener;
    this.timeService = timeService;
    this.pieceTable = new PieceTable(meta, config.getBlockSize(), storage.getAvailablePieces());
    this.complete = this.pieceTable.isComplete();
    // Nothing to announce for a torrent that was complete from the start.
    this.completionNotified = this.complete;
    this.running = true;
  }

  /**
   * Start the actor thread, and the ticks on the given scheduler, which is
   * also used for redials.
   */
  public synchronized void start(@Nonnull ScheduledExecutorService scheduler) {
    if (this.thread != null) {
      throw new IllegalStateException("Torrent actor already started");
    }
    this.scheduler = scheduler;
    long tick = this.config.getTickIntervalMillis();
    this.ticker = scheduler.scheduleWithFixedDelay(new Runnable() {
      @Override
      public void run() {
        post(new TorrentCommand.Tick());
      }
    }, tick, tick, TimeUnit.MILLISECONDS);
    Thread t = new Thread(this, "bt-torrent-" + this.meta.getInfoHash().getHexString().substring(0, 8));
    t.setDaemon(true);
    this.thread = t;
    t.start();
  }

  public void post(@Nonnull Input input) {
    this.inbox.add(input);
  }

  @Override
  public void onPeerEvent(PeerEvent event) {
    this.post(event);
  }

  @Override
  public void run() {
    logger.info("Torrent actor for {} started ({} of {} pieces)",
            new Object[]{this.meta.getInfoHash(), this.pieceTable.getVerifiedCount(), this.meta.getPieceCount()});
    try {
      while (this.running) {
        Input input = this.inbox.take();
        try {
          this.handle(input);
        } catch (RuntimeException e) {
          LoggerUtils.warnAndDebugDetails(logger, "Unable to handle {}", input, e);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    logger.info("Torrent actor for {} stopped", this.meta.getInfoHash());
  }

  /**
   * Waits for the actor thread to end after a {@link TorrentCommand.Shutdown}.
   */
  public boolean awaitTermination(long millis) throws InterruptedException {
    Thread t;
    synchronized (this) {
      t = this.thread;
    }
    if (t == null) {
      return true;
    }
    t.join(millis);
    return !t.isAlive();
  }

  public boolean isComplete() {
    return this.complete;
  }

  public int getConnectedPeerCount() {
    return this.connectedPeers.get();
  }

  PieceTable getPieceTable() {
    return this.pieceTable;
  }

  Collection<PeerState> getPeers() {
    return Collections.unmodifiableCollection(this.peers.values());
  }

  @CheckForNull
  PeerState getPeer(ConnectionId id) {
    return this.peers.get(id);
  }

  int getConnectionCount() {
    return this.connections.size();
  }

  /**
   * Handle one input. Only ever called from the actor thread, or directly
   * by tests in place of it.
   */
  void handle(Input input) {
    if (!this.running) {
      logger.trace("Actor stopped, ignoring {}", input);
      return;
    }
    logger.trace("Handling {}", input);
    if (input instanceof PeerEvent.HandshakeCompleted) {
      this.handleHandshake((PeerEvent.HandshakeCompleted) input);
    } else if (input instanceof PeerEvent.MessageReceived) {
      this.handleMessage((PeerEvent.MessageReceived) input);
    } else if (input instanceof PeerEvent.ProtocolViolation) {
      PeerEvent.ProtocolViolation violation = (PeerEvent.ProtocolViolation) input;
      PeerState peer = this.peers.get(violation.getConnectionId());
      logger.info("Protocol violation from {}: {}",
              peer == null ? violation.getConnectionId() : peer.getPeerId(), violation.getReason());
    } else if (input instanceof PeerEvent.Disconnected) {
      this.handleDisconnected((PeerEvent.Disconnected) input);
    } else if (input instanceof TorrentCommand.AddConnection) {
      ConnectionId id = ConnectionId.next();
      this.register(this.connectionFactory.accepted(id, ((TorrentCommand.AddConnection) input).getStream(), this));
    } else if (input instanceof TorrentCommand.Dial) {
      TorrentCommand.Dial dial = (TorrentCommand.Dial) input;
      if (dial.getAttempt() > 0 && this.pendingRedials > 0) {
        this.pendingRedials--;
      }
      ConnectionId id = ConnectionId.next();
      this.dials.put(id, dial);
      this.register(this.connectionFactory.dial(id, dial.getAddress(), this));
    } else if (input instanceof TorrentCommand.Tick) {
      this.handleTick();
    } else if (input instanceof TorrentCommand.Shutdown) {
      this.handleShutdown();
    } else {
      logger.warn("Unknown input {}", input);
    }
  }

  private void register(PeerConnection connection) {
    this.connections.put(connection.getId(), connection);
    connection.start();
  }

  private void handleHandshake(PeerEvent.HandshakeCompleted event) {
    ConnectionId id = event.getConnectionId();
    PeerConnection connection = this.connections.get(id);
    if (connection == null) {
      logger.debug("Handshake on unknown connection {}, ignoring", id);
      return;
    }
    if (this.localPeerId.equals(event.getPeerId())) {
      logger.debug("{} leads back to ourselves, closing it", id);
      connection.post(new PeerCommand.Close("connected to self"));
      return;
    }
    ConnectionId existing = this.connectionsByPeerId.get(event.getPeerId());
    if (existing != null) {
      logger.debug("Already connected to {} through {}, closing {}",
              new Object[]{event.getPeerId(), existing, id});
      connection.post(new PeerCommand.Close("duplicate connection"));
      return;
    }

    PeerState peer = new PeerState(id, event.getPeerId(), event.getRemoteAddress(), connection,
            this.timeService.now());
    this.peers.put(id, peer);
    this.connectionsByPeerId.put(peer.getPeerId(), id);
    this.connectedPeers.incrementAndGet();
    logger.info("Connected to {} at {}", peer.getPeerId(), peer.getRemoteAddress());

    // Always announced, an all-zero bitfield included.
    this.send(peer, PeerMessage.BitfieldMessage.craft(this.pieceTable.getVerifiedPieces(),
            this.meta.getPieceCount()));
    this.listener.peerConnected(peer);
  }

  private void handleMessage(PeerEvent.MessageReceived event) {
    PeerState peer = this.peers.get(event.getConnectionId());
    if (peer == null) {
      logger.debug("Message on {} which is not established, ignoring", event.getConnectionId());
      return;
    }
    PeerMessage message = event.getMessage();
    switch (message.getType()) {
      case KEEP_ALIVE:
        break;
      case CHOKE:
        peer.setPeerChoking(true);
        this.releaseInFlight(peer);
        break;
      case UNCHOKE:
        peer.setPeerChoking(false);
        this.schedule(peer);
        break;
      case INTERESTED:
        peer.setPeerInterested(true);
        this.fillUploadSlots();
        break;
      case NOT_INTERESTED:
        peer.setPeerInterested(false);
        if (!peer.isAmChoking()) {
          peer.setAmChoking(true);
          this.send(peer, PeerMessage.ChokeMessage.craft());
          this.fillUploadSlots();
        }
        break;
      case HAVE:
        peer.getBitfield().set(((PeerMessage.HaveMessage) message).getPieceIndex());
        this.updateInterest(peer);
        this.schedule(peer);
        break;
      case BITFIELD:
        peer.getBitfield().clear();
        peer.getBitfield().or(((PeerMessage.BitfieldMessage) message).getBitfield());
        this.updateInterest(peer);
        this.schedule(peer);
        break;
      case REQUEST:
        this.serve(peer, (PeerMessage.RequestMessage) message);
        break;
      case PIECE:
        this.handlePiece(peer, (PeerMessage.PieceMessage) message);
        break;
      case CANCEL:
        // Requests are served as soon as they arrive, nothing is left to cancel.
        break;
      default:
        logger.debug("Unexpected {} from {}", message, peer.getPeerId());
    }
  }

  private void serve(PeerState peer, PeerMessage.RequestMessage request) {
    if (peer.isAmChoking()) {
      logger.debug("{} asked for {} while choked, ignoring", peer.getPeerId(), request);
      return;
    }
    int piece = request.getPiece();
    if (!this.meta.isValidPieceIndex(piece) || request.getOffset() < 0 || request.getLength() <= 0 ||
            (long) request.getOffset() + request.getLength() > this.meta.getPieceLength(piece)) {
      logger.debug("{} asked for {} which is out of range, ignoring", peer.getPeerId(), request);
      return;
    }
    if (!this.pieceTable.isVerified(piece) || !this.storage.hasPiece(piece)) {
      logger.debug("{} asked for {} which we don't have, ignoring", peer.getPeerId(), request);
      return;
    }
    byte[] block;
    try {
      block = this.storage.readPiecePart(piece, request.getOffset(), request.getLength());
    } catch (IOException ioe) {
      LoggerUtils.errorAndDebugDetails(logger, "Unable to read piece #{} from storage", piece, ioe);
      return;
    }
    this.send(peer, PeerMessage.PieceMessage.craft(piece, request.getOffset(), block));
  }

  private void handlePiece(PeerState peer, PeerMessage.PieceMessage message) {
    BlockRequest block = new BlockRequest(message.getPiece(), message.getOffset(), message.getLength());
    if (!peer.removeInFlight(block)) {
      logger.debug("{} sent {} which wasn't requested from it, dropping", peer.getPeerId(), block);
      return;
    }
    int piece = block.getPiece();
    PieceTable.Reception reception = this.pieceTable.receive(piece, block.getOffset(), message.getBlock());
    switch (reception) {
      case VALID:
        this.pieceVerified(piece, peer);
        break;
      case INVALID:
        logger.info("Piece #{} from {} doesn't match its hash, downloading it again", piece, peer.getPeerId());
        this.listener.pieceVerificationFailed(piece, peer);
        break;
      case IGNORED:
        logger.debug("{} from {} wasn't expected anymore", block, peer.getPeerId());
        break;
      default:
        break;
    }
    this.scheduleAll();
  }

  private void pieceVerified(int piece, PeerState from) {
    byte[] data = this.pieceTable.takeVerifiedData(piece);
    try {
      if (data == null) {
        throw new IOException("verified data of piece #" + piece + " is gone");
      }
      this.storage.savePiece(piece, data);
    } catch (IOException ioe) {
      LoggerUtils.errorAndDebugDetails(logger, "Unable to save piece #{}, it will be downloaded again", piece, ioe);
      this.pieceTable.reset(piece);
      return;
    }

    logger.debug("Piece #{} verified and saved ({}/{})",
            new Object[]{piece, this.pieceTable.getVerifiedCount(), this.meta.getPieceCount()});
    PeerMessage have = PeerMessage.HaveMessage.craft(piece);
    for (PeerState peer : this.peers.values()) {
      this.send(peer, have);
    }
    this.listener.pieceDownloaded(piece, from);

    if (this.pieceTable.isComplete()) {
      this.complete = true;
    }
    for (PeerState peer : this.peers.values()) {
      this.updateInterest(peer);
    }
    if (this.complete && !this.completionNotified) {
      this.completionNotified = true;
      logger.info("Download of {} complete", this.meta.getInfoHash());
      this.listener.downloadComplete();
    }
  }

  private void handleDisconnected(PeerEvent.Disconnected event) {
    ConnectionId id = event.getConnectionId();
    if (this.connections.remove(id) == null) {
      logger.debug("{} is not a known connection, ignoring its disconnection", id);
      return;
    }
    TorrentCommand.Dial dial = this.dials.remove(id);
    PeerState peer = this.peers.remove(id);
    if (peer != null) {
      this.connectionsByPeerId.remove(peer.getPeerId());
      this.connectedPeers.decrementAndGet();
      this.releaseInFlight(peer);
      logger.info("Disconnected from {}: {}", peer.getPeerId(), event.getReason());
      if (!peer.isAmChoking()) {
        this.fillUploadSlots();
      }
      this.listener.peerDisconnected(peer);
      this.scheduleAll();
    } else {
      logger.debug("{} closed before handshake: {}", id, event.getReason());
    }
    if (dial != null) {
      this.redial(dial, peer != null);
    }
    if (this.connections.isEmpty() && this.pendingRedials == 0) {
      logger.info("No peer left for {} ({} of {} pieces)",
              new Object[]{this.meta.getInfoHash(), this.pieceTable.getVerifiedCount(), this.meta.getPieceCount()});
      this.listener.noPeersLeft();
    }
  }

  private void redial(TorrentCommand.Dial dial, boolean wasEstablished) {
    final int attempt = wasEstablished ? 1 : dial.getAttempt() + 1;
    long delay = this.config.getRedialPolicy().getDelayMillis(attempt);
    final ScheduledExecutorService s = this.scheduler;
    if (delay < 0 || s == null) {
      return;
    }
    final InetSocketAddress address = dial.getAddress();
    logger.debug("Redialing {} in {} ms (attempt {})", new Object[]{address, delay, attempt});
    this.pendingRedials++;
    s.schedule(new Runnable() {
      @Override
      public void run() {
        post(new TorrentCommand.Dial(address, attempt));
      }
    }, delay, TimeUnit.MILLISECONDS);
  }

  private void handleTick() {
    long now = this.timeService.now();
    long keepAlive = this.config.getKeepAliveIntervalMillis();
    for (PeerState peer : this.peers.values()) {
      if (now - peer.getLastSentMillis() >= keepAlive) {
        this.send(peer, PeerMessage.KeepAliveMessage.craft());
      }
    }
    this.scheduleAll();
  }

  private void handleShutdown() {
    logger.debug("Shutting down, closing {} connections", this.connections.size());
    for (PeerConnection connection : this.connections.values()) {
      connection.post(new PeerCommand.Close("shutting down"));
    }
    ScheduledFuture<?> t = this.ticker;
    if (t != null) {
      t.cancel(false);
    }
    this.running = false;
  }

  private void releaseInFlight(PeerState peer) {
    for (BlockRequest request : peer.getInFlight()) {
      this.pieceTable.release(request);
    }
    peer.clearInFlight();
  }

  private void updateInterest(PeerState peer) {
    boolean needed = this.pieceTable.isNeeded(peer.getBitfield());
    if (needed && !peer.isAmInterested()) {
      peer.setAmInterested(true);
      this.send(peer, PeerMessage.InterestedMessage.craft());
    } else if (!needed && peer.isAmInterested()) {
      peer.setAmInterested(false);
      this.send(peer, PeerMessage.NotInterestedMessage.craft());
    }
  }

  private void fillUploadSlots() {
    int unchoked = 0;
    for (PeerState peer : this.peers.values()) {
      if (!peer.isAmChoking()) {
        unchoked++;
      }
    }
    for (PeerState peer : this.peers.values()) {
      if (unchoked >= this.config.getUploadSlots()) {
        return;
      }
      if (peer.isPeerInterested() && peer.isAmChoking()) {
        peer.setAmChoking(false);
        this.send(peer, PeerMessage.UnchokeMessage.craft());
        unchoked++;
      }
    }
  }

  private void scheduleAll() {
    for (PeerState peer : this.peers.values()) {
      this.schedule(peer);
    }
  }

  /**
   * Fill the request pipeline of one peer, lowest piece index first.
   */
  private void schedule(PeerState peer) {
    if (peer.isPeerChoking() || !peer.isAmInterested()) {
      return;
    }
    List<BlockRequest> assigned = new ArrayList<BlockRequest>();
    while (peer.getInFlight().size() < this.config.getPipelineDepth()) {
      BlockRequest request = this.pieceTable.assignNext(peer.getBitfield());
      if (request == null) {
        break;
      }
      peer.addInFlight(request);
      assigned.add(request);
    }
    for (BlockRequest request : assigned) {
      this.send(peer, PeerMessage.RequestMessage.craft(request.getPiece(), request.getOffset(), request.getLength()));
    }
  }

  private void send(PeerState peer, PeerMessage message) {
    peer.setLastSentMillis(this.timeService.now());
    peer.getConnection().post(new PeerCommand.Send(message));
  }

  @Override
  public String toString() {
    return "TorrentActor{" + this.meta.getInfoHash() + ", " + this.peers.size() + " peers, " +
            this.pieceTable + "}";
  }
}
