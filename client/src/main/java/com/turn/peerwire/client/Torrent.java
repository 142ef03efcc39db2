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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.turn.peerwire.client.network.SocketTransport;
import com.turn.peerwire.client.network.Transport;
import com.turn.peerwire.client.network.TransportServer;
import com.turn.peerwire.client.network.TransportStream;
import com.turn.peerwire.client.storage.FileStorage;
import com.turn.peerwire.client.storage.PieceStorage;
import com.turn.peerwire.client.storage.VerifyingPieceStorageFactory;
import com.turn.peerwire.common.LoggerUtils;
import com.turn.peerwire.common.PeerId;
import com.turn.peerwire.common.SystemTimeService;
import com.turn.peerwire.common.TimeService;
import com.turn.peerwire.common.TorrentLoggerFactory;
import com.turn.peerwire.common.TorrentMeta;
import org.slf4j.Logger;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.BitSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Downloads and seeds the data of one torrent.
 *
 * <p>
 * Typical use:
 * </p>
 * <pre>
 *   Torrent torrent = Torrent.open(meta, new File("data.bin"), ClientConfig.defaults());
 *   torrent.addListener(...);
 *   torrent.start();
 *   torrent.listen(new InetSocketAddress(6881));
 *   torrent.connect(new InetSocketAddress("10.0.0.2", 6881));
 *   ...
 *   torrent.stop();
 * </pre>
 *
 * <p>
 * All methods are thread safe.
 * </p>
 */
public class Torrent {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(Torrent.class);

  private static final long STOP_TIMEOUT_MILLIS = 5000;

  private final TorrentMeta meta;
  private final PeerId peerId;
  private final PieceStorage storage;
  private final Transport transport;
  private final EventDispatcher eventDispatcher;
  private final TorrentActor actor;
  private final ScheduledExecutorService scheduler;

  @CheckForNull
  private TransportServer server;
  @CheckForNull
  private Thread acceptThread;
  private boolean started;
  private boolean stopped;

  public Torrent(@Nonnull TorrentMeta meta, @Nonnull PieceStorage storage, @Nonnull ClientConfig config) {
    this(meta, PeerId.random(), storage, config,
            new SocketTransport(config.getConnectionTimeoutMillis(), config.getSocketBufferSize()),
            new SystemTimeService());
  }

  public Torrent(@Nonnull TorrentMeta meta,
                 @Nonnull PeerId peerId,
                 @Nonnull PieceStorage storage,
                 @Nonnull ClientConfig config,
                 @Nonnull Transport transport,
                 @Nonnull TimeService timeService) {
    this.meta = meta;
    this.peerId = peerId;
    this.storage = storage;
    this.transport = transport;
    this.eventDispatcher = new EventDispatcher();
    this.actor = new TorrentActor(meta, peerId, storage, config,
            new ConnectionActorFactory(meta, peerId, transport, config.getSocketBufferSize()),
            this.eventDispatcher.multicaster(), timeService);
    this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
            .setNameFormat("bt-scheduler-%d")
            .setDaemon(true)
            .build());
  }

  /**
   * Open the data of a torrent on disk, checking the pieces already there.
   *
   * @param file the complete file, or the destination of the download
   */
  public static Torrent open(@Nonnull TorrentMeta meta, @Nonnull File file, @Nonnull ClientConfig config)
          throws IOException {
    FileStorage byteStorage = new FileStorage(file, meta.getTotalLength());
    PieceStorage storage = VerifyingPieceStorageFactory.INSTANCE.createStorage(meta, byteStorage);
    return new Torrent(meta, storage, config);
  }

  public TorrentMeta getMeta() {
    return this.meta;
  }

  public PeerId getPeerId() {
    return this.peerId;
  }

  public synchronized void start() {
    if (this.started) {
      return;
    }
    this.started = true;
    this.actor.start(this.scheduler);
    logger.info("Started {} as {}", this.meta.getInfoHash(), this.peerId);
  }

  /**
   * Connect to a remote peer. Failures are only logged.
   */
  public void connect(@Nonnull InetSocketAddress address) {
    this.actor.post(new TorrentCommand.Dial(address));
  }

  /**
   * Take over an already open stream from a remote peer, which is expected
   * to send its handshake first.
   */
  public void accept(@Nonnull TransportStream stream) {
    this.actor.post(new TorrentCommand.AddConnection(stream));
  }

  /**
   * Accept incoming connections on the given address, from a thread of
   * its own.
   *
   * @return the address actually bound, useful when binding port 0.
   */
  public synchronized InetSocketAddress listen(@Nonnull InetSocketAddress address) throws IOException {
    if (this.server != null) {
      throw new IllegalStateException("Already listening on " + this.server.getLocalAddress());
    }
    final TransportServer s = this.transport.bind(address);
    this.server = s;
    InetSocketAddress bound = s.getLocalAddress();
    Thread t = new Thread(new Runnable() {
      @Override
      public void run() {
        acceptLoop(s);
      }
    }, "bt-accept-" + bound.getPort());
    t.setDaemon(true);
    this.acceptThread = t;
    t.start();
    logger.info("Listening for peers on {}", bound);
    return bound;
  }

  private void acceptLoop(TransportServer s) {
    while (true) {
      TransportStream stream;
      try {
        stream = s.accept();
      } catch (ClosedChannelException e) {
        logger.debug("Stopped accepting connections");
        return;
      } catch (IOException e) {
        LoggerUtils.warnAndDebugDetails(logger, "Unable to accept connections anymore on {}", s, e);
        return;
      }
      logger.debug("Accepted connection from {}", stream.getRemoteAddress());
      this.accept(stream);
    }
  }

  public void addListener(@Nonnull TorrentListener listener) {
    this.eventDispatcher.addListener(listener);
  }

  public boolean removeListener(@Nonnull TorrentListener listener) {
    return this.eventDispatcher.removeListener(listener);
  }

  /**
   * @return the pieces verified and saved so far. A copy, safe to keep.
   */
  public BitSet getCompletedPieces() {
    return this.storage.getAvailablePieces();
  }

  public int getConnectedPeerCount() {
    return this.actor.getConnectedPeerCount();
  }

  public boolean isComplete() {
    return this.actor.isComplete();
  }

  /**
   * Close every connection, stop listening and release the storage.
   */
  public void stop() {
    TransportServer s;
    Thread t;
    synchronized (this) {
      if (this.stopped) {
        return;
      }
      this.stopped = true;
      s = this.server;
      t = this.acceptThread;
    }

    if (s != null) {
      try {
        s.close();
      } catch (IOException e) {
        LoggerUtils.warnAndDebugDetails(logger, "Error closing the server socket", e);
      }
    }
    this.actor.post(new TorrentCommand.Shutdown());
    try {
      if (t != null) {
        t.join(STOP_TIMEOUT_MILLIS);
      }
      if (!this.actor.awaitTermination(STOP_TIMEOUT_MILLIS)) {
        logger.warn("Torrent actor didn't stop within {} ms", STOP_TIMEOUT_MILLIS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    this.scheduler.shutdownNow();
    try {
      this.scheduler.awaitTermination(STOP_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    try {
      this.storage.close();
    } catch (IOException e) {
      LoggerUtils.warnAndDebugDetails(logger, "Error closing the storage of {}", this.meta.getInfoHash(), e);
    }
    logger.info("Stopped {}", this.meta.getInfoHash());
  }
}
