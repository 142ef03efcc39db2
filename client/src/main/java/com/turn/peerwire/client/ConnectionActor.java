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

import com.turn.peerwire.client.network.Transport;
import com.turn.peerwire.client.network.TransportStream;
import com.turn.peerwire.common.LoggerUtils;
import com.turn.peerwire.common.TorrentLoggerFactory;
import com.turn.peerwire.protocol.engine.NotEstablishedException;
import com.turn.peerwire.protocol.engine.ProtocolEngine;
import com.turn.peerwire.protocol.engine.ProtocolEvent;
import org.slf4j.Logger;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pumps the bytes of one peer connection through a {@link ProtocolEngine}.
 *
 * <p>
 * Two threads share the work. The reader thread dials the peer when needed,
 * reads from the stream, feeds the engine and reports events; it is the
 * only one reporting, so the {@link PeerEvent.Disconnected} event is always
 * the last one and reported exactly once. The writer thread executes the
 * commands posted by the torrent actor and is the only one writing to the
 * stream. The engine itself is guarded by its own monitor.
 * </p>
 */
public class ConnectionActor implements PeerConnection {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(ConnectionActor.class);

  /**
   * Tells the writer to write whatever the engine has queued.
   */
  private static final PeerCommand FLUSH = new PeerCommand() {
    @Override
    public String toString() {
      return "Flush";
    }
  };

  /**
   * Tells the writer the connection is over.
   */
  private static final PeerCommand STOP = new PeerCommand() {
    @Override
    public String toString() {
      return "Stop";
    }
  };

  private final ConnectionId id;
  private final ProtocolEngine engine;
  private final PeerEventSink sink;
  private final int readBufferSize;

  @CheckForNull
  private final Transport transport;
  @CheckForNull
  private final InetSocketAddress dialAddress;
  @CheckForNull
  private volatile TransportStream stream;

  private final BlockingQueue<PeerCommand> commands = new LinkedBlockingQueue<PeerCommand>();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  @CheckForNull
  private volatile String closeReason;

  private final Thread reader;
  private final Thread writer;

  private ConnectionActor(ConnectionId id, ProtocolEngine engine, PeerEventSink sink, int readBufferSize,
                          @CheckForNull Transport transport, @CheckForNull InetSocketAddress dialAddress,
                          @CheckForNull TransportStream stream) {
    this.id = id;
    this.engine = engine;
    this.sink = sink;
    this.readBufferSize = readBufferSize;
    this.transport = transport;
    this.dialAddress = dialAddress;
    this.stream = stream;
    this.reader = new Thread(new Runnable() {
      @Override
      public void run() {
        readLoop();
      }
    }, "bt-peer-reader-" + id);
    this.writer = new Thread(new Runnable() {
      @Override
      public void run() {
        writeLoop();
      }
    }, "bt-peer-writer-" + id);
    this.reader.setDaemon(true);
    this.writer.setDaemon(true);
  }

  /**
   * An actor for an already open stream.
   */
  public static ConnectionActor accepted(@Nonnull ConnectionId id, @Nonnull TransportStream stream,
                                         @Nonnull ProtocolEngine engine, @Nonnull PeerEventSink sink,
                                         int readBufferSize) {
    return new ConnectionActor(id, engine, sink, readBufferSize, null, null, stream);
  }

  /**
   * An actor that opens its stream once started.
   */
  public static ConnectionActor dialing(@Nonnull ConnectionId id, @Nonnull Transport transport,
                                        @Nonnull InetSocketAddress address,
                                        @Nonnull ProtocolEngine engine, @Nonnull PeerEventSink sink,
                                        int readBufferSize) {
    return new ConnectionActor(id, engine, sink, readBufferSize, transport, address, null);
  }

  @Override
  public ConnectionId getId() {
    return this.id;
  }

  @Override
  public void start() {
    this.reader.start();
    this.writer.start();
  }

  /**
   * Queue a command for the writer thread. A {@link PeerCommand.Close} also
   * closes the stream right away, so that a peer which stopped reading
   * can't hold it behind a pending write.
   */
  @Override
  public void post(PeerCommand command) {
    if (this.closed.get()) {
      logger.trace("{} is closed, dropping {}", this.id, command);
      return;
    }
    if (command instanceof PeerCommand.Close) {
      this.close(((PeerCommand.Close) command).getReason());
    }
    this.commands.add(command);
  }

  private void close(String reason) {
    // The reason must be visible before the reader sees the stream closed.
    this.closeReason = reason;
    if (this.closed.compareAndSet(false, true)) {
      logger.debug("Closing {}: {}", this.id, reason);
      this.closeStream();
    }
  }

  /**
   * Waits for both threads of this actor to end.
   *
   * @return true if they did within the given time
   */
  public boolean join(long millis) throws InterruptedException {
    long deadline = System.currentTimeMillis() + millis;
    this.reader.join(Math.max(1, millis));
    this.writer.join(Math.max(1, deadline - System.currentTimeMillis()));
    return !this.reader.isAlive() && !this.writer.isAlive();
  }

  private void readLoop() {
    String reason = "connection closed";
    try {
      TransportStream s = this.stream;
      if (s == null) {
        s = this.dial();
        if (s == null) {
          String requested = this.closeReason;
          reason = this.closed.get() && requested != null ? requested : "could not connect to " + this.dialAddress;
          return;
        }
      }
      this.flushIfNeeded();

      ByteBuffer buffer = ByteBuffer.allocate(this.readBufferSize);
      while (true) {
        int read = s.read(buffer);
        if (read < 0) {
          reason = "connection closed by peer";
          break;
        }
        buffer.flip();
        List<ProtocolEvent> events;
        synchronized (this.engine) {
          events = this.engine.receive(buffer);
        }
        buffer.clear();
        this.flushIfNeeded();

        String violation = this.report(events, s.getRemoteAddress());
        if (violation != null) {
          reason = "protocol violation: " + violation;
          break;
        }
      }
    } catch (IOException ioe) {
      String requested = this.closeReason;
      if (this.closed.get() && requested != null) {
        reason = requested;
      } else {
        reason = "I/O error: " + ioe.getMessage();
        LoggerUtils.debugWithDetails(logger, "{} failed", this.id, ioe);
      }
    } catch (RuntimeException e) {
      reason = "internal error: " + e;
      LoggerUtils.warnAndDebugDetails(logger, "{} failed unexpectedly", this.id, e);
    } finally {
      this.shutdown();
      logger.debug("{} is over: {}", this.id, reason);
      this.sink.onPeerEvent(new PeerEvent.Disconnected(this.id, reason));
    }
  }

  @CheckForNull
  private TransportStream dial() {
    Transport t = this.transport;
    InetSocketAddress address = this.dialAddress;
    if (t == null || address == null) {
      throw new IllegalStateException(this.id + " has neither a stream nor an address to dial");
    }
    TransportStream s;
    try {
      logger.debug("{} connecting to {}", this.id, address);
      s = t.connect(address);
    } catch (IOException ioe) {
      LoggerUtils.debugWithDetails(logger, "Unable to connect to {}", address, ioe);
      return null;
    }
    this.stream = s;
    if (this.closed.get()) {
      // Closed while connecting.
      closeQuietly(s);
      return null;
    }
    return s;
  }

  /**
   * Reports engine events to the sink.
   *
   * @return the reason of a protocol violation, if one was reported
   */
  @CheckForNull
  private String report(List<ProtocolEvent> events, SocketAddress remoteAddress) {
    for (ProtocolEvent event : events) {
      if (event instanceof ProtocolEvent.HandshakeCompleted) {
        this.sink.onPeerEvent(new PeerEvent.HandshakeCompleted(this.id,
                ((ProtocolEvent.HandshakeCompleted) event).getPeerId(), remoteAddress));
      } else if (event instanceof ProtocolEvent.MessageReceived) {
        this.sink.onPeerEvent(new PeerEvent.MessageReceived(this.id,
                ((ProtocolEvent.MessageReceived) event).getMessage()));
      } else if (event instanceof ProtocolEvent.ProtocolViolation) {
        String reason = ((ProtocolEvent.ProtocolViolation) event).getReason();
        this.sink.onPeerEvent(new PeerEvent.ProtocolViolation(this.id, reason));
        return reason;
      }
    }
    return null;
  }

  private void flushIfNeeded() {
    boolean pending;
    synchronized (this.engine) {
      pending = this.engine.hasOutbound();
    }
    if (pending) {
      this.commands.add(FLUSH);
    }
  }

  private void writeLoop() {
    try {
      while (true) {
        PeerCommand command = this.commands.take();
        if (command == STOP) {
          return;
        }
        if (command instanceof PeerCommand.Close) {
          // Already closed by post(), the writer only has to stop.
          return;
        }

        ByteBuffer out;
        synchronized (this.engine) {
          if (command instanceof PeerCommand.Send) {
            try {
              this.engine.send(((PeerCommand.Send) command).getMessage());
            } catch (NotEstablishedException e) {
              logger.debug("{} can't send {}: {}", new Object[]{this.id, command, e.getMessage()});
              continue;
            }
          }
          out = this.engine.takeOutbound();
        }
        TransportStream s = this.stream;
        if (s == null) {
          continue;
        }
        while (out.hasRemaining()) {
          s.write(out);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (IOException ioe) {
      LoggerUtils.debugWithDetails(logger, "Write to {} failed", this.id, ioe);
      // Closing the stream wakes the reader up, which reports the failure.
      this.closed.set(true);
      this.closeStream();
    }
  }

  private void shutdown() {
    this.closed.set(true);
    this.closeStream();
    synchronized (this.engine) {
      this.engine.close();
    }
    this.commands.add(STOP);
  }

  private void closeStream() {
    TransportStream s = this.stream;
    if (s != null) {
      closeQuietly(s);
    }
  }

  private static void closeQuietly(TransportStream s) {
    try {
      s.close();
    } catch (IOException e) {
      LoggerUtils.debugWithDetails(logger, "Error closing {}", s, e);
    }
  }

  @Override
  public String toString() {
    return this.id + (this.closed.get() ? " (closed)" : "");
  }
}
