package com.turn.peerwire.client;

import com.turn.peerwire.client.network.TransportStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory stream: the test feeds what the connection reads and inspects
 * what it wrote.
 */
class MemoryStream implements TransportStream {

  private static final byte[] EOF = new byte[0];
  private static final byte[] CLOSED = new byte[0];

  private final BlockingQueue<byte[]> incoming = new LinkedBlockingQueue<byte[]>();
  private final ByteArrayOutputStream written = new ByteArrayOutputStream();
  private final SocketAddress remoteAddress = new InetSocketAddress("127.0.0.1", 6881);
  private ByteBuffer pending;
  private volatile boolean closed;
  private volatile CountDownLatch writeGate;
  private final CountDownLatch writerStalled = new CountDownLatch(1);

  void feed(byte[] bytes) {
    incoming.add(bytes.clone());
  }

  void feed(ByteBuffer bytes) {
    byte[] copy = new byte[bytes.remaining()];
    bytes.duplicate().get(copy);
    incoming.add(copy);
  }

  void endOfStream() {
    incoming.add(EOF);
  }

  /**
   * From now on writes hang until the stream is closed, as with a peer that
   * stopped reading.
   */
  void stallWrites() {
    writeGate = new CountDownLatch(1);
  }

  boolean awaitStalledWriter() throws InterruptedException {
    return writerStalled.await(10, TimeUnit.SECONDS);
  }

  @Override
  public int read(ByteBuffer buffer) throws IOException {
    if (closed) {
      throw new ClosedChannelException();
    }
    if (pending == null || !pending.hasRemaining()) {
      byte[] chunk;
      try {
        chunk = incoming.take();
      } catch (InterruptedException e) {
        throw new InterruptedIOException();
      }
      if (chunk == CLOSED) {
        throw new AsynchronousCloseException();
      }
      if (chunk == EOF) {
        return -1;
      }
      pending = ByteBuffer.wrap(chunk);
    }
    int count = Math.min(buffer.remaining(), pending.remaining());
    ByteBuffer part = pending.duplicate();
    part.limit(part.position() + count);
    buffer.put(part);
    pending.position(pending.position() + count);
    return count;
  }

  @Override
  public int write(ByteBuffer buffer) throws IOException {
    if (closed) {
      throw new ClosedChannelException();
    }
    CountDownLatch gate = writeGate;
    if (gate != null) {
      writerStalled.countDown();
      try {
        gate.await();
      } catch (InterruptedException e) {
        throw new InterruptedIOException();
      }
      throw new AsynchronousCloseException();
    }
    int count = buffer.remaining();
    byte[] bytes = new byte[count];
    buffer.get(bytes);
    synchronized (written) {
      written.write(bytes, 0, count);
    }
    return count;
  }

  @Override
  public SocketAddress getRemoteAddress() {
    return remoteAddress;
  }

  @Override
  public boolean isOpen() {
    return !closed;
  }

  @Override
  public void close() {
    CountDownLatch gate = writeGate;
    if (gate != null) {
      gate.countDown();
    }
    if (!closed) {
      closed = true;
      incoming.add(CLOSED);
    }
  }

  byte[] getWritten() {
    synchronized (written) {
      return written.toByteArray();
    }
  }
}
