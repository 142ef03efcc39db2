package com.turn.peerwire.client;

import com.turn.peerwire.client.storage.TorrentByteStorage;

import java.nio.ByteBuffer;
import java.util.Arrays;

public class ByteArrayStorage implements TorrentByteStorage {

  private final byte[] array;
  private boolean finished = false;
  private boolean open = false;

  public ByteArrayStorage(int maxSize) {
    array = new byte[maxSize];
  }

  /**
   * A storage already holding the given content.
   */
  public static ByteArrayStorage of(byte[] content) {
    ByteArrayStorage storage = new ByteArrayStorage(content.length);
    System.arraycopy(content, 0, storage.array, 0, content.length);
    return storage;
  }

  @Override
  public void open(boolean seeder) {
    open = true;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  private int intPosition(long position) {
    if (position > Integer.MAX_VALUE || position < 0) {
      throw new IllegalArgumentException("Position is too large");
    }
    return (int) position;
  }

  @Override
  public synchronized int read(ByteBuffer buffer, long position) {
    int pos = intPosition(position);
    int bytesCount = buffer.remaining();
    buffer.put(Arrays.copyOfRange(array, pos, pos + bytesCount));
    return bytesCount;
  }

  @Override
  public synchronized int write(ByteBuffer block, long position) {
    int pos = intPosition(position);
    int bytesCount = block.remaining();
    byte[] toWrite = new byte[bytesCount];
    block.get(toWrite);
    System.arraycopy(toWrite, 0, array, pos, toWrite.length);
    return bytesCount;
  }

  @Override
  public void finish() {
    finished = true;
  }

  @Override
  public boolean isFinished() {
    return finished;
  }

  @Override
  public void close() {
    open = false;
  }

  public synchronized byte[] getData() {
    return array.clone();
  }
}
