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
package com.turn.peerwire.client.storage;

import com.turn.peerwire.common.TorrentLoggerFactory;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;

import javax.annotation.concurrent.GuardedBy;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * Single-file torrent byte storage.
 *
 * <p>
 * While the download is in progress the data lives in a file next to the
 * target, with the {@link #PARTIAL_FILE_NAME_SUFFIX} suffix. It's moved to
 * the target file by {@link #finish()}.
 * </p>
 *
 * @author mpetazzoni
 */
public class FileStorage implements TorrentByteStorage {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(FileStorage.class);

  private final File target;
  private final File partial;
  private final long size;

  @GuardedBy("this")
  private RandomAccessFile raf;
  @GuardedBy("this")
  private FileChannel channel;
  @GuardedBy("this")
  private File current;
  @GuardedBy("this")
  private boolean readOnly;

  public FileStorage(File target, long size) {
    this.target = target;
    this.partial = new File(target.getAbsolutePath() + PARTIAL_FILE_NAME_SUFFIX);
    this.size = size;
    this.current = this.partial.exists() || !this.target.exists() ? this.partial : this.target;
  }

  @Override
  public synchronized void open(boolean seeder) throws IOException {
    if (this.isOpen()) {
      return;
    }
    if (seeder) {
      if (!this.target.exists()) {
        throw new IOException("Target file " + this.target.getAbsolutePath() + " doesn't exist.");
      }
      this.current = this.target;
      this.raf = new RandomAccessFile(this.current, "r");
      this.readOnly = true;
    } else {
      if (this.partial.exists()) {
        logger.debug("Partial download found at {}. Continuing...", this.partial.getAbsolutePath());
        this.current = this.partial;
      } else if (!this.target.exists()) {
        logger.debug("Downloading new file to {}...", this.partial.getAbsolutePath());
        this.current = this.partial;
      } else {
        logger.debug("Using existing file {}.", this.target.getAbsolutePath());
        this.current = this.target;
      }
      FileUtils.forceMkdirParent(this.current);
      this.raf = new RandomAccessFile(this.current, "rw");
      this.readOnly = false;
      // Truncate or extend an existing file to the expected size.
      this.raf.setLength(this.size);
    }
    this.channel = this.raf.getChannel();
    logger.debug("Opened byte storage file at {} ({} byte(s)).", this.current.getAbsolutePath(), this.size);
  }

  public long size() {
    return this.size;
  }

  @Override
  public synchronized boolean isOpen() {
    return this.channel != null && this.channel.isOpen();
  }

  @Override
  public synchronized int read(ByteBuffer buffer, long position) throws IOException {
    this.checkOpen();
    int requested = buffer.remaining();
    if (position < 0 || position + requested > this.size) {
      throw new IllegalArgumentException("Invalid storage read request: " + requested + "@" + position);
    }

    int total = 0;
    while (buffer.hasRemaining()) {
      int bytes = this.channel.read(buffer, position + total);
      if (bytes < 0) {
        throw new IOException("Storage underrun!");
      }
      total += bytes;
    }
    return total;
  }

  @Override
  public synchronized int write(ByteBuffer block, long position) throws IOException {
    this.checkOpen();
    int requested = block.remaining();
    if (position < 0 || position + requested > this.size) {
      throw new IllegalArgumentException("Invalid storage write request: " + requested + "@" + position);
    }

    int total = 0;
    while (block.hasRemaining()) {
      total += this.channel.write(block, position + total);
    }
    return total;
  }

  private void checkOpen() throws IOException {
    if (!this.isOpen()) {
      throw new IOException("Storage " + this.current.getName() + " is not open");
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (!this.isOpen()) {
      return;
    }
    logger.debug("Closing file channel to {}.", this.current.getName());
    if (!this.readOnly) {
      this.channel.force(true);
    }
    this.raf.close();
    this.channel = null;
    this.raf = null;
  }

  /**
   * Move the partial file to its final location. The storage is closed
   * afterwards.
   */
  @Override
  public synchronized void finish() throws IOException {
    if (this.isFinished()) {
      return;
    }
    this.close();

    FileUtils.deleteQuietly(this.target);
    try {
      FileUtils.moveFile(this.partial, this.target);
    } catch (IOException ioe) {
      logger.warn("Could not move {} to its final location, copying it instead", this.partial.getName());
      FileUtils.copyFile(this.partial, this.target);
      FileUtils.deleteQuietly(this.partial);
    }
    this.current = this.target;
    logger.debug("Moved torrent data from {} to {}.", this.partial.getName(), this.target.getName());
  }

  @Override
  public synchronized boolean isFinished() {
    return this.current.equals(this.target);
  }

  @Override
  public String toString() {
    return "FileStorage{" + this.target.getAbsolutePath() + '}';
  }
}
