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

import com.google.common.base.Preconditions;
import com.turn.peerwire.Constants;

/**
 * Tuning of a {@link Torrent}. Immutable; use {@link #builder()}.
 */
public final class ClientConfig {

  private final int blockSize;
  private final int pipelineDepth;
  private final int uploadSlots;
  private final long keepAliveIntervalMillis;
  private final long tickIntervalMillis;
  private final int connectionTimeoutMillis;
  private final int socketBufferSize;
  private final RedialPolicy redialPolicy;

  private ClientConfig(Builder builder) {
    this.blockSize = builder.blockSize;
    this.pipelineDepth = builder.pipelineDepth;
    this.uploadSlots = builder.uploadSlots;
    this.keepAliveIntervalMillis = builder.keepAliveIntervalMillis;
    this.tickIntervalMillis = builder.tickIntervalMillis;
    this.connectionTimeoutMillis = builder.connectionTimeoutMillis;
    this.socketBufferSize = builder.socketBufferSize;
    this.redialPolicy = builder.redialPolicy;
  }

  public static ClientConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Size of the blocks requested from peers. */
  public int getBlockSize() {
    return this.blockSize;
  }

  /** Maximum number of requests in flight to one peer. */
  public int getPipelineDepth() {
    return this.pipelineDepth;
  }

  /** Maximum number of peers unchoked at once. */
  public int getUploadSlots() {
    return this.uploadSlots;
  }

  public long getKeepAliveIntervalMillis() {
    return this.keepAliveIntervalMillis;
  }

  public long getTickIntervalMillis() {
    return this.tickIntervalMillis;
  }

  public int getConnectionTimeoutMillis() {
    return this.connectionTimeoutMillis;
  }

  public int getSocketBufferSize() {
    return this.socketBufferSize;
  }

  public RedialPolicy getRedialPolicy() {
    return this.redialPolicy;
  }

  @Override
  public String toString() {
    return "ClientConfig{" +
            "blockSize=" + this.blockSize +
            ", pipelineDepth=" + this.pipelineDepth +
            ", uploadSlots=" + this.uploadSlots +
            ", keepAlive=" + this.keepAliveIntervalMillis + "ms" +
            ", tick=" + this.tickIntervalMillis + "ms" +
            ", connectTimeout=" + this.connectionTimeoutMillis + "ms" +
            ", socketBuffer=" + this.socketBufferSize +
            ", redial=" + this.redialPolicy +
            '}';
  }

  public static final class Builder {

    private int blockSize = Constants.DEFAULT_BLOCK_SIZE;
    private int pipelineDepth = Constants.DEFAULT_PIPELINE_DEPTH;
    private int uploadSlots = Constants.DEFAULT_UPLOAD_SLOTS;
    private long keepAliveIntervalMillis = Constants.DEFAULT_KEEP_ALIVE_INTERVAL_MILLIS;
    private long tickIntervalMillis = Constants.DEFAULT_TICK_INTERVAL_MILLIS;
    private int connectionTimeoutMillis = Constants.DEFAULT_CONNECTION_TIMEOUT_MILLIS;
    private int socketBufferSize = Constants.DEFAULT_SOCKET_BUFFER_SIZE;
    private RedialPolicy redialPolicy = RedialPolicy.NONE;

    private Builder() {
    }

    public Builder blockSize(int blockSize) {
      this.blockSize = blockSize;
      return this;
    }

    public Builder pipelineDepth(int pipelineDepth) {
      this.pipelineDepth = pipelineDepth;
      return this;
    }

    public Builder uploadSlots(int uploadSlots) {
      this.uploadSlots = uploadSlots;
      return this;
    }

    public Builder keepAliveIntervalMillis(long keepAliveIntervalMillis) {
      this.keepAliveIntervalMillis = keepAliveIntervalMillis;
      return this;
    }

    public Builder tickIntervalMillis(long tickIntervalMillis) {
      this.tickIntervalMillis = tickIntervalMillis;
      return this;
    }

    public Builder connectionTimeoutMillis(int connectionTimeoutMillis) {
      this.connectionTimeoutMillis = connectionTimeoutMillis;
      return this;
    }

    public Builder socketBufferSize(int socketBufferSize) {
      this.socketBufferSize = socketBufferSize;
      return this;
    }

    public Builder redialPolicy(RedialPolicy redialPolicy) {
      this.redialPolicy = Preconditions.checkNotNull(redialPolicy);
      return this;
    }

    /**
     * @throws IllegalArgumentException If a setting is out of range.
     */
    public ClientConfig build() {
      Preconditions.checkArgument(blockSize > 0 && blockSize <= Constants.MAX_BLOCK_SIZE,
              "Block size must be within 1..%s: %s", Constants.MAX_BLOCK_SIZE, blockSize);
      Preconditions.checkArgument(pipelineDepth > 0, "Pipeline depth must be positive: %s", pipelineDepth);
      Preconditions.checkArgument(uploadSlots >= 0, "Upload slots must not be negative: %s", uploadSlots);
      Preconditions.checkArgument(keepAliveIntervalMillis > 0, "Keep-alive interval must be positive");
      Preconditions.checkArgument(tickIntervalMillis > 0, "Tick interval must be positive");
      Preconditions.checkArgument(connectionTimeoutMillis >= 0, "Connection timeout must not be negative");
      Preconditions.checkArgument(socketBufferSize >= 0, "Socket buffer size must not be negative");
      return new ClientConfig(this);
    }
  }
}
