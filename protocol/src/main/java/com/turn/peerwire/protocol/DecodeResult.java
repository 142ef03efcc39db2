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
package com.turn.peerwire.protocol;

import javax.annotation.Nonnull;

/**
 * Outcome of {@link PeerMessage#decode(java.nio.ByteBuffer)}: either a
 * complete message along with the number of bytes its frame used, or the
 * indication that the frame isn't complete yet.
 */
public final class DecodeResult {

  private static final DecodeResult NEED_MORE_BYTES = new DecodeResult(null, 0);

  private final PeerMessage message;
  private final int consumed;

  private DecodeResult(PeerMessage message, int consumed) {
    this.message = message;
    this.consumed = consumed;
  }

  public static DecodeResult needMoreBytes() {
    return NEED_MORE_BYTES;
  }

  public static DecodeResult of(@Nonnull PeerMessage message, int consumed) {
    return new DecodeResult(message, consumed);
  }

  public boolean isComplete() {
    return this.message != null;
  }

  /**
   * @throws IllegalStateException If more bytes are needed.
   */
  @Nonnull
  public PeerMessage getMessage() {
    if (this.message == null) {
      throw new IllegalStateException("Frame is not complete");
    }
    return this.message;
  }

  /**
   * Size of the decoded frame, length field included. Zero when more bytes
   * are needed.
   */
  public int getConsumed() {
    return this.consumed;
  }

  @Override
  public String toString() {
    return this.isComplete() ? this.message + " (" + this.consumed + " bytes)" : "NeedMoreBytes";
  }
}
