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

/**
 * Decides whether a dialed peer is dialed again once its connection is
 * lost.
 *
 * <p>
 * Connection actors never retry on their own; the torrent actor asks its
 * policy after every disconnection of a connection it dialed.
 * </p>
 */
public abstract class RedialPolicy {

  /** Never redial. */
  public static final RedialPolicy NONE = new RedialPolicy() {
    @Override
    public long getDelayMillis(int attempt) {
      return -1;
    }

    @Override
    public String toString() {
      return "NONE";
    }
  };

  /**
   * @param attempt Number of the redial to come, starting at 1.
   * @return the delay before redialing, or a negative value to give up.
   */
  public abstract long getDelayMillis(int attempt);

  /**
   * Redial after a fixed delay, at most <em>maxAttempts</em> times in a row.
   * The count starts over once a redial reaches the handshake.
   */
  public static RedialPolicy fixedBackoff(final long delayMillis, final int maxAttempts) {
    Preconditions.checkArgument(delayMillis >= 0, "Negative delay: %s", delayMillis);
    Preconditions.checkArgument(maxAttempts > 0, "At least one attempt is needed: %s", maxAttempts);
    return new RedialPolicy() {
      @Override
      public long getDelayMillis(int attempt) {
        return attempt <= maxAttempts ? delayMillis : -1;
      }

      @Override
      public String toString() {
        return "FIXED(" + delayMillis + "ms x" + maxAttempts + ")";
      }
    };
  }
}
