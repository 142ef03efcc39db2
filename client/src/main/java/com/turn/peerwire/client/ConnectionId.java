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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifies one connection for the lifetime of a torrent, whether or not
 * the remote peer id is known yet.
 */
public final class ConnectionId {

  private static final AtomicLong ourSequence = new AtomicLong();

  private final long id;

  private ConnectionId(long id) {
    this.id = id;
  }

  public static ConnectionId next() {
    return new ConnectionId(ourSequence.incrementAndGet());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return this.id == ((ConnectionId) o).id;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(this.id);
  }

  @Override
  public String toString() {
    return "conn#" + this.id;
  }
}
