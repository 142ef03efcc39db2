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

/**
 * A block of a piece, as requested from a peer: piece index, offset in the
 * piece and length.
 */
public final class BlockRequest {

  private final int piece;
  private final int offset;
  private final int length;

  public BlockRequest(int piece, int offset, int length) {
    this.piece = piece;
    this.offset = offset;
    this.length = length;
  }

  public int getPiece() {
    return this.piece;
  }

  public int getOffset() {
    return this.offset;
  }

  public int getLength() {
    return this.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BlockRequest that = (BlockRequest) o;
    return this.piece == that.piece && this.offset == that.offset && this.length == that.length;
  }

  @Override
  public int hashCode() {
    int result = this.piece;
    result = 31 * result + this.offset;
    result = 31 * result + this.length;
    return result;
  }

  @Override
  public String toString() {
    return "#" + this.piece + " (" + this.length + "@" + this.offset + ")";
  }
}
