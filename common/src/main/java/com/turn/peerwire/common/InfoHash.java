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
package com.turn.peerwire.common;

import com.google.common.base.Preconditions;
import com.turn.peerwire.Constants;

import javax.annotation.Nonnull;
import java.util.Arrays;

/**
 * The 20-byte SHA-1 digest identifying a torrent.
 *
 * <p>
 * Two peers only exchange data once they agreed, during the handshake, on
 * the same info hash. It is usually written as 40 hexadecimal characters.
 * </p>
 */
public final class InfoHash {

  private final byte[] hash;

  private InfoHash(byte[] hash) {
    this.hash = hash;
  }

  @Nonnull
  public static InfoHash of(@Nonnull byte[] hash) {
    Preconditions.checkArgument(hash.length == Constants.PIECE_HASH_SIZE,
            "Info hash must be %s bytes, got %s", Constants.PIECE_HASH_SIZE, hash.length);
    return new InfoHash(hash.clone());
  }

  /**
   * Parse a 40-character hexadecimal info hash.
   *
   * @throws IllegalArgumentException If the string isn't 20 bytes of hex.
   */
  @Nonnull
  public static InfoHash fromHexString(@Nonnull String hex) {
    return of(TorrentUtils.hexStringToByteArray(hex.trim()));
  }

  public byte[] getBytes() {
    return this.hash.clone();
  }

  public String getHexString() {
    return TorrentUtils.byteArrayToHexString(this.hash);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Arrays.equals(this.hash, ((InfoHash) o).hash);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(this.hash);
  }

  @Override
  public String toString() {
    return this.getHexString();
  }
}
