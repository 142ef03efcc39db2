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
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Random;

/**
 * A 20-byte peer identifier, exchanged during the handshake.
 *
 * <p>
 * Any 20 bytes are accepted from remote peers. Locally generated ids follow
 * the Azureus convention <code>-XYabcd-</code> followed by random
 * characters, where <em>XY</em> identifies the client and <em>abcd</em> its
 * version.
 * </p>
 */
public final class PeerId {

  static final String BASE58_ALPHABET =
          "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

  private static final int RANDOM_SUFFIX_LENGTH = 12;

  private final byte[] id;

  private PeerId(byte[] id) {
    this.id = id;
  }

  @Nonnull
  public static PeerId of(@Nonnull byte[] id) {
    Preconditions.checkArgument(id.length == Constants.PIECE_HASH_SIZE,
            "Peer id must be %s bytes, got %s", Constants.PIECE_HASH_SIZE, id.length);
    return new PeerId(id.clone());
  }

  /**
   * Generate a random peer id for this client's own version.
   */
  @Nonnull
  public static PeerId random() {
    return random(Constants.CLIENT_IDENTIFIER,
            Constants.CLIENT_VERSION_MAJOR,
            Constants.CLIENT_VERSION_MINOR,
            Constants.CLIENT_VERSION_PATCH,
            new SecureRandom());
  }

  /**
   * Generate a random peer id.
   *
   * <p>
   * The version is written with base58 characters: one for the major
   * version (0-57), two for the minor version (0-3363) and one for the patch
   * version (0-57).
   * </p>
   *
   * @param client Two-character client identifier.
   * @throws IllegalArgumentException If a version part doesn't fit.
   */
  @Nonnull
  public static PeerId random(@Nonnull String client, int major, int minor, int patch,
                              @Nonnull Random random) {
    Preconditions.checkArgument(client.length() == 2, "Client identifier must be two characters: %s", client);
    Preconditions.checkArgument(major >= 0 && major < 58, "Major version %s doesn't fit one base58 character", major);
    Preconditions.checkArgument(minor >= 0 && minor < 58 * 58, "Minor version %s doesn't fit two base58 characters", minor);
    Preconditions.checkArgument(patch >= 0 && patch < 58, "Patch version %s doesn't fit one base58 character", patch);

    StringBuilder sb = new StringBuilder(Constants.PIECE_HASH_SIZE);
    sb.append('-').append(client)
            .append(BASE58_ALPHABET.charAt(major))
            .append(BASE58_ALPHABET.charAt(minor / 58))
            .append(BASE58_ALPHABET.charAt(minor % 58))
            .append(BASE58_ALPHABET.charAt(patch))
            .append('-');
    for (int i = 0; i < RANDOM_SUFFIX_LENGTH; i++) {
      sb.append(BASE58_ALPHABET.charAt(random.nextInt(BASE58_ALPHABET.length())));
    }
    return new PeerId(sb.toString().getBytes(Constants.BYTE_ENCODING));
  }

  public byte[] getBytes() {
    return this.id.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Arrays.equals(this.id, ((PeerId) o).id);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(this.id);
  }

  /**
   * Most clients use printable peer ids, so they are shown as text even
   * though that reads poorly for the few that don't.
   */
  @Override
  public String toString() {
    return new String(this.id, Constants.BYTE_ENCODING);
  }
}
