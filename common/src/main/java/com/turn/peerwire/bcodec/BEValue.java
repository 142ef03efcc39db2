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
package com.turn.peerwire.bcodec;

import javax.annotation.CheckForNull;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;


/**
 * A type-agnostic container for B-encoded values.
 *
 * <p>
 * Values produced by the {@link BDecoder} also remember the exact bytes
 * they were decoded from, which is what the info hash of a torrent is
 * computed over.
 * </p>
 *
 * @author mpetazzoni
 */
public class BEValue {

  /**
   * The B-encoded value can be a byte array, a Number, a List or a Map.
   * Lists and Maps contains BEValues too.
   */
  private final Object value;

  @CheckForNull
  private final byte[] encoded;

  BEValue(Object value, @CheckForNull byte[] encoded) {
    this.value = value;
    this.encoded = encoded;
  }

  public BEValue(Number value) {
    this((Object) value, null);
  }

  /**
   * Returns the bytes this value was decoded from.
   *
   * @throws IllegalStateException If the value wasn't built by a decoder.
   */
  public byte[] getEncoded() {
    if (this.encoded == null) {
      throw new IllegalStateException("Value was not decoded from a B-encoded stream");
    }
    return this.encoded.clone();
  }

  /**
   * Returns this BEValue as a String, interpreted as UTF-8.
   *
   * @throws InvalidBEncodingException If the value is not a byte[].
   */
  public String getString() throws InvalidBEncodingException {
    return new String(this.getBytes(), StandardCharsets.UTF_8);
  }

  /**
   * Returns this BEValue as a byte[].
   *
   * @throws InvalidBEncodingException If the value is not a byte[].
   */
  public byte[] getBytes() throws InvalidBEncodingException {
    if (this.value instanceof byte[]) {
      return (byte[]) this.value;
    }
    throw new InvalidBEncodingException("Expected byte[], got " + this.describe());
  }

  /**
   * Returns this BEValue as a Number.
   *
   * @throws InvalidBEncodingException If the value is not a {@link Number}.
   */
  public Number getNumber() throws InvalidBEncodingException {
    if (this.value instanceof Number) {
      return (Number) this.value;
    }
    throw new InvalidBEncodingException("Expected Number, got " + this.describe());
  }

  public int getInt() throws InvalidBEncodingException {
    return this.getNumber().intValue();
  }

  public long getLong() throws InvalidBEncodingException {
    return this.getNumber().longValue();
  }

  /**
   * Returns this BEValue as a List of BEValues.
   *
   * @throws InvalidBEncodingException If the value is not a list.
   */
  @SuppressWarnings("unchecked")
  public List<BEValue> getList() throws InvalidBEncodingException {
    if (this.value instanceof List) {
      return (List<BEValue>) this.value;
    }
    throw new InvalidBEncodingException("Expected List<BEValue>, got " + this.describe());
  }

  /**
   * Returns this BEValue as a Map of String keys and BEValue values.
   *
   * @throws InvalidBEncodingException If the value is not a map.
   */
  @SuppressWarnings("unchecked")
  public Map<String, BEValue> getMap() throws InvalidBEncodingException {
    if (this.value instanceof Map) {
      return (Map<String, BEValue>) this.value;
    }
    throw new InvalidBEncodingException("Expected Map<String, BEValue>, got " + this.describe());
  }

  private String describe() {
    return this.value == null ? "null" : this.value.getClass().getSimpleName();
  }
}
