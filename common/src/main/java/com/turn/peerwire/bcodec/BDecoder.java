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

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;


/**
 * B-encoding decoder.
 *
 * <p>
 * A b-encoded byte stream can represent byte arrays, numbers, lists and maps
 * (dictionaries). This class implements a decoder of such buffers into
 * {@link BEValue}s. Every decoded value keeps a copy of the exact bytes it
 * was read from, see {@link BEValue#getEncoded()}.
 * </p>
 *
 * @author mpetazzoni
 * @see <a href="http://en.wikipedia.org/wiki/Bencode">B-encoding specification</a>
 */
public class BDecoder {

  private final ByteBuffer data;

  /**
   * Initializes a new BDecoder reading from the current position of the
   * given buffer.
   */
  public BDecoder(ByteBuffer data) {
    this.data = data.slice();
  }

  /**
   * Decode the root member of a B-encoded byte array.
   */
  public static BEValue bdecode(byte[] data) throws InvalidBEncodingException {
    return new BDecoder(ByteBuffer.wrap(data)).bdecode();
  }

  /**
   * Decode the next b-encoded value.
   *
   * @throws InvalidBEncodingException If the data isn't valid b-encoding or
   * ends in the middle of a value.
   */
  public BEValue bdecode() throws InvalidBEncodingException {
    int start = this.data.position();
    Object value;
    int indicator = this.peek();
    if (indicator >= '0' && indicator <= '9') {
      value = this.bdecodeBytes();
    } else if (indicator == 'i') {
      value = this.bdecodeNumber();
    } else if (indicator == 'l') {
      value = this.bdecodeList();
    } else if (indicator == 'd') {
      value = this.bdecodeMap();
    } else {
      throw new InvalidBEncodingException("Unknown indicator '" + (char) indicator +
              "' at offset " + start);
    }

    byte[] encoded = new byte[this.data.position() - start];
    ByteBuffer span = this.data.duplicate();
    span.position(start);
    span.get(encoded);
    return new BEValue(value, encoded);
  }

  private byte[] bdecodeBytes() throws InvalidBEncodingException {
    long length = this.readDigits(':');
    if (length > this.data.remaining()) {
      throw new InvalidBEncodingException("Byte string of " + length +
              " bytes overruns the data (" + this.data.remaining() + " left)");
    }
    byte[] result = new byte[(int) length];
    this.data.get(result);
    return result;
  }

  private Number bdecodeNumber() throws InvalidBEncodingException {
    this.expect('i');
    StringBuilder digits = new StringBuilder();
    int c = this.read();
    if (c == '-') {
      digits.append('-');
      c = this.read();
      if (c == '0') {
        throw new InvalidBEncodingException("Negative zero not allowed");
      }
    }
    if (c == '0') {
      this.expect('e');
      return 0L;
    }
    if (c < '1' || c > '9') {
      throw new InvalidBEncodingException("Invalid Integer start '" + (char) c + "'");
    }
    while (c >= '0' && c <= '9') {
      digits.append((char) c);
      c = this.read();
    }
    if (c != 'e') {
      throw new InvalidBEncodingException("Integer should end with 'e'");
    }

    BigInteger number = new BigInteger(digits.toString());
    if (number.bitLength() < Long.SIZE) {
      return number.longValue();
    }
    return number;
  }

  private List<BEValue> bdecodeList() throws InvalidBEncodingException {
    this.expect('l');
    List<BEValue> result = new ArrayList<BEValue>();
    while (this.peek() != 'e') {
      result.add(this.bdecode());
    }
    this.expect('e');
    return result;
  }

  private Map<String, BEValue> bdecodeMap() throws InvalidBEncodingException {
    this.expect('d');
    Map<String, BEValue> result = new HashMap<String, BEValue>();
    while (this.peek() != 'e') {
      // Dictionary keys are always strings.
      String key = new String(this.bdecodeBytes(), StandardCharsets.UTF_8);
      result.put(key, this.bdecode());
    }
    this.expect('e');
    return result;
  }

  /**
   * Reads a non-negative decimal number up to (and including) the given
   * terminator. Leading zeros are rejected.
   */
  private long readDigits(char terminator) throws InvalidBEncodingException {
    long value = 0;
    int count = 0;
    int c = this.read();
    while (c != terminator) {
      if (c < '0' || c > '9') {
        throw new InvalidBEncodingException("Number expected, not '" + (char) c + "'");
      }
      if (count == 1 && value == 0) {
        throw new InvalidBEncodingException("Leading zero in length");
      }
      value = value * 10 + (c - '0');
      if (value > Integer.MAX_VALUE) {
        throw new InvalidBEncodingException("Length is too large");
      }
      count++;
      c = this.read();
    }
    if (count == 0) {
      throw new InvalidBEncodingException("Empty length");
    }
    return value;
  }

  private void expect(char expected) throws InvalidBEncodingException {
    int c = this.read();
    if (c != expected) {
      throw new InvalidBEncodingException("Expected '" + expected + "', not '" + (char) c + "'");
    }
  }

  private int peek() throws InvalidBEncodingException {
    if (!this.data.hasRemaining()) {
      throw new InvalidBEncodingException("Unexpected end of data");
    }
    return this.data.get(this.data.position()) & 0xFF;
  }

  private int read() throws InvalidBEncodingException {
    if (!this.data.hasRemaining()) {
      throw new InvalidBEncodingException("Unexpected end of data");
    }
    return this.data.get() & 0xFF;
  }
}
