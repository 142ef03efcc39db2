package com.turn.peerwire.common;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

public final class TorrentUtils {

  private TorrentUtils() {
  }

  /**
   * @param data for hashing
   * @return sha 1 hash of specified data
   */
  public static byte[] calculateSha1Hash(byte[] data) {
    return DigestUtils.sha1(data);
  }

  /**
   * Convert a byte string to a string containing a lowercase hexadecimal
   * representation of the original data.
   *
   * @param bytes The byte array to convert.
   */
  public static String byteArrayToHexString(byte[] bytes) {
    return Hex.encodeHexString(bytes);
  }

  /**
   * Parse a hexadecimal string (either case) back into bytes.
   *
   * @throws IllegalArgumentException If the string is not valid hexadecimal.
   */
  public static byte[] hexStringToByteArray(String hex) {
    try {
      return Hex.decodeHex(hex);
    } catch (DecoderException e) {
      throw new IllegalArgumentException("Invalid hexadecimal string: " + hex, e);
    }
  }

  /**
   * Number of <em>size</em>-sized chunks needed to cover <em>total</em>
   * bytes.
   */
  public static int chunkCount(long total, int size) {
    return (int) ((total + size - 1) / size);
  }

}
