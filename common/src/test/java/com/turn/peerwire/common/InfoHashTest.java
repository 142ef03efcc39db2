package com.turn.peerwire.common;

import org.testng.annotations.Test;

import static org.testng.Assert.*;

@Test
public class InfoHashTest {

  private static final String HEX = "0071a191ea94274b6c6bec3b2415d1ed06b232c1";

  public void hexStringIsLowercase() {
    InfoHash infoHash = InfoHash.fromHexString(HEX.toUpperCase());
    assertEquals(infoHash.getHexString(), HEX);
    assertEquals(infoHash.toString(), HEX);
    assertEquals(infoHash.getBytes()[1], (byte) 0x71);
  }

  public void equalityIsByContent() {
    assertEquals(InfoHash.fromHexString(HEX), InfoHash.of(TorrentUtils.hexStringToByteArray(HEX)));
    assertNotEquals(InfoHash.fromHexString(HEX), InfoHash.of(new byte[20]));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void rejectsShortHash() {
    InfoHash.fromHexString("0071a191");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void rejectsNonHex() {
    InfoHash.fromHexString("zz71a191ea94274b6c6bec3b2415d1ed06b232c1");
  }
}
