package com.turn.peerwire.common;

import org.testng.annotations.Test;

import java.util.Random;

import static org.testng.Assert.*;

@Test
public class PeerIdTest {

  public void versionIsWrittenInBase58() {
    PeerId peerId = PeerId.random("Rp", 22, 502, 11, new Random());
    String text = peerId.toString();
    assertEquals(text.length(), 20);
    assertTrue(text.startsWith("-RpP9fC-"), text);
    for (char c : text.substring(8).toCharArray()) {
      assertTrue(PeerId.BASE58_ALPHABET.indexOf(c) >= 0, "not base58: " + c);
    }
  }

  public void defaultPeerIdUsesClientIdentifier() {
    assertTrue(PeerId.random().toString().startsWith("-PW"));
    assertNotEquals(PeerId.random(), PeerId.random());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void majorVersionMustFitOneCharacter() {
    PeerId.random("Rp", 58, 0, 0, new Random());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void minorVersionMustFitTwoCharacters() {
    PeerId.random("Rp", 0, 58 * 58, 0, new Random());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void peerIdMustBeTwentyBytes() {
    PeerId.of(new byte[19]);
  }

  public void equalityIsByContent() {
    byte[] bytes = "-XX0000-abcdefghijkl".getBytes();
    PeerId peerId = PeerId.of(bytes);
    bytes[0] = 'Z';
    assertEquals(peerId, PeerId.of("-XX0000-abcdefghijkl".getBytes()));
    assertEquals(peerId.hashCode(), PeerId.of(peerId.getBytes()).hashCode());
  }
}
