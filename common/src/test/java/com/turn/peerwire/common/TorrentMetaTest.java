package com.turn.peerwire.common;

import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.testng.Assert.*;

@Test
public class TorrentMetaTest {

  private static final InfoHash INFO_HASH = InfoHash.of(new byte[20]);

  public void lastPieceMayBeShorter() {
    byte[] content = new byte[40];
    Arrays.fill(content, (byte) 7);
    TorrentMeta meta = TorrentMeta.fromContent(INFO_HASH, 16, content);

    assertEquals(meta.getPieceCount(), 3);
    assertEquals(meta.getPieceLength(0), 16);
    assertEquals(meta.getPieceLength(2), 8);
    assertEquals(meta.getTotalLength(), 40);
    assertTrue(meta.matches(2, Arrays.copyOfRange(content, 32, 40)));
    assertFalse(meta.matches(2, Arrays.copyOfRange(content, 0, 16)));
  }

  public void validIndexes() {
    TorrentMeta meta = TorrentMeta.fromContent(INFO_HASH, 4, new byte[8]);
    assertTrue(meta.isValidPieceIndex(1));
    assertFalse(meta.isValidPieceIndex(2));
    assertFalse(meta.isValidPieceIndex(-1));
  }

  @Test(expectedExceptions = IndexOutOfBoundsException.class)
  public void pieceLengthOfUnknownPiece() {
    TorrentMeta.fromContent(INFO_HASH, 4, new byte[8]).getPieceLength(2);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void hashCountMustCoverLength() {
    TorrentMeta.create(INFO_HASH, 4, 9, Arrays.asList(new byte[20], new byte[20]));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void hashesMustBeTwentyBytes() {
    TorrentMeta.create(INFO_HASH, 4, 4, Collections.singletonList(new byte[19]));
  }
}
