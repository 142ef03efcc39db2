package com.turn.peerwire.cli;

import com.turn.peerwire.TempFiles;
import com.turn.peerwire.common.InfoHash;
import com.turn.peerwire.common.TorrentMeta;
import com.turn.peerwire.common.TorrentParser;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

@Test
public class PeerMainTest {

  private TempFiles tempFiles;
  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;

  @BeforeMethod
  public void setUp() {
    tempFiles = new TempFiles();
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
  }

  @AfterMethod
  public void tearDown() {
    tempFiles.cleanup();
  }

  private int run(String... args) {
    return PeerMain.run(args, new PrintStream(out, true), new PrintStream(err, true));
  }

  private static byte[] torrentFile(byte[] content, int pieceLength) throws IOException {
    TorrentMeta meta = TorrentMeta.fromContent(
            InfoHash.of(new byte[20]), pieceLength, content);
    ByteArrayOutputStream pieces = new ByteArrayOutputStream();
    for (int i = 0; i < meta.getPieceCount(); i++) {
      pieces.write(meta.getPieceHash(i));
    }
    ByteArrayOutputStream torrent = new ByteArrayOutputStream();
    torrent.write(("d4:infod6:lengthi" + content.length + "e4:name8:data.bin12:piece lengthi" +
            pieceLength + "e6:pieces" + pieces.size() + ":").getBytes(StandardCharsets.US_ASCII));
    torrent.write(pieces.toByteArray());
    torrent.write("ee".getBytes(StandardCharsets.US_ASCII));
    return torrent.toByteArray();
  }

  public void noCommand() {
    assertEquals(run(), PeerMain.EXIT_USAGE);
    assertTrue(err.toString().contains("usage"));
  }

  public void help() {
    assertEquals(run("--help"), PeerMain.EXIT_OK);
    assertTrue(out.toString().contains("leech"));
  }

  public void unknownCommand() {
    assertEquals(run("share", "--info-hash", "00", "--torrent", "x.torrent"), PeerMain.EXIT_USAGE);
    assertTrue(err.toString().contains("Unknown command"));
  }

  public void leechNeedsItsOptions() {
    assertEquals(run("leech", "--info-hash", "00", "--torrent", "x.torrent"), PeerMain.EXIT_USAGE);
    assertEquals(run("leech", "--port", "abc"), PeerMain.EXIT_USAGE);
  }

  public void infoHashMustMatchTheTorrent() throws IOException {
    byte[] content = TempFiles.randomBytes(100);
    File torrent = tempFiles.createTempFile("data.torrent", torrentFile(content, 32));
    File data = tempFiles.createTempFile("data.bin", content);

    int code = run("seed", "--info-hash", "0000000000000000000000000000000000000000",
            "--torrent", torrent.getAbsolutePath(), "--data", data.getAbsolutePath());
    assertEquals(code, PeerMain.EXIT_ERROR);
    assertTrue(err.toString().contains("Info hash mismatch"), err.toString());

    assertEquals(run("seed", "--info-hash", "not-hex",
            "--torrent", torrent.getAbsolutePath(), "--data", data.getAbsolutePath()), PeerMain.EXIT_ERROR);
  }

  public void leechingCompleteFileEndsRightAway() throws IOException {
    byte[] content = TempFiles.randomBytes(100);
    byte[] torrentBytes = torrentFile(content, 32);
    File torrent = tempFiles.createTempFile("data.torrent", torrentBytes);
    File output = tempFiles.createTempFile("data.bin", content);
    String infoHash = new TorrentParser().parse(torrentBytes).getInfoHash().getHexString();

    int code = run("leech", "--ip", "127.0.0.1", "--port", "1", "--info-hash", infoHash.toUpperCase(),
            "--torrent", torrent.getAbsolutePath(), "--output", output.getAbsolutePath());
    assertEquals(code, PeerMain.EXIT_OK, err.toString());
    assertTrue(out.toString().contains("already complete"));
  }

  public void leechTimesOutWithSilentPeer() throws IOException {
    byte[] content = TempFiles.randomBytes(100);
    byte[] torrentBytes = torrentFile(content, 32);
    File torrent = tempFiles.createTempFile("data.torrent", torrentBytes);
    File output = new File(tempFiles.createTempDir(), "data.bin");
    String infoHash = new TorrentParser().parse(torrentBytes).getInfoHash().getHexString();

    // Connections land in the backlog and never get a handshake.
    ServerSocket silent = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    try {
      int code = run("leech", "--ip", "127.0.0.1", "--port", String.valueOf(silent.getLocalPort()),
              "--info-hash", infoHash, "--torrent", torrent.getAbsolutePath(),
              "--output", output.getAbsolutePath(), "--timeout", "1");
      assertEquals(code, PeerMain.EXIT_TIMEOUT);
      assertTrue(out.toString().contains("0/4 pieces"), out.toString());
    } finally {
      silent.close();
    }
  }

  @Test(timeOut = 60000)
  public void leechGivesUpWhenTheSeederIsUnreachable() throws IOException {
    byte[] content = TempFiles.randomBytes(100);
    byte[] torrentBytes = torrentFile(content, 32);
    File torrent = tempFiles.createTempFile("data.torrent", torrentBytes);
    File output = new File(tempFiles.createTempDir(), "data.bin");
    String infoHash = new TorrentParser().parse(torrentBytes).getInfoHash().getHexString();

    ServerSocket closed = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    int port = closed.getLocalPort();
    closed.close();

    int code = run("leech", "--ip", "127.0.0.1", "--port", String.valueOf(port), "--info-hash", infoHash,
            "--torrent", torrent.getAbsolutePath(), "--output", output.getAbsolutePath());
    assertEquals(code, PeerMain.EXIT_ERROR);
    assertTrue(out.toString().contains("No peer left with 0/4 pieces"), out.toString());
  }
}
