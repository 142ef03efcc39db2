package com.turn.peerwire.client;

import com.turn.peerwire.TempFiles;
import com.turn.peerwire.Utils;
import com.turn.peerwire.WaitFor;
import com.turn.peerwire.client.storage.PieceStorage;
import com.turn.peerwire.client.storage.PieceStorageImpl;
import com.turn.peerwire.common.InfoHash;
import com.turn.peerwire.common.TorrentMeta;
import org.apache.commons.io.FileUtils;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.File;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.testng.Assert.*;

/**
 * Downloads over real sockets on the loopback interface.
 */
@Test(timeOut = 60000)
public class TorrentTest {

  private TempFiles tempFiles;
  private final List<Torrent> torrents = new ArrayList<Torrent>();

  @BeforeClass
  public void configureLogging() {
    Utils.configureLogging();
  }

  @BeforeMethod
  public void setUp() {
    tempFiles = new TempFiles();
  }

  @AfterMethod
  public void tearDown() {
    for (Torrent torrent : torrents) {
      torrent.stop();
    }
    torrents.clear();
    tempFiles.cleanup();
  }

  private Torrent track(Torrent torrent) {
    torrents.add(torrent);
    return torrent;
  }

  private static InetSocketAddress loopback() {
    return new InetSocketAddress(InetAddress.getLoopbackAddress(), 0);
  }

  public void downloadFromSeederInMemory() throws Exception {
    byte[] content = TempFiles.randomBytes(5 * 32 * 1024 + 1000);
    TorrentMeta meta = TorrentMeta.fromContent(InfoHash.of(TempFiles.randomBytes(20)), 32 * 1024, content);

    BitSet all = new BitSet();
    all.set(0, meta.getPieceCount());
    Torrent seeder = track(new Torrent(meta, new PieceStorageImpl(ByteArrayStorage.of(content), all, meta),
            ClientConfig.defaults()));
    ByteArrayStorage leecherBytes = new ByteArrayStorage(content.length);
    PieceStorage leecherStorage = new PieceStorageImpl(leecherBytes, new BitSet(), meta);
    Torrent leecher = track(new Torrent(meta, leecherStorage, ClientConfig.defaults()));

    final CountDownLatch done = new CountDownLatch(1);
    final AtomicInteger pieces = new AtomicInteger();
    leecher.addListener(new TorrentListenerAdapter() {
      @Override
      public void pieceDownloaded(int pieceIndex, PeerInformation peerInformation) {
        pieces.incrementAndGet();
      }

      @Override
      public void downloadComplete() {
        done.countDown();
      }
    });

    seeder.start();
    InetSocketAddress address = seeder.listen(loopback());
    leecher.start();
    leecher.connect(address);

    assertTrue(done.await(30, TimeUnit.SECONDS), "download didn't complete");
    assertTrue(leecher.isComplete());
    assertEquals(pieces.get(), meta.getPieceCount());
    assertEquals(leecher.getCompletedPieces().cardinality(), meta.getPieceCount());
    assertEquals(leecherBytes.getData(), content);
    assertEquals(leecher.getConnectedPeerCount(), 1);
    assertEquals(seeder.getConnectedPeerCount(), 1);
  }

  public void downloadToFile() throws Exception {
    byte[] content = TempFiles.randomBytes(300 * 1024);
    TorrentMeta meta = TorrentMeta.fromContent(InfoHash.of(TempFiles.randomBytes(20)), 64 * 1024, content);
    File seedFile = tempFiles.createTempFile("seed.bin", content);
    File output = new File(tempFiles.createTempDir(), "download.bin");

    Torrent seeder = track(Torrent.open(meta, seedFile, ClientConfig.defaults()));
    assertTrue(seeder.isComplete());
    Torrent leecher = track(Torrent.open(meta, output, ClientConfig.defaults()));
    assertFalse(leecher.isComplete());

    final CountDownLatch done = new CountDownLatch(1);
    leecher.addListener(new TorrentListenerAdapter() {
      @Override
      public void downloadComplete() {
        done.countDown();
      }
    });

    seeder.start();
    leecher.start();
    // The leecher listens this time, the seeder dials.
    InetSocketAddress address = leecher.listen(loopback());
    seeder.connect(address);

    assertTrue(done.await(30, TimeUnit.SECONDS), "download didn't complete");
    leecher.stop();
    assertEquals(FileUtils.readFileToByteArray(output), content);
    assertFalse(new File(output.getAbsolutePath() + ".part").exists());
  }

  public void stoppingClosesConnections() throws Exception {
    byte[] content = TempFiles.randomBytes(64 * 1024);
    TorrentMeta meta = TorrentMeta.fromContent(InfoHash.of(TempFiles.randomBytes(20)), 16 * 1024, content);
    final Torrent first = track(new Torrent(meta, new PieceStorageImpl(new ByteArrayStorage(content.length),
            new BitSet(), meta), ClientConfig.defaults()));
    final Torrent second = track(new Torrent(meta, new PieceStorageImpl(new ByteArrayStorage(content.length),
            new BitSet(), meta), ClientConfig.defaults()));

    first.start();
    second.start();
    second.connect(first.listen(loopback()));
    assertTrue(new WaitFor() {
      @Override
      protected boolean condition() {
        return first.getConnectedPeerCount() == 1 && second.getConnectedPeerCount() == 1;
      }
    }.isMyResult());

    second.stop();
    assertTrue(new WaitFor() {
      @Override
      protected boolean condition() {
        return first.getConnectedPeerCount() == 0;
      }
    }.isMyResult());
  }

  public void dialFailureLeavesTorrentUsable() throws Exception {
    byte[] content = TempFiles.randomBytes(16 * 1024);
    TorrentMeta meta = TorrentMeta.fromContent(InfoHash.of(TempFiles.randomBytes(20)), 16 * 1024, content);
    Torrent torrent = track(new Torrent(meta, new PieceStorageImpl(new ByteArrayStorage(content.length),
            new BitSet(), meta), ClientConfig.builder().connectionTimeoutMillis(1000).build()));
    torrent.start();

    // Nothing listens on the port of a closed server.
    Torrent other = track(new Torrent(meta, new PieceStorageImpl(new ByteArrayStorage(content.length),
            new BitSet(), meta), ClientConfig.defaults()));
    InetSocketAddress address = other.listen(loopback());
    other.stop();

    torrent.connect(address);
    Thread.sleep(500);
    assertEquals(torrent.getConnectedPeerCount(), 0);
    assertFalse(torrent.isComplete());
  }
}
