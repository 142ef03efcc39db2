package com.turn.peerwire.client;

import com.turn.peerwire.TempFiles;
import com.turn.peerwire.client.network.TransportStream;
import com.turn.peerwire.client.storage.PieceStorage;
import com.turn.peerwire.client.storage.PieceStorageImpl;
import com.turn.peerwire.common.InfoHash;
import com.turn.peerwire.common.PeerId;
import com.turn.peerwire.common.TorrentMeta;
import com.turn.peerwire.protocol.PeerMessage;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Random;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.testng.Assert.*;

@Test
public class TorrentActorTest {

  private static final int BLOCK = 16 * 1024;

  private final Random random = new Random(42);
  private FakeConnectionFactory factory;
  private TorrentListener listener;
  private MockTimeService timeService;
  private int nextPort;

  @BeforeMethod
  public void setUp() {
    factory = new FakeConnectionFactory();
    listener = mock(TorrentListener.class);
    timeService = new MockTimeService();
    nextPort = 7000;
  }

  private static TorrentMeta meta(byte[] content, int pieceLength) {
    return TorrentMeta.fromContent(InfoHash.of(new byte[20]), pieceLength, content);
  }

  private static PieceStorage emptyStorage(TorrentMeta meta) {
    return new PieceStorageImpl(new ByteArrayStorage((int) meta.getTotalLength()), new BitSet(), meta);
  }

  private static PieceStorage fullStorage(TorrentMeta meta, byte[] content) {
    BitSet all = new BitSet();
    all.set(0, meta.getPieceCount());
    return new PieceStorageImpl(ByteArrayStorage.of(content), all, meta);
  }

  private TorrentActor actor(TorrentMeta meta, PieceStorage storage, ClientConfig config) {
    return new TorrentActor(meta, randomPeerId(), storage, config, factory, listener, timeService);
  }

  private TorrentActor actor(TorrentMeta meta, PieceStorage storage) {
    return actor(meta, storage, ClientConfig.defaults());
  }

  private PeerId randomPeerId() {
    return PeerId.random("Ts", 0, 1, 0, random);
  }

  private FakeConnection connect(TorrentActor actor, PeerId peerId) {
    actor.handle(new TorrentCommand.AddConnection(mock(TransportStream.class)));
    FakeConnection connection = factory.last();
    assertTrue(connection.isStarted());
    actor.handle(new PeerEvent.HandshakeCompleted(connection.getId(), peerId,
            new InetSocketAddress("127.0.0.1", nextPort++)));
    return connection;
  }

  private static void receive(TorrentActor actor, FakeConnection from, PeerMessage message) {
    actor.handle(new PeerEvent.MessageReceived(from.getId(), message));
  }

  private static BitSet pieces(int... indices) {
    BitSet result = new BitSet();
    for (int index : indices) {
      result.set(index);
    }
    return result;
  }

  private static void answer(TorrentActor actor, FakeConnection from, byte[] content, int pieceLength,
                             PeerMessage.RequestMessage request) {
    int start = request.getPiece() * pieceLength + request.getOffset();
    receive(actor, from, PeerMessage.PieceMessage.craft(request.getPiece(), request.getOffset(),
            Arrays.copyOfRange(content, start, start + request.getLength())));
  }

  public void fourPieceDownload() throws IOException {
    byte[] content = TempFiles.randomBytes(4 * BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    PieceStorage storage = emptyStorage(meta);
    TorrentActor actor = actor(meta, storage);

    FakeConnection seeder = connect(actor, randomPeerId());
    List<PeerMessage.BitfieldMessage> bitfields = seeder.sent(PeerMessage.Type.BITFIELD);
    assertEquals(bitfields.size(), 1);
    assertTrue(bitfields.get(0).getBitfield().isEmpty());
    assertEquals(seeder.sent().size(), 1);

    receive(actor, seeder, PeerMessage.BitfieldMessage.craft(pieces(0, 1, 2, 3), 4));
    assertEquals(seeder.sent(PeerMessage.Type.INTERESTED).size(), 1);
    assertTrue(seeder.sent(PeerMessage.Type.REQUEST).isEmpty(), "choked, no request");

    receive(actor, seeder, PeerMessage.UnchokeMessage.craft());
    List<PeerMessage.RequestMessage> requests = seeder.sent(PeerMessage.Type.REQUEST);
    assertEquals(requests.size(), 4);
    for (int i = 0; i < 4; i++) {
      assertEquals(requests.get(i).getPiece(), i);
      assertEquals(requests.get(i).getOffset(), 0);
      assertEquals(requests.get(i).getLength(), BLOCK);
    }

    answer(actor, seeder, content, BLOCK, requests.get(0));
    PieceTable table = actor.getPieceTable();
    assertEquals(table.getState(0), PieceState.VERIFIED);
    for (int i = 1; i < 4; i++) {
      assertEquals(table.getState(i), PieceState.MISSING);
    }
    assertEquals(seeder.sent(PeerMessage.Type.HAVE).size(), 1);
    assertFalse(actor.isComplete());

    for (PeerMessage.RequestMessage request : requests.subList(1, 4)) {
      answer(actor, seeder, content, BLOCK, request);
    }

    List<PeerMessage.HaveMessage> haves = seeder.sent(PeerMessage.Type.HAVE);
    assertEquals(haves.size(), 4);
    assertEquals(seeder.sent(PeerMessage.Type.NOT_INTERESTED).size(), 1);
    assertTrue(actor.isComplete());
    assertTrue(storage.isFinished());
    for (int i = 0; i < 4; i++) {
      assertEquals(storage.readPiecePart(i, 0, BLOCK), Arrays.copyOfRange(content, i * BLOCK, (i + 1) * BLOCK));
    }
    verify(listener, times(4)).pieceDownloaded(anyInt(), any(PeerInformation.class));
    verify(listener, times(1)).downloadComplete();
  }

  public void pipelineIsCapped() {
    byte[] content = TempFiles.randomBytes(16 * BLOCK);
    TorrentMeta meta = meta(content, 16 * BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta), ClientConfig.builder().pipelineDepth(5).build());

    FakeConnection seeder = connect(actor, randomPeerId());
    receive(actor, seeder, PeerMessage.BitfieldMessage.craft(pieces(0), 1));
    receive(actor, seeder, PeerMessage.UnchokeMessage.craft());

    List<PeerMessage.RequestMessage> requests = seeder.sent(PeerMessage.Type.REQUEST);
    assertEquals(requests.size(), 5);
    PeerState peer = actor.getPeer(seeder.getId());
    assertNotNull(peer);
    assertEquals(peer.getInFlight().size(), 5);

    answer(actor, seeder, content, 16 * BLOCK, requests.get(0));
    assertEquals(seeder.sent(PeerMessage.Type.REQUEST).size(), 6);
    assertEquals(peer.getInFlight().size(), 5);

    // Ticks don't overfill the pipeline either.
    actor.handle(new TorrentCommand.Tick());
    assertEquals(peer.getInFlight().size(), 5);
  }

  public void disconnectReleasesInFlightRequests() {
    byte[] content = TempFiles.randomBytes(4 * 4 * BLOCK);
    TorrentMeta meta = meta(content, 4 * BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta));

    FakeConnection first = connect(actor, randomPeerId());
    receive(actor, first, PeerMessage.BitfieldMessage.craft(pieces(2), 4));
    receive(actor, first, PeerMessage.UnchokeMessage.craft());
    List<PeerMessage.RequestMessage> issued = first.sent(PeerMessage.Type.REQUEST);
    assertEquals(issued.size(), 4);
    assertEquals(actor.getPieceTable().getAssignedCount(), 4);

    answer(actor, first, content, 4 * BLOCK, issued.get(0));
    answer(actor, first, content, 4 * BLOCK, issued.get(1));
    assertEquals(actor.getPieceTable().getState(2), PieceState.IN_PROGRESS);

    actor.handle(new PeerEvent.Disconnected(first.getId(), "connection reset"));
    PieceTable table = actor.getPieceTable();
    assertEquals(table.getAssignedCount(), 0);
    assertEquals(table.getReceivedBlockCount(2), 2);
    assertEquals(table.getState(2), PieceState.IN_PROGRESS);
    assertEquals(actor.getConnectedPeerCount(), 0);
    verify(listener).peerDisconnected(any(PeerInformation.class));

    FakeConnection second = connect(actor, randomPeerId());
    receive(actor, second, PeerMessage.HaveMessage.craft(2));
    receive(actor, second, PeerMessage.UnchokeMessage.craft());
    List<PeerMessage.RequestMessage> requests = second.sent(PeerMessage.Type.REQUEST);
    assertEquals(requests.size(), 2);
    assertEquals(requests.get(0).getPiece(), 2);
    assertEquals(requests.get(0).getOffset(), 2 * BLOCK);
    assertEquals(requests.get(1).getPiece(), 2);
    assertEquals(requests.get(1).getOffset(), 3 * BLOCK);

    answer(actor, second, content, 4 * BLOCK, requests.get(0));
    answer(actor, second, content, 4 * BLOCK, requests.get(1));
    assertEquals(table.getState(2), PieceState.VERIFIED);
  }

  public void emptyBitfieldIsSentAfterHandshake() {
    byte[] content = TempFiles.randomBytes(10 * BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta));

    FakeConnection peer = connect(actor, randomPeerId());
    List<PeerMessage> sent = peer.sent();
    assertEquals(sent.size(), 1);
    assertEquals(sent.get(0).getType(), PeerMessage.Type.BITFIELD);
    PeerMessage.BitfieldMessage bitfield = (PeerMessage.BitfieldMessage) sent.get(0);
    assertTrue(bitfield.getBitfield().isEmpty());
    // Two bytes for ten pieces after the length prefix and the tag.
    assertEquals(bitfield.getData().remaining(), 4 + 1 + 2);
  }

  public void chokeReleasesInFlightRequests() {
    byte[] content = TempFiles.randomBytes(4 * BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta));

    FakeConnection seeder = connect(actor, randomPeerId());
    receive(actor, seeder, PeerMessage.BitfieldMessage.craft(pieces(0, 1, 2, 3), 4));
    receive(actor, seeder, PeerMessage.UnchokeMessage.craft());
    assertEquals(actor.getPieceTable().getAssignedCount(), 4);

    receive(actor, seeder, PeerMessage.ChokeMessage.craft());
    assertEquals(actor.getPieceTable().getAssignedCount(), 0);
    assertTrue(actor.getPeer(seeder.getId()).getInFlight().isEmpty());

    // A late block is dropped, it isn't in flight anymore.
    answer(actor, seeder, content, BLOCK, seeder.<PeerMessage.RequestMessage>sent(PeerMessage.Type.REQUEST).get(0));
    assertFalse(actor.getPieceTable().isVerified(0));
  }

  public void corruptedPieceIsRequestedAgain() {
    byte[] content = TempFiles.randomBytes(2 * BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta));

    FakeConnection seeder = connect(actor, randomPeerId());
    receive(actor, seeder, PeerMessage.BitfieldMessage.craft(pieces(0, 1), 2));
    receive(actor, seeder, PeerMessage.UnchokeMessage.craft());
    seeder.clear();

    receive(actor, seeder, PeerMessage.PieceMessage.craft(0, 0, new byte[BLOCK]));
    verify(listener).pieceVerificationFailed(eq(0), any(PeerInformation.class));
    assertEquals(actor.getPieceTable().getState(0), PieceState.MISSING);
    assertTrue(seeder.sent(PeerMessage.Type.HAVE).isEmpty());

    List<PeerMessage.RequestMessage> again = seeder.sent(PeerMessage.Type.REQUEST);
    assertEquals(again.size(), 1);
    assertEquals(again.get(0).getPiece(), 0);
  }

  public void unrequestedBlockIsDropped() {
    byte[] content = TempFiles.randomBytes(2 * BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta));

    FakeConnection peer = connect(actor, randomPeerId());
    receive(actor, peer, PeerMessage.PieceMessage.craft(1, 0, Arrays.copyOfRange(content, BLOCK, 2 * BLOCK)));
    assertEquals(actor.getPieceTable().getState(1), PieceState.MISSING);
    verify(listener, never()).pieceDownloaded(anyInt(), any(PeerInformation.class));
  }

  public void seederServesRequestsOnlyWhenUnchoked() {
    byte[] content = TempFiles.randomBytes(3 * BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, fullStorage(meta, content));

    FakeConnection leecher = connect(actor, randomPeerId());
    List<PeerMessage.BitfieldMessage> bitfields = leecher.sent(PeerMessage.Type.BITFIELD);
    assertEquals(bitfields.size(), 1);
    assertEquals(bitfields.get(0).getBitfield(), pieces(0, 1, 2));

    receive(actor, leecher, PeerMessage.RequestMessage.craft(1, 0, BLOCK));
    assertTrue(leecher.sent(PeerMessage.Type.PIECE).isEmpty(), "choked peers are not served");

    receive(actor, leecher, PeerMessage.InterestedMessage.craft());
    assertEquals(leecher.sent(PeerMessage.Type.UNCHOKE).size(), 1);

    receive(actor, leecher, PeerMessage.RequestMessage.craft(1, 1024, 2048));
    List<PeerMessage.PieceMessage> served = leecher.sent(PeerMessage.Type.PIECE);
    assertEquals(served.size(), 1);
    assertEquals(served.get(0).getPiece(), 1);
    assertEquals(served.get(0).getOffset(), 1024);
    byte[] block = new byte[2048];
    served.get(0).getBlock().get(block);
    assertEquals(block, Arrays.copyOfRange(content, BLOCK + 1024, BLOCK + 3072));

    receive(actor, leecher, PeerMessage.NotInterestedMessage.craft());
    assertEquals(leecher.sent(PeerMessage.Type.CHOKE).size(), 1);
  }

  public void outOfRangeRequestIsNeverServed() {
    byte[] content = TempFiles.randomBytes(2 * BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, fullStorage(meta, content));

    FakeConnection leecher = connect(actor, randomPeerId());
    receive(actor, leecher, PeerMessage.InterestedMessage.craft());

    receive(actor, leecher, PeerMessage.RequestMessage.craft(2, 0, BLOCK));
    receive(actor, leecher, PeerMessage.RequestMessage.craft(1, BLOCK - 100, 200));
    receive(actor, leecher, PeerMessage.RequestMessage.craft(-1, 0, 16));
    assertTrue(leecher.sent(PeerMessage.Type.PIECE).isEmpty());

    // The connection stays usable.
    receive(actor, leecher, PeerMessage.RequestMessage.craft(0, 0, 16));
    assertEquals(leecher.sent(PeerMessage.Type.PIECE).size(), 1);
    assertFalse(leecher.isCloseRequested());
  }

  public void missingPieceIsNotServed() {
    byte[] content = TempFiles.randomBytes(2 * BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    BitSet first = pieces(0);
    PieceStorage storage = new PieceStorageImpl(ByteArrayStorage.of(content), first, meta);
    TorrentActor actor = actor(meta, storage);

    FakeConnection leecher = connect(actor, randomPeerId());
    receive(actor, leecher, PeerMessage.InterestedMessage.craft());
    receive(actor, leecher, PeerMessage.RequestMessage.craft(1, 0, BLOCK));
    assertTrue(leecher.sent(PeerMessage.Type.PIECE).isEmpty());
  }

  public void uploadSlotsAreLimited() {
    byte[] content = TempFiles.randomBytes(BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, fullStorage(meta, content), ClientConfig.builder().uploadSlots(2).build());

    List<FakeConnection> leechers = new ArrayList<FakeConnection>();
    for (int i = 0; i < 3; i++) {
      FakeConnection leecher = connect(actor, randomPeerId());
      receive(actor, leecher, PeerMessage.InterestedMessage.craft());
      leechers.add(leecher);
    }
    assertEquals(leechers.get(0).sent(PeerMessage.Type.UNCHOKE).size(), 1);
    assertEquals(leechers.get(1).sent(PeerMessage.Type.UNCHOKE).size(), 1);
    assertTrue(leechers.get(2).sent(PeerMessage.Type.UNCHOKE).isEmpty());

    actor.handle(new PeerEvent.Disconnected(leechers.get(0).getId(), "gone"));
    assertEquals(leechers.get(2).sent(PeerMessage.Type.UNCHOKE).size(), 1);
  }

  public void swarmStaysConsistentUnderChurn() {
    byte[] content = TempFiles.randomBytes(BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta));

    List<FakeConnection> open = new ArrayList<FakeConnection>();
    List<PeerId> ids = new ArrayList<PeerId>();
    for (int round = 0; round < 200; round++) {
      if (open.isEmpty() || random.nextInt(3) > 0) {
        PeerId id = randomPeerId();
        open.add(connect(actor, id));
        ids.add(id);
      } else {
        int victim = random.nextInt(open.size());
        actor.handle(new PeerEvent.Disconnected(open.remove(victim).getId(), "churn"));
        ids.remove(victim);
      }
      assertEquals(actor.getPeers().size(), open.size());
      assertEquals(actor.getConnectedPeerCount(), open.size());
      assertEquals(actor.getConnectionCount(), open.size());
    }

    // A second connection from a known peer is closed, the first one stays.
    if (!ids.isEmpty()) {
      FakeConnection duplicate = connect(actor, ids.get(0));
      assertTrue(duplicate.isCloseRequested());
      assertFalse(open.get(0).isCloseRequested());
      assertEquals(actor.getPeers().size(), open.size());
      assertNull(actor.getPeer(duplicate.getId()));
      actor.handle(new PeerEvent.Disconnected(duplicate.getId(), "duplicate connection"));
      assertNotNull(actor.getPeer(open.get(0).getId()));
      assertEquals(actor.getConnectedPeerCount(), open.size());
    }
  }

  public void connectionToSelfIsClosed() {
    byte[] content = TempFiles.randomBytes(BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    PeerId self = randomPeerId();
    TorrentActor actor = new TorrentActor(meta, self, emptyStorage(meta), ClientConfig.defaults(),
            factory, listener, timeService);

    FakeConnection connection = connect(actor, self);
    assertTrue(connection.isCloseRequested());
    assertEquals(actor.getConnectedPeerCount(), 0);
  }

  public void eventsOfUnknownConnectionsAreIgnored() {
    byte[] content = TempFiles.randomBytes(BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta));

    ConnectionId stranger = ConnectionId.next();
    actor.handle(new PeerEvent.HandshakeCompleted(stranger, randomPeerId(), null));
    actor.handle(new PeerEvent.MessageReceived(stranger, PeerMessage.UnchokeMessage.craft()));
    actor.handle(new PeerEvent.Disconnected(stranger, "whatever"));
    assertEquals(actor.getConnectedPeerCount(), 0);
    verifyNoInteractions(listener);
  }

  public void keepAliveAfterIdleInterval() {
    byte[] content = TempFiles.randomBytes(BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta),
            ClientConfig.builder().keepAliveIntervalMillis(1000).build());

    FakeConnection peer = connect(actor, randomPeerId());
    timeService.advance(999);
    actor.handle(new TorrentCommand.Tick());
    assertTrue(peer.sent(PeerMessage.Type.KEEP_ALIVE).isEmpty());

    timeService.advance(1);
    actor.handle(new TorrentCommand.Tick());
    assertEquals(peer.sent(PeerMessage.Type.KEEP_ALIVE).size(), 1);

    actor.handle(new TorrentCommand.Tick());
    assertEquals(peer.sent(PeerMessage.Type.KEEP_ALIVE).size(), 1);
  }

  public void storageFailureResetsPiece() throws IOException {
    byte[] content = TempFiles.randomBytes(2 * BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    PieceStorage storage = mock(PieceStorage.class);
    when(storage.getAvailablePieces()).thenReturn(new BitSet());
    doThrow(new IOException("disk full")).when(storage).savePiece(eq(0), any(byte[].class));
    TorrentActor actor = actor(meta, storage);

    FakeConnection seeder = connect(actor, randomPeerId());
    receive(actor, seeder, PeerMessage.BitfieldMessage.craft(pieces(0), 2));
    receive(actor, seeder, PeerMessage.UnchokeMessage.craft());
    seeder.clear();
    answer(actor, seeder, content, BLOCK, PeerMessage.RequestMessage.craft(0, 0, BLOCK));

    assertEquals(actor.getPieceTable().getState(0), PieceState.MISSING);
    assertTrue(seeder.sent(PeerMessage.Type.HAVE).isEmpty());
    verify(listener, never()).pieceDownloaded(anyInt(), any(PeerInformation.class));
    // Requested again right away.
    assertEquals(seeder.sent(PeerMessage.Type.REQUEST).size(), 1);
  }

  public void dialsGoThroughTheFactory() {
    byte[] content = TempFiles.randomBytes(BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta));

    InetSocketAddress address = new InetSocketAddress("127.0.0.1", 6881);
    actor.handle(new TorrentCommand.Dial(address));
    assertEquals(factory.dialed, Arrays.asList(address));
    assertTrue(factory.last().isStarted());

    // No redial with the default policy, and no scheduler anyway.
    actor.handle(new PeerEvent.Disconnected(factory.last().getId(), "connection refused"));
    assertEquals(factory.created.size(), 1);
    verify(listener).noPeersLeft();
  }

  public void lastClosedConnectionIsReported() {
    byte[] content = TempFiles.randomBytes(BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta));

    FakeConnection established = connect(actor, randomPeerId());
    actor.handle(new TorrentCommand.AddConnection(mock(TransportStream.class)));
    FakeConnection pending = factory.last();

    actor.handle(new PeerEvent.Disconnected(established.getId(), "connection reset"));
    verify(listener, never()).noPeersLeft();

    actor.handle(new PeerEvent.Disconnected(pending.getId(), "closed before handshake"));
    verify(listener).noPeersLeft();

    // Already gone, nothing more to report.
    actor.handle(new PeerEvent.Disconnected(pending.getId(), "closed before handshake"));
    verify(listener, times(1)).noPeersLeft();
  }

  public void shutdownClosesEveryConnection() {
    byte[] content = TempFiles.randomBytes(BLOCK);
    TorrentMeta meta = meta(content, BLOCK);
    TorrentActor actor = actor(meta, emptyStorage(meta));

    FakeConnection established = connect(actor, randomPeerId());
    actor.handle(new TorrentCommand.AddConnection(mock(TransportStream.class)));
    FakeConnection pending = factory.last();

    actor.handle(new TorrentCommand.Shutdown());
    assertTrue(established.isCloseRequested());
    assertTrue(pending.isCloseRequested());
  }
}
