package com.turn.peerwire.common;

import com.turn.peerwire.Constants;
import com.turn.peerwire.bcodec.BDecoder;
import com.turn.peerwire.bcodec.BEValue;
import com.turn.peerwire.bcodec.InvalidBEncodingException;
import org.apache.commons.io.FileUtils;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Reads the piece layout of a single-file .torrent metainfo file.
 *
 * <p>
 * Trackers, comments and the like are ignored: only the <code>info</code>
 * dictionary is of interest here. The info hash is the SHA-1 of the
 * <code>info</code> dictionary exactly as it appears in the file.
 * </p>
 */
public class TorrentParser {

  static final String INFO_TABLE = "info";
  static final String PIECE_LENGTH = "piece length";
  static final String PIECES = "pieces";
  static final String NAME = "name";
  static final String FILE_LENGTH = "length";
  static final String FILES = "files";

  @Nonnull
  public TorrentMeta parseFromFile(@Nonnull File torrentFile) throws IOException {
    byte[] fileContent = FileUtils.readFileToByteArray(torrentFile);
    return parse(fileContent);
  }

  /**
   * @param metadata binary .torrent content
   * @throws InvalidBEncodingException if metadata has incorrect format, misses
   *                                   a required field or describes several files
   */
  @Nonnull
  public TorrentMeta parse(@Nonnull byte[] metadata) throws InvalidBEncodingException {
    Map<String, BEValue> dictionaryMetadata = BDecoder.bdecode(metadata).getMap();
    BEValue info = getRequiredValueOrThrowException(dictionaryMetadata, INFO_TABLE);
    Map<String, BEValue> infoTable = info.getMap();

    if (infoTable.containsKey(FILES)) {
      throw new InvalidBEncodingException("Multi-file torrents are not supported");
    }

    int pieceLength = getRequiredValueOrThrowException(infoTable, PIECE_LENGTH).getInt();
    long length = getRequiredValueOrThrowException(infoTable, FILE_LENGTH).getLong();
    byte[] piecesHashes = getRequiredValueOrThrowException(infoTable, PIECES).getBytes();
    BEValue nameValue = infoTable.get(NAME);
    String name = nameValue == null ? null : nameValue.getString();

    if (piecesHashes.length % Constants.PIECE_HASH_SIZE != 0) {
      throw new InvalidBEncodingException("Incorrect size of pieces hashes");
    }
    List<byte[]> hashes = new ArrayList<byte[]>();
    for (int i = 0; i < piecesHashes.length; i += Constants.PIECE_HASH_SIZE) {
      hashes.add(Arrays.copyOfRange(piecesHashes, i, i + Constants.PIECE_HASH_SIZE));
    }

    InfoHash infoHash = InfoHash.of(TorrentUtils.calculateSha1Hash(info.getEncoded()));
    try {
      return TorrentMeta.create(infoHash, pieceLength, length, hashes, name);
    } catch (IllegalArgumentException e) {
      throw new InvalidBEncodingException("Inconsistent piece layout: " + e.getMessage());
    }
  }

  @Nonnull
  private BEValue getRequiredValueOrThrowException(Map<String, BEValue> map, String key) throws InvalidBEncodingException {
    final BEValue value = map.get(key);
    if (value == null)
      throw new InvalidBEncodingException("Invalid metadata format. Map doesn't contain required field " + key);
    return value;
  }
}
