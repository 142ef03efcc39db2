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
package com.turn.peerwire.client.storage;

import com.turn.peerwire.common.TorrentMeta;

import java.io.IOException;

public interface PieceStorageFactory {

  /**
   * Create a new {@link PieceStorage} for the given torrent over the given
   * byte storage.
   */
  PieceStorage createStorage(TorrentMeta meta, TorrentByteStorage byteStorage) throws IOException;

}
