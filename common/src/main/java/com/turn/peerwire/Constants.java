/*
 * Copyright 2000-2013 JetBrains s.r.o.
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

package com.turn.peerwire;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Protocol constants and client defaults.
 */
public class Constants {

  public static final Charset BYTE_ENCODING = StandardCharsets.ISO_8859_1;

  /** Size of info hashes, peer ids and piece hashes (one SHA-1 digest). */
  public static final int PIECE_HASH_SIZE = 20;

  /** Two-letter client code used in generated peer ids. */
  public static final String CLIENT_IDENTIFIER = "PW";
  public static final int CLIENT_VERSION_MAJOR = 1;
  public static final int CLIENT_VERSION_MINOR = 0;
  public static final int CLIENT_VERSION_PATCH = 0;

  /** Default block size is 2^14 bytes, or 16kB. */
  public static final int DEFAULT_BLOCK_SIZE = 16384;

  /** Max block request size is 2^17 bytes, or 128kB. */
  public static final int MAX_BLOCK_SIZE = 128 * 1024;

  /** No sensible frame is longer than this; longer ones come from broken or hostile peers. */
  public static final int MAX_MESSAGE_SIZE = 1024 * 1024;

  public static final int DEFAULT_PIPELINE_DEPTH = 5;
  public static final int DEFAULT_UPLOAD_SLOTS = 4;

  public static final long DEFAULT_KEEP_ALIVE_INTERVAL_MILLIS = 120 * 1000;
  public static final long DEFAULT_TICK_INTERVAL_MILLIS = 1000;
  public static final int DEFAULT_CONNECTION_TIMEOUT_MILLIS = 10000;
  public static final int DEFAULT_SOCKET_BUFFER_SIZE = 16 * 1024;

  public static final int DEFAULT_PORT = 6881;

}
