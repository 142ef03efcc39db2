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
package com.turn.peerwire.protocol;

import java.text.ParseException;

/**
 * Base class of the peer wire decoding failures.
 *
 * <p>
 * The error offset is the position, relative to the start of the frame or
 * handshake being decoded, where the problem was found.
 * </p>
 */
public class ProtocolException extends ParseException {

  private static final long serialVersionUID = -1;

  public ProtocolException(String message, int errorOffset) {
    super(message, errorOffset);
  }
}
