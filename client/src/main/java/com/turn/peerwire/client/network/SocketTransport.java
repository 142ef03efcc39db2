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
package com.turn.peerwire.client.network;

import com.turn.peerwire.common.TorrentLoggerFactory;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;

/**
 * {@link Transport} over blocking NIO TCP socket channels.
 */
public class SocketTransport implements Transport {

  private static final Logger logger =
          TorrentLoggerFactory.getLogger(SocketTransport.class);

  private final int connectTimeoutMillis;
  private final int socketBufferSize;

  /**
   * @param socketBufferSize Send and receive buffer size; 0 keeps the
   * system defaults.
   */
  public SocketTransport(int connectTimeoutMillis, int socketBufferSize) {
    this.connectTimeoutMillis = connectTimeoutMillis;
    this.socketBufferSize = socketBufferSize;
  }

  @Override
  public TransportStream connect(InetSocketAddress address) throws IOException {
    SocketChannel channel = SocketChannel.open();
    try {
      setBuffersSizeIfNecessary(channel, this.socketBufferSize);
      channel.socket().connect(address, this.connectTimeoutMillis);
    } catch (IOException ioe) {
      channel.close();
      throw ioe;
    }
    logger.debug("Connected to {}", address);
    return new SocketStream(channel);
  }

  @Override
  public TransportServer bind(InetSocketAddress address) throws IOException {
    ServerSocketChannel channel = ServerSocketChannel.open();
    try {
      channel.bind(address);
    } catch (IOException ioe) {
      channel.close();
      throw ioe;
    }
    logger.info("Listening for peers on {}", channel.getLocalAddress());
    return new SocketServer(channel, this.socketBufferSize);
  }

  private static void setBuffersSizeIfNecessary(SocketChannel socketChannel, int bufferSize) throws IOException {
    if (bufferSize <= 0) {
      return;
    }
    final Socket socket = socketChannel.socket();
    socket.setSendBufferSize(bufferSize);
    socket.setReceiveBufferSize(bufferSize);
  }

  private static class SocketServer implements TransportServer {

    private final ServerSocketChannel channel;
    private final int socketBufferSize;

    SocketServer(ServerSocketChannel channel, int socketBufferSize) {
      this.channel = channel;
      this.socketBufferSize = socketBufferSize;
    }

    @Override
    public TransportStream accept() throws IOException {
      SocketChannel socketChannel = this.channel.accept();
      setBuffersSizeIfNecessary(socketChannel, this.socketBufferSize);
      logger.trace("Accepted connection from {}", socketChannel.socket());
      return new SocketStream(socketChannel);
    }

    @Override
    public InetSocketAddress getLocalAddress() throws IOException {
      return (InetSocketAddress) this.channel.getLocalAddress();
    }

    @Override
    public void close() throws IOException {
      this.channel.close();
    }
  }

  private static class SocketStream implements TransportStream {

    private final SocketChannel channel;
    private final SocketAddress remoteAddress;

    SocketStream(SocketChannel channel) {
      this.channel = channel;
      this.remoteAddress = channel.socket().getRemoteSocketAddress();
    }

    @Override
    public int read(ByteBuffer buffer) throws IOException {
      return this.channel.read(buffer);
    }

    @Override
    public int write(ByteBuffer buffer) throws IOException {
      return this.channel.write(buffer);
    }

    @Override
    public SocketAddress getRemoteAddress() {
      return this.remoteAddress;
    }

    @Override
    public boolean isOpen() {
      return this.channel.isOpen();
    }

    @Override
    public void close() throws IOException {
      this.channel.close();
    }

    @Override
    public String toString() {
      return "SocketStream{" + this.remoteAddress + '}';
    }
  }
}
