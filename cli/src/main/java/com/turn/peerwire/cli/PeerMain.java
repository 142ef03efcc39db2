/**
 * Copyright (C) 2011-2013 Turn, Inc.
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
package com.turn.peerwire.cli;

import com.turn.peerwire.client.ClientConfig;
import com.turn.peerwire.client.Torrent;
import com.turn.peerwire.client.TorrentListenerAdapter;
import com.turn.peerwire.common.InfoHash;
import com.turn.peerwire.common.TorrentMeta;
import com.turn.peerwire.common.TorrentParser;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.turn.peerwire.Constants;
import com.turn.peerwire.bcodec.InvalidBEncodingException;
import jargs.gnu.CmdLineParser;
import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.PatternLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry-point for downloading from, or seeding to, a single
 * peer.
 */
public class PeerMain {

	private static final Logger logger =
		LoggerFactory.getLogger(PeerMain.class);

	static final int EXIT_OK = 0;
	static final int EXIT_USAGE = 1;
	static final int EXIT_ERROR = 2;
	static final int EXIT_TIMEOUT = 3;

	private static final String DEFAULT_SEED_ADDRESS = "0.0.0.0";

	/**
	 * Display program usage on the given {@link PrintStream}.
	 */
	private static void usage(PrintStream s) {
		s.println("usage: peerwire leech [options]");
		s.println("       peerwire seed [options]");
		s.println();
		s.println("Available options:");
		s.println("  -h,--help                  Show this help and exit.");
		s.println("  -a,--ip ADDR               Address of the seeder (leech), or to listen on (seed).");
		s.println("  -p,--port PORT             Port of the seeder (leech), or to listen on (seed, default: " +
			Constants.DEFAULT_PORT + ").");
		s.println("  -i,--info-hash HEX         Expected info hash of the torrent.");
		s.println("  -t,--torrent FILE          The .torrent metainfo file.");
		s.println("  -o,--output FILE           Where to download the data to (leech).");
		s.println("  -d,--data FILE             The data to seed (seed).");
		s.println("  -w,--timeout SECONDS       Give up downloading after this long (default: never).");
		s.println();
	}

	/**
	 * Main entry point for stand-alone operation.
	 */
	public static void main(String[] args) {
		BasicConfigurator.configure(new ConsoleAppender(
			new PatternLayout("%d [%-25t] %-5p: %m%n")));
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Runs a command to completion; for {@code seed}, until the process is
	 * killed.
	 *
	 * @return the exit code of the process
	 */
	static int run(String[] args, PrintStream out, PrintStream err) {
		if (args.length == 0) {
			usage(err);
			return EXIT_USAGE;
		}
		String command = args[0];
		if ("-h".equals(command) || "--help".equals(command)) {
			usage(out);
			return EXIT_OK;
		}

		CmdLineParser parser = new CmdLineParser();
		CmdLineParser.Option help = parser.addBooleanOption('h', "help");
		CmdLineParser.Option ip = parser.addStringOption('a', "ip");
		CmdLineParser.Option port = parser.addIntegerOption('p', "port");
		CmdLineParser.Option infoHash = parser.addStringOption('i', "info-hash");
		CmdLineParser.Option torrent = parser.addStringOption('t', "torrent");
		CmdLineParser.Option output = parser.addStringOption('o', "output");
		CmdLineParser.Option data = parser.addStringOption('d', "data");
		CmdLineParser.Option timeout = parser.addIntegerOption('w', "timeout");

		try {
			parser.parse(Arrays.copyOfRange(args, 1, args.length));
		} catch (CmdLineParser.OptionException oe) {
			err.println(oe.getMessage());
			usage(err);
			return EXIT_USAGE;
		}

		// Display help and exit if requested
		if (Boolean.TRUE.equals((Boolean)parser.getOptionValue(help))) {
			usage(out);
			return EXIT_OK;
		}
		if (parser.getRemainingArgs().length != 0) {
			err.println("Unexpected argument: " + parser.getRemainingArgs()[0]);
			usage(err);
			return EXIT_USAGE;
		}

		String ipValue = (String)parser.getOptionValue(ip);
		Integer portValue = (Integer)parser.getOptionValue(port);
		String infoHashValue = (String)parser.getOptionValue(infoHash);
		String torrentValue = (String)parser.getOptionValue(torrent);
		Integer timeoutValue = (Integer)parser.getOptionValue(timeout);

		if (infoHashValue == null || torrentValue == null) {
			err.println("Both --info-hash and --torrent are required.");
			usage(err);
			return EXIT_USAGE;
		}

		try {
			if ("leech".equals(command)) {
				String outputValue = (String)parser.getOptionValue(output);
				if (ipValue == null || portValue == null || outputValue == null) {
					err.println("leech needs --ip, --port and --output.");
					usage(err);
					return EXIT_USAGE;
				}
				TorrentMeta meta = loadTorrent(new File(torrentValue), infoHashValue);
				return leech(meta, new InetSocketAddress(ipValue, portValue),
					new File(outputValue), timeoutValue, out);
			} else if ("seed".equals(command)) {
				String dataValue = (String)parser.getOptionValue(data);
				if (dataValue == null) {
					err.println("seed needs --data.");
					usage(err);
					return EXIT_USAGE;
				}
				TorrentMeta meta = loadTorrent(new File(torrentValue), infoHashValue);
				InetSocketAddress address = new InetSocketAddress(
					ipValue == null ? DEFAULT_SEED_ADDRESS : ipValue,
					portValue == null ? Constants.DEFAULT_PORT : portValue);
				return seed(meta, address, new File(dataValue), out);
			}
			err.println("Unknown command: " + command);
			usage(err);
			return EXIT_USAGE;
		} catch (IllegalArgumentException iae) {
			err.println(iae.getMessage());
			return EXIT_ERROR;
		} catch (Exception e) {
			logger.error("Fatal error: {}", e.getMessage(), e);
			return EXIT_ERROR;
		}
	}

	/**
	 * Parses the torrent file and checks that it is the expected one.
	 *
	 * @throws IllegalArgumentException If the info hash given on the command
	 * line is malformed or doesn't match the torrent file.
	 */
	static TorrentMeta loadTorrent(File torrentFile, String expectedInfoHash)
		throws IOException {
		InfoHash expected;
		try {
			expected = InfoHash.fromHexString(expectedInfoHash.trim());
		} catch (IllegalArgumentException iae) {
			throw new IllegalArgumentException("Invalid info hash " + expectedInfoHash + ": " +
				iae.getMessage());
		}
		TorrentMeta meta;
		try {
			meta = new TorrentParser().parseFromFile(torrentFile);
		} catch (InvalidBEncodingException ibe) {
			throw new IllegalArgumentException("Invalid torrent file " + torrentFile + ": " +
				ibe.getMessage());
		}
		if (!expected.equals(meta.getInfoHash())) {
			throw new IllegalArgumentException("Info hash mismatch: " + torrentFile + " has " +
				meta.getInfoHash() + ", expected " + expected);
		}
		return meta;
	}

	private static int leech(TorrentMeta meta, InetSocketAddress seeder, File output,
		Integer timeoutSeconds, PrintStream out) throws IOException, InterruptedException {
		final Torrent torrent = Torrent.open(meta, output, ClientConfig.defaults());
		if (torrent.isComplete()) {
			out.println(output + " is already complete.");
			torrent.stop();
			return EXIT_OK;
		}

		final CountDownLatch done = new CountDownLatch(1);
		final AtomicBoolean stalled = new AtomicBoolean();
		torrent.addListener(new TorrentListenerAdapter() {
			@Override
			public void downloadComplete() {
				done.countDown();
			}

			@Override
			public void noPeersLeft() {
				// Nobody else will connect, we don't listen.
				stalled.set(true);
				done.countDown();
			}
		});
		torrent.start();
		torrent.connect(seeder);

		boolean completed;
		if (timeoutSeconds == null) {
			done.await();
			completed = true;
		} else {
			completed = done.await(timeoutSeconds, TimeUnit.SECONDS);
		}
		torrent.stop();
		if (completed && !torrent.isComplete() && stalled.get()) {
			out.println("No peer left with " + torrent.getCompletedPieces().cardinality() + "/" +
				meta.getPieceCount() + " pieces.");
			return EXIT_ERROR;
		}
		if (!completed) {
			out.println("Timed out after " + timeoutSeconds + "s with " +
				torrent.getCompletedPieces().cardinality() + "/" + meta.getPieceCount() + " pieces.");
			return EXIT_TIMEOUT;
		}
		out.println("Downloaded " + output + ".");
		return EXIT_OK;
	}

	private static int seed(TorrentMeta meta, InetSocketAddress address, File data,
		PrintStream out) throws IOException, InterruptedException {
		final Torrent torrent = Torrent.open(meta, data, ClientConfig.defaults());
		if (!torrent.isComplete()) {
			logger.warn("Only {}/{} pieces of {} are valid, seeding them anyway",
				new Object[]{torrent.getCompletedPieces().cardinality(), meta.getPieceCount(), data});
		}
		Runtime.getRuntime().addShutdownHook(new Thread(new Runnable() {
			@Override
			public void run() {
				torrent.stop();
			}
		}));
		torrent.start();
		InetSocketAddress bound = torrent.listen(address);
		out.println("Seeding " + meta.getInfoHash() + " on " + bound + ".");

		// Until killed.
		new CountDownLatch(1).await();
		return EXIT_OK;
	}
}
