package com.turn.peerwire;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Temporary files and directories for tests, removed by {@link #cleanup()}.
 */
public class TempFiles {
  private static final Random ourRandom = new Random(System.currentTimeMillis());

  private final File myCurrentTempDir;
  private final List<File> myFilesToDelete = new ArrayList<File>();

  public TempFiles() {
    myCurrentTempDir = FileUtils.getTempDirectory();
    if (!myCurrentTempDir.isDirectory()) {
      throw new IllegalStateException("Temp directory is not a directory: " + myCurrentTempDir.getAbsolutePath());
    }
  }

  private File doCreateTempDir(String prefix) throws IOException {
    do {
      final File f = new File(myCurrentTempDir, prefix + ourRandom.nextInt() + ".tmp");
      if (!f.exists() && f.mkdirs()) {
        return f.getCanonicalFile();
      }
    } while (true);
  }

  public final File createTempDir() throws IOException {
    File dir = doCreateTempDir("peerwire");
    myFilesToDelete.add(dir);
    return dir;
  }

  /**
   * Creates a file of the given content inside a fresh temp directory.
   */
  public final File createTempFile(String name, byte[] content) throws IOException {
    File file = new File(createTempDir(), name);
    FileUtils.writeByteArrayToFile(file, content);
    return file;
  }

  public static byte[] randomBytes(int size) {
    byte[] result = new byte[size];
    new Random(size).nextBytes(result);
    return result;
  }

  public void cleanup() {
    for (File file : myFilesToDelete) {
      FileUtils.deleteQuietly(file);
    }
    myFilesToDelete.clear();
  }
}
