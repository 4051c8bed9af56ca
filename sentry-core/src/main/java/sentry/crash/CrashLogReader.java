package sentry.crash;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Reads a crash log and empties it, so the same crash text is never ingested twice.
 *
 * <p>The file is replaced by an empty one through a rename in the same directory, which is
 * atomic where the file system supports it.
 */
public final class CrashLogReader {
  private static final Logger logger = Logger.getLogger(CrashLogReader.class.getName());

  private CrashLogReader() {
  }

  /**
   * Reads every line of the crash log, then truncates it. Bytes that are not valid UTF-8 are
   * replaced, never rejected.
   *
   * @param path the crash log
   * @return the lines, or an empty list if the file does not exist
   * @throws IOException if the file exists but cannot be read or truncated
   */
  public static List<String> readAndTruncate(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    byte[] content;
    try {
      content = Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      return List.of();
    }
    truncate(path);
    // crash handlers write whatever bytes they have; undecodable ones become U+FFFD
    return new String(content, StandardCharsets.UTF_8).lines().collect(Collectors.toList());
  }

  static void truncate(Path path) throws IOException {
    Path absolute = path.toAbsolutePath();
    Path temp = Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
    try {
      Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      logger.log(Level.FINE, "Atomic move not supported, truncating " + absolute + " in place");
      Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
