package sentry.crash;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrashLogReaderTest {

  @TempDir
  Path dir;

  @Test
  void missingFileYieldsNoLines() throws Exception {
    Path log = dir.resolve("crash.log");

    assertTrue(CrashLogReader.readAndTruncate(log).isEmpty());
    assertFalse(Files.exists(log));
  }

  @Test
  void readTruncatesFile() throws Exception {
    Path log = dir.resolve("crash.log");
    Files.writeString(log, "fatalError\n0x1\n", StandardCharsets.UTF_8);

    List<String> lines = CrashLogReader.readAndTruncate(log);

    assertEquals(List.of("fatalError", "0x1"), lines);
    assertTrue(Files.exists(log));
    assertEquals(0L, Files.size(log));
  }

  @Test
  void invalidUtf8IsReplacedAndFileStillTruncated() throws Exception {
    Path log = dir.resolve("crash.log");
    byte[] garbled = {'F', 'a', 't', 'a', 'l', ' ', (byte) 0xC3, 0x28, '\n', '0', 'x', '1', '\n'};
    Files.write(log, garbled);

    List<String> lines = CrashLogReader.readAndTruncate(log);

    assertEquals(List.of("Fatal \uFFFD(", "0x1"), lines);
    assertEquals(0L, Files.size(log));
  }

  @Test
  void crLfLineEndingsAreSplit() throws Exception {
    Path log = dir.resolve("crash.log");
    Files.writeString(log, "fatalError\r\n0x1\r\n", StandardCharsets.UTF_8);

    assertEquals(List.of("fatalError", "0x1"), CrashLogReader.readAndTruncate(log));
  }

  @Test
  void secondReadSeesNothing() throws Exception {
    Path log = dir.resolve("crash.log");
    Files.writeString(log, "fatalError\n", StandardCharsets.UTF_8);

    CrashLogReader.readAndTruncate(log);

    assertTrue(CrashLogReader.readAndTruncate(log).isEmpty());
  }

  @Test
  void noTemporaryFilesLeftBehind() throws Exception {
    Path log = dir.resolve("crash.log");
    Files.writeString(log, "fatalError\n", StandardCharsets.UTF_8);

    CrashLogReader.readAndTruncate(log);

    try (var entries = Files.list(dir)) {
      assertEquals(List.of(log), entries.toList());
    }
  }
}
