package sentry.model;

/**
 * One stack position. Every component is optional; a frame recovered from a raw crash log
 * usually carries only {@code instructionAddr}.
 *
 * @param filename        source file name (basename only)
 * @param function        function name, possibly demangled
 * @param rawFunction     original (un-demangled) function name
 * @param lineno          1-based line number
 * @param colno           1-based column number
 * @param absPath         absolute path of the source file
 * @param instructionAddr hexadecimal instruction address with a {@code 0x} prefix
 */
public record Frame(
    String filename,
    String function,
    String rawFunction,
    Integer lineno,
    Integer colno,
    String absPath,
    String instructionAddr) {

  public static Frame ofAddress(String instructionAddr) {
    return new Frame(null, null, null, null, null, null, instructionAddr);
  }
}
