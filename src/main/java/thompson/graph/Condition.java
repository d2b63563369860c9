package thompson.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Input condition on a consuming NFA state.
 *
 * <p>Bytes are the unit of input: literal characters must encode to exactly
 * one byte. Which bytes {@link Any} excludes (eg. newline) is left to the
 * matching engine.
 */
public interface Condition {

  /** Matches any byte. */
  Condition ANY = new Any();

  /** Not a consuming condition. Only used when resolving priorities. */
  Condition NONE = new None();

  /**
   * Condition matching exactly one character.
   *
   * @param character literal character
   * @return condition on the character's single byte
   * @throws IllegalArgumentException if the character is not a single byte
   */
  static Condition one(char character) {
    return new One(toByte(character));
  }

  /**
   * Condition matching any of the characters.
   *
   * @param characters class members, in order
   * @return condition on the members' bytes
   * @throws IllegalArgumentException if some character is not a single byte
   */
  static Condition anyOf(List<Character> characters) {
    final var bytes = new ArrayList<Byte>(characters.size());
    for (char character : characters) {
      bytes.add(toByte(character));
    }
    return new ByteClass(bytes);
  }

  private static byte toByte(char character) {
    // UTF-8 encodes a char in one byte exactly when it is ASCII
    if (character > 0x7F) {
      throw new IllegalArgumentException(
        "Character U+" + String.format("%04X", (int) character) + " does not encode to a single byte"
      );
    }
    return (byte) character;
  }

  /**
   * Label used when rendering the condition on a DOT graph edge.
   *
   * @return HTML label
   */
  String dotLabel();

  record One(byte value) implements Condition {
    @Override
    public String dotLabel() {
      return escapeHtml((char) Byte.toUnsignedInt(value));
    }
  }

  record ByteClass(List<Byte> bytes) implements Condition {
    public ByteClass {
      bytes = List.copyOf(bytes);
    }

    @Override
    public String dotLabel() {
      return bytes
        .stream()
        .map(b -> escapeHtml((char) Byte.toUnsignedInt(b)))
        .collect(Collectors.joining("", "[", "]"));
    }
  }

  record Any() implements Condition {
    @Override
    public String dotLabel() {
      return ".";
    }
  }

  record None() implements Condition {
    @Override
    public String dotLabel() {
      return "&epsilon;";
    }
  }

  private static String escapeHtml(char c) {
    switch (c) {
      case '<': return "&lt;";
      case '>': return "&gt;";
      case '&': return "&amp;";
      case '"': return "&quot;";
      default:
        if (c < 0x20 || c == 0x7F) {
          return "\\x" + String.format("%02X", (int) c);
        }
        return String.valueOf(c);
    }
  }
}
