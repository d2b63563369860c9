package thompson.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parser for the subset of regular expressions that compiles into a byte-level
 * Thompson NFA.
 *
 * This is a fairly standard recursive descent parser. Results are made
 * available through a visitor instead of as an explicit AST type, so the same
 * parse can either build a {@link Regex} tree or feed an NFA builder directly.
 *
 * Supported syntax:
 *
 *   - literals (ASCII only), {@code .}, escapes {@code \t \n \r \f \a \e \xhh}
 *     and escaped metacharacters
 *   - bracket classes {@code [abc]}, {@code [a-z]}, the empty class {@code []},
 *     and the ASCII classes {@code \d \w \s}
 *   - postfix {@code ?}, {@code +}, {@code *}
 *   - alternation {@code |} and grouping {@code (...)} or {@code (?:...)}
 */
public final class RegexParser<A> {

  private static final int SUPPORTED_FLAGS = Pattern.LITERAL | Pattern.COMMENTS;

  private static final List<Character> DIGITS = range('0', '9');
  private static final List<Character> WORD;
  private static final List<Character> SPACE = List.of(' ', '\t', '\n', '\u000B', '\f', '\r');

  static {
    final var word = new ArrayList<Character>();
    word.addAll(range('a', 'z'));
    word.addAll(range('A', 'Z'));
    word.add('_');
    word.addAll(DIGITS);
    WORD = Collections.unmodifiableList(word);
  }

  // Used when "visiting" the AST bottom up
  final private RegexVisitor<A> visitor;

  // Bookeeping around position in source
  private final String input;
  private final int length;
  private final int regexFlags;
  private int position = 0;

  // Single possibly stashed character - see `parseEscape`
  private char stashedChar = 0;

  /**
   * Parse a regular expression pattern from an input string.
   *
   * @param visitor regex visitor used to accept bottom-up parsing progress
   * @param input regular expression pattern
   * @param flags bitmask of match flags (only {@code LITERAL} and {@code COMMENTS})
   * @return parsed regular expression
   */
  public static<B> B parse(
    RegexVisitor<B> visitor,
    String input,
    int flags
  ) throws PatternSyntaxException {
    final int unsupportedFlags = flags & ~SUPPORTED_FLAGS;
    if (unsupportedFlags != 0) {
      throw new IllegalArgumentException(
        "Unsupported regex flags: 0x" + Integer.toHexString(unsupportedFlags)
      );
    }

    final var parser = new RegexParser<B>(visitor, input, flags);
    final B parsed = parser.checkFlags(Pattern.LITERAL)
      ? parser.parseLiteralSequence()
      : parser.parseAlternation();

    if (parser.peekChar() != -1) {
      throw parser.error("Unmatched closing `)`");
    }
    return parsed;
  }

  private RegexParser(RegexVisitor<A> visitor, String input, int regexFlags) {
    this.visitor = visitor;
    this.input = input;
    this.regexFlags = regexFlags;
    this.length = input.length();
  }

  private PatternSyntaxException error(String message) {
    return new PatternSyntaxException(message, input, position);
  }

  private PatternSyntaxException error(String message, int position) {
    return new PatternSyntaxException(message, input, position);
  }

  private UnsupportedPatternSyntaxException unsupported(String unsupported) {
    return new UnsupportedPatternSyntaxException(unsupported, input, position);
  }

  private boolean checkFlags(int flags) {
    return (regexFlags & flags) != 0;
  }

  /**
   * Advance the cursor past any whitespace or comments.
   */
  private void skipSpaceAndComments() {
    if (!checkFlags(Pattern.COMMENTS)) return;
    while (position < length) {
      final char c = input.charAt(position);
      if (c == '#') {
        while (position < length && input.charAt(position) != '\n') {
          position++;
        }
      } else if (Character.isWhitespace(c)) {
        position++;
      } else {
        break;
      }
    }
  }

  /**
   * Peek the next character in the input without advancing the position.
   *
   * @return next character or else -1 if there is none
   */
  int peekChar() {
    skipSpaceAndComments();
    return position < length ? input.charAt(position) : -1;
  }

  void skipChar() {
    skipSpaceAndComments();
    position++;
  }

  /**
   * Advance past the next character only if it matches the expected.
   *
   * @param matching desired character
   * @return whether the character was found
   */
  boolean nextCharIf(char matching) {
    skipSpaceAndComments();
    final boolean matches = position < length && input.charAt(position) == matching;
    if (matches) {
      position++;
    }
    return matches;
  }

  /**
   * Parse an alternation.
   */
  private A parseAlternation() throws PatternSyntaxException {
    A unionLhs = parseConcatenation();
    while (nextCharIf('|')) {
      A unionRhs = parseConcatenation();
      unionLhs = visitor.visitAlternation(unionLhs, unionRhs);
    }
    return unionLhs;
  }

  /**
   * Parse a concatenation.
   *
   * There is no empty expression in the syntax tree, so at least one quantified
   * atom is required.
   */
  private A parseConcatenation() throws PatternSyntaxException {
    A concatLhs = null;

    int c;
    while ((c = peekChar()) != -1) {
      if (c == ')' || c == '|') break;
      A concatRhs = parseQuantified();
      if (concatLhs == null) {
        concatLhs = concatRhs;
      } else {
        concatLhs = visitor.visitConcatenation(concatLhs, concatRhs);
      }
    }

    if (concatLhs == null) {
      throw error("Expected an expression");
    }
    return concatLhs;
  }

  /**
   * Parse an atom followed by any number of postfix quantifiers.
   *
   * Called on non-empty input.
   */
  private A parseQuantified() throws PatternSyntaxException {
    A quantified = parseAtom();

    int c;
    while ((c = peekChar()) != -1) {
      switch (c) {
        case '*':
        case '?':
        case '+':
          skipChar();
          break;

        case '{':
          throw unsupported("Counted repetitions");

        default:
          return quantified;
      }

      final int suffix = peekChar();
      if (suffix == '?') {
        throw unsupported("Lazy quantifiers");
      } else if (suffix == '+') {
        throw unsupported("Possessive quantifiers");
      }

      switch (c) {
        case '*':
          quantified = visitor.visitKleene(quantified);
          break;
        case '?':
          quantified = visitor.visitOptional(quantified);
          break;
        default:
          quantified = visitor.visitPlus(quantified);
          break;
      }
    }

    return quantified;
  }

  /**
   * Parse a single atom: a group, a class, or a character.
   *
   * Called on non-empty input.
   */
  private A parseAtom() throws PatternSyntaxException {
    final int c = peekChar();
    switch (c) {
      case '(':
        return parseGroup();

      case '^':
      case '$':
        throw unsupported("Anchors");

      case '*':
      case '?':
      case '+':
        throw error("Dangling meta character `" + (char) c + "`");

      case '{':
        throw unsupported("Counted repetitions");

      case '.':
        skipChar();
        return visitor.visitAny();

      case '[':
        return visitor.visitCharacterClass(parseBracketClass());

      case '\\':
        final List<Character> escapedClass = parseEscape();
        return escapedClass != null
          ? visitor.visitCharacterClass(escapedClass)
          : visitor.visitCharacter(stashedChar);

      default:
        final int start = position;
        position++;
        return visitor.visitCharacter(ascii((char) c, start));
    }
  }

  /**
   * Parse a parenthesized group. Groups never capture.
   */
  private A parseGroup() throws PatternSyntaxException {
    // Track the open paren so we can use it in the error message
    final int openParenPosition = position;
    skipChar();

    if (nextCharIf('?') && !nextCharIf(':')) {
      throw unsupported("Lookaround and inline flag groups");
    }

    final A union = parseAlternation();
    if (!nextCharIf(')')) {
      throw error(
        "Unclosed group (expected close paren for group opened at " + openParenPosition + ")"
      );
    }
    return union;
  }

  /**
   * Parse the whole input as literal characters.
   */
  private A parseLiteralSequence() throws PatternSyntaxException {
    A literal = null;
    while (position < length) {
      final int start = position;
      final A next = visitor.visitCharacter(ascii(input.charAt(position++), start));
      literal = (literal == null) ? next : visitor.visitConcatenation(literal, next);
    }

    if (literal == null) {
      throw error("Expected an expression");
    }
    return literal;
  }

  /**
   * Parse a bracketed character class.
   *
   * Whitespace inside the brackets is always literal, even in comments mode.
   *
   * @return members of the class in source order
   */
  private List<Character> parseBracketClass() throws PatternSyntaxException {
    final int openBracketPosition = position;
    skipChar();

    if (position < length && input.charAt(position) == '^') {
      throw unsupported("Negated character classes");
    }

    final var members = new ArrayList<Character>();
    while (true) {
      if (position >= length) {
        throw error(
          "Unclosed character class (expected close to bracket opened at " + openBracketPosition + ")"
        );
      }

      final char c = input.charAt(position);
      if (c == ']') {
        position++;
        return members;
      }

      final char lower;
      if (c == '\\') {
        final List<Character> escapedClass = parseEscape();
        if (escapedClass != null) {
          members.addAll(escapedClass);
          continue;
        }
        lower = stashedChar;
      } else {
        lower = parseClassCharacter();
      }

      // A `-` right before the closing bracket is a literal
      if (position + 1 < length && input.charAt(position) == '-' && input.charAt(position + 1) != ']') {
        position++;
        final int upperPosition = position;
        final char upper;
        if (input.charAt(position) == '\\') {
          if (parseEscape() != null) {
            throw error("Cannot end class range with character class", upperPosition);
          }
          upper = stashedChar;
        } else {
          upper = parseClassCharacter();
        }

        if (upper < lower) {
          throw error("Illegal character range", upperPosition);
        }
        members.addAll(range(lower, upper));
      } else {
        members.add(lower);
      }
    }
  }

  /**
   * Parse one unescaped character inside a bracket class.
   */
  private char parseClassCharacter() throws PatternSyntaxException {
    final char c = input.charAt(position);
    if (c == '[') {
      throw unsupported("Nested character classes");
    }
    final int start = position;
    position++;
    return ascii(c, start);
  }

  /**
   * Parse an escape sequence, starting at the backslash.
   *
   * If the escape denotes a single character instead of a class, the character
   * is stashed in `stashedChar`.
   *
   * @return members of the escaped class or {@code null} if a character was stashed
   */
  private List<Character> parseEscape() throws PatternSyntaxException {
    // NB: not `nextChar` since `\\ ` or `\\#` are escapes even in comment mode
    final int backslashPosition = position;
    position++;
    if (position >= length) {
      throw error("Pattern may not end with backslash", backslashPosition);
    }
    final char c = input.charAt(position);

    switch (c) {
      case '\\':
      case '.':
      case '+':
      case '*':
      case '?':
      case '(':
      case ')':
      case '|':
      case '[':
      case ']':
      case '{':
      case '}':
      case '^':
      case '$':
      case '-':
      case '/':
      case '#':
      case ' ':
        position++;
        stashedChar = c;
        return null;

      case 'd':
        position++;
        return DIGITS;

      case 'w':
        position++;
        return WORD;

      case 's':
        position++;
        return SPACE;

      case 'D':
      case 'W':
      case 'S':
        throw unsupported("Negated character classes");

      case 'b':
      case 'B':
      case 'A':
      case 'G':
      case 'z':
      case 'Z':
        throw unsupported("Boundary matchers");

      case 'k':
        throw unsupported("Back-references");

      case 'p':
      case 'P':
        throw unsupported("Character properties");

      case 't':
        position++;
        stashedChar = '\t';
        return null;

      case 'n':
        position++;
        stashedChar = '\n';
        return null;

      case 'r':
        position++;
        stashedChar = '\r';
        return null;

      case 'f':
        position++;
        stashedChar = '\f';
        return null;

      // Bell character
      case 'a':
        position++;
        stashedChar = '\u0007';
        return null;

      // Escape character
      case 'e':
        position++;
        stashedChar = '\u001B';
        return null;

      // Hexadecimal escape `\xhh`
      case 'x':
        position++;
        int codePoint = parseHexadecimalCharacter();
        codePoint = (codePoint << 4) | parseHexadecimalCharacter();
        stashedChar = ascii((char) codePoint, backslashPosition);
        return null;

      default:
        if ('1' <= c && c <= '9') {
          throw unsupported("Back-references");
        }
        throw error("Unknown escape sequence `\\" + c + "`", backslashPosition);
    }
  }

  /**
   * Parse a single hexadecimal character.
   *
   * @return value of the hexadecimal character
   */
  private int parseHexadecimalCharacter() throws PatternSyntaxException {
    if (position >= length) {
      throw error("Expected hexadecimal character but got end of regex");
    }

    final int hex = Character.digit(input.charAt(position), 16);
    if (hex < 0) {
      throw error("Expected a hexadecimal character");
    }
    position++;
    return hex;
  }

  /**
   * Ensure a literal character fits in a single byte.
   *
   * @param c character to check
   * @param index position of the character in the pattern
   * @return the same character
   */
  private char ascii(char c, int index) throws UnsupportedPatternSyntaxException {
    if (c > 0x7F) {
      throw new UnsupportedPatternSyntaxException("Non-ASCII characters", input, index);
    }
    return c;
  }

  private static List<Character> range(char lower, char upper) {
    final var characters = new ArrayList<Character>(upper - lower + 1);
    for (char c = lower; c <= upper; c++) {
      characters.add(c);
    }
    return Collections.unmodifiableList(characters);
  }
}
