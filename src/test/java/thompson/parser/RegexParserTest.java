package thompson.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RegexParserTest {

  private static Regex single(char c) {
    return new Regex.Single(c);
  }

  private static Regex seq(Regex left, Regex right) {
    return new Regex.Sequence(left, right);
  }

  @Test
  public void testConcatenationIsLeftAssociative() {
    assertEquals(seq(seq(single('a'), single('b')), single('c')), Regex.parse("abc"));
  }

  @Test
  public void testAlternationBindsLoosest() {
    assertEquals(
      new Regex.Or(new Regex.Or(seq(single('a'), single('b')), single('c')), single('d')),
      Regex.parse("ab|c|d")
    );
  }

  @Test
  public void testQuantifiers() {
    assertEquals(new Regex.Optional(single('a')), Regex.parse("a?"));
    assertEquals(new Regex.OneOrMore(single('a')), Regex.parse("a+"));
    assertEquals(new Regex.ZeroOrMore(single('a')), Regex.parse("a*"));
    assertEquals(seq(single('a'), new Regex.OneOrMore(single('b'))), Regex.parse("ab+"));
  }

  @Test
  public void testStackedQuantifiers() {
    assertEquals(new Regex.ZeroOrMore(new Regex.ZeroOrMore(single('a'))), Regex.parse("a**"));
    assertEquals(new Regex.OneOrMore(new Regex.Optional(single('a'))), Regex.parse("(a?)+"));
  }

  @Test
  public void testGroups() {
    assertEquals(new Regex.ZeroOrMore(seq(single('a'), single('b'))), Regex.parse("(ab)*"));
    assertEquals(
      seq(new Regex.Or(single('a'), single('b')), single('c')),
      Regex.parse("(?:a|b)c")
    );
  }

  @Test
  public void testDot() {
    assertEquals(seq(new Regex.Any(), single('a')), Regex.parse(".a"));
  }

  @Test
  public void testCharacterClass() {
    assertEquals(new Regex.CharClass(List.of('x', 'y', 'z')), Regex.parse("[xyz]"));
    assertEquals(new Regex.CharClass(List.of('a', 'b', 'c', '_', ']')), Regex.parse("[a-c_\\]]"));
    assertEquals(new Regex.CharClass(List.of('.', '-')), Regex.parse("[.-]"));
    assertEquals(new Regex.CharClass(List.of('b', 'a', 'b')), Regex.parse("[bab]"));
  }

  @Test
  public void testEmptyCharacterClass() {
    assertEquals(new Regex.CharClass(List.of()), Regex.parse("[]"));
  }

  @Test
  public void testEscapes() {
    assertEquals(single('.'), Regex.parse("\\."));
    assertEquals(single('\\'), Regex.parse("\\\\"));
    assertEquals(single('\t'), Regex.parse("\\t"));
    assertEquals(single('A'), Regex.parse("\\x41"));
    assertEquals(
      new Regex.CharClass(List.of('0', '1', '2', '3', '4', '5', '6', '7', '8', '9')),
      Regex.parse("\\d")
    );
    assertEquals(
      new Regex.CharClass(List.of('x', ' ', '\t', '\n', '\u000B', '\f', '\r')),
      Regex.parse("[x\\s]")
    );
  }

  @Test
  public void testCommentsFlag() {
    assertEquals(
      seq(seq(single('a'), single('b')), single('c')),
      Regex.parse("a b # trailing comment\n c ", Pattern.COMMENTS)
    );
    assertEquals(seq(single('a'), single(' ')), Regex.parse("a\\ ", Pattern.COMMENTS));
  }

  @Test
  public void testLiteralFlag() {
    assertEquals(seq(seq(single('a'), single('+')), single('(')), Regex.parse("a+(", Pattern.LITERAL));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnsupportedFlag() {
    Regex.parse("a", Pattern.CASE_INSENSITIVE);
  }

  @Test
  public void testVisitsBottomUpLeftToRight() {
    final List<String> visits = new ArrayList<>();
    final RegexVisitor<String> recorder = new RegexVisitor<>() {
      private String record(String visit) {
        visits.add(visit);
        return visit;
      }

      @Override
      public String visitAny() {
        return record(".");
      }

      @Override
      public String visitCharacter(char character) {
        return record(String.valueOf(character));
      }

      @Override
      public String visitCharacterClass(List<Character> members) {
        return record("[" + members.size() + "]");
      }

      @Override
      public String visitConcatenation(String lhs, String rhs) {
        return record("(" + lhs + rhs + ")");
      }

      @Override
      public String visitAlternation(String lhs, String rhs) {
        return record("(" + lhs + "|" + rhs + ")");
      }

      @Override
      public String visitOptional(String arg) {
        return record(arg + "?");
      }

      @Override
      public String visitPlus(String arg) {
        return record(arg + "+");
      }

      @Override
      public String visitKleene(String arg) {
        return record(arg + "*");
      }
    };

    final String parsed = RegexParser.parse(recorder, "ab*|.", 0);
    assertEquals("((ab*)|.)", parsed);
    assertEquals(List.of("a", "b", "b*", "(ab*)", ".", "((ab*)|.)"), visits);

    // Walking an explicit tree gives the same sequence of visits
    visits.clear();
    Regex.parse("ab*|.").accept(recorder);
    assertEquals(List.of("a", "b", "b*", "(ab*)", ".", "((ab*)|.)"), visits);
  }

  @Test
  public void testSyntaxErrors() {
    assertSyntaxError("", 0);
    assertSyntaxError("a|", 2);
    assertSyntaxError("()", 1);
    assertSyntaxError("(a", 2);
    assertSyntaxError("a)", 1);
    assertSyntaxError("*a", 0);
    assertSyntaxError("[ab", 3);
    assertSyntaxError("a\\", 1);
    assertSyntaxError("[z-a]", 3);
    assertSyntaxError("\\q", 0);
    assertSyntaxError("\\xZ1", 2);
  }

  @Test
  public void testUnsupportedSyntax() {
    assertUnsupported("^a", "Anchors");
    assertUnsupported("a$", "Anchors");
    assertUnsupported("a{2}", "Counted repetitions");
    assertUnsupported("a*?", "Lazy quantifiers");
    assertUnsupported("a++", "Possessive quantifiers");
    assertUnsupported("[^a]", "Negated character classes");
    assertUnsupported("\\W", "Negated character classes");
    assertUnsupported("(a)\\1", "Back-references");
    assertUnsupported("(?=a)", "Lookaround and inline flag groups");
    assertUnsupported("a\\b", "Boundary matchers");
    assertUnsupported("café", "Non-ASCII characters");
    assertUnsupported("[é]", "Non-ASCII characters");
    assertUnsupported("\\xE9", "Non-ASCII characters");
  }

  @Test
  public void testUnsupportedSyntaxMessageNamesTheByteLevelLimit() {
    try {
      Regex.parse("ab{2}");
      fail("Expected UnsupportedPatternSyntaxException");
    } catch (UnsupportedPatternSyntaxException e) {
      assertEquals("Counted repetitions", e.featureCategory());
      assertEquals(2, e.getIndex());
      assertTrue(e.getMessage(), e.getMessage().startsWith("Counted repetitions have no byte-level NFA encoding near index 2"));
    }
  }

  private static void assertSyntaxError(String pattern, int index) {
    try {
      Regex.parse(pattern);
      fail("Expected PatternSyntaxException for " + pattern);
    } catch (UnsupportedPatternSyntaxException e) {
      fail("Expected a plain syntax error for " + pattern + " but got " + e.getMessage());
    } catch (PatternSyntaxException e) {
      assertEquals(pattern, e.getPattern());
      assertEquals("index of error in " + pattern, index, e.getIndex());
    }
  }

  private static void assertUnsupported(String pattern, String category) {
    try {
      Regex.parse(pattern);
      fail("Expected UnsupportedPatternSyntaxException for " + pattern);
    } catch (UnsupportedPatternSyntaxException e) {
      assertEquals(category, e.featureCategory());
      assertEquals(category + " have no byte-level NFA encoding", e.getDescription());
    }
  }
}
