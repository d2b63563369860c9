package thompson.parser;

import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Explicit regular expression syntax tree.
 *
 * <p>Nodes are immutable. The tree can be built by hand or parsed from a
 * pattern, and is consumed through {@link RegexVisitor}.
 */
public interface Regex {

  /**
   * Traverse this tree bottom-up.
   *
   * @param visitor visitor receiving the nodes
   * @return output of the visitor on the root
   */
  <R> R accept(RegexVisitor<R> visitor);

  /**
   * Parse a pattern into an explicit syntax tree.
   *
   * @param pattern regular expression pattern
   * @return parsed tree
   */
  static Regex parse(String pattern) throws PatternSyntaxException {
    return parse(pattern, 0);
  }

  /**
   * Parse a pattern into an explicit syntax tree.
   *
   * @param pattern regular expression pattern
   * @param flags bitmask of {@code java.util.regex.Pattern} flags
   * @return parsed tree
   */
  static Regex parse(String pattern, int flags) throws PatternSyntaxException {
    return RegexParser.parse(new TreeBuilder(), pattern, flags);
  }

  record Any() implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitAny();
    }
  }

  record Single(char character) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitCharacter(character);
    }
  }

  record CharClass(List<Character> members) implements Regex {
    public CharClass {
      members = List.copyOf(members);
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitCharacterClass(members);
    }
  }

  record Sequence(Regex left, Regex right) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      final R lhs = left.accept(visitor);
      final R rhs = right.accept(visitor);
      return visitor.visitConcatenation(lhs, rhs);
    }
  }

  record Optional(Regex inner) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitOptional(inner.accept(visitor));
    }
  }

  record OneOrMore(Regex inner) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitPlus(inner.accept(visitor));
    }
  }

  record ZeroOrMore(Regex inner) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitKleene(inner.accept(visitor));
    }
  }

  record Or(Regex left, Regex right) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      final R lhs = left.accept(visitor);
      final R rhs = right.accept(visitor);
      return visitor.visitAlternation(lhs, rhs);
    }
  }

  /**
   * Visitor which materializes the traversal as an explicit tree.
   */
  final class TreeBuilder implements RegexVisitor<Regex> {

    @Override
    public Regex visitAny() {
      return new Any();
    }

    @Override
    public Regex visitCharacter(char character) {
      return new Single(character);
    }

    @Override
    public Regex visitCharacterClass(List<Character> members) {
      return new CharClass(members);
    }

    @Override
    public Regex visitConcatenation(Regex lhs, Regex rhs) {
      return new Sequence(lhs, rhs);
    }

    @Override
    public Regex visitAlternation(Regex lhs, Regex rhs) {
      return new Or(lhs, rhs);
    }

    @Override
    public Regex visitOptional(Regex arg) {
      return new Optional(arg);
    }

    @Override
    public Regex visitPlus(Regex arg) {
      return new OneOrMore(arg);
    }

    @Override
    public Regex visitKleene(Regex arg) {
      return new ZeroOrMore(arg);
    }
  }
}
