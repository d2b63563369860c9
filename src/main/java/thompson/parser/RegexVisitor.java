package thompson.parser;

import java.util.List;

/**
 * Bottom-up traversal of the regular expression syntax tree.
 *
 * <p>Children are always visited left to right before their parent, whether
 * the traversal is driven by {@link RegexParser} or by {@link Regex#accept}.
 *
 * @param <R> output from traversing the regex syntax tree
 */
public interface RegexVisitor<R> {

  /**
   * Matches any single character.
   */
  R visitAny();

  /**
   * Matches exactly one character.
   *
   * @param character character to match
   */
  R visitCharacter(char character);

  /**
   * Matches any one of the characters in the class.
   *
   * @param members characters in the class, in source order
   */
  R visitCharacterClass(List<Character> members);

  /**
   * Matches a concatenation of two patterns.
   *
   * @param lhs first pattern to match
   * @param rhs second pattern to match
   */
  R visitConcatenation(R lhs, R rhs);

  /**
   * Matches a union of two patterns.
   *
   * @param lhs first alternative
   * @param rhs second alternative
   */
  R visitAlternation(R lhs, R rhs);

  /**
   * Matches a pattern zero or one times.
   *
   * @param arg pattern to match
   */
  R visitOptional(R arg);

  /**
   * Matches a pattern one or more times.
   *
   * @param arg pattern to match
   */
  R visitPlus(R arg);

  /**
   * Matches a pattern zero or more times.
   *
   * @param arg pattern to match
   */
  R visitKleene(R arg);
}
