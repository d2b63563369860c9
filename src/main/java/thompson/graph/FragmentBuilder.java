package thompson.graph;

import java.util.ArrayList;
import java.util.List;
import thompson.parser.RegexVisitor;

/**
 * Regex syntax tree visitor which lowers the tree into an NFA arena using
 * Thompson's construction.
 *
 * <p>Every visit appends the states of one fragment and returns the index of
 * the fragment's entry state. Exits of a fragment are left {@code Open} until
 * the parent node (or {@link #finish}) patches them.
 */
public final class FragmentBuilder implements RegexVisitor<Integer> {

  private boolean used = false;
  private final List<NfaState> arena = new ArrayList<>();
  private final EdgePatcher patcher = new EdgePatcher(arena);

  /**
   * Add a state to the end of the arena.
   *
   * @param state state to add
   * @return index of the new state
   */
  private int append(NfaState state) {
    arena.add(state);
    return arena.size() - 1;
  }

  /**
   * @return snapshot of the arena built so far, open exits included
   */
  List<NfaState> states() {
    return List.copyOf(arena);
  }

  @Override
  public Integer visitAny() {
    return append(NfaState.match(Condition.ANY, Transition.OPEN));
  }

  /**
   * @throws IllegalArgumentException if the character is not a single byte
   */
  @Override
  public Integer visitCharacter(char character) {
    return append(NfaState.match(Condition.one(character), Transition.OPEN));
  }

  /**
   * @throws IllegalArgumentException if some member is not a single byte
   */
  @Override
  public Integer visitCharacterClass(List<Character> members) {
    return append(NfaState.match(Condition.anyOf(members), Transition.OPEN));
  }

  @Override
  public Integer visitConcatenation(Integer lhs, Integer rhs) {
    patcher.patch(lhs, Transition.linked(rhs));
    return lhs;
  }

  @Override
  public Integer visitAlternation(Integer lhs, Integer rhs) {
    // Exits of both sides stay open and get patched together by the parent
    return append(NfaState.branch(Transition.linked(lhs), Transition.linked(rhs)));
  }

  @Override
  public Integer visitOptional(Integer arg) {
    return append(NfaState.branch(Transition.linked(arg), Transition.OPEN));
  }

  @Override
  public Integer visitPlus(Integer arg) {
    final int loop = append(NfaState.branch(Transition.linked(arg), Transition.OPEN));
    patcher.patch(arg, Transition.linked(loop));
    return arg;
  }

  @Override
  public Integer visitKleene(Integer arg) {
    final int loop = append(NfaState.branch(Transition.linked(arg), Transition.OPEN));
    patcher.patch(arg, Transition.linked(loop));
    return loop;
  }

  /**
   * Finalize the construction of the NFA.
   *
   * @param entry entry state returned from visiting the root of the tree
   * @return NFA starting at the entry, with every open exit accepting
   */
  public Nfa finish(int entry) {
    if (used) {
      throw new IllegalStateException("finish may only be called once on an NFA builder");
    } else {
      used = true;
    }

    patcher.patch(entry, Transition.ACCEPT);
    return new Nfa(arena, entry);
  }
}
