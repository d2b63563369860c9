package thompson.graph;

import java.util.function.UnaryOperator;

/**
 * State in the NFA arena.
 *
 * <p>States are immutable values: a state handed out by an {@link Nfa} can't be
 * used to change the automaton.
 *
 * <p>{@link Match} and {@link Branch} are the only valid states. Other
 * implementations are rejected with an {@link IllegalArgumentException} when
 * an automaton holding them is ranked or rendered.
 */
public interface NfaState {

  /**
   * Rebuild the state with every outgoing transition passed through a function.
   *
   * @param update replacement for each transition
   * @return state with updated transitions (or this state if none changed)
   */
  NfaState mapTransitions(UnaryOperator<Transition> update);

  static NfaState match(Condition condition, Transition next) {
    return new Match(condition, next);
  }

  static NfaState branch(Transition next1, Transition next2) {
    return new Branch(next1, next2);
  }

  /**
   * Consuming state with a single successor.
   *
   * @param condition input that must be matched to take the transition
   * @param next successor once the input is consumed
   */
  record Match(Condition condition, Transition next) implements NfaState {

    @Override
    public NfaState mapTransitions(UnaryOperator<Transition> update) {
      final Transition updated = update.apply(next);
      return updated.equals(next) ? this : new Match(condition, updated);
    }
  }

  /**
   * Unconditioned split into two successors.
   *
   * @param next1 first successor
   * @param next2 second successor
   */
  record Branch(Transition next1, Transition next2) implements NfaState {

    @Override
    public NfaState mapTransitions(UnaryOperator<Transition> update) {
      final Transition updated1 = update.apply(next1);
      final Transition updated2 = update.apply(next2);
      if (updated1.equals(next1) && updated2.equals(next2)) {
        return this;
      }
      return new Branch(updated1, updated2);
    }
  }
}
