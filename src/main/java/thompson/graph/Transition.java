package thompson.graph;

/**
 * Where control goes after leaving an NFA state.
 *
 * <p>{@link Open} only exists while an automaton is under construction: it
 * marks a fragment exit that has not been wired to its successor yet.
 */
public interface Transition {

  /** Exit not wired to anything yet. */
  Transition OPEN = new Open();

  /** Reaching this transition means the match succeeded. */
  Transition ACCEPT = new Accept();

  static Transition linked(int state) {
    return new Linked(state);
  }

  /**
   * @param state index of the target state in the arena
   */
  record Linked(int state) implements Transition { }

  record Open() implements Transition { }

  record Accept() implements Transition { }
}
