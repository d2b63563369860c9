package thompson.graph;

import java.util.HashSet;
import java.util.List;
import java.util.Stack;

/**
 * Wires the open exits of a fragment to a target transition.
 *
 * <p>Repetition creates back edges, so the walk keeps a visited set and enters
 * every state at most once per call. Linked transitions are followed but never
 * overwritten, and accepting transitions are left alone. Each call starts from
 * an empty visited set.
 */
final class EdgePatcher {

  private final List<NfaState> arena;

  /**
   * @param arena states being built, updated in place
   */
  EdgePatcher(List<NfaState> arena) {
    this.arena = arena;
  }

  /**
   * Replace every {@code Open} transition reachable from a state.
   *
   * <p>Reachability is judged on the links present before the call: a freshly
   * patched transition is not followed, even when the target is a link.
   *
   * @param entry index of the state to start from
   * @param target transition to put in place of each open exit
   */
  void patch(int entry, Transition target) {
    final var visited = new HashSet<Integer>();
    final var toVisit = new Stack<Integer>();
    visited.add(entry);
    toVisit.push(entry);

    while (!toVisit.isEmpty()) {
      final int index = toVisit.pop();
      final NfaState patched = arena.get(index).mapTransitions((Transition transition) -> {
        if (transition instanceof Transition.Open) {
          return target;
        }
        if (transition instanceof Transition.Linked linked && visited.add(linked.state())) {
          toVisit.push(linked.state());
        }
        return transition;
      });
      arena.set(index, patched);
    }
  }
}
