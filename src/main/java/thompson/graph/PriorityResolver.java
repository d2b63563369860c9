package thompson.graph;

import java.util.HashMap;
import java.util.Map;

/**
 * Ranks NFA states for a matching engine choosing between transitions that
 * are viable at the same time. Lower keys win.
 *
 * <p>Consuming states are keyed by their condition: a literal by its byte
 * value, while {@code Any} and byte classes (whatever their contents) get
 * {@code 0}. A branch takes the lower key of its two successors, reaching
 * through further branches until it hits a consuming state. Reaching an
 * accepting or open exit without consuming anything gives
 * {@link #TERMINAL}, the least preferred key.
 *
 * <p>States already on the current resolution path are not re-entered, so
 * epsilon cycles (eg. from {@code (a?)*}) resolve to {@link #TERMINAL}
 * instead of recursing forever.
 */
public final class PriorityResolver {

  /** Key of a path that ends without consuming input. */
  public static final int TERMINAL = Integer.MAX_VALUE;

  private final Nfa nfa;

  // Keys of arena states, exact for the whole reachable subgraph
  private final Map<Integer, Integer> resolved = new HashMap<>();

  // States on the current resolution path, mapped to their depth on it
  private final Map<Integer, Integer> onPath = new HashMap<>();

  // Shallowest path depth re-entered since the last reset
  private int shallowestCut = Integer.MAX_VALUE;

  public PriorityResolver(Nfa nfa) {
    this.nfa = nfa;
  }

  /**
   * Priority key of a state.
   *
   * <p>The state need not be part of the automaton, but any links out of it
   * are resolved against the automaton's arena. Keys of arena states are
   * cached, so a resolver must not be shared between threads.
   *
   * @param state state to rank
   * @return key, lower being preferred
   * @throws IllegalStateException if a link points outside of the arena
   * @throws IllegalArgumentException if the state is neither a match nor a branch
   */
  public int priority(NfaState state) {
    onPath.clear();
    shallowestCut = Integer.MAX_VALUE;
    return statePriority(state);
  }

  private int statePriority(NfaState state) {
    if (state instanceof NfaState.Match match) {
      return transitionPriority(match.condition(), match.next());
    } else if (state instanceof NfaState.Branch branch) {
      return Math.min(
        transitionPriority(Condition.NONE, branch.next1()),
        transitionPriority(Condition.NONE, branch.next2())
      );
    }
    throw new IllegalArgumentException("Unknown NFA state " + state);
  }

  private int transitionPriority(Condition condition, Transition next) {
    if (condition instanceof Condition.One one) {
      return Byte.toUnsignedInt(one.value());
    } else if (condition instanceof Condition.Any || condition instanceof Condition.ByteClass) {
      return 0;
    }

    if (!(next instanceof Transition.Linked linked)) {
      return TERMINAL;
    }
    return linkedPriority(linked.state());
  }

  private int linkedPriority(int target) {
    final Integer known = resolved.get(target);
    if (known != null) {
      return known;
    }

    final Integer pathDepth = onPath.get(target);
    if (pathDepth != null) {
      shallowestCut = Math.min(shallowestCut, pathDepth);
      return TERMINAL;
    }

    final NfaState targetState = nfa
      .state(target)
      .orElseThrow(() -> new IllegalStateException("Link to state " + target + " is outside of the NFA"));

    final int depth = onPath.size();
    final int outerCut = shallowestCut;
    onPath.put(target, depth);
    shallowestCut = Integer.MAX_VALUE;

    final int key = statePriority(targetState);
    onPath.remove(target);

    // Only cache keys that don't depend on which states were above on the path
    if (shallowestCut >= depth) {
      resolved.put(target, key);
      shallowestCut = outerCut;
    } else {
      shallowestCut = Math.min(outerCut, shallowestCut);
    }
    return key;
  }
}
