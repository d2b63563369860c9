package thompson.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Stack;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Structural checks over automata compiled from a corpus of patterns.
 */
public class NfaPropertiesTest {

  // Every repeated body consumes at least one byte
  private static final List<String> CONSUMING_LOOPS = List.of(
    "a",
    "abc",
    "a|b|c",
    "(ab)*",
    "(a|b)*c",
    "..+.",
    "[xyz]+\\d*",
    "(a+b)+",
    "((a|b)c)*d?",
    "(a|bc|d?e)+f"
  );

  // Repeated bodies that can match the empty string
  private static final List<String> NULLABLE_LOOPS = List.of(
    "a**",
    "(a?)*",
    "(a*)*",
    "(a*)+",
    "(a|b?)+",
    "((a|b)*c?)+d",
    "(a+|b*)*",
    "(a?b?)*c"
  );

  private static List<String> corpus() {
    final var all = new ArrayList<String>(CONSUMING_LOOPS);
    all.addAll(NULLABLE_LOOPS);
    return all;
  }

  private static List<Transition> transitions(NfaState state) {
    final var out = new ArrayList<Transition>();
    state.mapTransitions((Transition t) -> {
      out.add(t);
      return t;
    });
    return out;
  }

  private static Set<Integer> reachable(Nfa nfa, int from, boolean epsilonOnly) {
    final var seen = new HashSet<Integer>();
    final var toVisit = new Stack<Integer>();
    toVisit.push(from);
    while (!toVisit.isEmpty()) {
      final NfaState state = nfa.state(toVisit.pop()).get();
      if (epsilonOnly && state instanceof NfaState.Match) {
        continue;
      }
      for (Transition t : transitions(state)) {
        if (t instanceof Transition.Linked linked && seen.add(linked.state())) {
          toVisit.push(linked.state());
        }
      }
    }
    return seen;
  }

  @Test
  public void testNoOpenTransitionsRemain() {
    for (String pattern : corpus()) {
      final Nfa nfa = Nfa.compile(pattern);
      final Set<Integer> live = reachable(nfa, nfa.startIndex(), false);
      live.add(nfa.startIndex());
      for (int index : live) {
        for (Transition t : transitions(nfa.state(index).get())) {
          assertFalse(pattern + " has an open exit at " + index, t instanceof Transition.Open);
        }
      }
    }
  }

  @Test
  public void testEveryStateIsReachable() {
    for (String pattern : corpus()) {
      final Nfa nfa = Nfa.compile(pattern);
      final Set<Integer> live = reachable(nfa, nfa.startIndex(), false);
      live.add(nfa.startIndex());
      assertTrue(pattern, live.size() == nfa.size());
    }
  }

  @Test
  public void testEpsilonCyclesHaveAnExit() {
    for (String pattern : corpus()) {
      final Nfa nfa = Nfa.compile(pattern);
      for (int index = 0; index < nfa.size(); index++) {
        if (!reachable(nfa, index, true).contains(index)) {
          continue;
        }

        // Members of the epsilon cycle through `index`
        final var cycle = new HashSet<Integer>();
        for (int other : reachable(nfa, index, true)) {
          if (reachable(nfa, other, true).contains(index)) {
            cycle.add(other);
          }
        }

        boolean exits = false;
        for (int member : cycle) {
          for (Transition t : transitions(nfa.state(member).get())) {
            if (!(t instanceof Transition.Linked linked) || !cycle.contains(linked.state())) {
              exits = true;
            }
          }
        }
        assertTrue(pattern + " traps an epsilon cycle through " + index, exits);
      }
    }
  }

  @Test
  public void testLoopsOverConsumingBodiesContainAConsumingState() {
    for (String pattern : CONSUMING_LOOPS) {
      final Nfa nfa = Nfa.compile(pattern);
      for (int index = 0; index < nfa.size(); index++) {
        assertFalse(
          pattern + " has an epsilon-only loop through " + index,
          reachable(nfa, index, true).contains(index)
        );
      }
    }
  }

  @Test
  public void testPriorityResolutionTerminates() {
    for (String pattern : corpus()) {
      final Nfa nfa = Nfa.compile(pattern);
      for (NfaState state : nfa.states()) {
        final int key = nfa.priority(state);
        assertTrue(pattern, key >= 0);
      }
    }
  }
}
