package thompson.graph;

import java.util.List;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import thompson.parser.Regex;
import thompson.parser.RegexParser;

/**
 * Thompson non-deterministic finite state automaton over bytes.
 *
 * The states live in a flat arena and refer to each other by index. Indices
 * are stable: the arena is never reordered and states are never removed. A
 * start index outside of the arena is allowed and means the automaton is
 * empty.
 *
 * Once built, the automaton is immutable and contains no {@code Open}
 * transitions. Queries hand out immutable state values, never anything that
 * could be used to modify the arena.
 */
public final class Nfa implements DotGraph {

  private static final String ACCEPT_VERTEX = "accept";

  private final List<NfaState> states;
  private final int start;
  private final PriorityResolver resolver;

  Nfa(List<NfaState> states, int start) {
    this.states = List.copyOf(states);
    this.start = start;
    this.resolver = new PriorityResolver(this);
  }

  /**
   * Automaton with no states at all.
   */
  public static Nfa empty() {
    return new Nfa(List.of(), 0);
  }

  /**
   * Automaton over an explicit arena, starting at index {@code 0}.
   *
   * <p>No checks are done on the states: this is meant for tests and low-level
   * tooling which assemble arenas by hand.
   *
   * @param states arena of states
   */
  public static Nfa fromStates(List<NfaState> states) {
    return new Nfa(states, 0);
  }

  /**
   * Compile a syntax tree.
   *
   * @param regex syntax tree to compile
   * @return compiled automaton
   * @throws IllegalArgumentException if a literal is not a single byte
   */
  public static Nfa fromRegex(Regex regex) {
    final var builder = new FragmentBuilder();
    return builder.finish(regex.accept(builder));
  }

  /**
   * Parse and compile a regular expression pattern.
   *
   * @param pattern regular expression to parse
   * @return compiled automaton
   */
  public static Nfa compile(String pattern) throws PatternSyntaxException {
    return compile(pattern, 0);
  }

  /**
   * Parse and compile a regular expression pattern.
   *
   * @param pattern regular expression to parse
   * @param flags {@code java.util.regex.Pattern} flags, either {@code LITERAL} or {@code COMMENTS}
   * @return compiled automaton
   */
  public static Nfa compile(String pattern, int flags) throws PatternSyntaxException {
    final var builder = new FragmentBuilder();
    return builder.finish(RegexParser.parse(builder, pattern, flags));
  }

  /**
   * Index of the start state in the arena.
   *
   * <p>This is not necessarily a valid index: see {@link #startState()}.
   */
  public int startIndex() {
    return start;
  }

  /**
   * @return start state, or nothing if the automaton is empty
   */
  public Optional<NfaState> startState() {
    return state(start);
  }

  /**
   * Look up a state in the arena.
   *
   * @param index position of the state
   * @return state, or nothing if the index is out of range
   */
  public Optional<NfaState> state(int index) {
    if (index < 0 || index >= states.size()) {
      return Optional.empty();
    }
    return Optional.of(states.get(index));
  }

  /**
   * @return number of states in the arena
   */
  public int size() {
    return states.size();
  }

  /**
   * @return unmodifiable snapshot of the arena, in index order
   */
  public List<NfaState> states() {
    return states;
  }

  /**
   * Priority key of a state when resolving between transitions viable at the
   * same time (lower is preferred).
   *
   * @see PriorityResolver
   */
  public int priority(NfaState state) {
    return resolver.priority(state);
  }

  @Override
  public Stream<DotGraph.Vertex> vertices() {
    final var arenaVertices = IntStream
      .range(0, states.size())
      .mapToObj((int id) -> new DotGraph.Vertex(Integer.toString(id), Integer.toString(id), false));
    return Stream.concat(arenaVertices, Stream.of(new DotGraph.Vertex(ACCEPT_VERTEX, ACCEPT_VERTEX, true)));
  }

  @Override
  public Stream<DotGraph.Edge> edges() {
    final Stream<DotGraph.Edge> startEdge = startState().isPresent()
      ? Stream.of(new DotGraph.Edge(null, Integer.toString(start), ""))
      : Stream.empty();

    final var transitionEdges = IntStream
      .range(0, states.size())
      .boxed()
      .flatMap((Integer id) -> {
        final String from = id.toString();
        final NfaState state = states.get(id);
        if (state instanceof NfaState.Match match) {
          return Stream.of(new DotGraph.Edge(from, vertexId(match.next()), match.condition().dotLabel()));
        } else if (state instanceof NfaState.Branch branch) {
          final String epsilon = Condition.NONE.dotLabel();
          return Stream.of(
            new DotGraph.Edge(from, vertexId(branch.next1()), epsilon),
            new DotGraph.Edge(from, vertexId(branch.next2()), epsilon)
          );
        }
        throw new IllegalArgumentException("Unknown NFA state " + state + " at index " + id);
      });

    return Stream.concat(startEdge, transitionEdges);
  }

  private static String vertexId(Transition transition) {
    if (transition instanceof Transition.Linked linked) {
      return Integer.toString(linked.state());
    } else if (transition instanceof Transition.Accept) {
      return ACCEPT_VERTEX;
    }
    return null;
  }

  @Override
  public String toString() {
    return "Nfa[start=" + start + ", states=" + states + "]";
  }
}
