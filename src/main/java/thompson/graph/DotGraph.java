package thompson.graph;

import java.util.stream.Stream;

/**
 * Graphs which can be rendered using the DOT language.
 */
public interface DotGraph {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param label HTML label shown in the vertex
   * @param accepting is this an accepting vertex?
   */
  record Vertex(String id, String label, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edge starts (or a blank vertex if {@code null})
   * @param to vertex where the edge ends (or a blank vertex if {@code null})
   * @param label HTML label on the edge
   */
  record Edge(String from, String to, String label) { }

  Stream<Vertex> vertices();

  Stream<Edge> edges();

  /**
   * Render the graph into its DOT source.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph ").append(quote(name)).append(" {\n");
    builder.append("  rankdir = LR;\n");

    vertices().forEach((Vertex vertex) -> builder
      .append("  ")
      .append(quote(vertex.id()))
      .append(" [shape = ")
      .append(vertex.accepting() ? "doublecircle" : "circle")
      .append(", label = <")
      .append(vertex.label())
      .append(">];\n"));

    int blanks = 0;
    final Iterable<Edge> es = () -> edges().iterator();
    for (Edge edge : es) {
      final String from = edge.from() == null ? "_blank" + blanks++ : edge.from();
      final String to = edge.to() == null ? "_blank" + blanks++ : edge.to();
      builder
        .append("  ")
        .append(quote(from))
        .append(" -> ")
        .append(quote(to))
        .append(" [label = <")
        .append(edge.label())
        .append(">];\n");
    }

    for (int i = 0; i < blanks; i++) {
      builder.append("  ").append(quote("_blank" + i)).append(" [shape = none, label = <>];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a double-quoted DOT ID.
   *
   * @param str string to escape into an ID
   */
  private static String quote(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }
}
