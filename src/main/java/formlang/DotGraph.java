package formlang;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Directed labelled multigraph that can be rendered for Graphviz.
 *
 * <p>The output is meant for looking at, not for reading back in.
 *
 * @param <V> vertex identifiers
 * @param <E> edge labels
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param initial does the automaton start here?
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean initial, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edge starts
   * @param to vertex where the edge ends
   * @param label label on the edge
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  Stream<Edge<V, E>> edges();

  /**
   * Render an edge label.
   *
   * @param edge edge associated with the label
   * @return HTML label string
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    final E label = edge.label();
    return label == null ? "" : label.toString();
  }

  /**
   * Render a vertex label.
   *
   * @param vertex vertex associated with the label
   * @return HTML label string
   */
  default String renderVertexLabel(Vertex<V> vertex) {
    return vertex.id().toString();
  }

  /**
   * Render a full Dot graph.
   *
   * <p>Every initial vertex gets an arrow coming out of an invisible node.
   * Compile the output using {@code dot -Tsvg fsm.dot > fsm.svg}.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph ").append(escapeId(name)).append(" {\n");
    builder.append("  rankdir = LR;\n");

    final List<String> entryArrows = new ArrayList<>();
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder
        .append("  ").append(id)
        .append(" [shape = ").append(shape)
        .append(", label = <").append(renderVertexLabel(vertex)).append(">];\n");

      if (vertex.initial()) {
        final var entryId = escapeId("_start" + entryArrows.size());
        builder.append("  ").append(entryId).append(" [shape = none, label = <>];\n");
        entryArrows.add("  " + entryId + " -> " + id + ";\n");
      }
    }
    entryArrows.forEach(builder::append);

    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      builder
        .append("  ").append(escapeId(edge.from().toString()))
        .append(" -> ").append(escapeId(edge.to().toString()))
        .append(" [label = <").append(renderEdgeLabel(edge)).append(">];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID: "any double-quoted string possibly
   * containing escaped quotes".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }
}
