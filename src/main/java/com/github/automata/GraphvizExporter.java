package com.github.automata;

import java.io.IOException;
import java.io.Writer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes a {@link FiniteStateMachine} as a GraphViz DOT digraph. Final states are drawn as double
 * circles, every other state as a circle, the start state in bold, and each transition is labelled
 * with its description.
 *
 * Guards are opaque and never exported, only the description identifies a transition.
 */
public final class GraphvizExporter {
  private static final Logger logger =
      LogManager.getLogger(GraphvizExporter.class.getSimpleName());

  /**
   * The writer is flushed but not closed.
   */
  public static <T> void export(final FiniteStateMachine<T> machine, final Writer writer)
      throws IOException {
    final String newLine = System.lineSeparator();
    writer.write("digraph G {" + newLine);
    for (final State state : machine.getStates()) {
      writer.write("  " + quote(state.getName()) + " [shape="
          + (machine.isFinalState(state) ? "doublecircle" : "circle")
          + (state.equals(machine.getStartState()) ? ", style=bold" : "") + "];" + newLine);
    }
    int edges = 0;
    for (final Transition<T> transition : machine.getTransitions()) {
      writer.write("  " + quote(transition.getFromState().getName()) + " -> "
          + quote(transition.getToState().getName()) + " [label="
          + quote(transition.getDescription()) + "];" + newLine);
      edges++;
    }
    writer.write("}" + newLine);
    writer.flush();
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("[m:%s] Exported %d states and %d transitions", machine.getId(),
          machine.getStates().size(), edges));
    }
  }

  static String quote(final String text) {
    return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  private GraphvizExporter() {}
}
