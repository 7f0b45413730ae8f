package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.io.StringWriter;

import org.junit.Test;

public class GraphvizExporterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testExport() throws FiniteStateMachineException, IOException {
    final FiniteStateMachine<Character> machine = FsmFactory.lengthMod3Machine();
    final StringWriter writer = new StringWriter();
    GraphvizExporter.export(machine, writer);
    final String dot = writer.toString();

    assertTrue(dot.startsWith("digraph G {"));
    assertTrue(dot.trim().endsWith("}"));
    assertTrue(dot.contains("\"mod3=0\" [shape=doublecircle, style=bold];"));
    assertTrue(dot.contains("\"mod3=1\" [shape=circle];"));
    assertTrue(dot.contains("\"mod3=0\" -> \"mod3=2\" [label=\"0->2\"];"));
  }

  @Test
  public void testQuote() {
    assertEquals("\"say \\\"hi\\\"\"", GraphvizExporter.quote("say \"hi\""));
    assertEquals("\"a\\\\b\"", GraphvizExporter.quote("a\\b"));
  }

}
