package io.cfgtypes.generator.analysis;

import io.cfgtypes.parser.api.GrammarException;
import java.util.List;

/**
 * Thrown when a grammar is well-formed text but semantically invalid. Carries every error found in
 * the failing phase, not just the first one.
 */
public class GrammarAnalysisException extends GrammarException {
  private final List<Diagnostic> diagnostics;

  public GrammarAnalysisException(List<Diagnostic> diagnostics) {
    super(Stage.ANALYSIS, summarize(diagnostics), null);
    this.diagnostics = List.copyOf(diagnostics);
  }

  private static String summarize(List<Diagnostic> diagnostics) {
    StringBuilder sb = new StringBuilder();
    sb.append(diagnostics.size()).append(diagnostics.size() == 1 ? " error" : " errors");
    sb.append(" in grammar");
    for (Diagnostic d : diagnostics) {
      sb.append("\n  ").append(d);
    }
    return sb.toString();
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }
}
