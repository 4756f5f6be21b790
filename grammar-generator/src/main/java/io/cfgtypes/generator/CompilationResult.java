package io.cfgtypes.generator;

import io.cfgtypes.generator.analysis.AnalyzedGrammar;
import io.cfgtypes.generator.analysis.Diagnostic;
import io.cfgtypes.generator.builder.BuilderModel;
import io.cfgtypes.generator.model.TypeModel;
import io.cfgtypes.parser.api.Grammar;
import java.util.List;
import java.util.Objects;

/** Everything produced by one successful pass through the pipeline. */
public record CompilationResult(
    Grammar grammar, AnalyzedGrammar analyzed, TypeModel types, BuilderModel builders) {

  public CompilationResult {
    Objects.requireNonNull(grammar, "grammar");
    Objects.requireNonNull(analyzed, "analyzed");
    Objects.requireNonNull(types, "types");
    Objects.requireNonNull(builders, "builders");
  }

  /** Non-fatal diagnostics found during analysis, such as unreachable rules. */
  public List<Diagnostic> warnings() {
    return analyzed.warnings();
  }

  public <T> T renderWith(ModelRenderer<T> renderer) {
    return renderer.render(types, builders);
  }
}
