package io.cfgtypes.generator;

import io.cfgtypes.generator.analysis.AnalyzedGrammar;
import io.cfgtypes.generator.analysis.GrammarAnalyzer;
import io.cfgtypes.generator.builder.BuilderModel;
import io.cfgtypes.generator.builder.BuilderSynthesizer;
import io.cfgtypes.generator.model.TypeModel;
import io.cfgtypes.generator.model.TypeModelBuilder;
import io.cfgtypes.parser.GrammarParser;
import io.cfgtypes.parser.api.Grammar;
import io.cfgtypes.parser.api.GrammarException;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Notation;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs source text through parsing, analysis, type modelling and builder synthesis.
 *
 * <p>Instances are stateless apart from their notation and can be shared between threads.
 */
public final class GrammarCompiler {
  private static final Logger log = LoggerFactory.getLogger(GrammarCompiler.class);

  private final Notation notation;
  private final GrammarAnalyzer analyzer = new GrammarAnalyzer();
  private final TypeModelBuilder typeModelBuilder = new TypeModelBuilder();
  private final BuilderSynthesizer synthesizer = new BuilderSynthesizer();

  private GrammarCompiler(Notation notation) {
    this.notation = Objects.requireNonNull(notation, "notation");
  }

  /**
   * A compiler whose notation is read from the {@code cfgtypes.notation.*} system properties,
   * falling back to {@link Notation#bnf()}.
   */
  public static GrammarCompiler create() {
    Notation notation = Notation.fromProperties(System.getProperties());
    log.debug("Using notation {}", notation);
    return new GrammarCompiler(notation);
  }

  public static GrammarCompiler create(Notation notation) {
    return new GrammarCompiler(notation);
  }

  public Notation notation() {
    return notation;
  }

  public CompilationResult compile(String source) throws GrammarException {
    return compile(source, null);
  }

  /**
   * @param startRule the rule reachability is computed from; {@code null} for the first rule
   */
  public CompilationResult compile(String source, Identifier startRule) throws GrammarException {
    return compile(GrammarParser.parse(source, notation), startRule);
  }

  public CompilationResult compile(Reader source) throws GrammarException {
    return compile(GrammarParser.parse(source, notation), null);
  }

  public CompilationResult compile(Grammar grammar, Identifier startRule) throws GrammarException {
    AnalyzedGrammar analyzed = analyzer.analyze(grammar, startRule);
    TypeModel types = typeModelBuilder.build(analyzed);
    BuilderModel builders = synthesizer.synthesize(types);
    log.debug(
        "Compiled {} rules starting at {} with {} warnings",
        grammar.rules().size(),
        analyzed.startRule(),
        analyzed.warnings().size());
    return new CompilationResult(grammar, analyzed, types, builders);
  }

  public <T> T render(String source, ModelRenderer<T> renderer) throws GrammarException {
    return compile(source).renderWith(renderer);
  }

  /**
   * Compiles independent grammars concurrently. Each outcome carries either its result or the
   * checked failure of that grammar; one failing grammar does not affect the others. Outcomes
   * are returned in the iteration order of {@code sources}.
   */
  public List<BatchOutcome> compileAll(Map<String, String> sources, Executor executor) {
    List<CompletableFuture<BatchOutcome>> futures = new ArrayList<>(sources.size());
    for (Map.Entry<String, String> entry : sources.entrySet()) {
      String name = entry.getKey();
      String source = entry.getValue();
      futures.add(CompletableFuture.supplyAsync(() -> compileOne(name, source), executor));
    }
    List<BatchOutcome> outcomes = new ArrayList<>(futures.size());
    for (CompletableFuture<BatchOutcome> future : futures) {
      outcomes.add(future.join());
    }
    return outcomes;
  }

  private BatchOutcome compileOne(String name, String source) {
    try {
      return BatchOutcome.success(name, compile(source));
    } catch (GrammarException e) {
      log.debug("Grammar {} failed: {}", name, e.getMessage());
      return BatchOutcome.failure(name, e);
    } catch (RuntimeException e) {
      throw new CompletionException("Internal failure compiling grammar " + name, e);
    }
  }
}
