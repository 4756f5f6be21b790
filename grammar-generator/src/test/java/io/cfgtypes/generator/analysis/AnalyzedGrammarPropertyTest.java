package io.cfgtypes.generator.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import io.cfgtypes.parser.api.Definition;
import io.cfgtypes.parser.api.DefinitionChoice;
import io.cfgtypes.parser.api.DefinitionPart;
import io.cfgtypes.parser.api.Grammar;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Rule;
import java.util.ArrayList;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/** Invariants that hold for every grammar the analyzer accepts. */
class AnalyzedGrammarPropertyTest {
  private static final List<String> NAMES = List.of("a", "b", "c", "d", "e", "f");

  @Property(tries = 500)
  void acceptedGrammarsAreClosedAndClassified(@ForAll("grammars") Grammar grammar) {
    AnalyzedGrammar analyzed;
    try {
      analyzed = new GrammarAnalyzer().analyze(grammar);
    } catch (GrammarAnalysisException e) {
      assertThat(e.getDiagnostics()).isNotEmpty().allMatch(Diagnostic::isError);
      return;
    }
    for (Rule rule : grammar.rules()) {
      for (DefinitionChoice choice : rule.definition().choices()) {
        for (DefinitionPart part : choice.parts()) {
          if (part instanceof DefinitionPart.Reference ref) {
            assertThat(analyzed.rules()).containsKey(ref.target());
          }
        }
      }
    }
    for (Rule rule : analyzed.rules().values()) {
      Identifier name = rule.identifier();
      assertThat(analyzed.shape(name)).isNotNull();
      assertThat(analyzed.recursion().get(name)).hasSize(rule.definition().choices().size());
      assertThat(analyzed.isReachable(name))
          .isEqualTo(analyzed.warnings().stream().noneMatch(w -> w.rule().equals(name)));
    }
  }

  @Provide
  Arbitrary<Grammar> grammars() {
    Arbitrary<DefinitionPart> parts =
        Arbitraries.oneOf(
            Arbitraries.of(NAMES).map(DefinitionPart.Reference::to),
            Arbitraries.of("x", "y", "0").map(DefinitionPart.Literal::of));
    Arbitrary<Definition> definitions =
        parts
            .list()
            .ofMaxSize(3)
            .map(DefinitionChoice::new)
            .list()
            .ofMinSize(1)
            .ofMaxSize(3)
            .map(Definition::new);
    return definitions
        .list()
        .ofMinSize(1)
        .ofMaxSize(NAMES.size())
        .map(
            defs -> {
              List<Rule> rules = new ArrayList<>();
              for (int i = 0; i < defs.size(); i++) {
                rules.add(new Rule(Identifier.of(NAMES.get(i)), defs.get(i)));
              }
              return new Grammar(rules);
            });
  }
}
