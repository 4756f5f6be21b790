package io.cfgtypes.generator.analysis;

import io.cfgtypes.parser.api.DefinitionChoice;
import io.cfgtypes.parser.api.DefinitionPart;
import io.cfgtypes.parser.api.Grammar;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Rule;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static analysis of a parsed grammar.
 *
 * <p>Phases, in order:
 *
 * <ol>
 *   <li>name resolution: undefined references, duplicate rule names and an unknown start rule are
 *       collected together and reported in one {@link GrammarAnalysisException}
 *   <li>dependency graph construction
 *   <li>productivity: rules without a finite derivation, and rules depending on them, fail the
 *       analysis
 *   <li>reachability from the start rule: unreachable rules are only warnings
 *   <li>recursion classification of every alternative and construction shape of every rule
 * </ol>
 *
 * <p>The analyzer keeps no state between calls; every call builds its own symbol table.
 */
public final class GrammarAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(GrammarAnalyzer.class);

  /** Analyzes the grammar with its first rule as start rule. */
  public AnalyzedGrammar analyze(Grammar grammar) throws GrammarAnalysisException {
    return analyze(grammar, null);
  }

  /**
   * Analyzes the grammar.
   *
   * @param grammar the parsed grammar
   * @param startRule the start rule, or {@code null} for the first rule in source order
   * @return the analysis result, with warnings attached
   * @throws GrammarAnalysisException with every error of the first failing phase
   */
  public AnalyzedGrammar analyze(Grammar grammar, Identifier startRule)
      throws GrammarAnalysisException {
    Map<Identifier, Rule> rules = new LinkedHashMap<>();
    List<Diagnostic> duplicates = new ArrayList<>();
    for (Rule rule : grammar.rules()) {
      if (rules.putIfAbsent(rule.identifier(), rule) != null) {
        duplicates.add(
            Diagnostic.of(
                Diagnostic.Kind.DUPLICATE_RULE_NAME,
                rule.identifier(),
                "Rule " + rule.identifier() + " is defined more than once"));
      }
    }
    List<Diagnostic> errors = new ArrayList<>(resolveReferences(grammar, rules));
    errors.addAll(duplicates);
    Identifier start = startRule == null ? grammar.first().identifier() : startRule;
    if (!rules.containsKey(start)) {
      errors.add(
          Diagnostic.of(
              Diagnostic.Kind.UNKNOWN_START_RULE,
              start,
              "Start rule " + start + " is not defined"));
    }
    if (!errors.isEmpty()) {
      throw new GrammarAnalysisException(errors);
    }

    RuleGraph graph = RuleGraph.of(rules.values());
    checkProductivity(rules, graph);

    Set<Identifier> reachable = graph.reachableFrom(start);
    List<Diagnostic> warnings = new ArrayList<>();
    for (Identifier name : rules.keySet()) {
      if (!reachable.contains(name)) {
        log.warn("Rule {} is not reachable from start rule {}", name, start);
        warnings.add(
            Diagnostic.of(
                Diagnostic.Kind.UNREACHABLE_RULE,
                name,
                "Rule " + name + " is not reachable from " + start));
      }
    }

    RecursionClassifier classifier = new RecursionClassifier(rules, graph);
    Map<Identifier, List<RecursionKind>> recursion = new LinkedHashMap<>();
    Map<Identifier, ConstructionShape> shapes = new LinkedHashMap<>();
    for (Rule rule : rules.values()) {
      List<RecursionKind> kinds = new ArrayList<>();
      for (DefinitionChoice choice : rule.definition().choices()) {
        kinds.add(classifier.classify(rule.identifier(), choice));
      }
      ConstructionShape shape = classifier.shape(rule, kinds);
      recursion.put(rule.identifier(), List.copyOf(kinds));
      shapes.put(rule.identifier(), shape);
      log.debug("Rule {} has shape {} with alternatives {}", rule.identifier(), shape, kinds);
    }
    return new AnalyzedGrammar(
        grammar, start, rules, graph, recursion, shapes, reachable, warnings);
  }

  private static List<Diagnostic> resolveReferences(Grammar grammar, Map<Identifier, Rule> rules) {
    List<Diagnostic> errors = new ArrayList<>();
    for (Rule rule : grammar.rules()) {
      List<DefinitionChoice> choices = rule.definition().choices();
      for (int alt = 0; alt < choices.size(); alt++) {
        for (DefinitionPart part : choices.get(alt).parts()) {
          if (part instanceof DefinitionPart.Reference ref && !rules.containsKey(ref.target())) {
            errors.add(
                Diagnostic.of(
                    Diagnostic.Kind.UNDEFINED_RULE_REFERENCE,
                    rule.identifier(),
                    "Alternative "
                        + (alt + 1)
                        + " of rule "
                        + rule.identifier()
                        + " references undefined rule "
                        + ref.target()));
          }
        }
      }
    }
    return errors;
  }

  /** Least fixpoint: a rule is productive once one alternative only references productive rules. */
  private static void checkProductivity(Map<Identifier, Rule> rules, RuleGraph graph)
      throws GrammarAnalysisException {
    Set<Identifier> productive = new HashSet<>();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Rule rule : rules.values()) {
        if (!productive.contains(rule.identifier())
            && rule.definition().choices().stream().anyMatch(c -> allProductive(c, productive))) {
          productive.add(rule.identifier());
          changed = true;
        }
      }
    }
    if (productive.size() == rules.size()) {
      return;
    }
    Set<Identifier> unproductive = new LinkedHashSet<>(rules.keySet());
    unproductive.removeAll(productive);
    List<Diagnostic> errors = new ArrayList<>();
    for (Identifier name : unproductive) {
      errors.add(
          Diagnostic.of(
              Diagnostic.Kind.UNPRODUCTIVE_RULE,
              name,
              "Rule " + name + " cannot derive a finite sequence"));
    }
    for (Identifier name : rules.keySet().stream().filter(productive::contains).toList()) {
      Set<Identifier> reached = graph.reachableFrom(name);
      for (Identifier dep : unproductive) {
        if (!reached.contains(dep)) {
          continue;
        }
        String how =
            graph.dependencies(name).contains(dep)
                ? " references unproductive rule "
                : " indirectly references unproductive rule ";
        errors.add(
            Diagnostic.of(
                Diagnostic.Kind.DEPENDS_ON_UNPRODUCTIVE_RULE, name, "Rule " + name + how + dep));
      }
    }
    throw new GrammarAnalysisException(errors);
  }

  private static boolean allProductive(DefinitionChoice choice, Set<Identifier> productive) {
    for (DefinitionPart part : choice.parts()) {
      if (part instanceof DefinitionPart.Reference ref && !productive.contains(ref.target())) {
        return false;
      }
    }
    return true;
  }
}
