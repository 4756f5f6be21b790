package io.cfgtypes.generator.analysis;

import io.cfgtypes.parser.api.Grammar;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Rule;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A grammar that passed analysis, with everything later stages need to shape types and builders.
 *
 * <p>Every reference in the grammar resolves to a key of {@link #rules()}, every rule is
 * productive, and every rule has a shape and one recursion kind per alternative.
 *
 * @param grammar the analyzed grammar
 * @param startRule the rule reachability was computed from
 * @param rules rules by name, in source order
 * @param graph the dependency graph
 * @param recursion recursion kind of each alternative, indexed like the rule's choices
 * @param shapes construction shape of each rule
 * @param reachable rules reachable from the start rule
 * @param warnings non-fatal findings
 */
public record AnalyzedGrammar(
    Grammar grammar,
    Identifier startRule,
    Map<Identifier, Rule> rules,
    RuleGraph graph,
    Map<Identifier, List<RecursionKind>> recursion,
    Map<Identifier, ConstructionShape> shapes,
    Set<Identifier> reachable,
    List<Diagnostic> warnings) {

  public AnalyzedGrammar {
    rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    recursion = Map.copyOf(recursion);
    shapes = Map.copyOf(shapes);
    reachable = Set.copyOf(reachable);
    warnings = List.copyOf(warnings);
  }

  public Rule rule(Identifier name) {
    Rule rule = rules.get(name);
    if (rule == null) {
      throw new IllegalArgumentException("Unknown rule " + name);
    }
    return rule;
  }

  public ConstructionShape shape(Identifier name) {
    return shapes.get(name);
  }

  public RecursionKind recursion(Identifier name, int alternative) {
    return recursion.get(name).get(alternative);
  }

  public boolean isReachable(Identifier name) {
    return reachable.contains(name);
  }
}
