package io.cfgtypes.generator.analysis;

import io.cfgtypes.parser.api.DefinitionChoice;
import io.cfgtypes.parser.api.DefinitionPart;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Rule;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Directed dependency graph of a grammar: an edge {@code A -> B} exists if some alternative of
 * {@code A} references {@code B}. Self edges are kept.
 */
public final class RuleGraph {
  private final Map<Identifier, Set<Identifier>> edges;

  private RuleGraph(Map<Identifier, Set<Identifier>> edges) {
    this.edges = edges;
  }

  /**
   * Builds the graph of rules with unique names. References are not checked, every referenced
   * name must already have been resolved.
   */
  public static RuleGraph of(Collection<Rule> rules) {
    Map<Identifier, Set<Identifier>> edges = new LinkedHashMap<>();
    for (Rule rule : rules) {
      Set<Identifier> targets = new LinkedHashSet<>();
      for (DefinitionChoice choice : rule.definition().choices()) {
        for (DefinitionPart part : choice.parts()) {
          if (part instanceof DefinitionPart.Reference ref) {
            targets.add(ref.target());
          }
        }
      }
      if (edges.put(rule.identifier(), Collections.unmodifiableSet(targets)) != null) {
        throw new IllegalArgumentException("Duplicate rule " + rule.identifier());
      }
    }
    return new RuleGraph(Collections.unmodifiableMap(edges));
  }

  public Set<Identifier> rules() {
    return edges.keySet();
  }

  /** Rules directly referenced by the given rule. */
  public Set<Identifier> dependencies(Identifier rule) {
    Set<Identifier> deps = edges.get(rule);
    if (deps == null) {
      throw new IllegalArgumentException("Unknown rule " + rule);
    }
    return deps;
  }

  /** Rules that directly reference the given rule. */
  public Set<Identifier> dependents(Identifier rule) {
    Set<Identifier> result = new LinkedHashSet<>();
    edges.forEach(
        (from, to) -> {
          if (to.contains(rule)) {
            result.add(from);
          }
        });
    return result;
  }

  /** The start rule and every rule reachable from it, in breadth-first order. */
  public Set<Identifier> reachableFrom(Identifier start) {
    Set<Identifier> seen = new LinkedHashSet<>();
    Deque<Identifier> queue = new ArrayDeque<>();
    seen.add(start);
    queue.add(start);
    while (!queue.isEmpty()) {
      for (Identifier next : dependencies(queue.poll())) {
        if (seen.add(next)) {
          queue.add(next);
        }
      }
    }
    return Collections.unmodifiableSet(seen);
  }

  /** True if a path of at least one edge leads from {@code from} to {@code to}. */
  public boolean reaches(Identifier from, Identifier to) {
    for (Identifier next : dependencies(from)) {
      if (next.equals(to) || reachableFrom(next).contains(to)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "RuleGraph" + edges;
  }
}
