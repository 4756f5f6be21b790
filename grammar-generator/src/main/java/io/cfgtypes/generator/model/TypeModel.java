package io.cfgtypes.generator.model;

import io.cfgtypes.parser.api.Identifier;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Abstract type hierarchy of a grammar: capabilities, their variants and the refinement edges
 * between capabilities.
 *
 * <p>Refinement is an explicit relation, not inheritance: {@code refinements.get(X)} holds the
 * capabilities X is a refinement of. A renderer may realize it with interfaces, sealed unions or
 * protocol conformance.
 *
 * @param startRule the rule values of the whole language belong to
 * @param capabilities one per rule, in source order
 * @param refinements capability to its direct supertypes; acyclic
 */
public record TypeModel(
    Identifier startRule,
    List<Capability> capabilities,
    Map<Identifier, Set<Identifier>> refinements) {

  public TypeModel {
    capabilities = List.copyOf(capabilities);
    Map<Identifier, Set<Identifier>> copy = new LinkedHashMap<>();
    refinements.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
    refinements = Collections.unmodifiableMap(copy);
  }

  public Capability capability(Identifier rule) {
    for (Capability c : capabilities) {
      if (c.rule().equals(rule)) {
        return c;
      }
    }
    throw new IllegalArgumentException("No capability for rule " + rule);
  }

  /** Direct supertypes of a capability. */
  public Set<Identifier> supertypesOf(Identifier rule) {
    return refinements.getOrDefault(rule, Set.of());
  }

  /** Transitive supertypes of a capability, nearest first. */
  public Set<Identifier> allSupertypesOf(Identifier rule) {
    Set<Identifier> result = new LinkedHashSet<>();
    Deque<Identifier> queue = new ArrayDeque<>(supertypesOf(rule));
    while (!queue.isEmpty()) {
      Identifier next = queue.poll();
      if (result.add(next)) {
        queue.addAll(supertypesOf(next));
      }
    }
    return result;
  }

  /** Direct refinements (subtypes) of a capability. */
  public Set<Identifier> subtypesOf(Identifier rule) {
    Set<Identifier> result = new LinkedHashSet<>();
    refinements.forEach(
        (sub, supers) -> {
          if (supers.contains(rule)) {
            result.add(sub);
          }
        });
    return result;
  }

  /** True if values of {@code sub} are also values of {@code sup}. */
  public boolean isRefinementOf(Identifier sub, Identifier sup) {
    return sub.equals(sup) || allSupertypesOf(sub).contains(sup);
  }
}
