package io.cfgtypes.parser.api;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A parsed grammar: the rules in the order they were written.
 *
 * <p>No semantic validation happens here. Names may be duplicated and references may dangle until
 * the grammar has been analyzed.
 */
public record Grammar(List<Rule> rules) {

  public Grammar {
    rules = List.copyOf(rules);
    if (rules.isEmpty()) {
      throw new IllegalArgumentException("Grammar needs at least one rule");
    }
  }

  public static Grammar of(Rule... rules) {
    return new Grammar(List.of(rules));
  }

  /** The first rule in source order, the default start rule. */
  public Rule first() {
    return rules.get(0);
  }

  /** Distinct rule names in source order. */
  public Set<Identifier> ruleNames() {
    return rules.stream()
        .map(Rule::identifier)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /** The first rule with the given name, if any. */
  public Optional<Rule> find(Identifier name) {
    return rules.stream().filter(r -> r.identifier().equals(name)).findFirst();
  }

  @Override
  public String toString() {
    return rules.stream().map(Object::toString).collect(Collectors.joining("\n"));
  }
}
