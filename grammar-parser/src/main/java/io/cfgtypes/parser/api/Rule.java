package io.cfgtypes.parser.api;

import java.util.Objects;

/** A named rule. */
public record Rule(Identifier identifier, Definition definition) {

  public Rule {
    Objects.requireNonNull(identifier, "identifier");
    Objects.requireNonNull(definition, "definition");
  }

  @Override
  public String toString() {
    return identifier + " ::= " + definition;
  }
}
