package io.cfgtypes.generator.model;

import io.cfgtypes.parser.api.Identifier;

/** Points at one alternative of one rule. */
public record VariantRef(Identifier rule, int index) {

  @Override
  public String toString() {
    return rule + "#" + index;
  }
}
