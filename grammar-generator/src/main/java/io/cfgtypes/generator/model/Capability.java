package io.cfgtypes.generator.model;

import io.cfgtypes.generator.analysis.ConstructionShape;
import io.cfgtypes.parser.api.Identifier;
import java.util.List;

/**
 * Abstract marker generated for a rule. Every variant of the rule satisfies it.
 *
 * @param rule the rule
 * @param name type name derived from the rule name
 * @param shape how values are constructed
 * @param variants one per alternative, in source order
 */
public record Capability(
    Identifier rule, String name, ConstructionShape shape, List<Variant> variants) {

  public Capability {
    variants = List.copyOf(variants);
  }

  public Variant variant(int index) {
    return variants.get(index);
  }
}
