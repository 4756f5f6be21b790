package io.cfgtypes.generator.model;

import io.cfgtypes.generator.analysis.RecursionKind;
import io.cfgtypes.parser.api.Identifier;
import java.util.List;
import java.util.Optional;

/**
 * Concrete variant generated for one alternative of a rule.
 *
 * @param rule the rule whose capability this variant satisfies
 * @param index position of the alternative within the rule
 * @param name name unique within the rule, derived from the sub-terms
 * @param subTerms ordered members
 * @param recursion how the alternative refers back to its rule
 * @param passThrough true if the alternative is a single reference realized by capability
 *     refinement: values of the referenced capability are values of this one, no wrapper needed
 */
public record Variant(
    Identifier rule,
    int index,
    String name,
    List<SubTerm> subTerms,
    RecursionKind recursion,
    boolean passThrough) {

  public Variant {
    subTerms = List.copyOf(subTerms);
    if (passThrough
        && (subTerms.size() != 1 || !(subTerms.get(0) instanceof SubTerm.CapabilitySlot))) {
      throw new IllegalArgumentException("Only a single capability slot can pass through");
    }
  }

  /** The refining capability of a pass-through variant. */
  public Optional<Identifier> refinedBy() {
    return passThrough
        ? Optional.of(((SubTerm.CapabilitySlot) subTerms.get(0)).capability())
        : Optional.empty();
  }

  /** Capabilities this variant owns values of, in order. */
  public List<Identifier> requiredCapabilities() {
    return subTerms.stream()
        .filter(SubTerm.CapabilitySlot.class::isInstance)
        .map(t -> ((SubTerm.CapabilitySlot) t).capability())
        .toList();
  }

  public VariantRef ref() {
    return new VariantRef(rule, index);
  }
}
