package io.cfgtypes.generator.analysis;

/** How values of a rule can be constructed. */
public enum ConstructionShape {
  /** No alternative leads back to the rule: pick one alternative and supply its parts. */
  FLAT,
  /**
   * {@code rule := base | rule suffix}: one base step followed by any number of growth steps.
   */
  LEFT_RECURSIVE_SEQUENCE,
  /** Anything else: values are composed from already built sub-terms. */
  GENERAL
}
