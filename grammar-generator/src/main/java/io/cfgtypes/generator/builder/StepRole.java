package io.cfgtypes.generator.builder;

/** What taking a step means for the value under construction. */
public enum StepRole {
  /** Selects the single alternative of a flat rule. */
  CHOICE,
  /** Starts a left-recursive sequence with a non-recursive alternative. */
  BASE,
  /** Wraps the value built so far in a growth alternative. */
  GROWTH
}
