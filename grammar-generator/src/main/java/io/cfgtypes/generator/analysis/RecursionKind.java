package io.cfgtypes.generator.analysis;

/** How an alternative of a rule refers back to the rule itself. */
public enum RecursionKind {
  /** No part leads back to the rule. */
  NON_RECURSIVE,
  /** The first part leads back to the rule. */
  LEFT_RECURSIVE,
  /** The last part leads back to the rule. */
  RIGHT_RECURSIVE,
  /** The rule recurs only away from the edges, directly or through a referenced rule. */
  INTERNALLY_RECURSIVE,
  /** More than one of the above. */
  MIXED;

  public boolean isRecursive() {
    return this != NON_RECURSIVE;
  }
}
