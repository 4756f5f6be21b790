package io.cfgtypes.generator.builder;

/** States of an incremental builder. */
public enum BuilderState {
  /** Nothing supplied yet. */
  INITIAL,
  /** A base step was taken; growth steps may follow. */
  GROWING,
  /** An alternative was chosen and fully supplied. */
  COMPLETE
}
