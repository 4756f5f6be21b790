package io.cfgtypes.generator.builder;

import io.cfgtypes.generator.analysis.ConstructionShape;
import io.cfgtypes.parser.api.Identifier;

/**
 * Thrown when an incremental builder is requested for a rule that cannot have one. This is a
 * contract violation by the caller, never a problem with the grammar.
 */
public class UnsupportedShapeException extends IllegalStateException {
  private final Identifier rule;
  private final ConstructionShape shape;

  public UnsupportedShapeException(Identifier rule, ConstructionShape shape) {
    super("Rule " + rule + " has shape " + shape + " and no incremental builder");
    this.rule = rule;
    this.shape = shape;
  }

  public Identifier getRule() {
    return rule;
  }

  public ConstructionShape getShape() {
    return shape;
  }
}
