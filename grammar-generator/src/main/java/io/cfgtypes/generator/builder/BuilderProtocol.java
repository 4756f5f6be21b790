package io.cfgtypes.generator.builder;

import io.cfgtypes.generator.analysis.ConstructionShape;
import io.cfgtypes.parser.api.Identifier;

/**
 * Construction contract of one rule: either an incremental {@link StateMachine} or a {@link
 * CompositionContract} taking whole sub-terms.
 */
public sealed interface BuilderProtocol permits StateMachine, CompositionContract {

  Identifier rule();

  ConstructionShape shape();
}
