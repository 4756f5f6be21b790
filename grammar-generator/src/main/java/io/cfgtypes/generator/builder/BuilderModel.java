package io.cfgtypes.generator.builder;

import io.cfgtypes.parser.api.Identifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Construction protocol of every rule, in source order. */
public record BuilderModel(Map<Identifier, BuilderProtocol> protocols) {

  public BuilderModel {
    protocols = Collections.unmodifiableMap(new LinkedHashMap<>(protocols));
  }

  public BuilderProtocol protocol(Identifier rule) {
    BuilderProtocol protocol = protocols.get(rule);
    if (protocol == null) {
      throw new IllegalArgumentException("No protocol for rule " + rule);
    }
    return protocol;
  }

  /**
   * The incremental builder of a rule.
   *
   * @throws UnsupportedShapeException if the rule is built by composition
   */
  public StateMachine stateMachine(Identifier rule) {
    BuilderProtocol protocol = protocol(rule);
    if (protocol instanceof StateMachine machine) {
      return machine;
    }
    throw new UnsupportedShapeException(rule, protocol.shape());
  }
}
