package io.cfgtypes.generator.builder;

import io.cfgtypes.generator.model.VariantRef;
import java.util.List;
import java.util.Objects;

/**
 * A construction step: the method a generated builder exposes.
 *
 * @param name step name, unique among the steps legal in the same state
 * @param role what the step does to the value under construction
 * @param variant the alternative the step selects
 * @param arguments sub-terms the step fills in, in order
 */
public record BuilderStep(
    String name, StepRole role, VariantRef variant, List<StepArgument> arguments) {

  /** Name of the terminal action, never used by an ordinary step. */
  public static final String BUILD = "Build";

  public BuilderStep {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(variant, "variant");
    arguments = List.copyOf(arguments);
    if (BUILD.equals(name)) {
      throw new IllegalArgumentException("Step name is reserved: " + name);
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
