package io.cfgtypes.generator.builder;

import io.cfgtypes.generator.model.VariantRef;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.text.SingleLineText;
import java.util.List;
import java.util.Objects;

/** A sub-term a builder step fills in. */
public sealed interface StepArgument
    permits StepArgument.FixedTerminal, StepArgument.SuppliedValue {

  /**
   * A terminal pinned by the step itself, such as the digit of a {@code Seven} step.
   *
   * @param path alternatives selected from the slot's capability down to the literal
   * @param text the literal
   */
  record FixedTerminal(List<VariantRef> path, SingleLineText text) implements StepArgument {
    public FixedTerminal {
      path = List.copyOf(path);
      Objects.requireNonNull(text, "text");
    }
  }

  /** An already built value of a capability, supplied by the caller. */
  record SuppliedValue(Identifier capability) implements StepArgument {
    public SuppliedValue {
      Objects.requireNonNull(capability, "capability");
    }
  }
}
