package io.cfgtypes.generator.model;

import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.text.SingleLineText;
import java.util.Objects;

/** One ordered member of a variant. */
public sealed interface SubTerm
    permits SubTerm.CapabilitySlot, SubTerm.LiteralSlot, SubTerm.EmptySlot {

  /** Owns a value satisfying the capability of a rule. */
  record CapabilitySlot(Identifier capability) implements SubTerm {
    public CapabilitySlot {
      Objects.requireNonNull(capability, "capability");
    }
  }

  /** Holds fixed literal text. */
  record LiteralSlot(SingleLineText text) implements SubTerm {
    public LiteralSlot {
      Objects.requireNonNull(text, "text");
    }
  }

  /** Carries no payload. */
  record EmptySlot() implements SubTerm {
    public static final EmptySlot INSTANCE = new EmptySlot();
  }
}
