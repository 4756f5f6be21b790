package io.cfgtypes.parser.api;

import io.cfgtypes.parser.text.SingleLineText;
import java.util.Objects;

/**
 * One grammar symbol occurrence within an alternative.
 *
 * <p>The set of kinds is closed: every consumer handles {@link Literal}, {@link Reference} and
 * {@link Epsilon} and nothing else.
 */
public sealed interface DefinitionPart
    permits DefinitionPart.Literal, DefinitionPart.Reference, DefinitionPart.Epsilon {

  /** A terminal symbol. */
  record Literal(SingleLineText text) implements DefinitionPart {
    public Literal {
      Objects.requireNonNull(text, "text");
    }

    public static Literal of(String text) {
      return new Literal(SingleLineText.of(text));
    }

    @Override
    public String toString() {
      return "\"" + text + "\"";
    }
  }

  /** A reference to another (or the same) rule by name. */
  record Reference(Identifier target) implements DefinitionPart {
    public Reference {
      Objects.requireNonNull(target, "target");
    }

    public static Reference to(String... fragments) {
      return new Reference(Identifier.of(fragments));
    }

    @Override
    public String toString() {
      return target.toString();
    }
  }

  /** The nullary terminal: produces nothing. */
  record Epsilon() implements DefinitionPart {
    public static final Epsilon INSTANCE = new Epsilon();

    @Override
    public String toString() {
      return "ε";
    }
  }
}
