package io.cfgtypes.parser.api;

import java.util.List;
import java.util.stream.Collectors;

/** All alternatives of one rule, in source order. */
public record Definition(List<DefinitionChoice> choices) {

  public Definition {
    choices = List.copyOf(choices);
    if (choices.isEmpty()) {
      throw new IllegalArgumentException("Definition needs at least one choice");
    }
  }

  public static Definition of(DefinitionChoice... choices) {
    return new Definition(List.of(choices));
  }

  @Override
  public String toString() {
    return choices.stream().map(Object::toString).collect(Collectors.joining(" | "));
  }
}
