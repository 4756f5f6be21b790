package io.cfgtypes.parser.api;

import java.util.List;
import java.util.stream.Collectors;

/** One alternative of a rule. May be empty, which derives the empty sequence. */
public record DefinitionChoice(List<DefinitionPart> parts) {

  public DefinitionChoice {
    parts = List.copyOf(parts);
  }

  public static DefinitionChoice of(DefinitionPart... parts) {
    return new DefinitionChoice(List.of(parts));
  }

  /** True for an empty choice or a choice made only of epsilon markers. */
  public boolean derivesNothing() {
    return parts.stream().allMatch(p -> p instanceof DefinitionPart.Epsilon);
  }

  public int size() {
    return parts.size();
  }

  @Override
  public String toString() {
    return parts.stream().map(Object::toString).collect(Collectors.joining(" "));
  }
}
