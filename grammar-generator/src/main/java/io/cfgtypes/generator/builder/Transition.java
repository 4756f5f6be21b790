package io.cfgtypes.generator.builder;

/** Taking {@code step} in state {@code from} leads to state {@code to}. */
public record Transition(BuilderState from, BuilderStep step, BuilderState to) {

  @Override
  public String toString() {
    return from + " --" + step.name() + "--> " + to;
  }
}
