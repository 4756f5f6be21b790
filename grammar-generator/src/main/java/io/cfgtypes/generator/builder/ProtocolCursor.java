package io.cfgtypes.generator.builder;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Walks a {@link StateMachine} one step at a time, the way a generated builder object would.
 * Illegal steps are rejected immediately. Not thread-safe.
 */
public final class ProtocolCursor {
  private final StateMachine machine;
  private final List<BuilderStep> taken = new ArrayList<>();
  private BuilderState state;
  private boolean built;

  ProtocolCursor(StateMachine machine) {
    this.machine = machine;
    this.state = machine.initial();
  }

  public BuilderState state() {
    return state;
  }

  public List<BuilderStep> legalSteps() {
    return built ? List.of() : machine.legalSteps(state);
  }

  public boolean canBuild() {
    return !built && machine.canBuild(state);
  }

  /**
   * Takes a step.
   *
   * @throws IllegalStateException if the step is not legal in the current state
   */
  public ProtocolCursor step(String name) {
    checkNotBuilt();
    Transition t =
        machine
            .transition(state, name)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Step "
                            + name
                            + " is not legal for "
                            + machine.rule()
                            + " in state "
                            + state
                            + ", legal steps: "
                            + legalSteps().stream()
                                .map(BuilderStep::name)
                                .collect(Collectors.joining(", "))));
    taken.add(t.step());
    state = t.to();
    return this;
  }

  /**
   * Finishes construction.
   *
   * @return the steps taken, in order
   * @throws IllegalStateException if Build is not legal in the current state
   */
  public List<BuilderStep> build() {
    checkNotBuilt();
    if (!machine.canBuild(state)) {
      throw new IllegalStateException(
          "Cannot build " + machine.rule() + " in state " + state + " after " + taken);
    }
    built = true;
    return List.copyOf(taken);
  }

  private void checkNotBuilt() {
    if (built) {
      throw new IllegalStateException("Already built");
    }
  }
}
