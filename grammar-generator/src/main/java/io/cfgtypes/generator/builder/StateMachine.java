package io.cfgtypes.generator.builder;

import io.cfgtypes.generator.analysis.ConstructionShape;
import io.cfgtypes.parser.api.Identifier;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Incremental builder of a rule as data: states, a legal-transition table and the states the
 * {@link BuilderStep#BUILD Build} action is legal in.
 *
 * <p>The table is checked on construction: transitions are deterministic (no two steps of the same
 * name leave a state), every state is reachable from the initial one, and at least one state
 * allows Build.
 *
 * @param rule the rule values are built for
 * @param shape {@link ConstructionShape#FLAT} or {@link ConstructionShape#LEFT_RECURSIVE_SEQUENCE}
 * @param initial the state a fresh builder is in
 * @param states all states of the machine
 * @param transitions the legal steps
 * @param accepting states in which Build is legal
 */
public record StateMachine(
    Identifier rule,
    ConstructionShape shape,
    BuilderState initial,
    Set<BuilderState> states,
    List<Transition> transitions,
    Set<BuilderState> accepting)
    implements BuilderProtocol {

  public StateMachine {
    if (shape == ConstructionShape.GENERAL) {
      throw new UnsupportedShapeException(rule, shape);
    }
    states = Collections.unmodifiableSet(EnumSet.copyOf(states));
    accepting = Collections.unmodifiableSet(EnumSet.copyOf(accepting));
    transitions = List.copyOf(transitions);
    validate(initial, states, transitions, accepting);
  }

  private static void validate(
      BuilderState initial,
      Set<BuilderState> states,
      List<Transition> transitions,
      Set<BuilderState> accepting) {
    if (!states.contains(initial) || !states.containsAll(accepting) || accepting.isEmpty()) {
      throw new IllegalArgumentException("Initial and accepting states must be machine states");
    }
    Set<String> seen = new HashSet<>();
    for (Transition t : transitions) {
      if (!states.contains(t.from()) || !states.contains(t.to())) {
        throw new IllegalArgumentException("Transition leaves the machine: " + t);
      }
      if (!seen.add(t.from() + "/" + t.step().name())) {
        throw new IllegalArgumentException("Ambiguous step " + t.step().name() + " in " + t.from());
      }
    }
    Set<BuilderState> reached = EnumSet.of(initial);
    Deque<BuilderState> queue = new ArrayDeque<>(reached);
    while (!queue.isEmpty()) {
      BuilderState from = queue.poll();
      for (Transition t : transitions) {
        if (t.from() == from && reached.add(t.to())) {
          queue.add(t.to());
        }
      }
    }
    if (!reached.containsAll(states)) {
      throw new IllegalArgumentException(
          "Unreachable states in " + states + ", reached " + reached);
    }
  }

  /** Steps legal in the given state, in table order. */
  public List<BuilderStep> legalSteps(BuilderState state) {
    return transitions.stream().filter(t -> t.from() == state).map(Transition::step).toList();
  }

  public Optional<Transition> transition(BuilderState from, String stepName) {
    return transitions.stream()
        .filter(t -> t.from() == from && t.step().name().equals(stepName))
        .findFirst();
  }

  public boolean canBuild(BuilderState state) {
    return accepting.contains(state);
  }

  /**
   * Runs a sequence of step names through the machine.
   *
   * @param sequence step names ending with {@link BuilderStep#BUILD}
   * @return true if every step is legal where it is taken and the sequence ends with a legal Build
   */
  public boolean accepts(List<String> sequence) {
    BuilderState state = initial;
    for (int i = 0; i < sequence.size(); i++) {
      String name = sequence.get(i);
      if (BuilderStep.BUILD.equals(name)) {
        return i == sequence.size() - 1 && canBuild(state);
      }
      Optional<Transition> t = transition(state, name);
      if (t.isEmpty()) {
        return false;
      }
      state = t.get().to();
    }
    return false;
  }

  /** A fresh cursor positioned at the initial state. */
  public ProtocolCursor cursor() {
    return new ProtocolCursor(this);
  }
}
