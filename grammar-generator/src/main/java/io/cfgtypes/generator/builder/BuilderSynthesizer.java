package io.cfgtypes.generator.builder;

import io.cfgtypes.generator.analysis.ConstructionShape;
import io.cfgtypes.generator.model.Capability;
import io.cfgtypes.generator.model.SubTerm;
import io.cfgtypes.generator.model.TermNames;
import io.cfgtypes.generator.model.TypeModel;
import io.cfgtypes.generator.model.Variant;
import io.cfgtypes.parser.api.Identifier;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the construction protocol of every rule from the type model.
 *
 * <ul>
 *   <li>flat rules: {@code INITIAL --choice--> COMPLETE}, Build from {@code COMPLETE}
 *   <li>left-recursive sequences: {@code INITIAL --base--> GROWING}, {@code GROWING --growth-->
 *       GROWING}, Build from {@code GROWING}
 *   <li>general rules: a {@link CompositionContract}, never a state machine
 * </ul>
 *
 * <p>The payload of an alternative (all sub-terms, or everything after the leading self reference
 * of a growth alternative) becomes steps as follows: a single literal gives one step named after
 * it, a single slot of an enumerable capability gives one step per terminal, nothing gives an
 * {@code Empty} step, and anything else gives one step taking the built sub-terms.
 */
public final class BuilderSynthesizer {
  private static final Logger log = LoggerFactory.getLogger(BuilderSynthesizer.class);

  public BuilderModel synthesize(TypeModel model) {
    TerminalExpander expander = new TerminalExpander(model);
    Map<Identifier, BuilderProtocol> protocols = new LinkedHashMap<>();
    for (Capability capability : model.capabilities()) {
      BuilderProtocol protocol =
          capability.shape() == ConstructionShape.GENERAL
              ? composition(capability)
              : incremental(capability, expander);
      protocols.put(capability.rule(), protocol);
    }
    return new BuilderModel(protocols);
  }

  /**
   * Synthesizes the incremental builder of one rule.
   *
   * @throws UnsupportedShapeException if the rule has shape {@link ConstructionShape#GENERAL}
   */
  public StateMachine synthesizeIncremental(TypeModel model, Identifier rule) {
    Capability capability = model.capability(rule);
    if (capability.shape() == ConstructionShape.GENERAL) {
      throw new UnsupportedShapeException(rule, capability.shape());
    }
    return incremental(capability, new TerminalExpander(model));
  }

  /** Composition contract of one rule. Any rule can be composed, general ones must be. */
  public CompositionContract synthesizeComposition(TypeModel model, Identifier rule) {
    return composition(model.capability(rule));
  }

  private StateMachine incremental(Capability capability, TerminalExpander expander) {
    List<Transition> transitions = new ArrayList<>();
    if (capability.shape() == ConstructionShape.FLAT) {
      List<Candidate> choices = new ArrayList<>();
      for (Variant variant : capability.variants()) {
        choices.addAll(candidates(variant, variant.subTerms(), StepRole.CHOICE, expander));
      }
      for (BuilderStep step : unique(capability, choices)) {
        transitions.add(new Transition(BuilderState.INITIAL, step, BuilderState.COMPLETE));
      }
      return new StateMachine(
          capability.rule(),
          capability.shape(),
          BuilderState.INITIAL,
          EnumSet.of(BuilderState.INITIAL, BuilderState.COMPLETE),
          transitions,
          EnumSet.of(BuilderState.COMPLETE));
    }

    List<Candidate> bases = new ArrayList<>();
    List<Candidate> growth = new ArrayList<>();
    for (Variant variant : capability.variants()) {
      if (variant.recursion().isRecursive()) {
        List<SubTerm> suffix = variant.subTerms().subList(1, variant.subTerms().size());
        growth.addAll(candidates(variant, suffix, StepRole.GROWTH, expander));
      } else {
        bases.addAll(candidates(variant, variant.subTerms(), StepRole.BASE, expander));
      }
    }
    for (BuilderStep step : unique(capability, bases)) {
      transitions.add(new Transition(BuilderState.INITIAL, step, BuilderState.GROWING));
    }
    for (BuilderStep step : unique(capability, growth)) {
      transitions.add(new Transition(BuilderState.GROWING, step, BuilderState.GROWING));
    }
    return new StateMachine(
        capability.rule(),
        capability.shape(),
        BuilderState.INITIAL,
        EnumSet.of(BuilderState.INITIAL, BuilderState.GROWING),
        transitions,
        EnumSet.of(BuilderState.GROWING));
  }

  /** A step before its name is made unique. */
  private record Candidate(
      String name, StepRole role, Variant variant, List<StepArgument> arguments) {}

  private static List<Candidate> candidates(
      Variant variant, List<SubTerm> payload, StepRole role, TerminalExpander expander) {
    List<SubTerm> effective =
        payload.stream().filter(t -> !(t instanceof SubTerm.EmptySlot)).toList();
    if (effective.isEmpty()) {
      return List.of(new Candidate("Empty", role, variant, List.of()));
    }
    if (effective.size() == 1) {
      SubTerm only = effective.get(0);
      if (only instanceof SubTerm.LiteralSlot literal) {
        return List.of(
            new Candidate(TermNames.literalName(literal.text().value()), role, variant, List.of()));
      }
      if (only instanceof SubTerm.CapabilitySlot slot) {
        Optional<List<StepArgument.FixedTerminal>> terminals =
            expander.terminals(slot.capability());
        if (terminals.isPresent()) {
          List<Candidate> candidates = new ArrayList<>();
          for (StepArgument.FixedTerminal terminal : terminals.get()) {
            candidates.add(
                new Candidate(
                    TermNames.literalName(terminal.text().value()),
                    role,
                    variant,
                    List.of(terminal)));
          }
          return candidates;
        }
      }
    }
    return List.of(
        new Candidate(TermNames.termsName(effective), role, variant, supplied(effective)));
  }

  private static List<StepArgument> supplied(List<SubTerm> terms) {
    List<StepArgument> arguments = new ArrayList<>();
    for (SubTerm term : terms) {
      if (term instanceof SubTerm.CapabilitySlot slot) {
        arguments.add(new StepArgument.SuppliedValue(slot.capability()));
      }
    }
    return arguments;
  }

  /** Turns candidates into steps, renaming those whose names collide within one state. */
  private static List<BuilderStep> unique(Capability capability, List<Candidate> candidates) {
    List<String> names =
        TermNames.disambiguate(
            candidates.stream().map(Candidate::name).toList(), Set.of(BuilderStep.BUILD));
    List<BuilderStep> steps = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      Candidate c = candidates.get(i);
      if (!c.name().equals(names.get(i))) {
        log.debug("Step {} of {} renamed to {}", c.name(), capability.rule(), names.get(i));
      }
      steps.add(new BuilderStep(names.get(i), c.role(), c.variant().ref(), c.arguments()));
    }
    return steps;
  }

  private static CompositionContract composition(Capability capability) {
    List<CompositionContract.Constructor> constructors = new ArrayList<>();
    for (Variant variant : capability.variants()) {
      constructors.add(
          new CompositionContract.Constructor(
              variant.name(), variant.ref(), supplied(variant.subTerms())));
    }
    return new CompositionContract(capability.rule(), constructors);
  }
}
