package io.cfgtypes.generator.builder;

import io.cfgtypes.generator.analysis.ConstructionShape;
import io.cfgtypes.generator.model.Capability;
import io.cfgtypes.generator.model.SubTerm;
import io.cfgtypes.generator.model.TypeModel;
import io.cfgtypes.generator.model.Variant;
import io.cfgtypes.generator.model.VariantRef;
import io.cfgtypes.parser.api.Identifier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds enumerable capabilities and lists their terminal values.
 *
 * <p>A capability is enumerable if its rule is flat and every variant is a single literal or a
 * single reference to another enumerable capability. {@code digit ::= "0" | nonZeroDigit} is
 * enumerable with the terminals 0 to 9, so a slot of type digit can be filled by one step per
 * digit instead of a separately built value.
 */
final class TerminalExpander {
  private static final Logger log = LoggerFactory.getLogger(TerminalExpander.class);

  private final TypeModel model;
  private final Map<Identifier, Optional<List<StepArgument.FixedTerminal>>> cache =
      new HashMap<>();

  TerminalExpander(TypeModel model) {
    this.model = model;
  }

  /** The distinct terminals of an enumerable capability, empty if it is not enumerable. */
  Optional<List<StepArgument.FixedTerminal>> terminals(Identifier capability) {
    return terminals(capability, new HashSet<>());
  }

  private Optional<List<StepArgument.FixedTerminal>> terminals(
      Identifier capability, Set<Identifier> visiting) {
    Optional<List<StepArgument.FixedTerminal>> cached = cache.get(capability);
    if (cached != null) {
      return cached;
    }
    if (!visiting.add(capability)) {
      return Optional.empty();
    }
    Optional<List<StepArgument.FixedTerminal>> result =
        expand(model.capability(capability), visiting);
    visiting.remove(capability);
    cache.put(capability, result);
    return result;
  }

  private Optional<List<StepArgument.FixedTerminal>> expand(
      Capability capability, Set<Identifier> visiting) {
    if (capability.shape() != ConstructionShape.FLAT) {
      return Optional.empty();
    }
    Map<String, StepArgument.FixedTerminal> byText = new LinkedHashMap<>();
    for (Variant variant : capability.variants()) {
      if (variant.subTerms().size() != 1) {
        return Optional.empty();
      }
      SubTerm term = variant.subTerms().get(0);
      List<StepArgument.FixedTerminal> found = new ArrayList<>();
      if (term instanceof SubTerm.LiteralSlot literal) {
        found.add(new StepArgument.FixedTerminal(List.of(variant.ref()), literal.text()));
      } else if (term instanceof SubTerm.CapabilitySlot slot) {
        Optional<List<StepArgument.FixedTerminal>> nested = terminals(slot.capability(), visiting);
        if (nested.isEmpty()) {
          return Optional.empty();
        }
        for (StepArgument.FixedTerminal t : nested.get()) {
          List<VariantRef> path = new ArrayList<>();
          path.add(variant.ref());
          path.addAll(t.path());
          found.add(new StepArgument.FixedTerminal(path, t.text()));
        }
      } else {
        return Optional.empty();
      }
      for (StepArgument.FixedTerminal t : found) {
        if (byText.putIfAbsent(t.text().value(), t) != null) {
          log.debug(
              "Terminal '{}' of {} is derivable more than once, keeping the first",
              t.text(),
              capability.rule());
        }
      }
    }
    return Optional.of(List.copyOf(byText.values()));
  }
}
