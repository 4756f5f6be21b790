package io.cfgtypes.generator.analysis;

import io.cfgtypes.parser.api.DefinitionChoice;
import io.cfgtypes.parser.api.DefinitionPart;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Rule;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/** Classifies alternatives by recursion and rules by construction shape. */
final class RecursionClassifier {
  private final Map<Identifier, Rule> rules;
  private final RuleGraph graph;

  RecursionClassifier(Map<Identifier, Rule> rules, RuleGraph graph) {
    this.rules = rules;
    this.graph = graph;
  }

  RecursionKind classify(Identifier origin, DefinitionChoice choice) {
    List<DefinitionPart> parts = choice.parts();
    int n = parts.size();
    boolean left =
        n > 0 && leadsBack(parts.get(0), origin, RecursionClassifier::first, new HashSet<>());
    boolean right =
        n > 0 && leadsBack(parts.get(n - 1), origin, RecursionClassifier::last, new HashSet<>());
    boolean internal = false;
    for (int i = 1; i < n - 1; i++) {
      if (refersTo(parts.get(i), origin)) {
        internal = true;
        break;
      }
    }
    int kinds = (left ? 1 : 0) + (right ? 1 : 0) + (internal ? 1 : 0);
    if (kinds > 1) {
      return RecursionKind.MIXED;
    }
    if (left) {
      return RecursionKind.LEFT_RECURSIVE;
    }
    if (right) {
      return RecursionKind.RIGHT_RECURSIVE;
    }
    if (internal) {
      return RecursionKind.INTERNALLY_RECURSIVE;
    }
    for (DefinitionPart part : parts) {
      if (part instanceof DefinitionPart.Reference ref && graph.reaches(ref.target(), origin)) {
        return RecursionKind.INTERNALLY_RECURSIVE;
      }
    }
    return RecursionKind.NON_RECURSIVE;
  }

  ConstructionShape shape(Rule rule, List<RecursionKind> kinds) {
    if (kinds.stream().noneMatch(RecursionKind::isRecursive)) {
      return ConstructionShape.FLAT;
    }
    Identifier self = rule.identifier();
    List<DefinitionChoice> choices = rule.definition().choices();
    boolean hasBase = false;
    boolean hasGrowth = false;
    for (int i = 0; i < choices.size(); i++) {
      if (kinds.get(i) == RecursionKind.NON_RECURSIVE) {
        hasBase = true;
      } else if (kinds.get(i) == RecursionKind.LEFT_RECURSIVE
          && isGrowthStep(self, choices.get(i))) {
        hasGrowth = true;
      } else {
        return ConstructionShape.GENERAL;
      }
    }
    return hasBase && hasGrowth
        ? ConstructionShape.LEFT_RECURSIVE_SEQUENCE
        : ConstructionShape.GENERAL;
  }

  /** {@code self suffix} where the suffix is not empty and never leads back to {@code self}. */
  private boolean isGrowthStep(Identifier self, DefinitionChoice choice) {
    List<DefinitionPart> parts = choice.parts();
    if (parts.size() < 2 || !refersTo(parts.get(0), self)) {
      return false;
    }
    boolean payload = false;
    for (DefinitionPart part : parts.subList(1, parts.size())) {
      if (part instanceof DefinitionPart.Reference ref) {
        if (ref.target().equals(self) || graph.reaches(ref.target(), self)) {
          return false;
        }
        payload = true;
      } else if (part instanceof DefinitionPart.Literal) {
        payload = true;
      }
    }
    return payload;
  }

  /**
   * True if the part is a reference to the origin, or to a rule whose every alternative has an edge
   * part (picked by {@code edge}) that in turn leads back to the origin.
   */
  private boolean leadsBack(
      DefinitionPart part,
      Identifier origin,
      Function<DefinitionChoice, DefinitionPart> edge,
      Set<Identifier> visiting) {
    if (!(part instanceof DefinitionPart.Reference ref)) {
      return false;
    }
    Identifier target = ref.target();
    if (target.equals(origin)) {
      return true;
    }
    if (!visiting.add(target)) {
      return false;
    }
    try {
      for (DefinitionChoice choice : rules.get(target).definition().choices()) {
        DefinitionPart next = edge.apply(choice);
        if (next == null || !leadsBack(next, origin, edge, visiting)) {
          return false;
        }
      }
      return true;
    } finally {
      visiting.remove(target);
    }
  }

  private static DefinitionPart first(DefinitionChoice choice) {
    return choice.parts().isEmpty() ? null : choice.parts().get(0);
  }

  private static DefinitionPart last(DefinitionChoice choice) {
    return choice.parts().isEmpty() ? null : choice.parts().get(choice.parts().size() - 1);
  }

  private static boolean refersTo(DefinitionPart part, Identifier rule) {
    return part instanceof DefinitionPart.Reference ref && ref.target().equals(rule);
  }
}
