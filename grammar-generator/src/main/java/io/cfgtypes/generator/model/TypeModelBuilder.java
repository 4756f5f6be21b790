package io.cfgtypes.generator.model;

import io.cfgtypes.generator.analysis.AnalyzedGrammar;
import io.cfgtypes.generator.analysis.ConstructionShape;
import io.cfgtypes.generator.analysis.RecursionKind;
import io.cfgtypes.parser.api.DefinitionChoice;
import io.cfgtypes.parser.api.DefinitionPart;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Rule;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps an analyzed grammar to its {@link TypeModel}.
 *
 * <p>Each rule becomes a capability and each alternative a variant. An alternative made of a
 * single reference to another rule {@code R} makes {@code R} a refinement of the rule: a
 * non-zero digit is a digit, so {@code digit ::= "0" | nonZeroDigit} yields the edge {@code
 * nonZeroDigit -> digit}. An edge that would close a cycle is left out and its alternative is
 * kept as an ordinary wrapping variant.
 *
 * <p>Capability names are unique across the model. Rules such as {@code digit} and {@code Digit}
 * are distinct but share a Pascal-case name; the later one gets a numeric suffix.
 *
 * <p>The builder has no failure mode of its own. An {@link IllegalStateException} means the
 * analyzed grammar is inconsistent.
 */
public final class TypeModelBuilder {
  private static final Logger log = LoggerFactory.getLogger(TypeModelBuilder.class);

  public TypeModel build(AnalyzedGrammar analyzed) {
    Map<Identifier, Set<Identifier>> refinements = new LinkedHashMap<>();
    List<Rule> rules = new ArrayList<>(analyzed.rules().values());
    List<String> typeNames = new ArrayList<>();
    for (Rule rule : rules) {
      typeNames.add(TermNames.capabilityName(rule.identifier()));
    }
    typeNames = TermNames.disambiguate(typeNames, Set.of());
    List<Capability> capabilities = new ArrayList<>();
    for (int i = 0; i < rules.size(); i++) {
      capabilities.add(capability(analyzed, rules.get(i), typeNames.get(i), refinements));
    }
    return new TypeModel(analyzed.startRule(), capabilities, refinements);
  }

  private Capability capability(
      AnalyzedGrammar analyzed,
      Rule rule,
      String typeName,
      Map<Identifier, Set<Identifier>> refinements) {
    Identifier self = rule.identifier();
    ConstructionShape shape = analyzed.shape(self);
    List<RecursionKind> kinds = analyzed.recursion().get(self);
    List<DefinitionChoice> choices = rule.definition().choices();
    if (shape == null || kinds == null || kinds.size() != choices.size()) {
      throw new IllegalStateException("Rule " + self + " was not fully analyzed");
    }

    List<List<SubTerm>> terms = new ArrayList<>();
    List<String> names = new ArrayList<>();
    for (DefinitionChoice choice : choices) {
      List<SubTerm> subTerms = subTerms(analyzed, self, choice);
      terms.add(subTerms);
      names.add(TermNames.termsName(subTerms));
    }
    names = TermNames.disambiguate(names, Set.of());

    List<Variant> variants = new ArrayList<>();
    for (int i = 0; i < choices.size(); i++) {
      List<SubTerm> subTerms = terms.get(i);
      boolean passThrough = false;
      if (subTerms.size() == 1 && subTerms.get(0) instanceof SubTerm.CapabilitySlot slot) {
        passThrough = refine(refinements, slot.capability(), self);
      }
      variants.add(new Variant(self, i, names.get(i), subTerms, kinds.get(i), passThrough));
    }
    if (!typeName.equals(TermNames.capabilityName(self))) {
      log.debug("Capability of {} renamed to {}", self, typeName);
    }
    return new Capability(self, typeName, shape, variants);
  }

  private static List<SubTerm> subTerms(
      AnalyzedGrammar analyzed, Identifier self, DefinitionChoice choice) {
    List<SubTerm> subTerms = new ArrayList<>();
    for (DefinitionPart part : choice.parts()) {
      if (part instanceof DefinitionPart.Literal literal) {
        subTerms.add(new SubTerm.LiteralSlot(literal.text()));
      } else if (part instanceof DefinitionPart.Reference ref) {
        if (!analyzed.rules().containsKey(ref.target())) {
          throw new IllegalStateException(
              "Rule " + self + " references unresolved rule " + ref.target());
        }
        subTerms.add(new SubTerm.CapabilitySlot(ref.target()));
      } else if (part instanceof DefinitionPart.Epsilon) {
        subTerms.add(SubTerm.EmptySlot.INSTANCE);
      }
    }
    return subTerms;
  }

  /** Records {@code sub -> sup} unless it would make the relation cyclic. */
  private static boolean refine(
      Map<Identifier, Set<Identifier>> refinements, Identifier sub, Identifier sup) {
    if (sub.equals(sup) || reachable(refinements, sup, sub)) {
      log.debug("Not refining {} into {}: the refinement would be cyclic", sub, sup);
      return false;
    }
    refinements.computeIfAbsent(sub, k -> new LinkedHashSet<>()).add(sup);
    return true;
  }

  private static boolean reachable(
      Map<Identifier, Set<Identifier>> refinements, Identifier from, Identifier to) {
    Set<Identifier> seen = new HashSet<>();
    Deque<Identifier> queue = new ArrayDeque<>();
    queue.add(from);
    while (!queue.isEmpty()) {
      Identifier next = queue.poll();
      if (next.equals(to)) {
        return true;
      }
      if (seen.add(next)) {
        queue.addAll(refinements.getOrDefault(next, Set.of()));
      }
    }
    return false;
  }
}
