package io.cfgtypes.generator.builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.cfgtypes.generator.Grammars;
import io.cfgtypes.generator.analysis.ConstructionShape;
import io.cfgtypes.generator.model.TypeModel;
import io.cfgtypes.generator.model.TypeModelBuilder;
import io.cfgtypes.generator.model.VariantRef;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.text.SingleLineText;
import java.util.List;
import org.junit.jupiter.api.Test;

class BuilderSynthesizerTest {
  private static final Identifier NUMBER = Identifier.of("number");
  private static final Identifier DIGIT = Identifier.of("digit");
  private static final Identifier NON_ZERO = Identifier.of("nonZeroDigit");

  private final BuilderSynthesizer synthesizer = new BuilderSynthesizer();

  private static TypeModel model(String source) throws Exception {
    return new TypeModelBuilder().build(Grammars.analyze(source));
  }

  private static List<String> names(List<BuilderStep> steps) {
    return steps.stream().map(BuilderStep::name).toList();
  }

  @Test
  void numberBuilderRequiresLeadingNonZeroDigit() throws Exception {
    StateMachine number = synthesizer.synthesizeIncremental(model(Grammars.NUMBER), NUMBER);
    assertEquals(ConstructionShape.LEFT_RECURSIVE_SEQUENCE, number.shape());
    assertTrue(number.accepts(List.of("One", "Two", "Three", "Zero", "Build")));
    assertFalse(number.accepts(List.of("Zero", "One", "Build")));
    assertFalse(number.accepts(List.of("Build")));
    assertFalse(number.accepts(List.of("One")));
    assertFalse(number.accepts(List.of("One", "Build", "Two")));
  }

  @Test
  void numberStatesAndSteps() throws Exception {
    StateMachine number = synthesizer.synthesizeIncremental(model(Grammars.NUMBER), NUMBER);
    assertThat(names(number.legalSteps(BuilderState.INITIAL)))
        .containsExactly("One", "Two", "Three", "Four", "Five", "Six", "Seven", "Eight", "Nine");
    assertThat(names(number.legalSteps(BuilderState.GROWING)))
        .containsExactly(
            "Zero", "One", "Two", "Three", "Four", "Five", "Six", "Seven", "Eight", "Nine");
    assertThat(number.canBuild(BuilderState.INITIAL)).isFalse();
    assertThat(number.canBuild(BuilderState.GROWING)).isTrue();
    assertThat(number.states())
        .containsExactlyInAnyOrder(BuilderState.INITIAL, BuilderState.GROWING);
  }

  @Test
  void enumeratedStepsPinTheirTerminal() throws Exception {
    StateMachine number = synthesizer.synthesizeIncremental(model(Grammars.NUMBER), NUMBER);

    BuilderStep one = number.transition(BuilderState.INITIAL, "One").orElseThrow().step();
    assertEquals(StepRole.BASE, one.role());
    assertEquals(new VariantRef(NUMBER, 0), one.variant());
    assertThat(one.arguments())
        .containsExactly(
            new StepArgument.FixedTerminal(
                List.of(new VariantRef(NON_ZERO, 0)), SingleLineText.of("1")));

    BuilderStep seven = number.transition(BuilderState.GROWING, "Seven").orElseThrow().step();
    assertEquals(StepRole.GROWTH, seven.role());
    assertEquals(new VariantRef(NUMBER, 1), seven.variant());
    assertThat(seven.arguments())
        .containsExactly(
            new StepArgument.FixedTerminal(
                List.of(new VariantRef(DIGIT, 1), new VariantRef(NON_ZERO, 6)),
                SingleLineText.of("7")));
  }

  @Test
  void flatRuleIsOneChoice() throws Exception {
    StateMachine digit = synthesizer.synthesizeIncremental(model(Grammars.NUMBER), DIGIT);
    assertEquals(ConstructionShape.FLAT, digit.shape());
    assertThat(digit.legalSteps(BuilderState.INITIAL)).allMatch(s -> s.role() == StepRole.CHOICE);
    assertThat(digit.legalSteps(BuilderState.INITIAL)).hasSize(10);
    assertTrue(digit.accepts(List.of("Zero", "Build")));
    assertFalse(digit.accepts(List.of("Zero", "One", "Build")));
    assertFalse(digit.accepts(List.of("Build")));
    assertThat(digit.accepting()).containsExactly(BuilderState.COMPLETE);
  }

  @Test
  void generalRulesAreComposed() throws Exception {
    TypeModel model = model(Grammars.EXPRESSION);
    Identifier expr = Identifier.of("expr");
    CompositionContract contract = synthesizer.synthesizeComposition(model, expr);
    assertThat(contract.constructors())
        .extracting(CompositionContract.Constructor::name)
        .containsExactly("ExprPlusTerm", "Term");
    assertThat(contract.constructors().get(0).arguments())
        .containsExactly(
            new StepArgument.SuppliedValue(expr),
            new StepArgument.SuppliedValue(Identifier.of("term")));

    BuilderModel builders = synthesizer.synthesize(model);
    assertThat(builders.protocol(expr)).isInstanceOf(CompositionContract.class);
    assertThat(builders.protocol(NUMBER)).isInstanceOf(StateMachine.class);
    assertThat(builders.protocols()).hasSize(6);
  }

  @Test
  void incrementalBuilderOfGeneralRuleIsUnsupported() throws Exception {
    TypeModel model = model(Grammars.EXPRESSION);
    Identifier term = Identifier.of("term");
    assertThatThrownBy(() -> synthesizer.synthesizeIncremental(model, term))
        .isInstanceOf(UnsupportedShapeException.class)
        .satisfies(
            e -> {
              UnsupportedShapeException u = (UnsupportedShapeException) e;
              assertEquals(term, u.getRule());
              assertEquals(ConstructionShape.GENERAL, u.getShape());
            });
    BuilderModel builders = synthesizer.synthesize(model);
    assertThatThrownBy(() -> builders.stateMachine(term))
        .isInstanceOf(UnsupportedShapeException.class);
  }

  @Test
  void emptyBaseBecomesExplicitStep() throws Exception {
    StateMachine digits =
        synthesizer.synthesizeIncremental(
            model("digits ::= ε | digits \"0\""), Identifier.of("digits"));
    assertThat(names(digits.legalSteps(BuilderState.INITIAL))).containsExactly("Empty");
    assertTrue(digits.accepts(List.of("Empty", "Build")));
    assertTrue(digits.accepts(List.of("Empty", "Zero", "Zero", "Build")));
    assertFalse(digits.accepts(List.of("Build")));
  }

  @Test
  void nonEnumerablePayloadIsSupplied() throws Exception {
    Identifier sum = Identifier.of("sum");
    Identifier term = Identifier.of("term");
    StateMachine machine =
        synthesizer.synthesizeIncremental(
            model("sum ::= term | sum \"+\" term\nterm ::= \"x\" | \"y\" \"z\""), sum);
    BuilderStep base = machine.legalSteps(BuilderState.INITIAL).get(0);
    assertEquals("Term", base.name());
    assertThat(base.arguments()).containsExactly(new StepArgument.SuppliedValue(term));
    BuilderStep growth = machine.legalSteps(BuilderState.GROWING).get(0);
    assertEquals("PlusTerm", growth.name());
    assertThat(growth.arguments()).containsExactly(new StepArgument.SuppliedValue(term));
    assertTrue(machine.accepts(List.of("Term", "PlusTerm", "PlusTerm", "Build")));
  }

  @Test
  void stepNamesNeverShadowBuild() throws Exception {
    StateMachine machine =
        synthesizer.synthesizeIncremental(
            model("a ::= \"build\" | \"Build\""), Identifier.of("a"));
    assertThat(names(machine.legalSteps(BuilderState.INITIAL)))
        .containsExactly("Build2", "Build3");
    assertTrue(machine.accepts(List.of("Build3", "Build")));
  }

  @Test
  void duplicateTerminalsAreEnumeratedOnce() throws Exception {
    StateMachine seq =
        synthesizer.synthesizeIncremental(
            model("seq ::= d | seq d\nd ::= \"1\" | n\nn ::= \"1\" | \"2\""),
            Identifier.of("seq"));
    assertThat(names(seq.legalSteps(BuilderState.INITIAL))).containsExactly("One", "Two");
  }
}
