package io.cfgtypes.generator.builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.cfgtypes.generator.Grammars;
import io.cfgtypes.generator.analysis.ConstructionShape;
import io.cfgtypes.generator.model.TypeModelBuilder;
import io.cfgtypes.generator.model.VariantRef;
import io.cfgtypes.parser.api.Identifier;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class StateMachineTest {
  private static final Identifier RULE = Identifier.of("r");

  private static BuilderStep step(String name, int variant) {
    return new BuilderStep(name, StepRole.CHOICE, new VariantRef(RULE, variant), List.of());
  }

  private static StateMachine number() throws Exception {
    return new BuilderSynthesizer()
        .synthesizeIncremental(
            new TypeModelBuilder().build(Grammars.analyze(Grammars.NUMBER)),
            Identifier.of("number"));
  }

  @Test
  void rejectsAmbiguousTransitions() {
    assertThatThrownBy(
            () ->
                new StateMachine(
                    RULE,
                    ConstructionShape.FLAT,
                    BuilderState.INITIAL,
                    EnumSet.of(BuilderState.INITIAL, BuilderState.COMPLETE),
                    List.of(
                        new Transition(BuilderState.INITIAL, step("A", 0), BuilderState.COMPLETE),
                        new Transition(BuilderState.INITIAL, step("A", 1), BuilderState.COMPLETE)),
                    EnumSet.of(BuilderState.COMPLETE)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Ambiguous");
  }

  @Test
  void rejectsUnreachableStates() {
    assertThatThrownBy(
            () ->
                new StateMachine(
                    RULE,
                    ConstructionShape.FLAT,
                    BuilderState.INITIAL,
                    EnumSet.allOf(BuilderState.class),
                    List.of(
                        new Transition(BuilderState.INITIAL, step("A", 0), BuilderState.COMPLETE)),
                    EnumSet.of(BuilderState.COMPLETE)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unreachable");
  }

  @Test
  void generalShapeHasNoMachine() {
    assertThrows(
        UnsupportedShapeException.class,
        () ->
            new StateMachine(
                RULE,
                ConstructionShape.GENERAL,
                BuilderState.INITIAL,
                EnumSet.of(BuilderState.INITIAL),
                List.of(),
                EnumSet.of(BuilderState.INITIAL)));
  }

  @Test
  void buildIsRejectedAsStepName() {
    assertThrows(IllegalArgumentException.class, () -> step(BuilderStep.BUILD, 0));
  }

  @Test
  void cursorWalksLegalSteps() throws Exception {
    ProtocolCursor cursor = number().cursor();
    assertEquals(BuilderState.INITIAL, cursor.state());
    assertThat(cursor.canBuild()).isFalse();
    cursor.step("Four").step("Two");
    assertEquals(BuilderState.GROWING, cursor.state());
    assertThat(cursor.canBuild()).isTrue();
    assertThat(cursor.build()).extracting(BuilderStep::name).containsExactly("Four", "Two");
    assertThat(cursor.legalSteps()).isEmpty();
  }

  @Test
  void cursorRejectsIllegalSteps() throws Exception {
    ProtocolCursor cursor = number().cursor();
    assertThatThrownBy(() -> cursor.step("Zero"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("legal steps: One");
    assertThatThrownBy(cursor::build).isInstanceOf(IllegalStateException.class);

    cursor.step("One");
    cursor.build();
    assertThatThrownBy(() -> cursor.step("One"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Already built");
  }
}
