package io.cfgtypes.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cfgtypes.parser.api.Definition;
import io.cfgtypes.parser.api.DefinitionChoice;
import io.cfgtypes.parser.api.DefinitionPart;
import io.cfgtypes.parser.api.Grammar;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Notation;
import io.cfgtypes.parser.api.Rule;
import io.cfgtypes.parser.text.SingleLineText;
import java.util.List;
import org.junit.jupiter.api.Test;

class GrammarWriterTest {

  private static Grammar single(Identifier name, DefinitionChoice... choices) {
    return Grammar.of(new Rule(name, new Definition(List.of(choices))));
  }

  @Test
  void writesOneRulePerLine() throws Exception {
    Grammar grammar = GrammarParser.parse(GrammarParserTest.NUMBER);
    String source = GrammarWriter.write(grammar);
    assertThat(source)
        .startsWith("number ::= nonZeroDigit | number digit\ndigit ::= \"0\" | nonZeroDigit\n");
    assertThat(GrammarParser.parse(source)).isEqualTo(grammar);
  }

  @Test
  void writesExplicitSeparators() {
    Grammar grammar =
        single(
            Identifier.of("a"),
            DefinitionChoice.of(DefinitionPart.Reference.to("b"), DefinitionPart.Literal.of("c")),
            DefinitionChoice.of(DefinitionPart.Epsilon.INSTANCE));
    assertThat(new GrammarWriter(Notation.ebnf()).toSource(grammar))
        .isEqualTo("a = b , \"c\" | ε ;\n");
  }

  @Test
  void writesEmptyChoices() throws Exception {
    Grammar grammar =
        single(
            Identifier.of("a"),
            DefinitionChoice.of(DefinitionPart.Reference.to("b")),
            DefinitionChoice.of());
    String source = GrammarWriter.write(grammar);
    assertThat(source).isEqualTo("a ::= b |\n");
    assertThat(GrammarParser.parse(source)).isEqualTo(grammar);
  }

  @Test
  void bracketsMultiFragmentAndDelimiterLikeNames() {
    GrammarWriter writer = new GrammarWriter(Notation.bnf());
    assertThat(writer.identifier(Identifier.of("non", "zero", "digit")))
        .isEqualTo("<non zero digit>");
    assertThat(writer.identifier(Identifier.of("ε"))).isEqualTo("<ε>");
    assertThat(writer.identifier(Identifier.of("1st"))).isEqualTo("<1st>");
    assertThat(writer.identifier(Identifier.of("digit"))).isEqualTo("digit");
  }

  @Test
  void rejectsUnwritableIdentifier() {
    GrammarWriter writer = new GrammarWriter(Notation.bnf());
    assertThatThrownBy(() -> writer.identifier(Identifier.of("a>b")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> writer.identifier(Identifier.of("")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void picksQuoteThatNeedsNoEscape() {
    GrammarWriter writer = new GrammarWriter(Notation.bnf());
    assertThat(writer.literal(SingleLineText.of("say \"hi\""))).isEqualTo("'say \"hi\"'");
    assertThat(writer.literal(SingleLineText.of("it's"))).isEqualTo("\"it's\"");
  }

  @Test
  void escapesWhenEveryQuoteOccurs() throws Exception {
    GrammarWriter writer = new GrammarWriter(Notation.bnf());
    String literal = writer.literal(SingleLineText.of("it's \"x\""));
    assertThat(literal).isEqualTo("\"it's \\\"x\\\"\"");

    Grammar grammar =
        single(Identifier.of("a"), DefinitionChoice.of(DefinitionPart.Literal.of("it's \"x\" \\")));
    assertThat(GrammarParser.parse(GrammarWriter.write(grammar))).isEqualTo(grammar);
  }

  @Test
  void rejectsLiteralThatCannotBeQuoted() {
    Notation noEscape = new Notation("::=", "|", null, null, "ε", "\"'", null, null);
    assertThatThrownBy(() -> new GrammarWriter(noEscape).literal(SingleLineText.of("'\"")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsEpsilonMixedWithParts() {
    Grammar grammar =
        single(
            Identifier.of("a"),
            DefinitionChoice.of(DefinitionPart.Epsilon.INSTANCE, DefinitionPart.Literal.of("x")));
    assertThatThrownBy(() -> GrammarWriter.write(grammar))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
