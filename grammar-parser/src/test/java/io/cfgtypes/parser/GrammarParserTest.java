package io.cfgtypes.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.cfgtypes.parser.api.Definition;
import io.cfgtypes.parser.api.DefinitionChoice;
import io.cfgtypes.parser.api.DefinitionPart;
import io.cfgtypes.parser.api.Grammar;
import io.cfgtypes.parser.api.GrammarException;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Notation;
import io.cfgtypes.parser.api.Rule;
import io.cfgtypes.parser.lexer.LexException;
import io.cfgtypes.parser.lexer.TokenType;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class GrammarParserTest {

  static final String NUMBER =
      "number ::= nonZeroDigit | number digit\n"
          + "digit ::= \"0\" | nonZeroDigit\n"
          + "nonZeroDigit ::= \"1\" | \"2\" | \"3\" | \"4\" | \"5\" | \"6\" | \"7\" | \"8\""
          + " | \"9\"\n";

  @Test
  void parsesNumberGrammar() throws Exception {
    Grammar grammar = GrammarParser.parse(NUMBER);
    assertThat(grammar.rules())
        .extracting(Rule::identifier)
        .containsExactly(
            Identifier.of("number"), Identifier.of("digit"), Identifier.of("nonZeroDigit"));

    Rule number = grammar.first();
    assertEquals(
        new Definition(
            List.of(
                DefinitionChoice.of(DefinitionPart.Reference.to("nonZeroDigit")),
                DefinitionChoice.of(
                    DefinitionPart.Reference.to("number"), DefinitionPart.Reference.to("digit")))),
        number.definition());
    assertEquals(9, grammar.rules().get(2).definition().choices().size());
    assertEquals(
        DefinitionChoice.of(DefinitionPart.Literal.of("0")),
        grammar.rules().get(1).definition().choices().get(0));
  }

  @Test
  void parsesEpsilonAndEmptyChoices() throws Exception {
    Grammar grammar = GrammarParser.parse("a ::= ε | \"x\" |\nb ::=\n");
    List<DefinitionChoice> choices = grammar.first().definition().choices();
    assertEquals(DefinitionChoice.of(DefinitionPart.Epsilon.INSTANCE), choices.get(0));
    assertEquals(DefinitionChoice.of(DefinitionPart.Literal.of("x")), choices.get(1));
    assertEquals(DefinitionChoice.of(), choices.get(2));
    assertThat(choices.get(2).derivesNothing()).isTrue();
    assertEquals(List.of(DefinitionChoice.of()), grammar.rules().get(1).definition().choices());
  }

  @Test
  void parsesBracketedIdentifiers() throws Exception {
    Grammar grammar = GrammarParser.parse("<signed number> ::= \"-\" <non zero digit>");
    assertEquals(Identifier.of("signed", "number"), grammar.first().identifier());
    assertEquals(
        DefinitionPart.Reference.to("non", "zero", "digit"),
        grammar.first().definition().choices().get(0).parts().get(1));
  }

  @Test
  void keepsDuplicatesAndDanglingReferences() throws Exception {
    Grammar grammar = GrammarParser.parse("a ::= missing\na ::= \"x\"");
    assertEquals(2, grammar.rules().size());
  }

  @Test
  void parsesEbnf() throws Exception {
    Grammar grammar =
        GrammarParser.parse("list = item, \",\", list | item;\nitem = \"x\";", Notation.ebnf());
    assertEquals(2, grammar.rules().size());
    assertEquals(3, grammar.first().definition().choices().get(0).size());
  }

  @Test
  void missingRuleAssign() {
    GrammarSyntaxException e =
        assertThrows(GrammarSyntaxException.class, () -> GrammarParser.parse("a b"));
    assertEquals(EnumSet.of(TokenType.RULE_ASSIGN), e.getExpected());
    assertEquals(TokenType.IDENTIFIER, e.getFound());
    assertEquals(3, e.getPosition().column());
    assertEquals(GrammarException.Stage.SYNTAX, e.getStage());
    assertEquals("1:3", e.getLocation());
    assertThat(e.getMessage()).endsWith("[syntax at 1:3]");
  }

  @Test
  void missingSequenceSeparator() {
    GrammarSyntaxException e =
        assertThrows(
            GrammarSyntaxException.class, () -> GrammarParser.parse("a = b c;", Notation.ebnf()));
    assertEquals(
        EnumSet.of(
            TokenType.SEQUENCE_SEPARATOR,
            TokenType.ALTERNATIVE_SEPARATOR,
            TokenType.RULE_TERMINATOR),
        e.getExpected());
    assertEquals(TokenType.IDENTIFIER, e.getFound());
  }

  @Test
  void missingTerminator() {
    GrammarSyntaxException e =
        assertThrows(
            GrammarSyntaxException.class, () -> GrammarParser.parse("a = b", Notation.ebnf()));
    assertEquals(
        EnumSet.of(
            TokenType.RULE_TERMINATOR,
            TokenType.ALTERNATIVE_SEPARATOR,
            TokenType.SEQUENCE_SEPARATOR),
        e.getExpected());
    assertEquals(TokenType.EOF, e.getFound());
  }

  @Test
  void partAfterEpsilon() {
    GrammarSyntaxException e =
        assertThrows(GrammarSyntaxException.class, () -> GrammarParser.parse("a ::= ε \"x\""));
    assertEquals(
        EnumSet.of(TokenType.RULE_TERMINATOR, TokenType.ALTERNATIVE_SEPARATOR), e.getExpected());
    assertEquals(TokenType.QUOTED_LITERAL, e.getFound());
  }

  @Test
  void secondRuleAssignOnOneLine() {
    GrammarSyntaxException e =
        assertThrows(GrammarSyntaxException.class, () -> GrammarParser.parse("a ::= b ::= c"));
    assertEquals(
        EnumSet.of(
            TokenType.RULE_TERMINATOR,
            TokenType.ALTERNATIVE_SEPARATOR,
            TokenType.QUOTED_LITERAL,
            TokenType.IDENTIFIER),
        e.getExpected());
    assertEquals(TokenType.RULE_ASSIGN, e.getFound());
  }

  @Test
  void emptySourceHasNoRule() {
    GrammarSyntaxException e =
        assertThrows(GrammarSyntaxException.class, () -> GrammarParser.parse("# only a comment"));
    assertEquals(EnumSet.of(TokenType.IDENTIFIER), e.getExpected());
    assertEquals(TokenType.EOF, e.getFound());
  }

  @Test
  void lexicalErrorsPropagate() {
    LexException e = assertThrows(LexException.class, () -> GrammarParser.parse("a ::= \"open"));
    assertEquals(LexException.Kind.UNTERMINATED_LITERAL, e.getKind());
  }

  @Test
  void readsFromReader() throws Exception {
    Grammar grammar = GrammarParser.parse(new StringReader(NUMBER), Notation.bnf());
    assertEquals(GrammarParser.parse(NUMBER), grammar);
  }

  @Test
  void wrapsReaderFailure() {
    Reader failing =
        new Reader() {
          @Override
          public int read(char[] cbuf, int off, int len) throws IOException {
            throw new IOException("disk gone");
          }

          @Override
          public void close() {}
        };
    GrammarIOException e =
        assertThrows(GrammarIOException.class, () -> GrammarParser.parse(failing, Notation.bnf()));
    assertThat(e).hasCauseInstanceOf(IOException.class);
    assertEquals(GrammarException.Stage.IO, e.getStage());
  }
}
