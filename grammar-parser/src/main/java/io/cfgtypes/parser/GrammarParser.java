package io.cfgtypes.parser;

import io.cfgtypes.parser.api.Definition;
import io.cfgtypes.parser.api.DefinitionChoice;
import io.cfgtypes.parser.api.DefinitionPart;
import io.cfgtypes.parser.api.Grammar;
import io.cfgtypes.parser.api.GrammarException;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Notation;
import io.cfgtypes.parser.api.Rule;
import io.cfgtypes.parser.lexer.GrammarLexer;
import io.cfgtypes.parser.lexer.LexException;
import io.cfgtypes.parser.lexer.Token;
import io.cfgtypes.parser.lexer.TokenType;
import io.cfgtypes.parser.text.InvalidTextException;
import io.cfgtypes.parser.text.SingleLineText;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for grammar source text, one method per rule of the meta-grammar:
 *
 * <pre>
 * grammar    := rule+ EOF
 * rule       := IDENTIFIER RULE_ASSIGN definition RULE_TERMINATOR
 * definition := choice (ALTERNATIVE_SEPARATOR choice)*
 * choice     := EPSILON_MARKER | part (SEQUENCE_SEPARATOR? part)*
 * part       := QUOTED_LITERAL | IDENTIFIER
 * </pre>
 *
 * <p>The sequence separator is mandatory between parts if the notation defines one and never
 * appears otherwise. The parser only recognizes structure: rule names are neither resolved nor
 * checked for uniqueness. The first lexical or syntax error aborts the parse.
 */
public final class GrammarParser {
  private static final Logger log = LoggerFactory.getLogger(GrammarParser.class);

  private static final EnumSet<TokenType> PART_START =
      EnumSet.of(TokenType.QUOTED_LITERAL, TokenType.IDENTIFIER);

  private final GrammarLexer lexer;
  private final Notation notation;
  private Token current;
  /** Tokens that could have extended the choice parsed last. */
  private EnumSet<TokenType> choiceContinuations = EnumSet.noneOf(TokenType.class);

  private GrammarParser(String source, Notation notation) {
    this.lexer = new GrammarLexer(source, notation);
    this.notation = notation;
  }

  /** Parses source text written in {@link Notation#bnf()}. */
  public static Grammar parse(String source) throws GrammarException {
    return parse(source, Notation.bnf());
  }

  public static Grammar parse(String source, Notation notation) throws GrammarException {
    GrammarParser parser = new GrammarParser(source, notation);
    Grammar grammar = parser.parseGrammar();
    log.debug("Parsed grammar with {} rules", grammar.rules().size());
    return grammar;
  }

  /**
   * Reads the whole stream and parses it. The reader is not closed.
   *
   * @throws GrammarIOException if reading fails
   */
  public static Grammar parse(Reader source, Notation notation) throws GrammarException {
    StringWriter buffer = new StringWriter();
    try {
      source.transferTo(buffer);
    } catch (IOException e) {
      throw new GrammarIOException("Failed to read grammar source", e);
    }
    return parse(buffer.toString(), notation);
  }

  private Grammar parseGrammar() throws GrammarException {
    advance();
    List<Rule> rules = new ArrayList<>();
    rules.add(parseRule());
    while (!current.is(TokenType.EOF)) {
      rules.add(parseRule());
    }
    return new Grammar(rules);
  }

  private Rule parseRule() throws GrammarException {
    Token name = expect(TokenType.IDENTIFIER);
    expect(TokenType.RULE_ASSIGN);
    Definition definition = parseDefinition();
    if (!current.is(TokenType.RULE_TERMINATOR)) {
      EnumSet<TokenType> expected =
          EnumSet.of(TokenType.RULE_TERMINATOR, TokenType.ALTERNATIVE_SEPARATOR);
      expected.addAll(choiceContinuations);
      throw unexpected(expected);
    }
    advance();
    return new Rule(toIdentifier(name), definition);
  }

  private Definition parseDefinition() throws GrammarException {
    List<DefinitionChoice> choices = new ArrayList<>();
    choices.add(parseChoice());
    while (current.is(TokenType.ALTERNATIVE_SEPARATOR)) {
      advance();
      choices.add(parseChoice());
    }
    return new Definition(choices);
  }

  private DefinitionChoice parseChoice() throws GrammarException {
    if (current.is(TokenType.EPSILON_MARKER)) {
      advance();
      choiceContinuations = EnumSet.noneOf(TokenType.class);
      return DefinitionChoice.of(DefinitionPart.Epsilon.INSTANCE);
    }
    List<DefinitionPart> parts = new ArrayList<>();
    if (!PART_START.contains(current.type())) {
      choiceContinuations = EnumSet.copyOf(PART_START);
      choiceContinuations.add(TokenType.EPSILON_MARKER);
      return new DefinitionChoice(parts); // empty alternative
    }
    parts.add(parsePart());
    choiceContinuations =
        notation.adjacencySequences()
            ? EnumSet.copyOf(PART_START)
            : EnumSet.of(TokenType.SEQUENCE_SEPARATOR);
    while (true) {
      if (notation.adjacencySequences()) {
        if (!PART_START.contains(current.type())) {
          break;
        }
      } else {
        if (!current.is(TokenType.SEQUENCE_SEPARATOR)) {
          if (PART_START.contains(current.type())) {
            throw unexpected(
                EnumSet.of(
                    TokenType.SEQUENCE_SEPARATOR,
                    TokenType.ALTERNATIVE_SEPARATOR,
                    TokenType.RULE_TERMINATOR));
          }
          break;
        }
        advance();
      }
      parts.add(parsePart());
    }
    return new DefinitionChoice(parts);
  }

  private DefinitionPart parsePart() throws GrammarException {
    if (current.is(TokenType.QUOTED_LITERAL)) {
      Token literal = advance();
      return new DefinitionPart.Literal(toText(literal, literal.value()));
    }
    if (current.is(TokenType.IDENTIFIER)) {
      return new DefinitionPart.Reference(toIdentifier(advance()));
    }
    throw unexpected(PART_START);
  }

  private Identifier toIdentifier(Token token) throws LexException {
    List<SingleLineText> fragments = new ArrayList<>();
    for (String fragment : token.value().split(" ")) {
      fragments.add(toText(token, fragment));
    }
    return new Identifier(fragments);
  }

  private static SingleLineText toText(Token token, String value) throws LexException {
    try {
      return SingleLineText.create(value);
    } catch (InvalidTextException e) {
      // the lexer never lets a line break into a token
      throw new LexException(
          LexException.Kind.EMBEDDED_LINE_BREAK, token.start(), "Line break inside token", e);
    }
  }

  private Token expect(TokenType type) throws GrammarException {
    if (!current.is(type)) {
      throw unexpected(EnumSet.of(type));
    }
    return advance();
  }

  /** Consumes the current token and returns it. */
  private Token advance() throws LexException {
    Token consumed = current;
    current = lexer.next();
    return consumed;
  }

  private GrammarSyntaxException unexpected(EnumSet<TokenType> expected) {
    return new GrammarSyntaxException(expected, current.type(), current.start());
  }
}
