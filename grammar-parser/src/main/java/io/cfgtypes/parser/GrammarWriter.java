package io.cfgtypes.parser;

import io.cfgtypes.parser.api.DefinitionChoice;
import io.cfgtypes.parser.api.DefinitionPart;
import io.cfgtypes.parser.api.Grammar;
import io.cfgtypes.parser.api.Identifier;
import io.cfgtypes.parser.api.Notation;
import io.cfgtypes.parser.api.Rule;
import io.cfgtypes.parser.lexer.GrammarLexer;
import io.cfgtypes.parser.lexer.LexException;
import io.cfgtypes.parser.lexer.Token;
import io.cfgtypes.parser.lexer.TokenType;
import io.cfgtypes.parser.text.SingleLineText;
import java.util.List;
import java.util.Objects;

/**
 * Serializes a {@link Grammar} back to source text, one rule per line.
 *
 * <p>Parsing the output with the same notation yields a grammar equal to the input. Values the
 * notation cannot spell, such as a literal containing every quote character in a notation without
 * escapes, are rejected with {@link IllegalArgumentException}.
 */
public final class GrammarWriter {
  private final Notation notation;

  public GrammarWriter(Notation notation) {
    this.notation = Objects.requireNonNull(notation, "notation");
  }

  public static String write(Grammar grammar) {
    return new GrammarWriter(Notation.bnf()).toSource(grammar);
  }

  public String toSource(Grammar grammar) {
    StringBuilder sb = new StringBuilder();
    for (Rule rule : grammar.rules()) {
      appendRule(sb, rule);
    }
    return sb.toString();
  }

  private void appendRule(StringBuilder sb, Rule rule) {
    sb.append(identifier(rule.identifier())).append(' ').append(notation.ruleAssign());
    List<DefinitionChoice> choices = rule.definition().choices();
    for (int i = 0; i < choices.size(); i++) {
      if (i > 0) {
        sb.append(' ').append(notation.alternativeSeparator());
      }
      appendChoice(sb, choices.get(i));
    }
    if (!notation.lineOriented()) {
      sb.append(' ').append(notation.ruleTerminator());
    }
    sb.append('\n');
  }

  private void appendChoice(StringBuilder sb, DefinitionChoice choice) {
    List<DefinitionPart> parts = choice.parts();
    for (int i = 0; i < parts.size(); i++) {
      DefinitionPart part = parts.get(i);
      if (part instanceof DefinitionPart.Epsilon && parts.size() > 1) {
        throw new IllegalArgumentException(
            "Epsilon must be the only part of its choice: " + choice);
      }
      if (i > 0 && !notation.adjacencySequences()) {
        sb.append(' ').append(notation.sequenceSeparator());
      }
      sb.append(' ');
      if (part instanceof DefinitionPart.Literal literal) {
        sb.append(literal(literal.text()));
      } else if (part instanceof DefinitionPart.Reference reference) {
        sb.append(identifier(reference.target()));
      } else if (part instanceof DefinitionPart.Epsilon) {
        sb.append(notation.epsilonMarker());
      }
    }
  }

  /** Spells an identifier bare if it scans back unchanged, bracketed otherwise. */
  String identifier(Identifier identifier) {
    String name = identifier.displayName();
    if (identifier.fragments().size() == 1
        && GrammarLexer.isBareIdentifier(name)
        && scansAsIdentifier(name, name)) {
      return name;
    }
    for (SingleLineText fragment : identifier.fragments()) {
      String f = fragment.value();
      if (f.isEmpty()
          || f.indexOf('>') >= 0
          || !f.equals(f.strip())
          || f.split("\\s+").length != 1) {
        throw new IllegalArgumentException("Identifier cannot be written: '" + name + "'");
      }
    }
    String bracketed = "<" + name + ">";
    if (!scansAsIdentifier(bracketed, name)) {
      throw new IllegalArgumentException("Identifier cannot be written: '" + name + "'");
    }
    return bracketed;
  }

  private boolean scansAsIdentifier(String text, String expectedValue) {
    try {
      Token token = new GrammarLexer(text, notation).next();
      return token.is(TokenType.IDENTIFIER)
          && token.value().equals(expectedValue)
          && token.end() == text.length();
    } catch (LexException e) {
      return false;
    }
  }

  String literal(SingleLineText text) {
    String value = text.value();
    Character escape = notation.escapeCharacter();
    for (char quote : notation.quoteCharacters().toCharArray()) {
      if (value.indexOf(quote) < 0 && (escape == null || value.indexOf(escape) < 0)) {
        return quote + value + quote;
      }
    }
    if (escape == null) {
      throw new IllegalArgumentException("Literal cannot be quoted without escapes: " + value);
    }
    char quote = notation.quoteCharacters().charAt(0);
    StringBuilder sb = new StringBuilder().append(quote);
    for (char c : value.toCharArray()) {
      if (c == quote || c == escape) {
        sb.append(escape);
      }
      sb.append(c);
    }
    return sb.append(quote).toString();
  }
}
