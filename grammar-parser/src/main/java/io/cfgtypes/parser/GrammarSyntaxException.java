package io.cfgtypes.parser;

import io.cfgtypes.parser.api.GrammarException;
import io.cfgtypes.parser.lexer.SourcePosition;
import io.cfgtypes.parser.lexer.TokenType;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/** Thrown when the token sequence does not form a grammar. */
public class GrammarSyntaxException extends GrammarException {
  private final Set<TokenType> expected;
  private final TokenType found;
  private final SourcePosition position;

  public GrammarSyntaxException(Set<TokenType> expected, TokenType found, SourcePosition position) {
    super(
        Stage.SYNTAX,
        "Expected " + describe(expected) + " but found " + found.description(),
        position.toString());
    this.expected = Collections.unmodifiableSet(EnumSet.copyOf(expected));
    this.found = found;
    this.position = position;
  }

  private static String describe(Set<TokenType> expected) {
    return expected.stream().map(TokenType::description).collect(Collectors.joining(" or "));
  }

  /** Token types that would have been accepted at the failing position. */
  public Set<TokenType> getExpected() {
    return expected;
  }

  public TokenType getFound() {
    return found;
  }

  public SourcePosition getPosition() {
    return position;
  }
}
