package io.cfgtypes.parser.lexer;

/**
 * A single token of grammar source text.
 *
 * <p>For literals the value is the unescaped content without quotes. For identifiers it is the
 * name fragments joined by single spaces. For delimiters it is the delimiter as written, and it is
 * empty for {@link TokenType#EOF} and for implicit (line break) rule terminators at end of input.
 *
 * @param type The type of this token
 * @param value The text value of this token
 * @param start Position where the token starts
 * @param end Character offset where the token ends (exclusive)
 */
public record Token(TokenType type, String value, SourcePosition start, int end) {

  /**
   * Returns the length of this token in source characters.
   *
   * @return The number of characters in this token
   */
  public int length() {
    return end - start.offset();
  }

  public boolean is(TokenType expected) {
    return type == expected;
  }

  @Override
  public String toString() {
    return String.format("%s['%s']@%s", type, value, start);
  }
}
