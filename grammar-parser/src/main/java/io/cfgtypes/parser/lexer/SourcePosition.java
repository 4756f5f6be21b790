package io.cfgtypes.parser.lexer;

/**
 * A location in grammar source text.
 *
 * @param offset zero-based character offset from the start of the input
 * @param line one-based line number
 * @param column one-based column number
 */
public record SourcePosition(int offset, int line, int column) {

  public static final SourcePosition START = new SourcePosition(0, 1, 1);

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
