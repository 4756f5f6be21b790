package io.cfgtypes.parser.lexer;

/**
 * Token types of grammar source text.
 *
 * <p>The concrete spelling of every delimiter comes from the {@link
 * io.cfgtypes.parser.api.Notation}.
 */
public enum TokenType {
  /** Rule name, bare ({@code digit}) or bracketed ({@code <non zero digit>}). */
  IDENTIFIER("identifier"),

  /** Terminal symbol in quotes: {@code "0"} */
  QUOTED_LITERAL("literal"),

  /** Rule definition operator: {@code ::=} */
  RULE_ASSIGN("rule assignment"),

  /** Alternative separator: {@code |} */
  ALTERNATIVE_SEPARATOR("alternative separator"),

  /** Explicit separator between parts, only for notations that have one: {@code ,} */
  SEQUENCE_SEPARATOR("sequence separator"),

  /** Marks an alternative that derives nothing: {@code ε} */
  EPSILON_MARKER("epsilon"),

  /** End of a rule: a line break or an explicit terminator such as {@code ;} */
  RULE_TERMINATOR("end of rule"),

  /** End of input */
  EOF("end of input");

  private final String description;

  TokenType(String description) {
    this.description = description;
  }

  /** Human readable name used in error messages. */
  public String description() {
    return description;
  }
}
