package io.cfgtypes.parser.lexer;

import io.cfgtypes.parser.api.GrammarException;

/** Thrown when grammar source text cannot be split into tokens. */
public class LexException extends GrammarException {

  /** Classification of malformed input. */
  public enum Kind {
    /** A quoted literal is not closed before the end of input. */
    UNTERMINATED_LITERAL,
    /** A character that cannot start any token. */
    ILLEGAL_CHARACTER,
    /** A line break inside a quoted literal. */
    EMBEDDED_LINE_BREAK,
    /** A bracketed identifier is not closed on its line. */
    UNTERMINATED_IDENTIFIER,
    /** A bracketed identifier without any name fragment. */
    EMPTY_IDENTIFIER
  }

  private final Kind kind;
  private final SourcePosition position;

  public LexException(Kind kind, SourcePosition position, String message) {
    this(kind, position, message, null);
  }

  public LexException(Kind kind, SourcePosition position, String message, Throwable cause) {
    super(Stage.LEX, message, position.toString(), cause);
    this.kind = kind;
    this.position = position;
  }

  public Kind getKind() {
    return kind;
  }

  public SourcePosition getPosition() {
    return position;
  }
}
