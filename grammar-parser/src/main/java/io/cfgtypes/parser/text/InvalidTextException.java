package io.cfgtypes.parser.text;

import io.cfgtypes.parser.api.GrammarException;

/** Thrown when a string cannot be turned into a {@link SingleLineText}. */
public class InvalidTextException extends GrammarException {

  /** The invariant the rejected input violated. */
  public enum Kind {
    /** The input contains a line feed ({@code \n}). */
    CONTAINS_LINE_FEED,
    /** The input contains a carriage return ({@code \r}). */
    CONTAINS_CARRIAGE_RETURN
  }

  private final Kind kind;
  private final int index;

  public InvalidTextException(Kind kind, int index) {
    super(Stage.TEXT, describe(kind), "index " + index);
    this.kind = kind;
    this.index = index;
  }

  private static String describe(Kind kind) {
    return switch (kind) {
      case CONTAINS_LINE_FEED -> "Text contains a line feed";
      case CONTAINS_CARRIAGE_RETURN -> "Text contains a carriage return";
    };
  }

  public Kind getKind() {
    return kind;
  }

  /** Index of the offending character within the rejected input. */
  public int getIndex() {
    return index;
  }
}
