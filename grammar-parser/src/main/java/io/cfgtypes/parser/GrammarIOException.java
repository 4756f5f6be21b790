package io.cfgtypes.parser;

import io.cfgtypes.parser.api.GrammarException;
import java.io.IOException;

/** Thrown when grammar source text cannot be read. */
public class GrammarIOException extends GrammarException {

  public GrammarIOException(String message, IOException cause) {
    super(Stage.IO, message, null, cause);
  }
}
