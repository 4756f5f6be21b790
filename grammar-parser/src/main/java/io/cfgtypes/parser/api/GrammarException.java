package io.cfgtypes.parser.api;

import java.util.Locale;

/**
 * Checked failure of turning grammar source into a model: the text could not be read, scanned,
 * parsed or analyzed. Contract violations by callers are unchecked and never extend this class.
 *
 * <p>Each failure names the {@link Stage} that rejected the grammar and, where one is known, the
 * location in the source or the rule it concerns. Both are appended to the message, e.g. {@code
 * Expected rule name but found end of input [syntax at 3:1]}.
 */
public class GrammarException extends Exception {

  /** Pipeline stage that rejected a grammar. */
  public enum Stage {
    TEXT,
    IO,
    LEX,
    SYNTAX,
    ANALYSIS
  }

  private final Stage stage;
  private final String location;

  public GrammarException(Stage stage, String message, String location) {
    this(stage, message, location, null);
  }

  public GrammarException(Stage stage, String message, String location, Throwable cause) {
    super(decorate(stage, message, location), cause);
    this.stage = stage;
    this.location = location;
  }

  private static String decorate(Stage stage, String message, String location) {
    String where = location == null ? "" : " at " + location;
    return message + " [" + stage.name().toLowerCase(Locale.ROOT) + where + "]";
  }

  public Stage getStage() {
    return stage;
  }

  /** Source position or rule name the failure concerns, or {@code null}. */
  public String getLocation() {
    return location;
  }
}
