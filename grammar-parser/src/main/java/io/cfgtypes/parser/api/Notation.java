package io.cfgtypes.parser.api;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Delimiters of a grammar source notation.
 *
 * <p>The lexer never hardcodes a delimiter: everything it recognizes besides identifiers comes from
 * here. {@code null} has a meaning for the optional delimiters:
 *
 * <ul>
 *   <li>{@code sequenceSeparator == null}: parts of an alternative are separated by adjacency
 *   <li>{@code ruleTerminator == null}: a line break ends a rule (continuation lines start with
 *       the alternative separator)
 *   <li>{@code escapeCharacter == null}: literals have no escapes, a literal ends at the first
 *       matching quote
 *   <li>{@code commentPrefix == null}: the notation has no comments
 * </ul>
 *
 * @param ruleAssign the rule definition operator, e.g. {@code ::=}
 * @param alternativeSeparator separates alternatives, e.g. {@code |}
 * @param sequenceSeparator explicit separator between parts, or {@code null}
 * @param ruleTerminator explicit end-of-rule marker, or {@code null}
 * @param epsilonMarker marks an alternative deriving nothing, e.g. {@code ε}
 * @param quoteCharacters characters that may open (and close) a literal
 * @param escapeCharacter escape inside literals, or {@code null}
 * @param commentPrefix starts a comment running to the end of the line, or {@code null}
 */
public record Notation(
    String ruleAssign,
    String alternativeSeparator,
    String sequenceSeparator,
    String ruleTerminator,
    String epsilonMarker,
    String quoteCharacters,
    Character escapeCharacter,
    String commentPrefix) {

  /** Prefix of the keys read by {@link #fromProperties(Properties)}. */
  public static final String PROPERTY_PREFIX = "cfgtypes.notation.";

  public Notation {
    requireToken(ruleAssign, "ruleAssign");
    requireToken(alternativeSeparator, "alternativeSeparator");
    requireToken(epsilonMarker, "epsilonMarker");
    if (sequenceSeparator != null) {
      requireToken(sequenceSeparator, "sequenceSeparator");
    }
    if (ruleTerminator != null) {
      requireToken(ruleTerminator, "ruleTerminator");
    }
    if (commentPrefix != null) {
      requireToken(commentPrefix, "commentPrefix");
    }
    if (quoteCharacters == null || quoteCharacters.isEmpty()) {
      throw new IllegalArgumentException("At least one quote character is required");
    }
    for (char q : quoteCharacters.toCharArray()) {
      if (Character.isWhitespace(q) || Character.isLetterOrDigit(q)) {
        throw new IllegalArgumentException("Illegal quote character: '" + q + "'");
      }
    }
    if (escapeCharacter != null && quoteCharacters.indexOf(escapeCharacter) >= 0) {
      throw new IllegalArgumentException("Escape character must differ from the quotes");
    }
    List<String> delimiters = new ArrayList<>();
    delimiters.add(ruleAssign);
    delimiters.add(alternativeSeparator);
    delimiters.add(epsilonMarker);
    if (sequenceSeparator != null) delimiters.add(sequenceSeparator);
    if (ruleTerminator != null) delimiters.add(ruleTerminator);
    if (commentPrefix != null) delimiters.add(commentPrefix);
    Set<String> seen = new HashSet<>();
    for (String d : delimiters) {
      if (!seen.add(d)) {
        throw new IllegalArgumentException("Delimiter used twice: '" + d + "'");
      }
    }
    for (char q : quoteCharacters.toCharArray()) {
      requireFree(q, "Quote character", delimiters);
    }
    if (escapeCharacter != null) {
      requireFree(escapeCharacter, "Escape character", delimiters);
    }
  }

  /** A quote or escape character may not occur in a delimiter or open a bracketed identifier. */
  private static void requireFree(char c, String what, List<String> delimiters) {
    if (c == '<' || c == '>') {
      throw new IllegalArgumentException(what + " clashes with identifier brackets: '" + c + "'");
    }
    for (String d : delimiters) {
      if (d.indexOf(c) >= 0) {
        throw new IllegalArgumentException(
            what + " '" + c + "' occurs in delimiter '" + d + "'");
      }
    }
  }

  private static void requireToken(String value, String name) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be empty");
    }
    for (char c : value.toCharArray()) {
      if (Character.isWhitespace(c)) {
        throw new IllegalArgumentException(name + " must not contain whitespace: '" + value + "'");
      }
    }
  }

  /** {@code rule ::= a b | "c"}, one rule per line, {@code #} comments. */
  public static Notation bnf() {
    return new Notation("::=", "|", null, null, "ε", "\"'", '\\', "#");
  }

  /** {@code rule = a, b | "c";} with explicit separators and terminators, no comments. */
  public static Notation ebnf() {
    return new Notation("=", "|", ",", ";", "ε", "\"'", '\\', null);
  }

  /** True if a line break terminates a rule. */
  public boolean lineOriented() {
    return ruleTerminator == null;
  }

  /** True if parts of an alternative are separated by adjacency alone. */
  public boolean adjacencySequences() {
    return sequenceSeparator == null;
  }

  public boolean isQuote(char c) {
    return quoteCharacters.indexOf(c) >= 0;
  }

  /**
   * Overlays {@code cfgtypes.notation.*} keys on {@link #bnf()}. An empty value clears an optional
   * delimiter, e.g. {@code cfgtypes.notation.commentPrefix=} disables comments.
   *
   * <p>Recognized keys: {@code ruleAssign}, {@code alternativeSeparator}, {@code
   * sequenceSeparator}, {@code ruleTerminator}, {@code epsilonMarker}, {@code quoteCharacters},
   * {@code escapeCharacter}, {@code commentPrefix}, and {@code preset} ({@code bnf} or {@code
   * ebnf}) selecting the base the other keys are applied to.
   *
   * @throws IllegalArgumentException if the resulting notation is inconsistent
   */
  public static Notation fromProperties(Properties props) {
    String preset = props.getProperty(PROPERTY_PREFIX + "preset", "bnf");
    Notation base =
        switch (preset) {
          case "bnf" -> bnf();
          case "ebnf" -> ebnf();
          default -> throw new IllegalArgumentException("Unknown notation preset: " + preset);
        };
    String escape =
        optional(
            props,
            "escapeCharacter",
            base.escapeCharacter == null ? null : String.valueOf(base.escapeCharacter));
    if (escape != null && escape.length() != 1) {
      throw new IllegalArgumentException("escapeCharacter must be a single character: " + escape);
    }
    return new Notation(
        props.getProperty(PROPERTY_PREFIX + "ruleAssign", base.ruleAssign),
        props.getProperty(PROPERTY_PREFIX + "alternativeSeparator", base.alternativeSeparator),
        optional(props, "sequenceSeparator", base.sequenceSeparator),
        optional(props, "ruleTerminator", base.ruleTerminator),
        props.getProperty(PROPERTY_PREFIX + "epsilonMarker", base.epsilonMarker),
        props.getProperty(PROPERTY_PREFIX + "quoteCharacters", base.quoteCharacters),
        escape == null ? null : escape.charAt(0),
        optional(props, "commentPrefix", base.commentPrefix));
  }

  private static String optional(Properties props, String key, String fallback) {
    String value = props.getProperty(PROPERTY_PREFIX + key);
    if (value == null) {
      return fallback;
    }
    return value.isEmpty() ? null : value;
  }
}
