package io.cfgtypes.generator.model;

import io.cfgtypes.parser.api.Identifier;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives names for generated types, variants and builder steps.
 *
 * <p>Names are letters and digits only and never start with a digit. Digits in literals are
 * spelled out so that {@code "1"} becomes {@code One}, punctuation gets its common name ({@code
 * "+"} is {@code Plus}) and runs of letters are capitalized ({@code "if"} is {@code If}).
 */
public final class TermNames {
  private static final String[] DIGITS = {
    "Zero", "One", "Two", "Three", "Four", "Five", "Six", "Seven", "Eight", "Nine"
  };

  private static final Map<Character, String> SYMBOLS =
      Map.ofEntries(
          Map.entry('+', "Plus"),
          Map.entry('-', "Minus"),
          Map.entry('*', "Star"),
          Map.entry('/', "Slash"),
          Map.entry('\\', "Backslash"),
          Map.entry('(', "LeftParen"),
          Map.entry(')', "RightParen"),
          Map.entry('[', "LeftBracket"),
          Map.entry(']', "RightBracket"),
          Map.entry('{', "LeftBrace"),
          Map.entry('}', "RightBrace"),
          Map.entry('<', "Less"),
          Map.entry('>', "Greater"),
          Map.entry('=', "Equals"),
          Map.entry('.', "Dot"),
          Map.entry(',', "Comma"),
          Map.entry(';', "Semicolon"),
          Map.entry(':', "Colon"),
          Map.entry('!', "Bang"),
          Map.entry('?', "Question"),
          Map.entry('&', "Ampersand"),
          Map.entry('|', "Pipe"),
          Map.entry('^', "Caret"),
          Map.entry('%', "Percent"),
          Map.entry('#', "Hash"),
          Map.entry('@', "At"),
          Map.entry('$', "Dollar"),
          Map.entry('~', "Tilde"),
          Map.entry('"', "Quote"),
          Map.entry('\'', "Apostrophe"),
          Map.entry('`', "Backtick"),
          Map.entry('_', "Underscore"),
          Map.entry(' ', "Space"),
          Map.entry('\t', "Tab"));

  private TermNames() {}

  /** Type name of a rule's capability: {@code <non zero digit>} gives {@code NonZeroDigit}. */
  public static String capabilityName(Identifier rule) {
    String pascal = rule.toPascalCase();
    if (pascal.isEmpty()) {
      return literalName(rule.displayName());
    }
    return Character.isDigit(pascal.charAt(0)) ? "_" + pascal : pascal;
  }

  /**
   * Name of a literal: {@code "10"} gives {@code OneZero}, {@code "<="} gives {@code
   * LessEquals}.
   */
  public static String literalName(String text) {
    if (text.isEmpty()) {
      return "Empty";
    }
    StringBuilder sb = new StringBuilder();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isLetter(c)) {
        int start = i;
        while (i < text.length() && Character.isLetter(text.charAt(i))) {
          i++;
        }
        String word = text.substring(start, i);
        sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        continue;
      }
      if (c >= '0' && c <= '9') {
        sb.append(DIGITS[c - '0']);
      } else if (SYMBOLS.containsKey(c)) {
        sb.append(SYMBOLS.get(c));
      } else {
        sb.append(String.format("U%04X", (int) c));
      }
      i++;
    }
    return sb.toString();
  }

  /** Name of a sequence of sub-terms: {@code expr "+" term} gives {@code ExprPlusTerm}. */
  public static String termsName(List<SubTerm> terms) {
    StringBuilder sb = new StringBuilder();
    for (SubTerm term : terms) {
      if (term instanceof SubTerm.CapabilitySlot slot) {
        sb.append(capabilityName(slot.capability()));
      } else if (term instanceof SubTerm.LiteralSlot literal) {
        sb.append(literalName(literal.text().value()));
      } else if (term instanceof SubTerm.EmptySlot) {
        sb.append("Empty");
      }
    }
    return sb.length() == 0 ? "Empty" : sb.toString();
  }

  /**
   * Makes names unique by appending 2, 3, ... to repeats, in order. Names in {@code reserved} are
   * treated as already taken.
   */
  public static List<String> disambiguate(List<String> names, Set<String> reserved) {
    Set<String> taken = new HashSet<>(reserved);
    List<String> result = new ArrayList<>(names.size());
    for (String name : names) {
      String candidate = name;
      for (int n = 2; !taken.add(candidate); n++) {
        candidate = name + n;
      }
      result.add(candidate);
    }
    return result;
  }
}
