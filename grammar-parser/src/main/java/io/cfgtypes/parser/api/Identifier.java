package io.cfgtypes.parser.api;

import io.cfgtypes.parser.text.SingleLineText;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Name of a grammar rule: an ordered, non-empty sequence of fragments.
 *
 * <p>A bare identifier such as {@code nonZeroDigit} has a single fragment, a bracketed one such as
 * {@code <non zero digit>} has one fragment per word. Equality is structural over the fragments,
 * so the two spellings above name different rules.
 */
public record Identifier(List<SingleLineText> fragments) {

  public Identifier {
    fragments = List.copyOf(fragments);
    if (fragments.isEmpty()) {
      throw new IllegalArgumentException("Identifier needs at least one fragment");
    }
  }

  /** Creates an identifier from literal fragments, e.g. {@code Identifier.of("non", "zero")}. */
  public static Identifier of(String... fragments) {
    return new Identifier(Arrays.stream(fragments).map(SingleLineText::of).toList());
  }

  /** The fragments joined by single spaces, as written inside angle brackets. */
  public String displayName() {
    return fragments.stream().map(SingleLineText::value).collect(Collectors.joining(" "));
  }

  /**
   * {@code <non zero digit>}, {@code non-zero-digit} and {@code nonZeroDigit} all give {@code
   * NonZeroDigit}.
   */
  public String toPascalCase() {
    StringBuilder sb = new StringBuilder();
    for (String word : words()) {
      sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
    }
    return sb.toString();
  }

  public String toCamelCase() {
    String pascal = toPascalCase();
    if (pascal.isEmpty()) {
      return pascal;
    }
    return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
  }

  private List<String> words() {
    List<String> words = new ArrayList<>();
    for (SingleLineText fragment : fragments) {
      for (String word : fragment.value().split("[^\\p{L}\\p{N}]+")) {
        if (!word.isEmpty()) {
          words.add(word);
        }
      }
    }
    return words;
  }

  @Override
  public String toString() {
    return fragments.size() == 1 ? displayName() : "<" + displayName() + ">";
  }
}
