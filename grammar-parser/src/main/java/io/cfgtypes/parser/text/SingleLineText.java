package io.cfgtypes.parser.text;

import java.util.Objects;

/**
 * A string that contains no line break of either convention.
 *
 * <p>Instances can only be obtained through {@link #create(String)} or {@link #of(String)}, so the
 * invariant holds for the lifetime of every value. Every literal and every identifier fragment of
 * a grammar is a {@code SingleLineText}.
 */
public final class SingleLineText implements Comparable<SingleLineText> {
  private final String value;

  private SingleLineText(String value) {
    this.value = value;
  }

  /**
   * Validates the input and wraps it.
   *
   * <p>A line feed is reported in preference to a carriage return, so {@code "a\r\n"} fails with
   * {@link InvalidTextException.Kind#CONTAINS_LINE_FEED}.
   *
   * @param input the candidate text
   * @return the validated text
   * @throws InvalidTextException if the input contains {@code \n} or {@code \r}
   */
  public static SingleLineText create(String input) throws InvalidTextException {
    Objects.requireNonNull(input, "input");
    int lf = input.indexOf('\n');
    if (lf >= 0) {
      throw new InvalidTextException(InvalidTextException.Kind.CONTAINS_LINE_FEED, lf);
    }
    int cr = input.indexOf('\r');
    if (cr >= 0) {
      throw new InvalidTextException(InvalidTextException.Kind.CONTAINS_CARRIAGE_RETURN, cr);
    }
    return new SingleLineText(input);
  }

  /**
   * Unchecked variant of {@link #create(String)} for text that is known to be valid, such as
   * constants in code.
   *
   * @throws IllegalArgumentException if the input contains a line break
   */
  public static SingleLineText of(String input) {
    try {
      return create(input);
    } catch (InvalidTextException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
  }

  public String value() {
    return value;
  }

  public boolean isEmpty() {
    return value.isEmpty();
  }

  public int length() {
    return value.length();
  }

  @Override
  public int compareTo(SingleLineText o) {
    return value.compareTo(o.value);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SingleLineText other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
