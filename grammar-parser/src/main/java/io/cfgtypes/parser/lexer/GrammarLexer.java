package io.cfgtypes.parser.lexer;

import io.cfgtypes.parser.api.Notation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scanner turning grammar source text into tokens.
 *
 * <p>Tokens are produced on demand by {@link #next()}; once the input is exhausted every further
 * call returns {@link TokenType#EOF}. {@link #reset()} restarts the scan from the beginning, so the
 * same lexer can be drained any number of times.
 *
 * <p>The lexer handles:
 *
 * <ul>
 *   <li>Delimiters of the configured {@link Notation}, longest match first
 *   <li>Quoted literals, with the notation's escape character if it has one
 *   <li>Bare identifiers ({@code nonZeroDigit}, {@code non-zero-digit}) and bracketed ones ({@code
 *       <non zero digit>})
 *   <li>Whitespace and comments, which are skipped
 *   <li>Line breaks, which end a rule in line-oriented notations unless the next line continues
 *       it with an alternative separator
 * </ul>
 */
public final class GrammarLexer {

  private final String input;
  private final Notation notation;

  /** Delimiter spelling to token type, longest spelling first. */
  private final Map<String, TokenType> delimiters;

  private int pos;
  private int line;
  private int column;

  /** Type of the last token handed out, {@code null} before the first one. */
  private TokenType last;

  public GrammarLexer(String input) {
    this(input, Notation.bnf());
  }

  public GrammarLexer(String input, Notation notation) {
    this.input = Objects.requireNonNull(input, "input");
    this.notation = Objects.requireNonNull(notation, "notation");
    this.delimiters = delimiterTable(notation);
    reset();
  }

  private static Map<String, TokenType> delimiterTable(Notation notation) {
    Map<String, TokenType> table = new LinkedHashMap<>();
    table.put(notation.ruleAssign(), TokenType.RULE_ASSIGN);
    table.put(notation.alternativeSeparator(), TokenType.ALTERNATIVE_SEPARATOR);
    table.put(notation.epsilonMarker(), TokenType.EPSILON_MARKER);
    if (notation.sequenceSeparator() != null) {
      table.put(notation.sequenceSeparator(), TokenType.SEQUENCE_SEPARATOR);
    }
    if (notation.ruleTerminator() != null) {
      table.put(notation.ruleTerminator(), TokenType.RULE_TERMINATOR);
    }
    Map<String, TokenType> sorted = new LinkedHashMap<>();
    table.entrySet().stream()
        .sorted(
            Comparator.comparingInt((Map.Entry<String, TokenType> e) -> e.getKey().length())
                .reversed())
        .forEach(e -> sorted.put(e.getKey(), e.getValue()));
    return sorted;
  }

  /** Rewinds to the beginning of the input. */
  public void reset() {
    pos = 0;
    line = 1;
    column = 1;
    last = null;
  }

  /**
   * Scans the remaining input.
   *
   * @return the remaining tokens, ending with exactly one EOF token
   * @throws LexException on malformed input
   */
  public List<Token> tokenize() throws LexException {
    List<Token> tokens = new ArrayList<>();
    Token token;
    do {
      token = next();
      tokens.add(token);
    } while (token.type() != TokenType.EOF);
    return tokens;
  }

  /**
   * Produces the next token.
   *
   * @return the next token, {@link TokenType#EOF} once the input is exhausted
   * @throws LexException on malformed input
   */
  public Token next() throws LexException {
    while (true) {
      skipBlanks();
      if (pos >= input.length()) {
        return endOfInput();
      }
      char c = input.charAt(pos);
      if (notation.lineOriented() && isLineBreak(c)) {
        SourcePosition at = position();
        int start = pos;
        consumeLineBreak();
        if (last == null || last == TokenType.RULE_TERMINATOR || continuesOnNextLine()) {
          continue;
        }
        return emit(new Token(TokenType.RULE_TERMINATOR, input.substring(start, pos), at, pos));
      }
      return emit(scanToken(c));
    }
  }

  private Token emit(Token token) {
    last = token.type();
    return token;
  }

  private Token endOfInput() {
    SourcePosition at = position();
    if (notation.lineOriented()
        && last != null
        && last != TokenType.RULE_TERMINATOR
        && last != TokenType.EOF) {
      return emit(new Token(TokenType.RULE_TERMINATOR, "", at, pos));
    }
    return emit(new Token(TokenType.EOF, "", at, pos));
  }

  private Token scanToken(char c) throws LexException {
    if (notation.isQuote(c)) {
      return scanLiteral();
    }
    for (Map.Entry<String, TokenType> d : delimiters.entrySet()) {
      if (matchesDelimiter(d.getKey())) {
        SourcePosition at = position();
        advance(d.getKey().length());
        return new Token(d.getValue(), d.getKey(), at, pos);
      }
    }
    if (c == '<') {
      return scanBracketedIdentifier();
    }
    if (isIdentifierStart(c)) {
      return scanBareIdentifier();
    }
    throw new LexException(
        LexException.Kind.ILLEGAL_CHARACTER, position(), "Illegal character '" + c + "'");
  }

  private boolean matchesDelimiter(String delimiter) {
    if (!input.startsWith(delimiter, pos)) {
      return false;
    }
    // word-like delimiters must not swallow the start of an identifier
    char tail = delimiter.charAt(delimiter.length() - 1);
    int after = pos + delimiter.length();
    return !isIdentifierPart(tail)
        || after >= input.length()
        || !isIdentifierPart(input.charAt(after));
  }

  private Token scanLiteral() throws LexException {
    SourcePosition at = position();
    char quote = input.charAt(pos);
    advance(1);
    StringBuilder value = new StringBuilder();
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (c == quote) {
        advance(1);
        return new Token(TokenType.QUOTED_LITERAL, value.toString(), at, pos);
      }
      if (isLineBreak(c)) {
        throw new LexException(
            LexException.Kind.EMBEDDED_LINE_BREAK, position(), "Line break inside literal");
      }
      Character escape = notation.escapeCharacter();
      if (escape != null && c == escape) {
        advance(1);
        if (pos >= input.length()) {
          break;
        }
        char escaped = input.charAt(pos);
        if (isLineBreak(escaped)) {
          throw new LexException(
              LexException.Kind.EMBEDDED_LINE_BREAK, position(), "Line break inside literal");
        }
        value.append(escaped);
        advance(1);
        continue;
      }
      value.append(c);
      advance(1);
    }
    throw new LexException(
        LexException.Kind.UNTERMINATED_LITERAL,
        at,
        "Literal opened with " + quote + " is not closed");
  }

  private Token scanBracketedIdentifier() throws LexException {
    SourcePosition at = position();
    advance(1); // <
    int contentStart = pos;
    while (pos < input.length() && input.charAt(pos) != '>' && !isLineBreak(input.charAt(pos))) {
      advance(1);
    }
    if (pos >= input.length() || input.charAt(pos) != '>') {
      throw new LexException(
          LexException.Kind.UNTERMINATED_IDENTIFIER, at, "Missing '>' after identifier");
    }
    String content = input.substring(contentStart, pos).trim();
    advance(1); // >
    if (content.isEmpty()) {
      throw new LexException(LexException.Kind.EMPTY_IDENTIFIER, at, "Identifier has no name");
    }
    return new Token(TokenType.IDENTIFIER, String.join(" ", content.split("\\s+")), at, pos);
  }

  private Token scanBareIdentifier() {
    SourcePosition at = position();
    int start = pos;
    while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
      advance(1);
    }
    return new Token(TokenType.IDENTIFIER, input.substring(start, pos), at, pos);
  }

  private boolean continuesOnNextLine() {
    int i = pos;
    String comment = notation.commentPrefix();
    while (i < input.length()) {
      char c = input.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (comment != null && input.startsWith(comment, i)) {
        while (i < input.length() && !isLineBreak(input.charAt(i))) {
          i++;
        }
      } else {
        break;
      }
    }
    return input.startsWith(notation.alternativeSeparator(), i);
  }

  private void skipBlanks() {
    String comment = notation.commentPrefix();
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (Character.isWhitespace(c) && !(notation.lineOriented() && isLineBreak(c))) {
        advance(1);
      } else if (comment != null && input.startsWith(comment, pos)) {
        while (pos < input.length() && !isLineBreak(input.charAt(pos))) {
          advance(1);
        }
      } else {
        return;
      }
    }
  }

  private void consumeLineBreak() {
    if (input.charAt(pos) == '\r' && pos + 1 < input.length() && input.charAt(pos + 1) == '\n') {
      advance(2);
    } else {
      advance(1);
    }
  }

  private void advance(int count) {
    for (int i = 0; i < count; i++) {
      char c = input.charAt(pos++);
      boolean crlf = c == '\r' && pos < input.length() && input.charAt(pos) == '\n';
      if (c == '\n' || (c == '\r' && !crlf)) {
        line++;
        column = 1;
      } else {
        column++;
      }
    }
  }

  private SourcePosition position() {
    return new SourcePosition(pos, line, column);
  }

  private static boolean isLineBreak(char c) {
    return c == '\n' || c == '\r';
  }

  static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '-';
  }

  /** True if the text would be scanned back as a single bare identifier. */
  public static boolean isBareIdentifier(String text) {
    if (text.isEmpty() || !isIdentifierStart(text.charAt(0))) {
      return false;
    }
    for (int i = 1; i < text.length(); i++) {
      if (!isIdentifierPart(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
