package io.cfgtypes.generator.analysis;

import io.cfgtypes.parser.api.Identifier;
import java.util.Objects;

/**
 * A finding of the grammar analyzer.
 *
 * @param severity whether the finding fails the analysis
 * @param kind what was found
 * @param rule the rule the finding is about
 * @param message human readable description
 */
public record Diagnostic(Severity severity, Kind kind, Identifier rule, String message) {

  public enum Severity {
    ERROR,
    WARNING
  }

  public enum Kind {
    /** A reference to a rule that is not defined. */
    UNDEFINED_RULE_REFERENCE(Severity.ERROR),
    /** A rule name defined more than once. */
    DUPLICATE_RULE_NAME(Severity.ERROR),
    /** The requested start rule is not defined. */
    UNKNOWN_START_RULE(Severity.ERROR),
    /** A rule with no finite derivation. */
    UNPRODUCTIVE_RULE(Severity.ERROR),
    /** A productive rule with an alternative that needs an unproductive rule. */
    DEPENDS_ON_UNPRODUCTIVE_RULE(Severity.ERROR),
    /** A rule that cannot be reached from the start rule. */
    UNREACHABLE_RULE(Severity.WARNING);

    private final Severity severity;

    Kind(Severity severity) {
      this.severity = severity;
    }

    public Severity severity() {
      return severity;
    }
  }

  public Diagnostic {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(message, "message");
  }

  static Diagnostic of(Kind kind, Identifier rule, String message) {
    return new Diagnostic(kind.severity(), kind, rule, message);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return severity + " " + kind + " [" + rule + "]: " + message;
  }
}
