package io.cfgtypes.generator;

import io.cfgtypes.parser.api.GrammarException;
import java.util.Objects;
import java.util.Optional;

/** Result of compiling one named grammar in a batch: either a result or the failure. */
public record BatchOutcome(String name, CompilationResult result, GrammarException failure) {

  public BatchOutcome {
    Objects.requireNonNull(name, "name");
    if ((result == null) == (failure == null)) {
      throw new IllegalArgumentException("Exactly one of result and failure must be present");
    }
  }

  static BatchOutcome success(String name, CompilationResult result) {
    return new BatchOutcome(name, result, null);
  }

  static BatchOutcome failure(String name, GrammarException failure) {
    return new BatchOutcome(name, null, failure);
  }

  public boolean isSuccess() {
    return result != null;
  }

  public Optional<CompilationResult> resultIfPresent() {
    return Optional.ofNullable(result);
  }

  public Optional<GrammarException> failureIfPresent() {
    return Optional.ofNullable(failure);
  }
}
