package io.b2mash.b2b.mediaflow.integrity;

import java.util.List;

/** Outcome of a preventive creation check. */
public record ValidationResult(boolean valid, List<String> errors) {

  public ValidationResult {
    errors = List.copyOf(errors);
  }

  public static ValidationResult of(List<String> errors) {
    return new ValidationResult(errors.isEmpty(), errors);
  }
}
