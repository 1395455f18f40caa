package com.github.keenon.bayesnet.model;

/**
 * Thrown when a factor operation is asked to work with a scope it can't support: a variable that isn't in the
 * factor, a variable that shows up twice, a shared variable whose cardinality disagrees between two factors, or a
 * scope too large to hold in a single array.
 */
public class FactorScopeException extends IllegalStateException {
  public FactorScopeException(String message) {
    super(message);
  }
}
