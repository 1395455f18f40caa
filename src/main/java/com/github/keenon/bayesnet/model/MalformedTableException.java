package com.github.keenon.bayesnet.model;

/**
 * Thrown when a conditional probability table can't be turned into a factor: a missing row or parent, a
 * distribution of the wrong length, or probabilities that don't sum to one.
 */
public class MalformedTableException extends IllegalArgumentException {
  public MalformedTableException(String message) {
    super(message);
  }
}
