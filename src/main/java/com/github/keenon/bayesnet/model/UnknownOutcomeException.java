package com.github.keenon.bayesnet.model;

/**
 * Thrown when an evidence or query value isn't one of the declared outcomes of its variable.
 */
public class UnknownOutcomeException extends IllegalArgumentException {
  private final String variable;
  private final String outcome;

  public UnknownOutcomeException(String variable, String outcome) {
    super("Variable \"" + variable + "\" has no outcome \"" + outcome + "\"");
    this.variable = variable;
    this.outcome = outcome;
  }

  public String getVariable() {
    return variable;
  }

  public String getOutcome() {
    return outcome;
  }
}
