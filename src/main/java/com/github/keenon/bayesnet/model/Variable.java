package com.github.keenon.bayesnet.model;

import com.carrotsearch.hppc.ObjectIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Created by keenon on 3/2/16.
 * <p>
 * A named discrete random variable, with an ordered list of outcome labels. The position of a label in the list is
 * the index that factors use to address it, so the list never changes after construction.
 */
public class Variable {
  private final String name;
  private final List<String> outcomes;

  // OPTIMIZATION:
  // evidence and event queries look labels up repeatedly, so we keep a primitive index instead of scanning the list
  private final ObjectIntHashMap<String> outcomeIndices = new ObjectIntHashMap<>();

  /**
   * @param name     the name of the variable, which is how factors and networks refer to it
   * @param outcomes the ordered, distinct outcome labels. Must not be empty.
   */
  public Variable(String name, List<String> outcomes) {
    if (name == null) throw new IllegalArgumentException("A variable needs a name");
    if (outcomes == null || outcomes.isEmpty()) {
      throw new IllegalArgumentException("Variable \"" + name + "\" must have at least one outcome");
    }
    this.name = name;
    this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    for (int i = 0; i < this.outcomes.size(); i++) {
      String outcome = this.outcomes.get(i);
      if (outcomeIndices.containsKey(outcome)) {
        throw new IllegalArgumentException("Variable \"" + name + "\" lists outcome \"" + outcome + "\" twice");
      }
      outcomeIndices.put(outcome, i);
    }
  }

  public String getName() {
    return name;
  }

  /**
   * @return the outcome labels, in domain order. Unmodifiable.
   */
  public List<String> getOutcomes() {
    return outcomes;
  }

  public int getCardinality() {
    return outcomes.size();
  }

  public String getOutcome(int index) {
    return outcomes.get(index);
  }

  /**
   * Finds the domain index of a label.
   *
   * @param outcome the label to look up
   * @return the index of the label in the domain
   * @throws UnknownOutcomeException if the label isn't part of the domain
   */
  public int indexOf(String outcome) {
    if (outcome == null || !outcomeIndices.containsKey(outcome)) {
      throw new UnknownOutcomeException(name, outcome);
    }
    return outcomeIndices.get(outcome);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Variable)) return false;
    Variable other = (Variable) o;
    return name.equals(other.name) && outcomes.equals(other.outcomes);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + outcomes.hashCode();
  }

  @Override
  public String toString() {
    return name + outcomes;
  }
}
