package com.github.keenon.bayesnet.inference;

import com.github.keenon.bayesnet.model.BayesianNetwork;
import com.github.keenon.bayesnet.model.Factor;
import com.github.keenon.bayesnet.model.MalformedTableException;
import com.github.keenon.bayesnet.model.Variable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Created by keenon on 3/4/16.
 * <p>
 * Turns the conditional probability table of a network vertex into its initial factor. The factor's scope is the
 * vertex itself followed by its parents in reverse declaration order, so the vertex's own outcome is the fastest
 * moving index and the first declared parent the slowest. Reading the flat values front to back therefore visits
 * parent assignments in nested order, first parent outermost, with a full distribution over the vertex for each.
 * <p>
 * Every distribution is validated here, so a malformed table fails when the factors are built rather than halfway
 * through a query.
 */
public class FactorBuilder {
  /** How far a distribution may sum from 1.0 before we reject it */
  public static final double DEFAULT_TOLERANCE = 1.0e-8;

  private final BayesianNetwork network;
  private final double tolerance;

  public FactorBuilder(BayesianNetwork network) {
    this(network, DEFAULT_TOLERANCE);
  }

  /**
   * @param network   the network whose tables to read
   * @param tolerance how far each distribution may sum from 1.0
   */
  public FactorBuilder(BayesianNetwork network, double tolerance) {
    if (tolerance < 0) throw new IllegalArgumentException("Tolerance must be non-negative, got " + tolerance);
    this.network = network;
    this.tolerance = tolerance;
  }

  /**
   * @return one factor per vertex, in the network's insertion order
   * @throws MalformedTableException if any vertex's table is malformed
   */
  public List<Factor> buildFactors() {
    List<Factor> factors = new ArrayList<>(network.numVertices());
    for (String vertex : network.getVertices()) {
      factors.add(buildFactor(vertex));
    }
    return factors;
  }

  /**
   * Builds the initial factor for one vertex.
   *
   * @param vertex the vertex name
   * @return a factor over [vertex, last parent, ..., first parent]
   * @throws IllegalArgumentException if the network has no such vertex
   * @throws MalformedTableException  if the table is missing, incomplete, or doesn't hold proper distributions
   */
  public Factor buildFactor(String vertex) {
    BayesianNetwork.Node node = network.getNode(vertex);
    if (node.getTable() == null) {
      throw new MalformedTableException("Vertex \"" + vertex + "\" has no conditional probability table");
    }
    Variable self = node.getVariable();
    List<String> parentNames = node.getParents();

    List<Variable> parents = new ArrayList<>(parentNames.size());
    Set<String> seen = new HashSet<>();
    for (String parent : parentNames) {
      if (!seen.add(parent)) {
        throw new MalformedTableException("Vertex \"" + vertex + "\" lists parent \"" + parent + "\" twice");
      }
      if (parent.equals(vertex)) {
        throw new MalformedTableException("Vertex \"" + vertex + "\" lists itself as a parent");
      }
      if (!network.contains(parent)) {
        throw new MalformedTableException("Vertex \"" + vertex + "\" has unknown parent \"" + parent + "\"");
      }
      parents.add(network.getVariable(parent));
    }

    int size = self.getCardinality();
    for (Variable parent : parents) {
      try {
        size = Math.multiplyExact(size, parent.getCardinality());
      } catch (ArithmeticException e) {
        throw new MalformedTableException("Table for \"" + vertex + "\" has more than " + Integer.MAX_VALUE +
            " entries");
      }
    }
    double[] values = new double[size];
    int[] cursor = new int[]{0};
    explore(node, parents, new ArrayList<>(), values, cursor);
    assert cursor[0] == values.length;

    List<Variable> scope = new ArrayList<>(parents.size() + 1);
    scope.add(self);
    for (int i = parents.size() - 1; i >= 0; i--) {
      scope.add(parents.get(i));
    }
    return new Factor(scope, values);
  }

  ////////////////////////////////////////////////////////////////////////////
  // PRIVATE IMPLEMENTATION
  ////////////////////////////////////////////////////////////////////////////

  /**
   * Recursively walks every parent assignment, first parent outermost, appending the matching distribution to values.
   */
  private void explore(BayesianNetwork.Node node, List<Variable> parents, List<String> assignment, double[] values, int[] cursor) {
    if (assignment.size() == parents.size()) {
      double[] distribution = node.getTable().getDistribution(assignment);
      checkDistribution(node.getVariable(), assignment, distribution);
      System.arraycopy(distribution, 0, values, cursor[0], distribution.length);
      cursor[0] += distribution.length;
      return;
    }
    for (String outcome : parents.get(assignment.size()).getOutcomes()) {
      assignment.add(outcome);
      explore(node, parents, assignment, values, cursor);
      assignment.remove(assignment.size() - 1);
    }
  }

  private void checkDistribution(Variable variable, List<String> assignment, double[] distribution) {
    String where = assignment.isEmpty() ? "" : " given " + assignment;
    if (distribution == null || distribution.length != variable.getCardinality()) {
      throw new MalformedTableException("Distribution for \"" + variable.getName() + "\"" + where + " has " +
          (distribution == null ? 0 : distribution.length) + " entries, expected " + variable.getCardinality());
    }
    double sum = 0.0;
    for (double p : distribution) {
      if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
        throw new MalformedTableException("Distribution for \"" + variable.getName() + "\"" + where +
            " has probability " + p + " outside [0, 1]");
      }
      sum += p;
    }
    if (Math.abs(sum - 1.0) > tolerance) {
      throw new MalformedTableException("Distribution for \"" + variable.getName() + "\"" + where +
          " sums to " + sum + ", not 1");
    }
  }
}
