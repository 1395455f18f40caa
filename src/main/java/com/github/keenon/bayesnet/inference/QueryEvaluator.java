package com.github.keenon.bayesnet.inference;

import com.github.keenon.bayesnet.model.BayesianNetwork;
import com.github.keenon.bayesnet.model.Factor;
import com.github.keenon.bayesnet.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Created by keenon on 3/5/16.
 * <p>
 * Answers exact posterior queries against a discrete Bayesian network:
 * - {@link #queryDistribution(Set, Map)}: the joint posterior over some variables, given evidence
 * - {@link #queryEvent(Map, Map)}: the posterior probability of an event, where each query variable may take any of a
 * set of outcomes
 * <p>
 * Every query starts from fresh copies of the per-vertex factors, so queries never see each other's evidence.
 */
public class QueryEvaluator {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(QueryEvaluator.class);

  private final BayesianNetwork network;
  private final VariableElimination elimination;
  private final List<String> topologicalOrder;

  /**
   * @param network the network to query
   * @throws IllegalStateException if the network has a missing parent or a cycle
   * @throws com.github.keenon.bayesnet.model.MalformedTableException if any table is malformed
   */
  public QueryEvaluator(BayesianNetwork network) {
    this(new VariableElimination(network));
  }

  public QueryEvaluator(VariableElimination elimination) {
    this.elimination = elimination;
    this.network = elimination.network;
    this.topologicalOrder = network.topologicalOrder();
  }

  /**
   * Computes the joint posterior over the query variables given the evidence. Every other vertex is eliminated, in
   * topological order.
   *
   * @param query    the variables to keep. Must be non-empty, and disjoint from the evidence.
   * @param evidence observed outcome label by variable name
   * @return a factor whose scope is exactly the query variables, with values summing to 1
   * @throws ArithmeticException if the evidence has probability zero
   */
  public Factor queryDistribution(Set<String> query, Map<String, String> evidence) {
    checkQuery(query, evidence);
    List<String> order = new ArrayList<>();
    for (String vertex : topologicalOrder) {
      if (!query.contains(vertex) && !evidence.containsKey(vertex)) order.add(vertex);
    }
    return queryDistribution(query, evidence, order);
  }

  /**
   * Same as {@link #queryDistribution(Set, Map)}, but eliminates variables in a caller-chosen order.
   *
   * @param eliminationOrder the variables to sum out. Must not contain query or evidence variables. Vertices left out
   *                         of the order stay in the result.
   */
  public Factor queryDistribution(Set<String> query, Map<String, String> evidence, List<String> eliminationOrder) {
    checkQuery(query, evidence);
    for (String variable : eliminationOrder) {
      if (query.contains(variable)) {
        throw new IllegalArgumentException("Query variable \"" + variable + "\" can't be eliminated");
      }
      if (evidence.containsKey(variable)) {
        throw new IllegalArgumentException("Evidence variable \"" + variable + "\" can't be eliminated");
      }
    }
    log.debug("Querying {} given {}, eliminating {}", query, evidence, eliminationOrder);

    List<Factor> factors = elimination.condition(elimination.freshFactors(), evidence);
    Factor result = VariableElimination.eliminate(factors, eliminationOrder);
    return normalize(result);
  }

  /**
   * Computes the posterior probability that every query variable takes one of its accepted outcomes, given the
   * evidence.
   *
   * @param query    accepted outcome labels by variable name. Outcomes within a variable are alternatives, variables
   *                 must all hold at once.
   * @param evidence observed outcome label by variable name
   * @return the probability of the event. Rounding may push this a hair outside [0, 1].
   * @throws com.github.keenon.bayesnet.model.UnknownOutcomeException if an accepted label is not in its domain
   * @throws ArithmeticException if the evidence has probability zero
   */
  public double queryEvent(Map<String, Set<String>> query, Map<String, String> evidence) {
    // Validate labels up front, so a typo fails before we pay for elimination
    List<String> variables = new ArrayList<>(query.keySet());
    int[][] acceptedIndices = new int[variables.size()][];
    for (int i = 0; i < variables.size(); i++) {
      Variable variable = network.getVariable(variables.get(i));
      Set<String> accepted = query.get(variables.get(i));
      if (accepted == null || accepted.isEmpty()) {
        throw new IllegalArgumentException("Query variable \"" + variables.get(i) + "\" accepts no outcomes");
      }
      acceptedIndices[i] = new int[accepted.size()];
      int cursor = 0;
      for (String outcome : accepted) {
        acceptedIndices[i][cursor++] = variable.indexOf(outcome);
      }
    }

    Factor distribution = queryDistribution(query.keySet(), evidence);

    int[] strides = new int[variables.size()];
    for (int i = 0; i < strides.length; i++) {
      strides[i] = distribution.getStride(variables.get(i));
    }
    return sumAccepted(distribution, acceptedIndices, strides, 0, 0);
  }

  /**
   * Computes the posterior over a single variable given evidence.
   *
   * @return the probability of each outcome, in domain order
   */
  public double[] marginal(String variable, Map<String, String> evidence) {
    return queryDistribution(Collections.singleton(variable), evidence).getValues();
  }

  /**
   * Divides every value of a factor by their sum.
   *
   * @param factor the factor to normalize, unchanged
   * @return a new factor with the same scope, whose values sum to 1
   * @throws ArithmeticException if the values sum to zero, which means the evidence is impossible
   */
  public static Factor normalize(Factor factor) {
    double sum = factor.valueSum();
    if (sum == 0.0) {
      throw new ArithmeticException("Can't normalize a factor over " + Arrays.toString(factor.getScope()) +
          " that sums to zero, the evidence has probability zero");
    }
    double[] values = factor.getValues();
    for (int i = 0; i < values.length; i++) {
      values[i] /= sum;
    }
    return new Factor(factor.getScope(), factor.getCardinalities(), values);
  }

  ////////////////////////////////////////////////////////////////////////////
  // PRIVATE IMPLEMENTATION
  ////////////////////////////////////////////////////////////////////////////

  private void checkQuery(Set<String> query, Map<String, String> evidence) {
    if (query.isEmpty()) throw new IllegalArgumentException("Query must name at least one variable");
    for (String variable : query) {
      network.getVariable(variable);
      if (evidence.containsKey(variable)) {
        throw new IllegalArgumentException("Variable \"" + variable + "\" is both queried and observed");
      }
    }
  }

  /**
   * Recursively walks the Cartesian product of accepted indices, one variable per level, summing the values at the
   * flat offsets.
   */
  private static double sumAccepted(Factor distribution, int[][] acceptedIndices, int[] strides, int depth, int offset) {
    if (depth == acceptedIndices.length) {
      return distribution.getValue(offset);
    }
    double sum = 0.0;
    for (int index : acceptedIndices[depth]) {
      sum += sumAccepted(distribution, acceptedIndices, strides, depth + 1, offset + index * strides[depth]);
    }
    return sum;
  }
}
