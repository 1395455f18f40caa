package com.github.keenon.bayesnet.inference;

import com.github.keenon.bayesnet.model.BayesianNetwork;
import com.github.keenon.bayesnet.model.Factor;
import com.github.keenon.bayesnet.model.FactorAlgebra;
import com.github.keenon.bayesnet.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Created by keenon on 3/4/16.
 * <p>
 * Sum-product variable elimination over the factors of a discrete Bayesian network. The joint distribution is kept
 * as a working list of factors whose product it is. Conditioning on evidence shrinks the factors that mention an
 * observed variable, and eliminating a variable replaces every factor that mentions it with their product, summed
 * over that variable.
 * <p>
 * The per-vertex factors are built once, when this object is created, and are never handed out: the working list
 * always holds copies, so {@link #refresh()} can restore it at any time. Instances are not thread-safe; use one per
 * thread.
 */
public class VariableElimination {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(VariableElimination.class);

  final BayesianNetwork network;
  private final List<Factor> originalFactors;
  private List<Factor> factors;

  /**
   * Builds the per-vertex factors of the network, validating every table.
   *
   * @param network the network to compute over. Changes to it after construction are not picked up.
   * @throws com.github.keenon.bayesnet.model.MalformedTableException if any table is malformed
   */
  public VariableElimination(BayesianNetwork network) {
    this(network, new FactorBuilder(network));
  }

  /**
   * @param network the network to compute over
   * @param builder the builder to make the per-vertex factors with, eg one with a custom tolerance
   */
  public VariableElimination(BayesianNetwork network, FactorBuilder builder) {
    this.network = network;
    this.originalFactors = builder.buildFactors();
    this.factors = freshFactors();
  }

  /**
   * @return the working list of factors, by reference. Mutating it mutates the state of this object.
   */
  public List<Factor> getFactors() {
    return factors;
  }

  /**
   * @return an independent copy of every per-vertex factor, as built from the network, in network order
   */
  public List<Factor> freshFactors() {
    List<Factor> copies = new ArrayList<>(originalFactors.size());
    for (Factor factor : originalFactors) {
      copies.add(FactorAlgebra.copy(factor));
    }
    return copies;
  }

  /**
   * Throws away any evidence or elimination applied so far, restoring the working list to the per-vertex factors.
   */
  public void refresh() {
    factors = freshFactors();
  }

  /**
   * Conditions the working list on evidence.
   *
   * @param evidence   observed outcome label by variable name
   * @param inPlace    whether to store the result as the new working list
   * @param resetFirst whether to {@link #refresh()} before conditioning, dropping previously applied evidence
   * @return the conditioned list of factors
   * @throws IllegalArgumentException if an evidence variable is not in the network
   * @throws com.github.keenon.bayesnet.model.UnknownOutcomeException if an observed label is not in its variable's
   *                                                                  domain
   */
  public List<Factor> condition(Map<String, String> evidence, boolean inPlace, boolean resetFirst) {
    if (resetFirst) refresh();
    List<Factor> conditioned = condition(factors, evidence);
    if (inPlace) factors = conditioned;
    return conditioned;
  }

  /**
   * Conditions a list of factors on evidence. Every factor mentioning an observed variable is replaced by the slice
   * consistent with the observation. Factors left with an empty scope are dropped: they are constants, and every
   * query normalizes its result, so they cancel. Anything that wants unnormalized totals must account for this.
   * The exception is a constant of exactly zero, which is kept so that normalization reports the impossible evidence.
   * <p>
   * Variables no factor mentions any more, eg because they were already observed, are skipped.
   *
   * @param factors  the factors to condition, unchanged
   * @param evidence observed outcome label by variable name
   * @return a new list holding the conditioned factors. Factors that didn't mention any evidence are shared.
   */
  public List<Factor> condition(List<Factor> factors, Map<String, String> evidence) {
    // Check everything before touching anything, so a bad observation can't leave us half conditioned
    Map<Variable, String> observations = new LinkedHashMap<>();
    for (Map.Entry<String, String> observation : evidence.entrySet()) {
      Variable variable = network.getVariable(observation.getKey());
      variable.indexOf(observation.getValue());
      observations.put(variable, observation.getValue());
    }

    List<Factor> conditioned = new ArrayList<>(factors);
    for (Map.Entry<Variable, String> observation : observations.entrySet()) {
      String name = observation.getKey().getName();
      for (int i = 0; i < conditioned.size(); i++) {
        if (conditioned.get(i).contains(name)) {
          conditioned.set(i, FactorAlgebra.reduce(conditioned.get(i), observation.getKey(), observation.getValue()));
        }
      }
      // A zero constant is kept: it doesn't cancel, it means the evidence is impossible
      conditioned.removeIf(factor -> factor.numVariables() == 0 && factor.getValue(0) != 0.0);
    }
    log.debug("Conditioned on {}, {} factors remain", evidence, conditioned.size());
    return conditioned;
  }

  /**
   * Eliminates variables from the working list, in order, and returns the product of what's left.
   *
   * @param order the variables to sum out, in the order to sum them out
   * @return the product of all remaining factors
   */
  public Factor eliminate(List<String> order) {
    return eliminate(factors, order);
  }

  /**
   * Runs sum-product variable elimination over a list of factors. Each variable in the order is eliminated by
   * {@link #eliminateVariable(List, String)}, then every factor left over is multiplied into a single one.
   * <p>
   * The list is mutated: when this returns it holds exactly the returned factor.
   *
   * @param factors the factors to eliminate from. Must be owned by the caller.
   * @param order   the variables to sum out. Each may appear only once. The order is used as given.
   * @return the product of all factors after elimination. An empty list yields the 0-dimensional unit factor.
   * @throws IllegalArgumentException if a variable appears twice in the order
   */
  public static Factor eliminate(List<Factor> factors, List<String> order) {
    Set<String> seen = new HashSet<>();
    for (String variable : order) {
      if (!seen.add(variable)) {
        throw new IllegalArgumentException("Variable \"" + variable + "\" appears twice in elimination order " + order);
      }
    }

    for (String variable : order) {
      eliminateVariable(factors, variable);
    }

    Factor result;
    if (factors.isEmpty()) {
      result = Factor.unit();
    } else if (factors.size() == 1) {
      result = factors.get(0);
    } else {
      // The first factor is copied, so the in-place multiplications below only ever touch our own product
      result = FactorAlgebra.copy(factors.get(0));
      for (int i = 1; i < factors.size(); i++) {
        FactorAlgebra.multiplyInPlace(result, factors.get(i));
      }
    }
    factors.clear();
    factors.add(result);
    return result;
  }

  /**
   * Eliminates a single variable: every factor mentioning it is replaced by their product with the variable summed
   * out. If no factor mentions it, this does nothing.
   *
   * @param factors  the factors to eliminate from, mutated
   * @param variable the variable to sum out
   */
  public static void eliminateVariable(List<Factor> factors, String variable) {
    List<Factor> mentioning = new ArrayList<>();
    List<Factor> rest = new ArrayList<>();
    for (Factor factor : factors) {
      if (factor.contains(variable)) mentioning.add(factor);
      else rest.add(factor);
    }

    if (mentioning.isEmpty()) {
      log.debug("No factor mentions \"{}\", skipping", variable);
      return;
    }

    // Copy before multiplying in place, so factors the caller may still hold are never touched
    Factor product = FactorAlgebra.copy(mentioning.get(0));
    for (int i = 1; i < mentioning.size(); i++) {
      FactorAlgebra.multiplyInPlace(product, mentioning.get(i));
    }
    Factor summed = FactorAlgebra.reduce(product, variable);
    log.debug("Eliminated \"{}\" from {} factors, leaving a factor over {}", variable, mentioning.size(),
        Arrays.toString(summed.getScope()));

    factors.clear();
    factors.addAll(rest);
    factors.add(summed);
  }
}
