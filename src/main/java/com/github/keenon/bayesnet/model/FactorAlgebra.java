package com.github.keenon.bayesnet.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Created by keenon on 3/3/16.
 * <p>
 * The operations that sum-product variable elimination needs on {@link Factor}s: multiply two factors together, and
 * reduce a factor by one variable, either by summing it out or by selecting a single observed outcome.
 * <p>
 * Everything here returns a new factor and leaves its arguments alone, except {@link #multiplyInPlace(Factor, Factor)},
 * which exists for callers that own the receiver and want to avoid an allocation per multiplication.
 * <p>
 * For background cf. Koller & Friedman, Probabilistic Graphical Models, sections 9.3 and 10.2.
 */
public final class FactorAlgebra {

  private FactorAlgebra() {
  }

  /**
   * Multiplies two factors. The result's scope is a's scope followed by any of b's variables a doesn't have, in the
   * order b lists them. Each result value is the product of the a and b values for the matching sub-assignments.
   *
   * @param a the left factor, unchanged
   * @param b the right factor, unchanged
   * @return a new factor over the union of the scopes
   * @throws FactorScopeException if a variable shared by a and b has different cardinalities in each
   */
  public static Factor multiply(Factor a, Factor b) {
    Factor result = a.deepCopy();
    multiplyInPlace(result, b);
    return result;
  }

  /**
   * Multiplies operand into receiver, replacing receiver's scope, cardinalities, strides and values with those of the
   * product. The operand is unchanged.
   *
   * @param receiver the factor to overwrite with the product
   * @param operand  the factor to multiply by
   * @throws FactorScopeException if a variable shared by both factors has different cardinalities in each. The
   *                              receiver is left untouched in that case.
   */
  public static void multiplyInPlace(Factor receiver, Factor operand) {
    // Merge the scopes, first seen wins
    List<String> scope = new ArrayList<>(receiver.scope.length + operand.scope.length);
    List<Integer> cardinality = new ArrayList<>(receiver.scope.length + operand.scope.length);
    for (int i = 0; i < receiver.scope.length; i++) {
      scope.add(receiver.scope[i]);
      cardinality.add(receiver.cardinality[i]);
    }
    for (int i = 0; i < operand.scope.length; i++) {
      int position = receiver.positionOf(operand.scope[i]);
      if (position == -1) {
        scope.add(operand.scope[i]);
        cardinality.add(operand.cardinality[i]);
      } else if (receiver.cardinality[position] != operand.cardinality[i]) {
        throw new FactorScopeException("Variable \"" + operand.scope[i] + "\" has cardinality " +
            receiver.cardinality[position] + " in one factor and " + operand.cardinality[i] + " in the other");
      }
    }

    int n = scope.size();
    String[] unionScope = scope.toArray(new String[n]);
    int[] unionCardinality = new int[n];
    int[] receiverStride = new int[n];
    int[] operandStride = new int[n];
    int total = 1;
    for (int l = 0; l < n; l++) {
      unionCardinality[l] = cardinality.get(l);
      receiverStride[l] = receiver.getStride(unionScope[l]);
      operandStride[l] = operand.getStride(unionScope[l]);
      total = Factor.growTableSize(total, unionCardinality[l], unionScope);
    }

    // Walk every assignment of the union scope in flat order, keeping running offsets into both operands
    double[] values = new double[total];
    int[] assignment = new int[n];
    int j = 0;
    int k = 0;
    for (int i = 0; i < total; i++) {
      values[i] = receiver.values[j] * operand.values[k];

      for (int l = 0; l < n; l++) {
        assignment[l]++;
        if (assignment[l] == unionCardinality[l]) {
          assignment[l] = 0;
          j -= (unionCardinality[l] - 1) * receiverStride[l];
          k -= (unionCardinality[l] - 1) * operandStride[l];
        } else {
          j += receiverStride[l];
          k += operandStride[l];
          break;
        }
      }
    }

    receiver.setTable(unionScope, unionCardinality, values);
  }

  /**
   * Sums a variable out of a factor.
   *
   * @param factor   the factor to reduce, unchanged
   * @param variable the name of the variable to sum out
   * @return a new factor without the variable, with one value per assignment of the remaining variables
   * @throws FactorScopeException if the factor doesn't mention the variable
   */
  public static Factor reduce(Factor factor, String variable) {
    return reduce(factor, factor.requirePosition(variable), -1);
  }

  /**
   * Conditions a factor on an observed value of a variable, keeping only the entries consistent with the observation.
   * The variable is then dropped from the scope.
   *
   * @param factor   the factor to reduce, unchanged
   * @param variable the observed variable
   * @param value    the observed outcome label
   * @return a new factor without the variable
   * @throws FactorScopeException    if the factor doesn't mention the variable
   * @throws UnknownOutcomeException if the value is not an outcome of the variable
   */
  public static Factor reduce(Factor factor, Variable variable, String value) {
    int position = factor.requirePosition(variable.getName());
    int index = variable.indexOf(value);
    if (factor.cardinality[position] != variable.getCardinality()) {
      throw new FactorScopeException("Variable \"" + variable.getName() + "\" has cardinality " +
          variable.getCardinality() + " but the factor has " + factor.cardinality[position]);
    }
    return reduce(factor, position, index);
  }

  /**
   * @return an independent deep copy of the factor
   */
  public static Factor copy(Factor factor) {
    return factor.deepCopy();
  }

  ////////////////////////////////////////////////////////////////////////////
  // PRIVATE IMPLEMENTATION
  ////////////////////////////////////////////////////////////////////////////

  /**
   * Shared index walk for sum-out and observe. For every assignment of the remaining variables, we either sum the
   * entries spaced stride[position] apart, or pick the one at the observed index.
   *
   * @param factor   the factor to reduce
   * @param position the scope position of the variable being removed
   * @param index    the observed outcome index, or -1 to sum out
   */
  private static Factor reduce(Factor factor, int position, int index) {
    int variableStride = factor.stride[position];
    int variableCardinality = factor.cardinality[position];

    double[] result = new double[factor.values.length / variableCardinality];

    // k walks the base offset of each block of the variable; every variableStride steps we've finished one run of
    // less significant variables, and jump over the rest of the block
    int k = 0;
    for (int i = 0; i < result.length; i++) {
      if (index == -1) {
        double sum = 0.0;
        for (int h = 0; h < variableCardinality; h++) {
          sum += factor.values[k + variableStride * h];
        }
        result[i] = sum;
      } else {
        result[i] = factor.values[k + variableStride * index];
      }

      k++;
      if (k % variableStride == 0) {
        k += variableStride * (variableCardinality - 1);
      }
    }

    String[] scope = new String[factor.scope.length - 1];
    int[] cardinality = new int[factor.cardinality.length - 1];
    for (int i = 0, cursor = 0; i < factor.scope.length; i++) {
      if (i == position) continue;
      scope[cursor] = factor.scope[i];
      cardinality[cursor] = factor.cardinality[i];
      cursor++;
    }

    // The later variables' strides come out divided by variableCardinality, which is what setTable recomputes
    Factor reduced = new Factor(scope, cardinality, result);
    assert strideShrunk(factor, reduced, position, variableCardinality);
    return reduced;
  }

  private static boolean strideShrunk(Factor before, Factor after, int position, int variableCardinality) {
    for (int i = position + 1; i < before.scope.length; i++) {
      if (after.stride[i - 1] != before.stride[i] / variableCardinality) return false;
    }
    return true;
  }
}
