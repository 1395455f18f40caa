package com.github.keenon.bayesnet.model;

import com.carrotsearch.hppc.ObjectIntHashMap;
import com.github.keenon.bayesnet.FactorProto;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Created by keenon on 3/3/16.
 * <p>
 * Holds a table of non-negative values over a scope of discrete variables, flattened into a single array. The flat
 * layout is a mixed-radix encoding of an assignment to the scope, where the first variable in the scope is the least
 * significant digit. Each variable keeps its cardinality and its stride, the distance in the flat array between two
 * assignments that differ by one in that variable only:
 * <p>
 * stride[0] = 1, stride[i] = stride[i-1] * cardinality[i-1]
 * <p>
 * A factor with an empty scope is legal, and holds exactly one value.
 * <p>
 * The operations on factors (multiply, sum out, observe) live in {@link FactorAlgebra}.
 */
public class Factor implements Iterable<int[]> {
  protected String[] scope;
  protected int[] cardinality;
  protected int[] stride;

  // OPTIMIZATION:
  // in an immutable design this would be private, but FactorAlgebra rewrites it in place when multiplying into a
  // receiver, so we leave it as protected
  protected double[] values;

  private ObjectIntHashMap<String> positions;

  /**
   * Creates a factor over a scope, with all values set to zero.
   *
   * @param scope       the variable names, least significant first. Must be distinct.
   * @param cardinality the number of outcomes of each variable, in scope order
   */
  public Factor(String[] scope, int[] cardinality) {
    this(scope, cardinality, new double[tableSize(scope, cardinality)]);
  }

  /**
   * Creates a factor over a scope, with the given values in flat order.
   *
   * @param scope       the variable names, least significant first. Must be distinct.
   * @param cardinality the number of outcomes of each variable, in scope order
   * @param values      the flat values. Must have as many entries as the product of the cardinalities. Not copied.
   * @throws FactorScopeException if the scope is inconsistent with the cardinalities or the values
   */
  public Factor(String[] scope, int[] cardinality, double[] values) {
    setTable(scope, cardinality, values);
  }

  /**
   * Convenience constructor for a factor over known variables.
   */
  public Factor(List<Variable> variables, double[] values) {
    this(namesOf(variables), cardinalitiesOf(variables), values);
  }

  /**
   * @return a 0-dimensional factor holding the single value 1.0, the identity for multiplication
   */
  public static Factor unit() {
    return new Factor(new String[0], new int[0], new double[]{1.0});
  }

  /**
   * @return the scope, least significant variable first, passed by value
   */
  public String[] getScope() {
    return scope.clone();
  }

  /**
   * @return the number of variables in the scope
   */
  public int numVariables() {
    return scope.length;
  }

  public boolean contains(String variable) {
    return positions.containsKey(variable);
  }

  /**
   * @return the position of the variable in the scope, or -1 if the factor doesn't mention it
   */
  public int positionOf(String variable) {
    return positions.containsKey(variable) ? positions.get(variable) : -1;
  }

  /**
   * @return the cardinalities of the scope variables, in scope order, passed by value
   */
  public int[] getCardinalities() {
    return cardinality.clone();
  }

  /**
   * @throws FactorScopeException if the factor doesn't mention the variable
   */
  public int getCardinality(String variable) {
    return cardinality[requirePosition(variable)];
  }

  /**
   * @return the stride of the variable in the flat values, or 0 if the factor doesn't mention it. Zero is the
   * natural stride for an absent variable: changing its value never moves within this factor.
   */
  public int getStride(String variable) {
    int position = positionOf(variable);
    return position == -1 ? 0 : stride[position];
  }

  /**
   * @return the strides of the scope variables, in scope order, passed by value
   */
  public int[] getStrides() {
    return stride.clone();
  }

  /**
   * @return the flat values, passed by value
   */
  public double[] getValues() {
    return values.clone();
  }

  public double getValue(int flatIndex) {
    return values[flatIndex];
  }

  /**
   * @return the number of entries in the table, which is the product of the cardinalities
   */
  public int size() {
    return values.length;
  }

  /**
   * Retrieve a single value for an assignment.
   *
   * @param assignment one outcome index per scope variable, in scope order
   * @return the value for the given assignment
   */
  public double getAssignmentValue(int[] assignment) {
    return values[getTableAccessOffset(assignment)];
  }

  /**
   * Set a single value in the table.
   *
   * @param assignment one outcome index per scope variable, in scope order
   * @param value      the value to put into the table
   */
  public void setAssignmentValue(int[] assignment, double value) {
    assert !Double.isNaN(value);
    values[getTableAccessOffset(assignment)] = value;
  }

  /**
   * @return the sum of all the values in the table
   */
  public double valueSum() {
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    return sum;
  }

  /**
   * Copy this factor. The copy shares no arrays with the original.
   */
  public Factor deepCopy() {
    return new Factor(scope.clone(), cardinality.clone(), values.clone());
  }

  /**
   * WARNING: This is pass by reference to avoid massive GC overload during heavy iterations, and because the standard
   * use case is to use the assignments array as an accessor. Please, clone if you save a copy, otherwise the array
   * will mutate underneath you.
   *
   * @return an iterator over all possible assignments to this factor, in flat order
   */
  @Override
  public Iterator<int[]> iterator() {
    return new Iterator<int[]>() {
      Iterator<int[]> unsafe = fastPassByReferenceIterator();

      @Override
      public boolean hasNext() {
        return unsafe.hasNext();
      }

      @Override
      public int[] next() {
        return unsafe.next().clone();
      }
    };
  }

  /**
   * This is its own function because people will inevitably attempt this optimization of not cloning the array we
   * hand to the iterator, to save on GC, and it should not be default behavior. If you know what you're doing, then
   * this may be the iterator for you.
   * <p>
   * Assignments come out in flat order: the first scope variable ticks fastest, like an odometer read backwards.
   *
   * @return an iterator that will mutate the value it returns to you, so you must clone if you want to keep a copy
   */
  public Iterator<int[]> fastPassByReferenceIterator() {
    final int[] assignments = new int[cardinality.length];
    final int total = values.length;
    if (assignments.length > 0) assignments[0] = -1;

    return new Iterator<int[]>() {
      int emitted = 0;

      @Override
      public boolean hasNext() {
        return emitted < total;
      }

      @Override
      public int[] next() {
        if (!hasNext()) throw new NoSuchElementException();
        emitted++;
        if (assignments.length == 0) return assignments;
        // Add one to the first position
        assignments[0]++;
        // Carry any resulting overflow all the way to the end.
        for (int i = 0; i < assignments.length; i++) {
          if (assignments[i] >= cardinality[i]) {
            assignments[i] = 0;
            if (i < assignments.length - 1) {
              assignments[i + 1]++;
            }
          } else {
            break;
          }
        }
        return assignments;
      }
    };
  }

  /**
   * Does a deep comparison, using equality with tolerance checks against the table of values. Scope order matters.
   *
   * @param other     the factor to compare to
   * @param tolerance the tolerance to accept in differences
   * @return whether the two factors are within tolerance of one another
   */
  public boolean valueEquals(Factor other, double tolerance) {
    if (!Arrays.equals(scope, other.scope)) return false;
    if (!Arrays.equals(cardinality, other.cardinality)) return false;
    for (int i = 0; i < values.length; i++) {
      if (Math.abs(values[i] - other.values[i]) > tolerance) return false;
    }
    return true;
  }

  /**
   * Convenience function to write this factor directly to a stream, encoded as proto. Reversible with readFromStream.
   *
   * @param stream the stream to write to. does not flush automatically
   * @throws IOException passed through from the stream
   */
  public void writeToStream(OutputStream stream) throws IOException {
    getProtoBuilder().build().writeDelimitedTo(stream);
  }

  /**
   * Convenience function to read a factor (assumed serialized with proto) directly from a stream.
   *
   * @param stream the stream to be read from
   * @return a new in-memory factor, or null if the stream was already exhausted
   * @throws IOException passed through from the stream
   */
  public static Factor readFromStream(InputStream stream) throws IOException {
    FactorProto.Factor proto = FactorProto.Factor.parseDelimitedFrom(stream);
    if (proto == null) return null;
    return readFromProto(proto);
  }

  /**
   * @return proto Builder object
   */
  public FactorProto.Factor.Builder getProtoBuilder() {
    FactorProto.Factor.Builder b = FactorProto.Factor.newBuilder();
    for (String variable : scope) {
      b.addScope(variable);
    }
    for (int n : cardinality) {
      b.addCardinality(n);
    }
    for (double value : values) {
      b.addValues(value);
    }
    return b;
  }

  /**
   * Creates a new in-memory factor from a proto serialization.
   *
   * @param proto the proto object to be turned into an in-memory factor
   * @return an in-memory factor
   */
  public static Factor readFromProto(FactorProto.Factor proto) {
    String[] scope = proto.getScopeList().toArray(new String[0]);
    int[] cardinality = new int[proto.getCardinalityCount()];
    for (int i = 0; i < cardinality.length; i++) {
      cardinality[i] = proto.getCardinality(i);
    }
    double[] values = new double[proto.getValuesCount()];
    for (int i = 0; i < values.length; i++) {
      values[i] = proto.getValues(i);
      assert !Double.isNaN(values[i]);
    }
    return new Factor(scope, cardinality, values);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Factor(");
    for (int i = 0; i < scope.length; i++) {
      if (i > 0) sb.append(", ");
      sb.append(scope[i]).append(':').append(cardinality[i]);
    }
    return sb.append(") ").append(Arrays.toString(values)).toString();
  }

  ////////////////////////////////////////////////////////////////////////////
  // PRIVATE IMPLEMENTATION
  ////////////////////////////////////////////////////////////////////////////

  /**
   * Replaces the whole table. Strides and the position index are recomputed from the new scope order, so every
   * operation that produces a new scope goes through here.
   */
  final void setTable(String[] scope, int[] cardinality, double[] values) {
    if (scope.length != cardinality.length) {
      throw new FactorScopeException("Scope " + Arrays.toString(scope) + " has " + scope.length +
          " variables but " + cardinality.length + " cardinalities");
    }
    ObjectIntHashMap<String> positions = new ObjectIntHashMap<>();
    int[] stride = new int[scope.length];
    int runningStride = 1;
    for (int i = 0; i < scope.length; i++) {
      if (positions.containsKey(scope[i])) {
        throw new FactorScopeException("Variable \"" + scope[i] + "\" appears twice in scope " + Arrays.toString(scope));
      }
      if (cardinality[i] <= 0) {
        throw new FactorScopeException("Variable \"" + scope[i] + "\" has non-positive cardinality " + cardinality[i]);
      }
      positions.put(scope[i], i);
      stride[i] = runningStride;
      runningStride = growTableSize(runningStride, cardinality[i], scope);
    }
    if (values.length != runningStride) {
      throw new FactorScopeException("Scope " + Arrays.toString(scope) + " needs " + runningStride +
          " values, but got " + values.length);
    }
    this.scope = scope;
    this.cardinality = cardinality;
    this.stride = stride;
    this.values = values;
    this.positions = positions;
  }

  int requirePosition(String variable) {
    int position = positionOf(variable);
    if (position == -1) {
      throw new FactorScopeException("Variable \"" + variable + "\" is not in scope " + Arrays.toString(scope));
    }
    return position;
  }

  /**
   * Compute the distance into the flat values array that corresponds to a setting of all the scope variables.
   *
   * @param assignment assignment indices, in the same order as the scope
   * @return the offset index
   */
  private int getTableAccessOffset(int[] assignment) {
    assert (assignment.length == cardinality.length);
    int offset = 0;
    for (int i = 0; i < assignment.length; i++) {
      assert (assignment[i] < cardinality[i]);
      offset += assignment[i] * stride[i];
    }
    return offset;
  }

  private static int tableSize(String[] scope, int[] cardinality) {
    int c = 1;
    for (int n : cardinality) {
      if (n <= 0) throw new FactorScopeException("Non-positive cardinality " + n);
      c = growTableSize(c, n, scope);
    }
    return c;
  }

  /**
   * Multiplies a running table size by one more cardinality, refusing to wrap around.
   *
   * @throws FactorScopeException if the table would have more entries than a Java array can hold
   */
  static int growTableSize(int size, int cardinality, String[] scope) {
    try {
      return Math.multiplyExact(size, cardinality);
    } catch (ArithmeticException e) {
      FactorScopeException tooLarge = new FactorScopeException("Scope " + Arrays.toString(scope) +
          " has more than " + Integer.MAX_VALUE + " entries");
      tooLarge.initCause(e);
      throw tooLarge;
    }
  }

  private static String[] namesOf(List<Variable> variables) {
    String[] names = new String[variables.size()];
    for (int i = 0; i < names.length; i++) {
      names[i] = variables.get(i).getName();
    }
    return names;
  }

  private static int[] cardinalitiesOf(List<Variable> variables) {
    int[] cardinality = new int[variables.size()];
    for (int i = 0; i < cardinality.length; i++) {
      cardinality[i] = variables.get(i).getCardinality();
    }
    return cardinality;
  }
}
