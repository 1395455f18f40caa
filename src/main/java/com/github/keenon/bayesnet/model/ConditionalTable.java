package com.github.keenon.bayesnet.model;

import com.github.keenon.bayesnet.BayesianNetworkProto;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Created by keenon on 3/2/16.
 * <p>
 * The conditional probability table of a single vertex. There are exactly two kinds, and they are modelled as two
 * subclasses rather than guessed from the shape of the data:
 * - {@link Unconditional}: one distribution over the vertex's outcomes, for vertices with no parents
 * - {@link Conditional}: one distribution per assignment of the parents, keyed by the parent outcome labels in
 * parent declaration order
 * <p>
 * Tables are plain data. Whether the distributions are well formed is checked when the table is turned into a
 * factor, see {@link com.github.keenon.bayesnet.inference.FactorBuilder}.
 */
public abstract class ConditionalTable {

  /**
   * Looks up the distribution over the vertex's outcomes for a given parent assignment.
   *
   * @param parentAssignment the parent outcome labels, in parent declaration order. Empty for unconditional tables.
   * @return the distribution, by reference
   * @throws MalformedTableException if the table has no distribution for this assignment
   */
  public abstract double[] getDistribution(List<String> parentAssignment);

  /**
   * @return the number of distributions stored in this table
   */
  public abstract int numRows();

  /**
   * Does a deep comparison, using equality with tolerance checks against the probabilities.
   *
   * @param other     the table to compare to
   * @param tolerance the tolerance to accept in differences
   * @return whether the two tables are within tolerance of one another
   */
  public abstract boolean valueEquals(ConditionalTable other, double tolerance);

  /**
   * @return a copy of this table, sharing no arrays with it
   */
  public abstract ConditionalTable cloneTable();

  abstract void writeToProto(BayesianNetworkProto.Node.Builder builder);

  static ConditionalTable readFromProto(BayesianNetworkProto.Node proto) {
    switch (proto.getTableType()) {
      case Unconditional:
        if (proto.getRowCount() != 1) {
          throw new MalformedTableException("Unconditional table for \"" + proto.getName() + "\" must have exactly one row");
        }
        return new Unconditional(readProbabilities(proto.getRow(0)));
      case Conditional:
        Conditional table = new Conditional();
        for (BayesianNetworkProto.Row row : proto.getRowList()) {
          table.put(new ArrayList<>(row.getParentValueList()), readProbabilities(row));
        }
        return table;
    }
    throw new IllegalStateException("Have a proto table type that doesn't exist");
  }

  public static Unconditional unconditional(double... distribution) {
    return new Unconditional(distribution);
  }

  public static Conditional conditional() {
    return new Conditional();
  }

  /**
   * A table for a vertex without parents.
   */
  public static class Unconditional extends ConditionalTable {
    private final double[] distribution;

    public Unconditional(double[] distribution) {
      if (distribution == null) throw new MalformedTableException("An unconditional table needs a distribution");
      this.distribution = distribution;
    }

    @Override
    public double[] getDistribution(List<String> parentAssignment) {
      if (parentAssignment != null && !parentAssignment.isEmpty()) {
        throw new MalformedTableException("Unconditional table was asked for parent assignment " + parentAssignment);
      }
      return distribution;
    }

    @Override
    public int numRows() {
      return 1;
    }

    @Override
    public boolean valueEquals(ConditionalTable other, double tolerance) {
      if (!(other instanceof Unconditional)) return false;
      return withinTolerance(distribution, ((Unconditional) other).distribution, tolerance);
    }

    @Override
    public ConditionalTable cloneTable() {
      return new Unconditional(distribution.clone());
    }

    @Override
    void writeToProto(BayesianNetworkProto.Node.Builder builder) {
      builder.setTableType(BayesianNetworkProto.TableType.Unconditional);
      builder.addRow(getRowBuilder(Collections.emptyList(), distribution));
    }

    @Override
    public String toString() {
      return Arrays.toString(distribution);
    }
  }

  /**
   * A table for a vertex with parents, holding one distribution for every assignment of the parents.
   */
  public static class Conditional extends ConditionalTable {
    private final Map<List<String>, double[]> rows = new LinkedHashMap<>();

    /**
     * Sets the distribution for one parent assignment, replacing any previous one.
     *
     * @param parentAssignment the parent outcome labels, in parent declaration order
     * @param distribution     the distribution over the vertex's own outcomes
     * @return this table, so rows can be chained
     */
    public Conditional put(List<String> parentAssignment, double... distribution) {
      if (parentAssignment == null || parentAssignment.isEmpty()) {
        throw new MalformedTableException("A conditional row needs a parent assignment");
      }
      rows.put(Collections.unmodifiableList(new ArrayList<>(parentAssignment)), distribution);
      return this;
    }

    @Override
    public double[] getDistribution(List<String> parentAssignment) {
      double[] distribution = rows.get(parentAssignment);
      if (distribution == null) {
        throw new MalformedTableException("Conditional table has no distribution for parent assignment " + parentAssignment);
      }
      return distribution;
    }

    @Override
    public int numRows() {
      return rows.size();
    }

    @Override
    public boolean valueEquals(ConditionalTable other, double tolerance) {
      if (!(other instanceof Conditional)) return false;
      Map<List<String>, double[]> otherRows = ((Conditional) other).rows;
      if (!rows.keySet().equals(otherRows.keySet())) return false;
      for (Map.Entry<List<String>, double[]> row : rows.entrySet()) {
        if (!withinTolerance(row.getValue(), otherRows.get(row.getKey()), tolerance)) return false;
      }
      return true;
    }

    @Override
    public ConditionalTable cloneTable() {
      Conditional clone = new Conditional();
      for (Map.Entry<List<String>, double[]> row : rows.entrySet()) {
        clone.rows.put(row.getKey(), row.getValue().clone());
      }
      return clone;
    }

    @Override
    void writeToProto(BayesianNetworkProto.Node.Builder builder) {
      builder.setTableType(BayesianNetworkProto.TableType.Conditional);
      for (Map.Entry<List<String>, double[]> row : rows.entrySet()) {
        builder.addRow(getRowBuilder(row.getKey(), row.getValue()));
      }
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("{");
      for (Map.Entry<List<String>, double[]> row : rows.entrySet()) {
        sb.append("\n\t").append(row.getKey()).append(": ").append(Arrays.toString(row.getValue()));
      }
      return sb.append("\n}").toString();
    }
  }

  ////////////////////////////////////////////////////////////////////////////
  // PRIVATE IMPLEMENTATION
  ////////////////////////////////////////////////////////////////////////////

  private static BayesianNetworkProto.Row.Builder getRowBuilder(List<String> parentAssignment, double[] distribution) {
    BayesianNetworkProto.Row.Builder builder = BayesianNetworkProto.Row.newBuilder();
    for (String value : parentAssignment) {
      builder.addParentValue(value);
    }
    for (double p : distribution) {
      builder.addProbability(p);
    }
    return builder;
  }

  private static double[] readProbabilities(BayesianNetworkProto.Row row) {
    double[] distribution = new double[row.getProbabilityCount()];
    for (int i = 0; i < distribution.length; i++) {
      distribution[i] = row.getProbability(i);
    }
    return distribution;
  }

  private static boolean withinTolerance(double[] a, double[] b, double tolerance) {
    if (a.length != b.length) return false;
    for (int i = 0; i < a.length; i++) {
      if (Math.abs(a[i] - b[i]) > tolerance) return false;
    }
    return true;
  }
}
