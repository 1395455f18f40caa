package com.github.keenon.bayesnet.model;

import com.github.keenon.bayesnet.BayesianNetworkProto;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.*;

/**
 * Created by keenon on 3/2/16.
 * <p>
 * A discrete Bayesian network: a set of named vertices, each with an ordered list of parent vertices and a conditional
 * probability table over its own outcomes. This is really just the data structure. Turning tables into factors and
 * running inference lives in {@link com.github.keenon.bayesnet.inference}, and uses only the public interface here.
 * <p>
 * Vertices keep the order in which they were added. Parents may be added after their children, so structural problems
 * (missing parents, cycles) are only reported when something asks for the structure, eg {@link #topologicalOrder()}.
 */
public class BayesianNetwork {
  private final Map<String, Node> nodes = new LinkedHashMap<>();

  /**
   * A single vertex of the network: its variable, its parents, and its table.
   */
  public static class Node {
    private final Variable variable;
    private final List<String> parents;
    private final ConditionalTable table;

    public Node(Variable variable, List<String> parents, ConditionalTable table) {
      assert variable != null;
      this.variable = variable;
      this.parents = parents == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(parents));
      this.table = table;
    }

    public Variable getVariable() {
      return variable;
    }

    public String getName() {
      return variable.getName();
    }

    /**
     * @return the parent names, in declaration order. Unmodifiable.
     */
    public List<String> getParents() {
      return parents;
    }

    public ConditionalTable getTable() {
      return table;
    }

    /**
     * Does a deep comparison, using equality with tolerance checks against the table probabilities.
     */
    public boolean valueEquals(Node other, double tolerance) {
      if (!variable.equals(other.variable)) return false;
      if (!parents.equals(other.parents)) return false;
      if (table == null || other.table == null) return table == other.table;
      return table.valueEquals(other.table, tolerance);
    }

    BayesianNetworkProto.Node.Builder getProtoBuilder() {
      BayesianNetworkProto.Node.Builder builder = BayesianNetworkProto.Node.newBuilder();
      builder.setName(variable.getName());
      for (String outcome : variable.getOutcomes()) {
        builder.addOutcome(outcome);
      }
      for (String parent : parents) {
        builder.addParent(parent);
      }
      if (table == null) {
        throw new IllegalStateException("Vertex \"" + variable.getName() + "\" has no table to serialize");
      }
      table.writeToProto(builder);
      return builder;
    }

    static Node readFromProto(BayesianNetworkProto.Node proto) {
      Variable variable = new Variable(proto.getName(), proto.getOutcomeList());
      return new Node(variable, proto.getParentList(), ConditionalTable.readFromProto(proto));
    }
  }

  /**
   * Adds a vertex to the network.
   *
   * @param name     the vertex name
   * @param outcomes the ordered outcome labels of the vertex
   * @param parents  the parent vertex names, in the order used by the table's parent assignments. May be empty.
   * @param table    the conditional probability table
   * @return a reference to the created node. This can be safely ignored, as the node is already saved in the network
   */
  public Node addNode(String name, List<String> outcomes, List<String> parents, ConditionalTable table) {
    return addNode(new Variable(name, outcomes), parents, table);
  }

  /**
   * Adds a vertex without parents to the network.
   *
   * @param name         the vertex name
   * @param outcomes     the ordered outcome labels of the vertex
   * @param distribution the prior distribution over the outcomes
   * @return a reference to the created node. This can be safely ignored, as the node is already saved in the network
   */
  public Node addRootNode(String name, List<String> outcomes, double... distribution) {
    return addNode(name, outcomes, Collections.emptyList(), ConditionalTable.unconditional(distribution));
  }

  /**
   * Adds a vertex to the network.
   *
   * @throws IllegalArgumentException if a vertex of the same name already exists
   */
  public Node addNode(Variable variable, List<String> parents, ConditionalTable table) {
    if (nodes.containsKey(variable.getName())) {
      throw new IllegalArgumentException("Network already has a vertex named \"" + variable.getName() + "\"");
    }
    Node node = new Node(variable, parents, table);
    nodes.put(variable.getName(), node);
    return node;
  }

  public boolean contains(String name) {
    return nodes.containsKey(name);
  }

  /**
   * @throws IllegalArgumentException if there is no such vertex
   */
  public Node getNode(String name) {
    Node node = nodes.get(name);
    if (node == null) throw new IllegalArgumentException("Network has no vertex named \"" + name + "\"");
    return node;
  }

  /**
   * @throws IllegalArgumentException if there is no such vertex
   */
  public Variable getVariable(String name) {
    return getNode(name).getVariable();
  }

  /**
   * @return the vertex names, in insertion order
   */
  public List<String> getVertices() {
    return new ArrayList<>(nodes.keySet());
  }

  public Collection<Node> getNodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public int numVertices() {
    return nodes.size();
  }

  /**
   * @return the names of every vertex that lists the given vertex as a parent, in insertion order
   */
  public List<String> getChildren(String name) {
    getNode(name);
    List<String> children = new ArrayList<>();
    for (Node node : nodes.values()) {
      if (node.parents.contains(name)) children.add(node.getName());
    }
    return children;
  }

  /**
   * Orders the vertices so that every vertex comes after all of its parents. Ties are broken by insertion order, so
   * the result is deterministic.
   *
   * @return the vertex names in topological order
   * @throws IllegalStateException if a parent is not part of the network, or if the parent relation has a cycle
   */
  public List<String> topologicalOrder() {
    Map<String, Integer> unresolvedParents = new HashMap<>();
    for (Node node : nodes.values()) {
      for (String parent : node.parents) {
        if (!nodes.containsKey(parent)) {
          throw new IllegalStateException("Vertex \"" + node.getName() + "\" has unknown parent \"" + parent + "\"");
        }
      }
      unresolvedParents.put(node.getName(), new HashSet<>(node.parents).size());
    }

    List<String> order = new ArrayList<>();
    Set<String> placed = new HashSet<>();
    while (order.size() < nodes.size()) {
      boolean progress = false;
      // Always take the earliest-inserted ready vertex, so insertion order breaks ties
      for (Node node : nodes.values()) {
        if (placed.contains(node.getName()) || unresolvedParents.get(node.getName()) > 0) continue;
        order.add(node.getName());
        placed.add(node.getName());
        for (Node child : nodes.values()) {
          if (child.parents.contains(node.getName())) {
            unresolvedParents.put(child.getName(), unresolvedParents.get(child.getName()) - 1);
          }
        }
        progress = true;
        break;
      }
      if (!progress) {
        List<String> stuck = new ArrayList<>();
        for (String name : nodes.keySet()) {
          if (!placed.contains(name)) stuck.add(name);
        }
        throw new IllegalStateException("Network has a cycle among vertices " + stuck);
      }
    }
    return order;
  }

  /**
   * Writes the protobuf version of this network to a stream. Reversible with readFromStream().
   *
   * @param stream the output stream to write to
   * @throws IOException passed through from the stream
   */
  public void writeToStream(OutputStream stream) throws IOException {
    getProtoBuilder().build().writeDelimitedTo(stream);
  }

  /**
   * Static function to deserialize a network from an input stream.
   *
   * @param stream the stream to read from, assuming protobuf encoding
   * @return a new network, or null if the stream was already exhausted
   * @throws IOException passed through from the stream
   */
  public static BayesianNetwork readFromStream(InputStream stream) throws IOException {
    return readFromProto(BayesianNetworkProto.BayesianNetwork.parseDelimitedFrom(stream));
  }

  /**
   * @return the proto builder corresponding to this network
   */
  public BayesianNetworkProto.BayesianNetwork.Builder getProtoBuilder() {
    BayesianNetworkProto.BayesianNetwork.Builder builder = BayesianNetworkProto.BayesianNetwork.newBuilder();
    for (Node node : nodes.values()) {
      builder.addNode(node.getProtoBuilder());
    }
    return builder;
  }

  /**
   * Recreates an in-memory network from a proto serialization.
   *
   * @param proto the proto to read
   * @return an in-memory network
   */
  public static BayesianNetwork readFromProto(BayesianNetworkProto.BayesianNetwork proto) {
    if (proto == null) return null;
    BayesianNetwork network = new BayesianNetwork();
    for (BayesianNetworkProto.Node node : proto.getNodeList()) {
      Node read = Node.readFromProto(node);
      network.addNode(read.variable, read.parents, read.table);
    }
    return network;
  }

  /**
   * Check that two networks are deeply value-equivalent, down to the table probabilities, within some tolerance.
   * Vertex order matters. Mostly useful for testing.
   */
  public boolean valueEquals(BayesianNetwork other, double tolerance) {
    if (!getVertices().equals(other.getVertices())) return false;
    for (Node node : nodes.values()) {
      if (!node.valueEquals(other.nodes.get(node.getName()), tolerance)) return false;
    }
    return true;
  }

  /**
   * @return a deep copy of this network, sharing no tables with it
   */
  public BayesianNetwork cloneNetwork() {
    BayesianNetwork clone = new BayesianNetwork();
    for (Node node : nodes.values()) {
      clone.addNode(node.variable, node.parents, node.table == null ? null : node.table.cloneTable());
    }
    return clone;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (Node node : nodes.values()) {
      sb.append("\n\t").append(node.variable).append(" | ").append(node.parents);
    }
    return sb.append("\n}").toString();
  }
}
