package com.github.keenon.bayesnet.inference;

import com.github.keenon.bayesnet.model.*;
import com.pholser.junit.quickcheck.ForAll;
import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import org.junit.Test;
import org.junit.contrib.theories.Theories;
import org.junit.contrib.theories.Theory;
import org.junit.runner.RunWith;

import java.util.*;

import static org.junit.Assert.*;

/**
 * Created by keenon on 3/5/16.
 * <p>
 * Checks posterior queries against hand-computed values, and quickchecks them against brute force enumeration of the
 * full joint distribution.
 */
@RunWith(Theories.class)
public class QueryEvaluatorTest {

  private static Map<String, String> evidence(String... pairs) {
    Map<String, String> evidence = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      evidence.put(pairs[i], pairs[i + 1]);
    }
    return evidence;
  }

  private static Set<String> labels(String... labels) {
    return new LinkedHashSet<>(Arrays.asList(labels));
  }

  @Test
  public void testQuestionnairePosterior() {
    QueryEvaluator evaluator = new QueryEvaluator(ExampleNetworks.questionnaire());
    Factor posterior = evaluator.queryDistribution(Collections.singleton("C"), evidence("Q4", "Yes"));

    assertArrayEquals(new String[]{"C"}, posterior.getScope());
    assertArrayEquals(new double[]{0.0853658536585365, 0.6585365853658537, 0.2560975609756097},
        posterior.getValues(), 1e-9);
  }

  @Test
  public void testTwoParentPosterior() {
    QueryEvaluator evaluator = new QueryEvaluator(ExampleNetworks.sprinkler());
    double[] rain = evaluator.marginal("Rain", evidence("Grass", "Wet"));
    assertEquals(0.16038 / 0.44838, rain[0], 1e-9);
    assertEquals(0.288 / 0.44838, rain[1], 1e-9);
  }

  @Test
  public void testNoEvidenceGivesPrior() {
    QueryEvaluator evaluator = new QueryEvaluator(ExampleNetworks.questionnaire());
    assertArrayEquals(new double[]{0.1, 0.6, 0.3}, evaluator.marginal("C", Collections.emptyMap()), 1e-12);
  }

  @Test
  public void testQueriesDontShareEvidence() {
    QueryEvaluator evaluator = new QueryEvaluator(ExampleNetworks.questionnaire());
    double[] prior = evaluator.marginal("Q2", Collections.emptyMap());
    evaluator.marginal("Q2", evidence("C", "C1"));
    assertArrayEquals(prior, evaluator.marginal("Q2", Collections.emptyMap()), 0.0);
  }

  @Test
  public void testJointQueryScope() {
    QueryEvaluator evaluator = new QueryEvaluator(ExampleNetworks.questionnaire());
    Factor joint = evaluator.queryDistribution(labels("Q1", "Q2"), evidence("Q4", "Yes"));
    assertEquals(labels("Q1", "Q2"), new HashSet<>(Arrays.asList(joint.getScope())));
    assertEquals(6, joint.size());
    assertEquals(1.0, joint.valueSum(), 1e-9);
  }

  @Test
  public void testSingleLabelEventMatchesDistribution() {
    QueryEvaluator evaluator = new QueryEvaluator(ExampleNetworks.questionnaire());
    double[] distribution = evaluator.marginal("C", evidence("Q4", "Yes"));
    List<String> outcomes = ExampleNetworks.questionnaire().getVariable("C").getOutcomes();

    for (int i = 0; i < outcomes.size(); i++) {
      Map<String, Set<String>> query = new HashMap<>();
      query.put("C", labels(outcomes.get(i)));
      assertEquals(distribution[i], evaluator.queryEvent(query, evidence("Q4", "Yes")), 1e-12);
    }
  }

  @Test
  public void testFullAcceptedSetIsCertain() {
    QueryEvaluator evaluator = new QueryEvaluator(ExampleNetworks.questionnaire());
    Map<String, Set<String>> query = new HashMap<>();
    query.put("C", labels("C1", "C2", "C3"));
    query.put("Q1", labels("A1.1", "A1.2", "A1.3"));
    assertEquals(1.0, evaluator.queryEvent(query, evidence("Q4", "Yes")), 1e-9);
  }

  @Test
  public void testMultiVariableEvent() {
    QueryEvaluator evaluator = new QueryEvaluator(ExampleNetworks.questionnaire());
    Factor joint = evaluator.queryDistribution(labels("Q1", "Q2"), evidence("Q4", "Yes"));

    // Q2 = A2.1 is index 0, so it contributes no offset
    double expected = 0.0;
    for (int q1 : new int[]{0, 2}) {
      expected += joint.getValue(q1 * joint.getStride("Q1"));
    }

    Map<String, Set<String>> query = new LinkedHashMap<>();
    query.put("Q2", labels("A2.1"));
    query.put("Q1", labels("A1.1", "A1.3"));
    assertEquals(expected, evaluator.queryEvent(query, evidence("Q4", "Yes")), 1e-12);
  }

  @Test
  public void testCustomEliminationOrder() {
    QueryEvaluator evaluator = new QueryEvaluator(ExampleNetworks.questionnaire());
    Factor forward = evaluator.queryDistribution(Collections.singleton("C"), evidence("Q4", "Yes"),
        Arrays.asList("Q1", "Q2", "Q3"));
    Factor backward = evaluator.queryDistribution(Collections.singleton("C"), evidence("Q4", "Yes"),
        Arrays.asList("Q3", "Q2", "Q1"));
    assertArrayEquals(forward.getValues(), backward.getValues(), 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEliminatingQueryVariableRejected() {
    new QueryEvaluator(ExampleNetworks.questionnaire())
        .queryDistribution(Collections.singleton("C"), Collections.emptyMap(), Arrays.asList("Q1", "C"));
  }

  @Test(expected = ArithmeticException.class)
  public void testImpossibleEvidence() {
    // Q4 is never "Yes" when Q3 is "B"
    new QueryEvaluator(ExampleNetworks.questionnaire()).marginal("C", evidence("Q3", "B", "Q4", "Yes"));
  }

  @Test(expected = ArithmeticException.class)
  public void testImpossibleRootEvidence() {
    BayesianNetwork network = new BayesianNetwork();
    network.addRootNode("a", Arrays.asList("a0", "a1"), 1.0, 0.0);
    network.addNode("b", Arrays.asList("b0", "b1"), Collections.singletonList("a"),
        ConditionalTable.conditional()
            .put(Collections.singletonList("a0"), 1.0, 0.0)
            .put(Collections.singletonList("a1"), 0.5, 0.5));
    new QueryEvaluator(network).marginal("b", evidence("a", "a1"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testQueryAndEvidenceOverlap() {
    new QueryEvaluator(ExampleNetworks.questionnaire()).queryDistribution(labels("C", "Q1"), evidence("C", "C1"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyQueryRejected() {
    new QueryEvaluator(ExampleNetworks.questionnaire()).queryDistribution(Collections.emptySet(), evidence("C", "C1"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownQueryVariable() {
    new QueryEvaluator(ExampleNetworks.questionnaire()).marginal("Q7", Collections.emptyMap());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyAcceptedSetRejected() {
    Map<String, Set<String>> query = new HashMap<>();
    query.put("C", Collections.emptySet());
    new QueryEvaluator(ExampleNetworks.questionnaire()).queryEvent(query, Collections.emptyMap());
  }

  @Test
  public void testUnknownAcceptedLabel() {
    Map<String, Set<String>> query = new HashMap<>();
    query.put("Q3", labels("A", "Neither"));
    try {
      new QueryEvaluator(ExampleNetworks.questionnaire()).queryEvent(query, Collections.emptyMap());
      fail("Expected an UnknownOutcomeException");
    } catch (UnknownOutcomeException e) {
      assertEquals("Neither", e.getOutcome());
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testCyclicNetworkRejected() {
    BayesianNetwork network = new BayesianNetwork();
    network.addNode("a", Arrays.asList("0", "1"), Collections.singletonList("b"),
        ConditionalTable.conditional()
            .put(Collections.singletonList("0"), 0.5, 0.5)
            .put(Collections.singletonList("1"), 0.5, 0.5));
    network.addNode("b", Arrays.asList("0", "1"), Collections.singletonList("a"),
        ConditionalTable.conditional()
            .put(Collections.singletonList("0"), 0.5, 0.5)
            .put(Collections.singletonList("1"), 0.5, 0.5));
    new QueryEvaluator(network);
  }

  @Theory
  public void testMatchesBruteForce(@ForAll(sampleSize = 30) @From(QueryCaseGenerator.class) QueryCase queryCase) {
    QueryEvaluator evaluator = new QueryEvaluator(queryCase.network);
    Factor posterior = evaluator.queryDistribution(queryCase.query, queryCase.evidence);

    assertEquals(queryCase.query, new HashSet<>(Arrays.asList(posterior.getScope())));
    assertEquals(1.0, posterior.valueSum(), 1e-9);

    double evidenceMass = bruteForceMass(queryCase.network, queryCase.evidence);
    String[] scope = posterior.getScope();
    for (int[] assignment : posterior) {
      Map<String, String> fixed = new HashMap<>(queryCase.evidence);
      for (int i = 0; i < scope.length; i++) {
        fixed.put(scope[i], queryCase.network.getVariable(scope[i]).getOutcome(assignment[i]));
      }
      assertEquals(bruteForceMass(queryCase.network, fixed) / evidenceMass, posterior.getAssignmentValue(assignment), 1e-9);
    }
  }

  /**
   * Sums the full joint probability over every assignment of the network consistent with the fixed outcomes.
   */
  private static double bruteForceMass(BayesianNetwork network, Map<String, String> fixed) {
    List<Variable> variables = new ArrayList<>();
    for (BayesianNetwork.Node node : network.getNodes()) {
      variables.add(node.getVariable());
    }
    int size = 1;
    for (Variable variable : variables) size *= variable.getCardinality();
    Factor odometer = new Factor(variables, new double[size]);

    double mass = 0.0;
    for (int[] assignment : odometer) {
      Map<String, String> outcomes = new HashMap<>();
      boolean consistent = true;
      for (int i = 0; i < variables.size(); i++) {
        String outcome = variables.get(i).getOutcome(assignment[i]);
        String required = fixed.get(variables.get(i).getName());
        if (required != null && !required.equals(outcome)) consistent = false;
        outcomes.put(variables.get(i).getName(), outcome);
      }
      if (!consistent) continue;

      double p = 1.0;
      for (BayesianNetwork.Node node : network.getNodes()) {
        List<String> parentOutcomes = new ArrayList<>();
        for (String parent : node.getParents()) parentOutcomes.add(outcomes.get(parent));
        p *= node.getTable().getDistribution(parentOutcomes)[node.getVariable().indexOf(outcomes.get(node.getName()))];
      }
      mass += p;
    }
    return mass;
  }

  public static class QueryCase {
    public BayesianNetwork network;
    public Set<String> query;
    public Map<String, String> evidence;

    @Override
    public String toString() {
      return "query " + query + " given " + evidence + " on " + network;
    }
  }

  public static class QueryCaseGenerator extends Generator<QueryCase> {
    public QueryCaseGenerator(Class<QueryCase> type) {
      super(type);
    }

    @Override
    public QueryCase generate(SourceOfRandomness sourceOfRandomness, GenerationStatus generationStatus) {
      QueryCase queryCase = new QueryCase();
      queryCase.network = BayesianNetworkTest.NetworkGenerator.randomNetwork(sourceOfRandomness);

      List<String> vertices = queryCase.network.getVertices();
      for (int i = vertices.size() - 1; i > 0; i--) {
        Collections.swap(vertices, i, sourceOfRandomness.nextInt(0, i));
      }

      int numQuery = sourceOfRandomness.nextInt(1, Math.min(2, vertices.size()));
      queryCase.query = new HashSet<>(vertices.subList(0, numQuery));
      queryCase.evidence = new HashMap<>();
      for (String vertex : vertices.subList(numQuery, vertices.size())) {
        if (sourceOfRandomness.nextBoolean()) {
          List<String> outcomes = queryCase.network.getVariable(vertex).getOutcomes();
          queryCase.evidence.put(vertex, outcomes.get(sourceOfRandomness.nextInt(0, outcomes.size() - 1)));
        }
      }
      return queryCase;
    }
  }
}
