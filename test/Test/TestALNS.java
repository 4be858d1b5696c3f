package Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import Auxiliary.RandomSource;
import DiversityControl.AcceptanceType;
import Problem.DestroyOperator;
import Problem.RepairOperator;
import SearchMethod.ALNS;
import SearchMethod.ALNSConfig;
import SearchMethod.AdaptiveOperatorSelection;
import SearchMethod.DecoupledAOS;
import SearchMethod.LNS;
import SearchMethod.LNSConfig;
import Solution.OptResult;
import Solution.Solution;

/**
 * ALNS and LNS on a random 10 city TSP
 */
public class TestALNS
{
	private TSPInstance tsp;
	private List<DestroyOperator<TSPInstance>> destroyOperators;
	private List<RepairOperator<TSPInstance>> repairOperators;
	private ALNSConfig config;

	@BeforeEach
	public void setUp()
	{
		tsp = TSPInstance.random(10, 7);
		destroyOperators = Arrays.asList(TSPOperators.randomRemoval(), TSPOperators.worstRemoval());
		repairOperators = Arrays.asList(TSPOperators.greedyInsertion(), TSPOperators.randomInsertion());
		config = new ALNSConfig();
		config.setMaxIterations(500);
	}

	private OptResult run(ALNS<TSPInstance> alns)
	{
		return alns.run(Integer.BYTES, tsp.n, TSPOperators.tourLength(), TSPOperators.randomTour(),
				destroyOperators, repairOperators, tsp);
	}

	/**
	 * Cost of the tour the engine starts from: generate is its first random draw.
	 */
	private double initialCost(long seed)
	{
		Solution initial = Solution.ofInts(tsp.n);
		TSPOperators.randomTour().generate(initial, new RandomSource(seed), tsp);
		return tsp.tourLength(initial.toIntArray());
	}

	@Test
	public void testWeightsLearnAndTourImproves()
	{
		ALNS<TSPInstance> alns = new ALNS<>(config);
		OptResult result = run(alns);

		double destroy[] = alns.getDestroyWeights();
		double repair[] = alns.getRepairWeights();
		boolean moved = false;
		for(double w : destroy)
			moved |= w != 1.0;
		for(double w : repair)
			moved |= w != 1.0;
		assertTrue(moved, "some weight must have moved away from 1.0");

		assertTrue(result.getBestCost() <= initialCost(config.getSeed()));
		assertTrue(tsp.isPermutation(result.getBest().toIntArray()));
		assertEquals(result.getBestCost(), tsp.tourLength(result.getBest().toIntArray()), 1e-9);
	}

	@Test
	public void testWeightsStayAboveFloor()
	{
		config.setWeightUpdateInterval(5);
		config.setDecay(0.1);
		ALNS<TSPInstance> alns = new ALNS<>(config);
		run(alns);

		double sum = 0;
		for(double w : alns.getDestroyWeights())
		{
			assertTrue(w >= AdaptiveOperatorSelection.MIN_WEIGHT);
			sum += w;
		}
		assertTrue(sum > 0);
		for(double w : alns.getRepairWeights())
			assertTrue(w >= AdaptiveOperatorSelection.MIN_WEIGHT);
	}

	@Test
	public void testOneEvaluationPerIteration()
	{
		OptResult result = run(new ALNS<>(config));
		assertEquals(500, result.getNumIterations());
		assertEquals(501, result.getNumEvaluations());
	}

	@Test
	public void testDeterminismAndMonotoneConvergence()
	{
		config.setAcceptanceType(AcceptanceType.SALike);
		OptResult a = run(new ALNS<>(config));
		OptResult b = run(new ALNS<>(config));

		assertArrayEquals(a.getConvergence(), b.getConvergence());
		double conv[] = a.getConvergence();
		for(int i = 1; i < conv.length; i++)
			assertTrue(conv[i] <= conv[i - 1]);
	}

	@Test
	public void testRestartAcceptance()
	{
		config.setAcceptanceType(AcceptanceType.Restart);
		config.setRestartThreshold(10);
		OptResult result = run(new ALNS<>(config));
		assertTrue(tsp.isPermutation(result.getBest().toIntArray()));
		assertTrue(result.getBestCost() <= initialCost(config.getSeed()));
	}

	/**
	 * Single destroy/repair pair whose candidate is always the incumbent plus one,
	 * so every application is worse than both the current and the best solution.
	 */
	private ALNS<Double> runWorseningPair(AcceptanceType acceptanceType)
	{
		config.setMaxIterations(50);
		config.setAcceptanceType(acceptanceType);
		config.setRewards(10, 5, 3);
		List<DestroyOperator<Double>> destroy = Collections.singletonList(
				(solution, destroyed, degree, random, ctx) -> destroyed.copyFrom(solution));
		List<RepairOperator<Double>> repair = Collections.singletonList(
				(destroyed, repaired, random, ctx) -> repaired.setDouble(0, destroyed.getDouble(0) + 1.0));

		ALNS<Double> alns = new ALNS<>(config);
		OptResult result = alns.run(Double.BYTES, 1, (solution, ctx) -> solution.getDouble(0),
				(out, random, ctx) -> out.setDouble(0, 0.0), destroy, repair, null);
		assertEquals(0.0, result.getBestCost(), 0.0);
		assertEquals(51, result.getNumEvaluations());
		return alns;
	}

	@Test
	public void testRejectedOperatorsLoseWeight()
	{
		ALNS<Double> alns = runWorseningPair(AcceptanceType.Better);

		assertEquals(0.8, alns.getDestroyWeights()[0], 1e-12);
		assertEquals(0.8, alns.getRepairWeights()[0], 1e-12);

		DecoupledAOS selection = alns.getOperatorSelection();
		assertEquals(50, selection.getIterationCounter());
		assertEquals("D0", selection.getDestroyAOS().getName(0));
		assertEquals("R0", selection.getRepairAOS().getName(0));
		assertEquals(0, selection.getDestroyAOS().getUses(0), "accumulators reset at the segment boundary");
	}

	@Test
	public void testAcceptedWorseMovesEarnAcceptedReward()
	{
		ALNS<Double> alns = runWorseningPair(AcceptanceType.Always);

		assertEquals(0.8 + 0.2 * 3, alns.getDestroyWeights()[0], 1e-12);
		assertEquals(0.8 + 0.2 * 3, alns.getRepairWeights()[0], 1e-12);
	}

	@Test
	public void testWeightsAbsentBeforeFirstRun()
	{
		ALNS<TSPInstance> alns = new ALNS<>(config);
		assertNull(alns.getDestroyWeights());
		assertNull(alns.getRepairWeights());
		assertNull(alns.getOperatorSelection());
	}

	@Test
	public void testEmptyOperatorPoolGivesEmptyResult()
	{
		ALNS<TSPInstance> alns = new ALNS<>(config);
		OptResult result = alns.run(Integer.BYTES, tsp.n, TSPOperators.tourLength(), TSPOperators.randomTour(),
				Collections.<DestroyOperator<TSPInstance>>emptyList(), repairOperators, tsp);
		assertTrue(result.isEmpty());
		assertEquals(0, result.getNumEvaluations());
	}

	@Test
	public void testBasicLNS()
	{
		LNSConfig lnsConfig = new LNSConfig();
		lnsConfig.setMaxIterations(300);
		lnsConfig.setDestroyDegree(0.4);
		OptResult result = new LNS<TSPInstance>(lnsConfig).run(Integer.BYTES, tsp.n, TSPOperators.tourLength(),
				TSPOperators.randomTour(), TSPOperators.randomRemoval(), TSPOperators.greedyInsertion(), tsp);

		assertTrue(tsp.isPermutation(result.getBest().toIntArray()));
		assertTrue(result.getBestCost() <= initialCost(lnsConfig.getSeed()));
		assertEquals(301, result.getNumEvaluations());
	}
}
