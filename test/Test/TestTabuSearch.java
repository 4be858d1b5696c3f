package Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import Auxiliary.RandomSource;
import Problem.GenerateFunction;
import Problem.NeighborFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;
import Tabu.SolutionHashes;
import Tabu.TabuConfig;
import Tabu.TabuSearch;

/**
 * Tabu Search on small TSP instances
 *
 * Covers:
 * - Solution quality on the regular pentagon
 * - Evaluation accounting (1 + iterations x candidates)
 * - Determinism and monotone convergence
 * - Tabu list bound and reactive tenure range
 * - Aspiration and the all-tabu fallback
 * - Intensification restarts and the diversification penalty
 */
public class TestTabuSearch
{
	private static final double RADIUS = 5.0;

	private TSPInstance pentagon;
	private TabuConfig config;

	@BeforeEach
	public void setUp()
	{
		pentagon = TSPInstance.regularPolygon(5, RADIUS);
		config = new TabuConfig();
		config.setTenure(5);
		config.setMaxIterations(200);
		config.setNeighborsPerIteration(10);
		config.setSeed(42);
	}

	private OptResult runPentagon(TabuSearch<TSPInstance> ts)
	{
		return ts.run(Integer.BYTES, 5, TSPOperators.tourLength(), TSPOperators.swap(),
				TSPOperators.randomTour(), pentagon);
	}

	@Test
	public void testPentagonReachesPerimeter()
	{
		OptResult result = runPentagon(new TabuSearch<>(config));
		double optimum = TSPInstance.polygonPerimeter(5, RADIUS);

		int tour[] = result.getBest().toIntArray();
		assertTrue(pentagon.isPermutation(tour), "best must be a permutation");
		assertEquals(result.getBestCost(), pentagon.tourLength(tour), 1e-9, "reported cost must match the tour");
		assertTrue(result.getBestCost() >= optimum - 1e-9, "cannot beat the optimum");
		assertTrue(result.getBestCost() <= optimum * 1.05, "within 5% of " + optimum + ": " + result.getBestCost());
	}

	@Test
	public void testEvaluationAccounting()
	{
		OptResult result = runPentagon(new TabuSearch<>(config));
		assertEquals(200, result.getNumIterations());
		assertEquals(200L * 10 + 1, result.getNumEvaluations(), "chosen candidates are never re-evaluated");
	}

	@Test
	public void testDeterministicForSameSeed()
	{
		OptResult a = runPentagon(new TabuSearch<>(config));
		TabuSearch<TSPInstance> reused = new TabuSearch<>(config);
		runPentagon(reused);
		OptResult b = runPentagon(reused);

		assertArrayEquals(a.getConvergence(), b.getConvergence(), "same seed, same trajectory");
		assertTrue(a.getBest().contentEquals(b.getBest()));
		assertEquals(a.getNumEvaluations(), b.getNumEvaluations());
	}

	@Test
	public void testConvergenceIsMonotone()
	{
		TSPInstance tsp = TSPInstance.random(15, 3);
		OptResult min = new TabuSearch<TSPInstance>(config).run(Integer.BYTES, tsp.n, TSPOperators.tourLength(),
				TSPOperators.twoOpt(), TSPOperators.randomTour(), tsp);
		double conv[] = min.getConvergence();
		for(int i = 1; i < conv.length; i++)
			assertTrue(conv[i] <= conv[i - 1], "minimizing convergence must not increase at " + i);

		config.setDirection(Direction.Maximize);
		OptResult max = new TabuSearch<TSPInstance>(config).run(Integer.BYTES, tsp.n, TSPOperators.tourLength(),
				TSPOperators.twoOpt(), TSPOperators.randomTour(), tsp);
		conv = max.getConvergence();
		for(int i = 1; i < conv.length; i++)
			assertTrue(conv[i] >= conv[i - 1], "maximizing convergence must not decrease at " + i);
		assertTrue(max.getBestCost() > min.getBestCost());
	}

	@Test
	public void testTabuListNeverExceedsTenure()
	{
		config.setObserver((iteration, size, tenure, aspirationUsed, current, best) ->
				assertTrue(size <= tenure, "tabu list size " + size + " > tenure " + tenure));
		runPentagon(new TabuSearch<>(config));
	}

	@Test
	public void testReactiveTenureStaysInRange()
	{
		config.setReactive(true);
		config.setTenureRange(3, 12);
		config.setTenure(40);
		config.setObserver((iteration, size, tenure, aspirationUsed, current, best) -> {
			assertTrue(tenure >= 3 && tenure <= 12, "tenure out of range: " + tenure);
			assertTrue(size <= tenure);
		});

		TabuSearch<TSPInstance> ts = new TabuSearch<>(config);
		OptResult result = runPentagon(ts);

		assertFalse(result.isEmpty());
		assertTrue(ts.getCyclesDetected() > 0, "a five city walk must revisit tours");
	}

	@Test
	public void testAspirationRule()
	{
		assertTrue(TabuSearch.isAdmissible(false, false, Direction.Minimize, 10, 5), "non-tabu is always admissible");
		assertTrue(TabuSearch.isAdmissible(true, true, Direction.Minimize, 4, 5), "tabu but beats best");
		assertFalse(TabuSearch.isAdmissible(true, true, Direction.Minimize, 5, 5), "ties do not aspirate");
		assertFalse(TabuSearch.isAdmissible(true, false, Direction.Minimize, 1, 5), "aspiration disabled");
		assertTrue(TabuSearch.isAdmissible(true, true, Direction.Maximize, 6, 5));
	}

	@Test
	public void testAllCandidatesTabuStillMoves()
	{
		// Every neighbor is the same tour, tabu from the start and never better than best
		GenerateFunction<TSPInstance> fixed = (out, random, tsp) -> out.setInts(new int[] {0, 1, 2, 3, 4});
		NeighborFunction<TSPInstance> same = (current, out, random, tsp) -> out.copyFrom(current);
		config.setMaxIterations(20);

		TabuSearch<TSPInstance> ts = new TabuSearch<>(config);
		OptResult result = ts.run(Integer.BYTES, 5, TSPOperators.tourLength(), same, fixed, pentagon);

		assertEquals(20, result.getNumIterations(), "fallback keeps the search going");
		assertEquals(20L * 10 + 1, result.getNumEvaluations());
		assertEquals(0, ts.getAspirationCount());
		assertTrue(ts.getTabuList().size() <= ts.getTabuList().getTenure());
	}

	@Test
	public void testAspirationInsideSearch()
	{
		// One candidate per iteration, always one below the incumbent, and every solution shares one hash
		GenerateFunction<Double> start = (out, random, ctx) -> out.setDouble(0, 1000.0);
		NeighborFunction<Double> down = (current, out, random, ctx) -> {
			out.copyFrom(current);
			out.setDouble(0, current.getDouble(0) - 1.0);
		};
		int aspirated[] = new int[1];
		config.setNeighborsPerIteration(1);
		config.setMaxIterations(30);
		config.setObserver((iteration, size, tenure, aspirationUsed, current, best) -> {
			if(aspirationUsed)
				aspirated[0]++;
		});

		TabuSearch<Double> ts = new TabuSearch<>(config);
		OptResult result = ts.run(Double.BYTES, 1, (solution, ctx) -> solution.getDouble(0), down, start,
				solution -> 0L, null);

		assertEquals(30, ts.getAspirationCount());
		assertEquals(30, aspirated[0]);
		assertEquals(970.0, result.getBestCost(), 0.0);
		assertTrue(ts.getTabuList().contains(0L));

		config.setAspiration(false);
		ts = new TabuSearch<>(config);
		result = ts.run(Double.BYTES, 1, (solution, ctx) -> solution.getDouble(0), down, start,
				solution -> 0L, null);
		assertEquals(0, ts.getAspirationCount());
		assertEquals(970.0, result.getBestCost(), 0.0, "the all-tabu fallback still moves");
	}

	@Test
	public void testIntensificationRestartsFromBest()
	{
		config.setIntensification(true);
		config.setIntensificationTrigger(10);

		// nonImproving as the engine counts it: reset whenever the best improves
		Solution initial = Solution.ofInts(5);
		TSPOperators.randomTour().generate(initial, new RandomSource(config.getSeed()), pentagon);
		int state[] = new int[2]; // {nonImproving, restarts seen}
		double previousBest[] = {pentagon.tourLength(initial.toIntArray())};
		config.setObserver((iteration, size, tenure, aspirationUsed, current, best) -> {
			if(best < previousBest[0])
				state[0] = 0;
			else
				state[0]++;
			previousBest[0] = best;

			if(state[0] > 0 && state[0] % 10 == 0)
			{
				assertEquals(best, current, 0.0, "incumbent must be the best at iteration " + iteration);
				state[1]++;
			}
		});

		OptResult result = runPentagon(new TabuSearch<>(config));

		assertTrue(state[1] >= 3, "expected several restarts, saw " + state[1]);
		assertEquals(TSPInstance.polygonPerimeter(5, RADIUS), result.getBestCost(), 1e-6);
	}

	/**
	 * Neighbors cycle through costs 1, 2, 3 (three per iteration); hash = value.
	 * With tenure 1 plain tabu search alternates between 1 and 2; a heavy
	 * frequency penalty makes the never visited 3 the better scored candidate.
	 */
	private double[] currentCosts(boolean diversification)
	{
		int calls[] = new int[1];
		GenerateFunction<Double> start = (out, random, ctx) -> out.setDouble(0, 5.0);
		NeighborFunction<Double> cycle = (current, out, random, ctx) -> out.setDouble(0, 1.0 + (calls[0]++ % 3));

		double currents[] = new double[8];
		config.setTenure(1);
		config.setNeighborsPerIteration(3);
		config.setMaxIterations(currents.length);
		config.setDiversification(diversification);
		config.setDiversificationTrigger(2);
		config.setDiversificationWeight(10.0);
		config.setObserver((iteration, size, tenure, aspirationUsed, current, best) -> currents[iteration] = current);

		OptResult result = new TabuSearch<Double>(config).run(Double.BYTES, 1, (solution, ctx) -> solution.getDouble(0),
				cycle, start, solution -> (long) solution.getDouble(0), null);
		assertEquals(1.0, result.getBestCost(), 0.0);
		return currents;
	}

	@Test
	public void testDiversificationPenaltyChangesTheMove()
	{
		double plain[] = currentCosts(false);
		assertArrayEquals(new double[] {1, 2, 1, 2, 1, 2, 1, 2}, plain, 0.0);

		double diversified[] = currentCosts(true);
		assertEquals(1.0, diversified[2], 0.0, "before the trigger the cheapest admissible move is kept");
		assertEquals(3.0, diversified[3], 0.0, "penalised frequent solutions lose to the unvisited one");
	}

	@Test
	public void testDiversificationAndIntensification()
	{
		TSPInstance tsp = TSPInstance.random(12, 5);
		config.setDiversification(true);
		config.setDiversificationTrigger(10);
		config.setIntensification(true);
		config.setIntensificationTrigger(15);
		config.setMaxIterations(300);

		TabuSearch<TSPInstance> ts = new TabuSearch<>(config);
		OptResult result = ts.run(Integer.BYTES, tsp.n, TSPOperators.tourLength(), TSPOperators.twoOpt(),
				TSPOperators.randomTour(), SolutionHashes::hashTour, tsp);

		assertTrue(tsp.isPermutation(result.getBest().toIntArray()));
		assertEquals(result.getBestCost(), tsp.tourLength(result.getBest().toIntArray()), 1e-9);
		assertTrue(ts.getFrequencyMemory().size() > 0, "frequency memory is fed when either mode is on");
		assertEquals(300L * 10 + 1, result.getNumEvaluations());
	}

	@Test
	public void testEvaluationBudget()
	{
		config.setMaxEvaluations(55);
		OptResult result = runPentagon(new TabuSearch<>(config));

		// 1 + 10 per iteration; the budget is checked before each iteration
		assertEquals(6, result.getNumIterations());
		assertEquals(61, result.getNumEvaluations());
	}

	@Test
	public void testInvalidInputsGiveEmptyResult()
	{
		TabuSearch<TSPInstance> ts = new TabuSearch<>(config);

		OptResult zeroSize = ts.run(Integer.BYTES, 0, TSPOperators.tourLength(), TSPOperators.swap(),
				TSPOperators.randomTour(), pentagon);
		assertTrue(zeroSize.isEmpty());
		assertEquals(0, zeroSize.getNumEvaluations());

		OptResult noNeighbor = ts.run(Integer.BYTES, 5, TSPOperators.tourLength(), null,
				TSPOperators.randomTour(), pentagon);
		assertTrue(noNeighbor.isEmpty());
		assertEquals(0, noNeighbor.getNumIterations());
	}
}
