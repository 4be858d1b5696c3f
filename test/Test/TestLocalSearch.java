package Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import Auxiliary.RandomSource;
import Improvement.LocalSearch;
import Improvement.VariableNeighborhoodDescent;
import Problem.Evaluator;
import Problem.NeighborFunction;
import Solution.Direction;
import Solution.Solution;

public class TestLocalSearch
{
	private TSPInstance tsp;
	private Evaluator<TSPInstance> evaluator;
	private RandomSource random;
	private Solution tour;

	@BeforeEach
	public void setUp()
	{
		tsp = TSPInstance.random(12, 11);
		evaluator = new Evaluator<>(TSPOperators.tourLength(), tsp, 0);
		random = new RandomSource(42);
		tour = Solution.ofInts(tsp.n);
		TSPOperators.randomTour().generate(tour, random, tsp);
	}

	@Test
	public void testDescentNeverWorsensAndCountsEvaluations()
	{
		LocalSearch<TSPInstance> ls = new LocalSearch<>(evaluator, TSPOperators.twoOpt(), Direction.Minimize,
				random, 200, 15, tour);

		double start = evaluator.evaluate(tour);
		double end = ls.localSearch(tour, start);

		assertTrue(end <= start, "local search must not worsen the solution");
		assertEquals(end, tsp.tourLength(tour.toIntArray()), 1e-9, "returned cost must match the solution");
		assertTrue(tsp.isPermutation(tour.toIntArray()));
		assertEquals(1 + (long) ls.getLastRounds() * 15, evaluator.getNumEvaluations(),
				"each round costs exactly K evaluations");
	}

	@Test
	public void testRoundLimit()
	{
		LocalSearch<TSPInstance> ls = new LocalSearch<>(evaluator, TSPOperators.swap(), Direction.Minimize,
				random, 3, 5, tour);
		ls.localSearch(tour, evaluator.evaluate(tour));
		assertTrue(ls.getLastRounds() <= 3);
	}

	@Test
	public void testEvaluationBudgetStopsBetweenRounds()
	{
		Evaluator<TSPInstance> limited = new Evaluator<>(TSPOperators.tourLength(), tsp, 30);
		LocalSearch<TSPInstance> ls = new LocalSearch<>(limited, TSPOperators.twoOpt(), Direction.Minimize,
				random, 1000, 10, tour);
		ls.localSearch(tour, limited.evaluate(tour));
		assertTrue(limited.getNumEvaluations() < 30 + 10, "at most one round past the budget");
	}

	@Test
	public void testVariableNeighborhoodDescent()
	{
		List<NeighborFunction<TSPInstance>> neighborhoods = Arrays.asList(TSPOperators.swap(), TSPOperators.twoOpt());
		VariableNeighborhoodDescent<TSPInstance> vnd = new VariableNeighborhoodDescent<>(evaluator, neighborhoods,
				Direction.Minimize, random, 50, 5, 3, tour);

		double start = evaluator.evaluate(tour);
		double end = vnd.descend(tour, start);

		assertTrue(end <= start);
		assertEquals(end, tsp.tourLength(tour.toIntArray()), 1e-9);
		assertTrue(tsp.isPermutation(tour.toIntArray()));
	}

	@Test
	public void testVariableNeighborhoodDescentNeedsNeighborhoods()
	{
		assertThrows(IllegalArgumentException.class, () -> new VariableNeighborhoodDescent<>(evaluator,
				Collections.<NeighborFunction<TSPInstance>>emptyList(), Direction.Minimize, random, 10, 5, 3, tour));
	}
}
