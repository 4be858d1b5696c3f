package Improvement;

import java.util.List;

import Auxiliary.RandomSource;
import Problem.Evaluator;
import Problem.NeighborFunction;
import Solution.Direction;
import Solution.Solution;

/**
 * Variable Neighborhood Descent used by General VNS.
 *
 * Neighborhood l (1..L) samples {@code K * l} candidates per round from the
 * l-th neighbor function, or from the last one when fewer functions than
 * neighborhoods are given. A neighborhood is descended until a round brings no
 * improvement; any improvement sends the search back to l = 1, otherwise it
 * moves on to l + 1. Total rounds are capped at {@code maxIterations * L}.
 */
public class VariableNeighborhoodDescent<C>
{
	private final Evaluator<C> evaluator;
	private final List<NeighborFunction<C>> neighborhoods;
	private final Direction direction;
	private final RandomSource random;
	private final int maxIterations;
	private final int neighborsPerRound;
	private final int numNeighborhoods;

	private final Solution candidate;
	private final Solution bestCandidate;

	public VariableNeighborhoodDescent(Evaluator<C> evaluator, List<NeighborFunction<C>> neighborhoods,
			Direction direction, RandomSource random, int maxIterations, int neighborsPerRound,
			int numNeighborhoods, Solution shape)
	{
		if(neighborhoods == null || neighborhoods.isEmpty())
			throw new IllegalArgumentException("VND needs at least one neighbor function");

		this.evaluator = evaluator;
		this.neighborhoods = neighborhoods;
		this.direction = direction;
		this.random = random;
		this.maxIterations = maxIterations;
		this.neighborsPerRound = neighborsPerRound;
		this.numNeighborhoods = Math.max(1, numNeighborhoods);
		this.candidate = new Solution(shape.getElementSize(), shape.getSize());
		this.bestCandidate = new Solution(shape.getElementSize(), shape.getSize());
	}

	/**
	 * Descend from {@code solution} (modified in place).
	 *
	 * @return cost of {@code solution} after the descent
	 */
	public double descend(Solution solution, double cost)
	{
		long roundBudget = (long) maxIterations * numNeighborhoods;
		long rounds = 0;
		int l = 1;

		while(l <= numNeighborhoods && rounds < roundBudget && !evaluator.isExhausted())
		{
			NeighborFunction<C> neighbor = neighborhoods.get(Math.min(l, neighborhoods.size()) - 1);
			int samples = neighborsPerRound * l;
			boolean improved = false;

			for(int iter = 0; iter < maxIterations && rounds < roundBudget && !evaluator.isExhausted(); iter++)
			{
				rounds++;
				double bestCost = 0;
				for(int n = 0; n < samples; n++)
				{
					neighbor.neighbor(solution, candidate, random, evaluator.getContext());
					double c = evaluator.evaluate(candidate);
					if(n == 0 || direction.isBetter(c, bestCost))
					{
						bestCandidate.copyFrom(candidate);
						bestCost = c;
					}
				}

				if(samples > 0 && direction.isBetter(bestCost, cost))
				{
					solution.copyFrom(bestCandidate);
					cost = bestCost;
					improved = true;
				}
				else
					break;
			}

			l = improved ? 1 : l + 1;
		}
		return cost;
	}
}
