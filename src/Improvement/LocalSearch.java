package Improvement;

import Auxiliary.RandomSource;
import Problem.Evaluator;
import Problem.NeighborFunction;
import Solution.Direction;
import Solution.Solution;

/**
 * Sampled steepest-descent hill climbing shared by ILS, VNS, GRASP and the
 * memetic algorithm.
 *
 * Each round samples {@code neighborsPerRound} (K) independent neighbors of the
 * current solution, keeps the best of them (first seen wins ties) and moves
 * only when that best is strictly better than the current cost. The first round
 * without improvement ends the descent. A round always costs exactly K
 * evaluations; the evaluation budget is checked between rounds.
 *
 * Scratch buffers are allocated once, in the constructor.
 */
public class LocalSearch<C>
{
	private final Evaluator<C> evaluator;
	private final NeighborFunction<C> neighbor;
	private final Direction direction;
	private final RandomSource random;
	private final int maxIterations;
	private final int neighborsPerRound;

	private final Solution candidate;
	private final Solution bestNeighbor;

	private int lastRounds;

	public LocalSearch(Evaluator<C> evaluator, NeighborFunction<C> neighbor, Direction direction,
			RandomSource random, int maxIterations, int neighborsPerRound, Solution shape)
	{
		this.evaluator = evaluator;
		this.neighbor = neighbor;
		this.direction = direction;
		this.random = random;
		this.maxIterations = maxIterations;
		this.neighborsPerRound = neighborsPerRound;
		this.candidate = new Solution(shape.getElementSize(), shape.getSize());
		this.bestNeighbor = new Solution(shape.getElementSize(), shape.getSize());
	}

	/**
	 * Descend from {@code solution} (modified in place).
	 *
	 * @param cost current cost of {@code solution}
	 * @return cost of {@code solution} after the descent
	 */
	public double localSearch(Solution solution, double cost)
	{
		lastRounds = 0;
		if(neighborsPerRound <= 0)
			return cost;

		for(int iter = 0; iter < maxIterations && !evaluator.isExhausted(); iter++)
		{
			lastRounds++;
			double bestNeighborCost = 0;

			for(int k = 0; k < neighborsPerRound; k++)
			{
				neighbor.neighbor(solution, candidate, random, evaluator.getContext());
				double candidateCost = evaluator.evaluate(candidate);

				if(k == 0 || direction.isBetter(candidateCost, bestNeighborCost))
				{
					bestNeighbor.copyFrom(candidate);
					bestNeighborCost = candidateCost;
				}
			}

			if(!direction.isBetter(bestNeighborCost, cost))
				break;

			solution.copyFrom(bestNeighbor);
			cost = bestNeighborCost;
		}
		return cost;
	}

	/**
	 * @return rounds performed by the last call (each cost K evaluations)
	 */
	public int getLastRounds()
	{
		return lastRounds;
	}

	public int getNeighborsPerRound()
	{
		return neighborsPerRound;
	}
}
