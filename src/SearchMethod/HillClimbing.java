package SearchMethod;

import Auxiliary.RandomSource;
import DiversityControl.AcceptanceCriterion;
import DiversityControl.AcceptanceDecision;
import DiversityControl.AcceptanceType;
import Improvement.LocalSearch;
import Problem.Evaluator;
import Problem.GenerateFunction;
import Problem.NeighborFunction;
import Problem.ObjectiveFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Hill Climbing in four variants (see {@link HillClimbingVariant}).
 *
 * Steepest moves are single {@link LocalSearch} rounds, so a move costs exactly
 * neighborsPerStep evaluations. Steepest and FirstImprovement stop at the first
 * iteration without a strictly better neighbor; that iteration is still
 * recorded. RandomRestart runs numRestarts steepest climbs from fresh random
 * starts and concatenates their convergence. Stochastic never stops early: one
 * neighbor per iteration, accepted by a SALike {@link AcceptanceCriterion} whose
 * temperature stays constant (alpha = 1).
 */
public class HillClimbing<C>
{
	private final HillClimbingConfig config;
	private final RandomSource random;

	private Direction direction;
	private Evaluator<C> evaluator;
	private OptResult result;
	private double bestCost;
	private int climbs;

	public HillClimbing(HillClimbingConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	public OptResult run(int elementSize, int solutionSize, ObjectiveFunction<C> objective,
			NeighborFunction<C> neighbor, GenerateFunction<C> generate, C context)
	{
		if(elementSize <= 0 || solutionSize <= 0)
		{
			System.err.println("[HC] invalid solution shape: elementSize=" + elementSize + " solutionSize=" + solutionSize);
			return OptResult.empty();
		}
		if(objective == null || neighbor == null || generate == null)
		{
			System.err.println("[HC] objective, neighbor and generate functions are required");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		direction = config.getDirection();
		evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		HillClimbingVariant variant = config.getVariant();
		int restarts = variant == HillClimbingVariant.RandomRestart ? config.getNumRestarts() : 1;
		result = new OptResult((int) Math.min(Integer.MAX_VALUE, (long) config.getMaxIterations() * restarts));
		bestCost = direction.worst();
		climbs = 0;

		Solution current;
		Solution candidate;
		LocalSearch<C> localSearch;
		try
		{
			current = new Solution(elementSize, solutionSize);
			candidate = new Solution(elementSize, solutionSize);
			localSearch = new LocalSearch<>(evaluator, neighbor, direction, random, 1, config.getNeighborsPerStep(), current);
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[HC] could not allocate scratch buffers");
			return result;
		}

		if(variant == HillClimbingVariant.Stochastic)
		{
			generate.generate(current, random, context);
			stochastic(current, candidate, neighbor, context);
		}
		else
		{
			int offset = 0;
			for(int r = 0; r < restarts && !evaluator.isExhausted(); r++)
			{
				generate.generate(current, random, context);
				offset += climb(current, candidate, offset, localSearch, neighbor, context,
						variant == HillClimbingVariant.FirstImprovement);
				climbs++;
			}
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	/**
	 * One climb from {@code current} (freshly generated, not yet evaluated).
	 *
	 * @return iterations recorded
	 */
	private int climb(Solution current, Solution candidate, int offset, LocalSearch<C> localSearch,
			NeighborFunction<C> neighbor, C context, boolean firstImprovement)
	{
		double cost = evaluator.evaluate(current);
		if(result.isEmpty() || direction.isBetter(cost, bestCost))
		{
			result.updateBest(current, cost);
			bestCost = cost;
		}

		int steps = 0;
		for(int iter = 0; iter < config.getMaxIterations(); iter++)
		{
			if(evaluator.isExhausted())
				break;

			boolean moved;
			if(firstImprovement)
			{
				double next = firstImprovementStep(current, candidate, cost, neighbor, context);
				moved = direction.isBetter(next, cost);
				cost = next;
			}
			else
			{
				double next = localSearch.localSearch(current, cost);
				moved = direction.isBetter(next, cost);
				cost = next;
			}

			if(direction.isBetter(cost, bestCost))
			{
				result.updateBest(current, cost);
				bestCost = cost;
			}

			result.recordIteration(offset + iter, bestCost);
			steps++;

			if(config.shouldPrint(offset + iter))
				System.out.printf("[HC] iter:%d | best:%.4f | current:%.4f | evals:%d%n",
						offset + iter + 1, bestCost, cost, evaluator.getNumEvaluations());

			if(!moved)
				break;
		}
		return steps;
	}

	// moves current to the first strictly better of up to K neighbors
	private double firstImprovementStep(Solution current, Solution candidate, double cost,
			NeighborFunction<C> neighbor, C context)
	{
		for(int k = 0; k < config.getNeighborsPerStep(); k++)
		{
			if(evaluator.isExhausted())
				break;

			neighbor.neighbor(current, candidate, random, context);
			double candidateCost = evaluator.evaluate(candidate);
			if(direction.isBetter(candidateCost, cost))
			{
				current.copyFrom(candidate);
				return candidateCost;
			}
		}
		return cost;
	}

	private void stochastic(Solution current, Solution candidate, NeighborFunction<C> neighbor, C context)
	{
		AcceptanceCriterion acceptance = new AcceptanceCriterion(AcceptanceType.SALike, direction, random,
				config.getTemperature(), 1.0, 0);

		double cost = evaluator.evaluate(current);
		result.updateBest(current, cost);
		bestCost = cost;
		climbs = 1;

		for(int iter = 0; iter < config.getMaxIterations(); iter++)
		{
			if(evaluator.isExhausted())
				break;

			neighbor.neighbor(current, candidate, random, context);
			double candidateCost = evaluator.evaluate(candidate);
			if(acceptance.decide(candidateCost, cost) == AcceptanceDecision.Accept)
			{
				current.copyFrom(candidate);
				cost = candidateCost;
				if(direction.isBetter(cost, bestCost))
				{
					result.updateBest(current, cost);
					bestCost = cost;
				}
			}

			result.recordIteration(iter, bestCost);

			if(config.shouldPrint(iter))
				System.out.printf("[HC] iter:%d | best:%.4f | current:%.4f | evals:%d%n",
						iter + 1, bestCost, cost, evaluator.getNumEvaluations());
		}
	}

	/**
	 * @return climbs started by the last run (1 except for RandomRestart)
	 */
	public int getClimbCount()
	{
		return climbs;
	}

	public HillClimbingConfig getConfig()
	{
		return config;
	}
}
