package SearchMethod;

import java.util.List;

import Auxiliary.RandomSource;
import Improvement.LocalSearch;
import Improvement.VariableNeighborhoodDescent;
import Problem.Evaluator;
import Problem.GenerateFunction;
import Problem.NeighborFunction;
import Problem.ObjectiveFunction;
import Problem.ShakeFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Variable Neighborhood Search.
 *
 * One outer iteration walks k = 1..kMax: shake the incumbent in neighborhood k,
 * improve it (local search, nothing, or VND depending on the variant) and move
 * there if it is better, in which case k goes back to 1; otherwise k grows.
 * The incumbent only ever improves, so it is also the best solution.
 */
public class VNS<C>
{
	private final VNSConfig config;
	private final RandomSource random;

	public VNS(VNSConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	/**
	 * @param neighbors local search uses the first; VND uses them in order.
	 *                  Ignored by the Reduced variant, which may pass an empty list.
	 */
	public OptResult run(int elementSize, int solutionSize, ObjectiveFunction<C> objective,
			List<NeighborFunction<C>> neighbors, ShakeFunction<C> shake, GenerateFunction<C> generate, C context)
	{
		VNSVariant variant = config.getVariant();
		if(elementSize <= 0 || solutionSize <= 0)
		{
			System.err.println("[VNS] invalid solution shape: elementSize=" + elementSize + " solutionSize=" + solutionSize);
			return OptResult.empty();
		}
		if(objective == null || shake == null || generate == null)
		{
			System.err.println("[VNS] objective, shake and generate functions are required");
			return OptResult.empty();
		}
		if(variant != VNSVariant.Reduced && (neighbors == null || neighbors.isEmpty()))
		{
			System.err.println("[VNS] variant " + variant + " needs at least one neighbor function");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		Direction direction = config.getDirection();
		Evaluator<C> evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		OptResult result = new OptResult(config.getMaxIterations());

		Solution current;
		Solution candidate;
		LocalSearch<C> localSearch = null;
		VariableNeighborhoodDescent<C> vnd = null;
		try
		{
			current = new Solution(elementSize, solutionSize);
			candidate = new Solution(elementSize, solutionSize);
			if(variant == VNSVariant.Basic)
				localSearch = new LocalSearch<>(evaluator, neighbors.get(0), direction, random,
						config.getLsMaxIterations(), config.getLsNeighbors(), current);
			else if(variant == VNSVariant.General)
				vnd = new VariableNeighborhoodDescent<>(evaluator, neighbors, direction, random,
						config.getLsMaxIterations(), config.getLsNeighbors(), config.getVndNeighborhoods(), current);
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[VNS] could not allocate scratch buffers");
			return result;
		}

		generate.generate(current, random, context);
		double currentCost = evaluator.evaluate(current);
		currentCost = improve(localSearch, vnd, current, currentCost);
		result.updateBest(current, currentCost);

		for(int iter = 0; iter < config.getMaxIterations(); iter++)
		{
			if(evaluator.isExhausted())
				break;

			int k = 1;
			while(k <= config.getKMax() && !evaluator.isExhausted())
			{
				shake.shake(current, candidate, k, random, context);
				double candidateCost = evaluator.evaluate(candidate);
				candidateCost = improve(localSearch, vnd, candidate, candidateCost);

				if(direction.isBetter(candidateCost, currentCost))
				{
					current.copyFrom(candidate);
					currentCost = candidateCost;
					result.updateBest(current, currentCost);
					k = 1;
				}
				else
					k++;
			}

			result.recordIteration(iter, currentCost);

			if(config.shouldPrint(iter))
				System.out.printf("[VNS] iter:%d | best:%.4f | evals:%d%n",
						iter + 1, currentCost, evaluator.getNumEvaluations());
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	private double improve(LocalSearch<C> localSearch, VariableNeighborhoodDescent<C> vnd,
			Solution solution, double cost)
	{
		if(localSearch != null)
			return localSearch.localSearch(solution, cost);
		if(vnd != null)
			return vnd.descend(solution, cost);
		return cost;
	}

	public VNSConfig getConfig()
	{
		return config;
	}
}
