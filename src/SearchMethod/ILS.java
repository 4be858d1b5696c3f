package SearchMethod;

import Auxiliary.RandomSource;
import DiversityControl.AcceptanceCriterion;
import DiversityControl.AcceptanceDecision;
import Improvement.LocalSearch;
import Problem.Evaluator;
import Problem.GenerateFunction;
import Problem.NeighborFunction;
import Problem.ObjectiveFunction;
import Problem.PerturbFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Iterated Local Search.
 *
 * Descends to a local optimum, then repeats: perturb the incumbent, evaluate,
 * descend, and let the acceptance criterion decide. Without a perturb function
 * the perturbation is {@code perturbationStrength} chained neighbor moves.
 */
public class ILS<C>
{
	private final ILSConfig config;
	private final RandomSource random;

	public ILS(ILSConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	/**
	 * @param perturb may be null (chained neighbor moves are used instead)
	 */
	public OptResult run(int elementSize, int solutionSize, ObjectiveFunction<C> objective,
			NeighborFunction<C> neighbor, GenerateFunction<C> generate, PerturbFunction<C> perturb, C context)
	{
		if(elementSize <= 0 || solutionSize <= 0)
		{
			System.err.println("[ILS] invalid solution shape: elementSize=" + elementSize + " solutionSize=" + solutionSize);
			return OptResult.empty();
		}
		if(objective == null || neighbor == null || generate == null)
		{
			System.err.println("[ILS] objective, neighbor and generate functions are required");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		Direction direction = config.getDirection();
		Evaluator<C> evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		OptResult result = new OptResult(config.getMaxIterations());

		Solution current;
		Solution candidate;
		Solution chain;
		LocalSearch<C> localSearch;
		try
		{
			current = new Solution(elementSize, solutionSize);
			candidate = new Solution(elementSize, solutionSize);
			chain = new Solution(elementSize, solutionSize);
			localSearch = new LocalSearch<>(evaluator, neighbor, direction, random,
					config.getLsMaxIterations(), config.getLsNeighbors(), current);
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[ILS] could not allocate scratch buffers");
			return result;
		}

		AcceptanceCriterion acceptance = new AcceptanceCriterion(config.getAcceptanceType(), direction, random,
				config.getInitialTemperature(), config.getCoolingRate(), config.getRestartThreshold());
		acceptance.reset();

		generate.generate(current, random, context);
		double currentCost = evaluator.evaluate(current);
		currentCost = localSearch.localSearch(current, currentCost);
		result.updateBest(current, currentCost);
		double bestCost = currentCost;

		for(int iter = 0; iter < config.getMaxIterations(); iter++)
		{
			if(evaluator.isExhausted())
				break;

			if(perturb != null)
				perturb.perturb(current, candidate, config.getPerturbationStrength(), random, context);
			else
				chainedMoves(neighbor, current, candidate, chain, context);

			double candidateCost = evaluator.evaluate(candidate);
			candidateCost = localSearch.localSearch(candidate, candidateCost);

			if(direction.isBetter(candidateCost, bestCost))
			{
				result.updateBest(candidate, candidateCost);
				bestCost = candidateCost;
			}

			AcceptanceDecision decision = acceptance.decide(candidateCost, currentCost);
			if(decision == AcceptanceDecision.Accept)
			{
				current.copyFrom(candidate);
				currentCost = candidateCost;
			}
			else if(decision == AcceptanceDecision.RestartFromBest)
			{
				current.copyFrom(result.getBest());
				currentCost = bestCost;
			}

			result.recordIteration(iter, bestCost);

			if(config.shouldPrint(iter))
				System.out.printf("[ILS] iter:%d | best:%.4f | current:%.4f | evals:%d%n",
						iter + 1, bestCost, currentCost, evaluator.getNumEvaluations());
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	// strength neighbor moves, ping-ponging between out and chain
	private void chainedMoves(NeighborFunction<C> neighbor, Solution current, Solution out, Solution chain, C context)
	{
		neighbor.neighbor(current, out, random, context);
		for(int s = 1; s < config.getPerturbationStrength(); s++)
		{
			chain.copyFrom(out);
			neighbor.neighbor(chain, out, random, context);
		}
	}

	public ILSConfig getConfig()
	{
		return config;
	}
}
