package SearchMethod;

import Auxiliary.RandomSource;
import DiversityControl.AcceptanceCriterion;
import DiversityControl.AcceptanceDecision;
import Problem.DestroyOperator;
import Problem.Evaluator;
import Problem.GenerateFunction;
import Problem.ObjectiveFunction;
import Problem.RepairOperator;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Large Neighborhood Search with a single destroy/repair pair and the shared
 * acceptance criterion.
 */
public class LNS<C>
{
	private final LNSConfig config;
	private final RandomSource random;

	public LNS(LNSConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	public OptResult run(int elementSize, int solutionSize, ObjectiveFunction<C> objective,
			GenerateFunction<C> generate, DestroyOperator<C> destroy, RepairOperator<C> repair, C context)
	{
		if(elementSize <= 0 || solutionSize <= 0)
		{
			System.err.println("[LNS] invalid solution shape: elementSize=" + elementSize + " solutionSize=" + solutionSize);
			return OptResult.empty();
		}
		if(objective == null || generate == null || destroy == null || repair == null)
		{
			System.err.println("[LNS] objective, generate, destroy and repair functions are required");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		Direction direction = config.getDirection();
		Evaluator<C> evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		OptResult result = new OptResult(config.getMaxIterations());

		Solution current;
		Solution destroyed;
		Solution candidate;
		try
		{
			current = new Solution(elementSize, solutionSize);
			destroyed = new Solution(elementSize, solutionSize);
			candidate = new Solution(elementSize, solutionSize);
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[LNS] could not allocate scratch buffers");
			return result;
		}

		AcceptanceCriterion acceptance = new AcceptanceCriterion(config.getAcceptanceType(), direction, random,
				config.getInitialTemperature(), config.getCoolingRate(), config.getRestartThreshold());
		acceptance.reset();

		generate.generate(current, random, context);
		double currentCost = evaluator.evaluate(current);
		result.updateBest(current, currentCost);
		double bestCost = currentCost;

		for(int iter = 0; iter < config.getMaxIterations(); iter++)
		{
			if(evaluator.isExhausted())
				break;

			destroy.destroy(current, destroyed, config.getDestroyDegree(), random, context);
			repair.repair(destroyed, candidate, random, context);
			double candidateCost = evaluator.evaluate(candidate);

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
				System.out.printf("[LNS] iter:%d | best:%.4f | current:%.4f | evals:%d%n",
						iter + 1, bestCost, currentCost, evaluator.getNumEvaluations());
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	public LNSConfig getConfig()
	{
		return config;
	}
}
