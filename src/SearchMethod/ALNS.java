package SearchMethod;

import java.util.List;

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
 * Adaptive Large Neighborhood Search.
 *
 * Each iteration picks a destroy and a repair operator from their own
 * weighted pools ({@link DecoupledAOS}), rebuilds the incumbent through them,
 * evaluates the result once and lets the shared {@link AcceptanceCriterion}
 * decide whether it becomes the incumbent. The outcome rewards both operators:
 * rewardBest for a new global best, otherwise rewardBetter for beating the
 * incumbent, otherwise rewardAccepted when the criterion accepted it.
 */
public class ALNS<C>
{
	private final ALNSConfig config;
	private final RandomSource random;

	private DecoupledAOS daos;

	public ALNS(ALNSConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	public OptResult run(int elementSize, int solutionSize, ObjectiveFunction<C> objective,
			GenerateFunction<C> generate, List<DestroyOperator<C>> destroyOperators,
			List<RepairOperator<C>> repairOperators, C context)
	{
		if(elementSize <= 0 || solutionSize <= 0)
		{
			System.err.println("[ALNS] invalid solution shape: elementSize=" + elementSize + " solutionSize=" + solutionSize);
			return OptResult.empty();
		}
		if(objective == null || generate == null)
		{
			System.err.println("[ALNS] objective and generate functions are required");
			return OptResult.empty();
		}
		if(destroyOperators == null || destroyOperators.isEmpty() || repairOperators == null
				|| repairOperators.isEmpty())
		{
			System.err.println("[ALNS] at least one destroy and one repair operator are required");
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
			System.err.println("[ALNS] could not allocate scratch buffers");
			return result;
		}

		daos = new DecoupledAOS(operatorNames("D", destroyOperators.size()),
				operatorNames("R", repairOperators.size()), random, config);
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

			int d = daos.selectDestroyOperator();
			int r = daos.selectRepairOperator();

			destroyOperators.get(d).destroy(current, destroyed, config.getDestroyDegree(), random, context);
			repairOperators.get(r).repair(destroyed, candidate, random, context);
			double candidateCost = evaluator.evaluate(candidate);

			AcceptanceDecision decision = acceptance.decide(candidateCost, currentCost);

			OperatorOutcome outcome;
			if(direction.isBetter(candidateCost, bestCost))
			{
				outcome = OperatorOutcome.NewGlobalBest;
				result.updateBest(candidate, candidateCost);
				bestCost = candidateCost;
			}
			else if(direction.isBetter(candidateCost, currentCost))
				outcome = OperatorOutcome.Improved;
			else if(decision.isAccepted())
				outcome = OperatorOutcome.Accepted;
			else
				outcome = OperatorOutcome.Rejected;

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

			daos.recordOutcome(d, r, outcome);
			result.recordIteration(iter, bestCost);

			if(config.shouldPrint(iter))
			{
				System.out.printf("[ALNS] iter:%d | best:%.4f | current:%.4f | evals:%d%n",
						iter + 1, bestCost, currentCost, evaluator.getNumEvaluations());
				daos.printStats(iter + 1);
			}
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	static String[] operatorNames(String prefix, int count)
	{
		String[] names = new String[count];
		for(int i = 0; i < count; i++)
			names[i] = prefix + i;
		return names;
	}

	/**
	 * @return destroy weights after the last run (null before the first run)
	 */
	public double[] getDestroyWeights()
	{
		return daos == null ? null : daos.getDestroyAOS().getWeights();
	}

	/**
	 * @return repair weights after the last run (null before the first run)
	 */
	public double[] getRepairWeights()
	{
		return daos == null ? null : daos.getRepairAOS().getWeights();
	}

	public DecoupledAOS getOperatorSelection()
	{
		return daos;
	}

	public ALNSConfig getConfig()
	{
		return config;
	}
}
