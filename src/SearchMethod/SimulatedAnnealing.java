package SearchMethod;

import Auxiliary.RandomSource;
import DiversityControl.AcceptanceCriterion;
import DiversityControl.AcceptanceDecision;
import DiversityControl.AcceptanceType;
import Problem.Evaluator;
import Problem.GenerateFunction;
import Problem.NeighborFunction;
import Problem.ObjectiveFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Simulated Annealing.
 *
 * Moves are grouped in Markov chains of {@code chainLength} moves at a fixed
 * temperature; each move draws one neighbor, evaluates it and hands it to a
 * SALike {@link AcceptanceCriterion} with alpha = 1, so the Metropolis rule is
 * shared with ILS/LNS while the temperature is driven from here. After a chain
 * the temperature follows the {@link CoolingSchedule}, unless reheating is on,
 * the chain acceptance rate fell below reheatThreshold and T is under T0/2, in
 * which case T = min(T * reheatFactor, T0).
 *
 * The run ends after maxIterations moves, when T drops to minTemperature or
 * below, or when the evaluation budget is spent. One convergence entry per move.
 *
 * With autoCalibrate, T0 = -mean|delta| / ln(targetAcceptance) over
 * calibrationSamples neighbors of the start solution (zero deltas ignored; no
 * non-zero delta keeps the configured T0). Calibration evaluations count
 * toward the budget; afterwards the generator is reseeded so the search starts
 * from the same solution an uncalibrated run would.
 */
public class SimulatedAnnealing<C>
{
	private final SAConfig config;
	private final RandomSource random;

	private double startTemperature;
	private double finalTemperature;
	private int reheatCount;

	public SimulatedAnnealing(SAConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	public OptResult run(int elementSize, int solutionSize, ObjectiveFunction<C> objective,
			NeighborFunction<C> neighbor, GenerateFunction<C> generate, C context)
	{
		if(elementSize <= 0 || solutionSize <= 0)
		{
			System.err.println("[SA] invalid solution shape: elementSize=" + elementSize + " solutionSize=" + solutionSize);
			return OptResult.empty();
		}
		if(objective == null || neighbor == null || generate == null)
		{
			System.err.println("[SA] objective, neighbor and generate functions are required");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		Direction direction = config.getDirection();
		Evaluator<C> evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		OptResult result = new OptResult(config.getMaxIterations());
		reheatCount = 0;

		Solution current;
		Solution candidate;
		try
		{
			current = new Solution(elementSize, solutionSize);
			candidate = new Solution(elementSize, solutionSize);
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[SA] could not allocate scratch buffers");
			return result;
		}

		double t0 = config.getInitialTemperature();
		if(config.isAutoCalibrate())
		{
			t0 = calibrate(evaluator, neighbor, generate, current, candidate, context);
			random.setSeed(config.getSeed());
		}
		startTemperature = t0;

		generate.generate(current, random, context);
		double currentCost = evaluator.evaluate(current);
		result.updateBest(current, currentCost);
		double bestCost = currentCost;

		AcceptanceCriterion acceptance = new AcceptanceCriterion(AcceptanceType.SALike, direction, random, t0, 1.0, 0);
		acceptance.reset();

		double temperature = t0;
		int chains = 0;
		int iter = 0;
		while(iter < config.getMaxIterations() && temperature > config.getMinTemperature() && !evaluator.isExhausted())
		{
			int moves = 0;
			int accepted = 0;
			for(int m = 0; m < config.getChainLength() && iter < config.getMaxIterations(); m++, iter++)
			{
				if(evaluator.isExhausted())
					break;

				neighbor.neighbor(current, candidate, random, context);
				double candidateCost = evaluator.evaluate(candidate);
				moves++;

				if(acceptance.decide(candidateCost, currentCost) == AcceptanceDecision.Accept)
				{
					current.copyFrom(candidate);
					currentCost = candidateCost;
					accepted++;

					if(direction.isBetter(currentCost, bestCost))
					{
						result.updateBest(current, currentCost);
						bestCost = currentCost;
					}
				}

				result.recordIteration(iter, bestCost);

				if(config.shouldPrint(iter))
					System.out.printf("[SA] iter:%d | best:%.4f | current:%.4f | T:%.6f | evals:%d%n",
							iter + 1, bestCost, currentCost, temperature, evaluator.getNumEvaluations());
			}

			chains++;
			double acceptanceRate = moves == 0 ? 0.0 : (double) accepted / moves;
			temperature = nextTemperature(temperature, t0, acceptanceRate, chains);
			acceptance.setTemperature(temperature);
		}
		finalTemperature = temperature;

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	double nextTemperature(double temperature, double t0, double acceptanceRate, int chains)
	{
		if(config.isReheat() && acceptanceRate < config.getReheatThreshold() && temperature < t0 / 2)
		{
			reheatCount++;
			return Math.min(temperature * config.getReheatFactor(), t0);
		}

		switch(config.getCooling())
		{
			case Linear:
			{
				int totalChains = Math.max(1, (config.getMaxIterations() + config.getChainLength() - 1) / config.getChainLength());
				double step = (t0 - config.getMinTemperature()) / totalChains;
				return Math.max(temperature - step, config.getMinTemperature());
			}
			case Logarithmic:
				return t0 / Math.log(2.0 + chains);
			case Adaptive:
				if(acceptanceRate < config.getAdaptiveLow())
					return temperature * config.getAdaptiveFactor();
				if(acceptanceRate > config.getAdaptiveHigh())
					return temperature / config.getAdaptiveFactor();
				return temperature;
			case Geometric:
			default:
				return temperature * config.getCoolingRate();
		}
	}

	// start is generated into current and candidate is scratch; both are overwritten later
	private double calibrate(Evaluator<C> evaluator, NeighborFunction<C> neighbor, GenerateFunction<C> generate,
			Solution current, Solution candidate, C context)
	{
		generate.generate(current, random, context);
		double startCost = evaluator.evaluate(current);

		double sum = 0;
		int count = 0;
		for(int s = 0; s < config.getCalibrationSamples(); s++)
		{
			neighbor.neighbor(current, candidate, random, context);
			double delta = Math.abs(evaluator.evaluate(candidate) - startCost);
			if(delta > 0)
			{
				sum += delta;
				count++;
			}
		}

		if(count == 0)
			return config.getInitialTemperature();
		return -(sum / count) / Math.log(config.getTargetAcceptance());
	}

	/**
	 * @return T0 of the last run (the calibrated value when autoCalibrate is on)
	 */
	public double getStartTemperature()
	{
		return startTemperature;
	}

	public double getFinalTemperature()
	{
		return finalTemperature;
	}

	public int getReheatCount()
	{
		return reheatCount;
	}

	public SAConfig getConfig()
	{
		return config;
	}
}
