package Population;

import Auxiliary.RandomSource;
import Problem.Evaluator;
import Problem.ObjectiveFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Differential Evolution over double vectors.
 *
 * For every target i of a generation: build the donor with the configured
 * {@link DEStrategy}, clamp it into the bounds, cross it with the target
 * (binomial: each coordinate from the donor with probability CR, plus one
 * forced coordinate jRand), evaluate the trial and let it replace the target
 * when it is at least as good. Replacement is in place, so later targets of the
 * same generation already see it, and the best index moves as soon as a trial
 * beats the best.
 *
 * Evaluations: NP for the initial population plus NP per generation.
 */
public class DifferentialEvolution<C>
{
	private final DEConfig config;
	private final RandomSource random;

	public DifferentialEvolution(DEConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	/**
	 * @param dimension number of double coordinates per individual
	 */
	public OptResult run(int dimension, ObjectiveFunction<C> objective, C context)
	{
		if(dimension <= 0)
		{
			System.err.println("[DE] invalid dimension: " + dimension);
			return OptResult.empty();
		}
		if(objective == null)
		{
			System.err.println("[DE] objective function is required");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		Direction direction = config.getDirection();
		Evaluator<C> evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		OptResult result = new OptResult(config.getMaxIterations());

		int n = config.effectivePopulationSize();
		DEStrategy strategy = config.getStrategy();
		double lower = config.getLowerBound();
		double upper = config.getUpperBound();
		double f = config.getWeight();

		double[][] population;
		double[] fitness;
		double[] donor;
		Solution trial;
		int[] r;
		try
		{
			population = new double[n][dimension];
			fitness = new double[n];
			donor = new double[dimension];
			trial = Solution.ofDoubles(dimension);
			r = new int[strategy.getRandomVectors()];
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[DE] could not allocate a population of " + n);
			return result;
		}

		int bestIndex = 0;
		for(int i = 0; i < n; i++)
		{
			for(int d = 0; d < dimension; d++)
				population[i][d] = lower + random.uniform() * (upper - lower);
			trial.setDoubles(population[i]);
			fitness[i] = evaluator.evaluate(trial);
			if(i == 0 || direction.isBetter(fitness[i], fitness[bestIndex]))
				bestIndex = i;
		}
		trial.setDoubles(population[bestIndex]);
		result.updateBest(trial, fitness[bestIndex]);

		for(int gen = 0; gen < config.getMaxIterations(); gen++)
		{
			if(evaluator.isExhausted())
				break;

			for(int i = 0; i < n; i++)
			{
				if(evaluator.isExhausted())
					break;

				pickDistinct(r, n, i);
				double[] x = population[i];
				double[] best = population[bestIndex];
				for(int d = 0; d < dimension; d++)
				{
					double v;
					switch(strategy)
					{
						case Best1:
							v = best[d] + f * (population[r[0]][d] - population[r[1]][d]);
							break;
						case CurrentToBest1:
							v = x[d] + f * (best[d] - x[d]) + f * (population[r[0]][d] - population[r[1]][d]);
							break;
						case Rand2:
							v = population[r[0]][d] + f * (population[r[1]][d] - population[r[2]][d])
									+ f * (population[r[3]][d] - population[r[4]][d]);
							break;
						case Best2:
							v = best[d] + f * (population[r[0]][d] - population[r[1]][d])
									+ f * (population[r[2]][d] - population[r[3]][d]);
							break;
						case Rand1:
						default:
							v = population[r[0]][d] + f * (population[r[1]][d] - population[r[2]][d]);
							break;
					}
					donor[d] = PSO.clamp(v, lower, upper);
				}

				int jRand = random.nextInt(0, dimension - 1);
				for(int d = 0; d < dimension; d++)
				{
					if(d == jRand || random.uniform() < config.getCrossoverRate())
						trial.setDouble(d, donor[d]);
					else
						trial.setDouble(d, x[d]);
				}

				double trialCost = evaluator.evaluate(trial);
				if(!direction.isBetter(fitness[i], trialCost))
				{
					for(int d = 0; d < dimension; d++)
						x[d] = trial.getDouble(d);
					fitness[i] = trialCost;

					if(direction.isBetter(trialCost, fitness[bestIndex]))
					{
						bestIndex = i;
						result.updateBest(trial, trialCost);
					}
				}
			}

			result.recordIteration(gen, fitness[bestIndex]);

			if(config.shouldPrint(gen))
				System.out.printf("[DE] gen:%d | best:%.6f | evals:%d%n",
						gen + 1, fitness[bestIndex], evaluator.getNumEvaluations());
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	// fills r with distinct indices in [0, n) that differ from target
	private void pickDistinct(int[] r, int n, int target)
	{
		for(int k = 0; k < r.length; k++)
		{
			int candidate;
			boolean taken;
			do
			{
				candidate = random.nextInt(0, n - 1);
				taken = candidate == target;
				for(int j = 0; j < k && !taken; j++)
					taken = r[j] == candidate;
			}
			while(taken);
			r[k] = candidate;
		}
	}

	public DEConfig getConfig()
	{
		return config;
	}
}
