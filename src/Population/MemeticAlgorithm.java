package Population;

import Auxiliary.RandomSource;
import Improvement.LocalSearch;
import Problem.CrossoverFunction;
import Problem.Evaluator;
import Problem.GenerateFunction;
import Problem.MutationFunction;
import Problem.NeighborFunction;
import Problem.ObjectiveFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Memetic Algorithm: generational GA whose offspring are refined by local search.
 *
 * Per generation:
 * 1. Rank the population by fitness (best first, honouring the direction)
 * 2. Copy the elitismCount best individuals unchanged
 * 3. Fill the rest with offspring: select two parents, cross over with
 *    probability crossoverRate (otherwise clone), mutate, evaluate, then with
 *    probability lsProbability run local search
 *
 * Learning:
 * - Lamarckian: the descended solution replaces the offspring genome
 * - Baldwinian: the offspring keeps its genome but takes the descended fitness.
 *   The descended solution was evaluated, so it can still become the reported best.
 */
public class MemeticAlgorithm<C>
{
	private final MemeticConfig config;
	private final RandomSource random;

	private Direction direction;
	private Evaluator<C> evaluator;
	private LocalSearch<C> localSearch;
	private Solution lsScratch;
	private OptResult result;
	private double bestCost;

	public MemeticAlgorithm(MemeticConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	/**
	 * @param mutation may be null (no mutation)
	 * @param neighbor may be null (no local search)
	 */
	public OptResult run(int elementSize, int solutionSize, ObjectiveFunction<C> objective,
			GenerateFunction<C> generate, CrossoverFunction<C> crossover, MutationFunction<C> mutation,
			NeighborFunction<C> neighbor, C context)
	{
		if(elementSize <= 0 || solutionSize <= 0)
		{
			System.err.println("[MA] invalid solution shape: elementSize=" + elementSize + " solutionSize=" + solutionSize);
			return OptResult.empty();
		}
		if(objective == null || generate == null || crossover == null)
		{
			System.err.println("[MA] objective, generate and crossover functions are required");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		direction = config.getDirection();
		evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		result = new OptResult(config.getMaxIterations());
		bestCost = direction.worst();

		int popSize = Math.max(MemeticConfig.MIN_POPULATION_SIZE, config.getPopulationSize());
		int elitism = Math.min(config.getElitismCount(), popSize);

		Solution[] population;
		Solution[] offspring;
		double[] fitness;
		double[] offspringFitness;
		int[] ranking;
		Solution child1;
		Solution child2;
		try
		{
			population = new Solution[popSize];
			offspring = new Solution[popSize];
			for(int i = 0; i < popSize; i++)
			{
				population[i] = new Solution(elementSize, solutionSize);
				offspring[i] = new Solution(elementSize, solutionSize);
			}
			fitness = new double[popSize];
			offspringFitness = new double[popSize];
			ranking = new int[popSize];
			child1 = new Solution(elementSize, solutionSize);
			child2 = new Solution(elementSize, solutionSize);
			lsScratch = new Solution(elementSize, solutionSize);
			localSearch = neighbor == null ? null : new LocalSearch<>(evaluator, neighbor, direction, random,
					config.getLsMaxIterations(), config.getLsNeighbors(), child1);
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[MA] could not allocate a population of " + popSize);
			return result;
		}

		for(int i = 0; i < popSize; i++)
		{
			generate.generate(population[i], random, context);
			fitness[i] = config.isLsOnInitial()
					? evaluateAndLearn(population[i])
					: evaluateOnly(population[i]);
		}

		for(int gen = 0; gen < config.getMaxIterations(); gen++)
		{
			if(evaluator.isExhausted())
				break;

			rank(fitness, ranking);

			int count = 0;
			for(; count < elitism; count++)
			{
				offspring[count].copyFrom(population[ranking[count]]);
				offspringFitness[count] = fitness[ranking[count]];
			}

			while(count < popSize)
			{
				int p1 = selectParent(fitness, ranking);
				int p2 = selectParent(fitness, ranking);

				if(random.uniform() < config.getCrossoverRate())
					crossover.crossover(population[p1], population[p2], child1, child2, random, context);
				else
				{
					child1.copyFrom(population[p1]);
					child2.copyFrom(population[p2]);
				}

				if(mutation != null)
				{
					mutation.mutate(child1, config.getMutationRate(), random, context);
					mutation.mutate(child2, config.getMutationRate(), random, context);
				}

				offspringFitness[count] = evaluateAndLearn(child1);
				offspring[count].copyFrom(child1);
				count++;

				if(count < popSize)
				{
					offspringFitness[count] = evaluateAndLearn(child2);
					offspring[count].copyFrom(child2);
					count++;
				}
			}

			Solution[] swap = population;
			population = offspring;
			offspring = swap;
			double[] swapFitness = fitness;
			fitness = offspringFitness;
			offspringFitness = swapFitness;

			result.recordIteration(gen, bestCost);

			if(config.shouldPrint(gen))
				System.out.printf("[MA] gen:%d | best:%.4f | evals:%d%n",
						gen + 1, bestCost, evaluator.getNumEvaluations());
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	private double evaluateOnly(Solution individual)
	{
		double cost = evaluator.evaluate(individual);
		trackBest(individual, cost);
		return cost;
	}

	/**
	 * Evaluate and, with probability lsProbability, descend according to the learning type.
	 *
	 * @return fitness the individual carries in the population
	 */
	private double evaluateAndLearn(Solution individual)
	{
		double cost = evaluateOnly(individual);
		if(localSearch == null || random.uniform() >= config.getLsProbability())
			return cost;

		if(config.getLearning() == LearningType.Lamarckian)
		{
			cost = localSearch.localSearch(individual, cost);
			trackBest(individual, cost);
			return cost;
		}

		lsScratch.copyFrom(individual);
		double learned = localSearch.localSearch(lsScratch, cost);
		trackBest(lsScratch, learned);
		return learned;
	}

	private void trackBest(Solution solution, double cost)
	{
		if(result.isEmpty() || direction.isBetter(cost, bestCost))
		{
			result.updateBest(solution, cost);
			bestCost = cost;
		}
	}

	/**
	 * Indices of the population ordered best first (insertion sort, stable).
	 */
	void rank(double[] fitness, int[] ranking)
	{
		for(int i = 0; i < ranking.length; i++)
		{
			int idx = i;
			int j = i - 1;
			while(j >= 0 && direction.isBetter(fitness[idx], fitness[ranking[j]]))
			{
				ranking[j + 1] = ranking[j];
				j--;
			}
			ranking[j + 1] = idx;
		}
	}

	private int selectParent(double[] fitness, int[] ranking)
	{
		switch(config.getSelection())
		{
			case Roulette:
				return rouletteSelect(fitness);
			case Rank:
				return ranking[rankSelect(fitness.length)];
			case Tournament:
			default:
				return tournamentSelect(fitness);
		}
	}

	private int tournamentSelect(double[] fitness)
	{
		int n = fitness.length;
		int best = random.nextInt(0, n - 1);
		for(int t = 1; t < config.getTournamentSize(); t++)
		{
			int r = random.nextInt(0, n - 1);
			if(direction.isBetter(fitness[r], fitness[best]))
				best = r;
		}
		return best;
	}

	// Weight = distance from the worst individual + 1, so the worst keeps a chance
	private int rouletteSelect(double[] fitness)
	{
		int n = fitness.length;
		double worst = fitness[0];
		for(int i = 1; i < n; i++)
			if(direction.isBetter(worst, fitness[i]))
				worst = fitness[i];

		double total = 0;
		for(int i = 0; i < n; i++)
			total += direction.delta(worst, fitness[i]) + 1.0;
		if(!(total > 0) || Double.isInfinite(total))
			return random.nextInt(0, n - 1);

		double r = random.uniform() * total;
		double cumulative = 0;
		for(int i = 0; i < n; i++)
		{
			cumulative += direction.delta(worst, fitness[i]) + 1.0;
			if(r < cumulative)
				return i;
		}
		return n - 1;
	}

	// Linear ranking: rank 0 weighs n, rank n-1 weighs 1
	private int rankSelect(int n)
	{
		double total = n * (n + 1) / 2.0;
		double r = random.uniform() * total;
		double cumulative = 0;
		for(int i = 0; i < n; i++)
		{
			cumulative += n - i;
			if(r < cumulative)
				return i;
		}
		return n - 1;
	}

	public MemeticConfig getConfig()
	{
		return config;
	}
}
