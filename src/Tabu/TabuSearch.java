package Tabu;

import Auxiliary.RandomSource;
import Problem.Evaluator;
import Problem.GenerateFunction;
import Problem.NeighborFunction;
import Problem.ObjectiveFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Reactive dual-memory Tabu Search.
 *
 * KEY DESIGN PRINCIPLES:
 * 1. Every iteration samples K candidates, each evaluated exactly once; the
 *    chosen one becomes the incumbent with its computed cost, so a run costs
 *    1 + iterations * K evaluations.
 * 2. Recency memory (tabu list) forbids recent incumbents; aspiration lets a
 *    forbidden candidate through when it beats the best-ever cost.
 * 3. Frequency memory penalises often-visited solutions while the search is
 *    stagnating (diversification) and breaks score ties towards rarely visited
 *    ones (intensification, which also periodically restarts from the best).
 * 4. When every candidate is tabu the one made tabu longest ago is taken, so
 *    the walk never stalls.
 *
 * The best-ever solution is updated from every evaluated candidate, tabu or not.
 */
public class TabuSearch<C>
{
	private final TabuConfig config;
	private final RandomSource random;

	// Memories of the last run
	private TabuList tabuList;
	private FrequencyMemory frequency;
	private ReactiveTenure reactiveTenure;
	private int aspirationCount;

	public TabuSearch(TabuConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	/**
	 * Whether a candidate may be chosen: not tabu, or tabu but aspirating
	 * (aspiration enabled and candidate strictly better than the best-ever cost).
	 */
	public static boolean isAdmissible(boolean tabu, boolean aspiration, Direction direction,
			double candidateCost, double bestCost)
	{
		if(!tabu)
			return true;
		return aspiration && direction.isBetter(candidateCost, bestCost);
	}

	/**
	 * Run with the default byte-wise FNV-1a hash.
	 */
	public OptResult run(int elementSize, int solutionSize, ObjectiveFunction<C> objective,
			NeighborFunction<C> neighbor, GenerateFunction<C> generate, C context)
	{
		return run(elementSize, solutionSize, objective, neighbor, generate, SolutionHashes::hashBytes, context);
	}

	public OptResult run(int elementSize, int solutionSize, ObjectiveFunction<C> objective,
			NeighborFunction<C> neighbor, GenerateFunction<C> generate, SolutionHash hash, C context)
	{
		if(elementSize <= 0 || solutionSize <= 0)
		{
			System.err.println("[TS] invalid solution shape: elementSize=" + elementSize + " solutionSize=" + solutionSize);
			return OptResult.empty();
		}
		if(objective == null || neighbor == null || generate == null || hash == null)
		{
			System.err.println("[TS] objective, neighbor, generate and hash functions are required");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		Direction direction = config.getDirection();
		Evaluator<C> evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		OptResult result = new OptResult(config.getMaxIterations());

		int k = config.getNeighborsPerIteration();
		boolean reactive = config.isReactive();
		boolean useFrequency = config.usesFrequencyMemory();
		int initialTenure = reactive
				? Math.max(config.getMinTenure(), Math.min(config.getMaxTenure(), config.getTenure()))
				: config.getTenure();

		Solution current;
		Solution[] candidates;
		long[] hashes;
		double[] costs;
		try
		{
			current = new Solution(elementSize, solutionSize);
			candidates = new Solution[k];
			for(int i = 0; i < k; i++)
				candidates[i] = new Solution(elementSize, solutionSize);
			hashes = new long[k];
			costs = new double[k];
			tabuList = new TabuList(initialTenure, reactive ? config.getMaxTenure() : initialTenure);
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[TS] could not allocate scratch buffers for " + k + " candidates");
			return result;
		}
		frequency = new FrequencyMemory();
		reactiveTenure = new ReactiveTenure(initialTenure, config.getMinTenure(), config.getMaxTenure(),
				config.getReactiveIncrease(), config.getReactiveDecrease(),
				config.getCycleWindow(), config.getReactiveDecreaseInterval());
		aspirationCount = 0;

		generate.generate(current, random, context);
		double currentCost = evaluator.evaluate(current);
		result.updateBest(current, currentCost);
		double bestCost = currentCost;

		long currentHash = hash.hash(current);
		tabuList.add(currentHash, -1);
		if(useFrequency)
			frequency.increment(currentHash);
		if(reactive)
			reactiveTenure.remember(currentHash);

		int nonImproving = 0;
		TabuObserver observer = config.getObserver();

		for(int iter = 0; iter < config.getMaxIterations(); iter++)
		{
			if(evaluator.isExhausted())
				break;

			boolean diversify = config.isDiversification() && nonImproving >= config.getDiversificationTrigger();

			int chosen = -1;
			double chosenScore = 0;
			int chosenFrequency = 0;
			boolean chosenAspirated = false;
			int bestCandidate = -1;

			for(int i = 0; i < k; i++)
			{
				neighbor.neighbor(current, candidates[i], random, context);
				costs[i] = evaluator.evaluate(candidates[i]);
				hashes[i] = hash.hash(candidates[i]);

				if(direction.isBetter(costs[i], bestCandidate < 0 ? bestCost : costs[bestCandidate]))
					bestCandidate = i;

				boolean tabu = tabuList.contains(hashes[i]);
				if(!isAdmissible(tabu, config.isAspiration(), direction, costs[i], bestCost))
					continue;

				int freq = useFrequency ? frequency.get(hashes[i]) : 0;
				double score = diversify
						? direction.penalize(costs[i], config.getDiversificationWeight() * freq)
						: costs[i];

				boolean take = chosen < 0 || direction.isBetter(score, chosenScore);
				if(!take && config.isIntensification() && score == chosenScore && freq < chosenFrequency)
					take = true;
				if(take)
				{
					chosen = i;
					chosenScore = score;
					chosenFrequency = freq;
					chosenAspirated = tabu;
				}
			}

			// Everything tabu: take the least recently forbidden candidate
			if(chosen < 0)
			{
				int oldest = Integer.MAX_VALUE;
				for(int i = 0; i < k; i++)
				{
					int inserted = tabuList.insertionIteration(hashes[i]);
					if(inserted < oldest)
					{
						oldest = inserted;
						chosen = i;
					}
				}
			}
			if(chosenAspirated)
				aspirationCount++;

			current.copyFrom(candidates[chosen]);
			currentCost = costs[chosen];
			currentHash = hashes[chosen];

			tabuList.add(currentHash, iter);
			if(useFrequency)
				frequency.increment(currentHash);
			if(reactive)
				tabuList.setTenure(reactiveTenure.update(currentHash));

			if(bestCandidate >= 0)
			{
				result.updateBest(candidates[bestCandidate], costs[bestCandidate]);
				bestCost = costs[bestCandidate];
				nonImproving = 0;
			}
			else
			{
				nonImproving++;
				if(config.isIntensification() && nonImproving % config.getIntensificationTrigger() == 0)
				{
					current.copyFrom(result.getBest());
					currentCost = bestCost;
				}
			}

			result.recordIteration(iter, bestCost);

			if(observer != null)
				observer.iterationCompleted(iter, tabuList.size(), tabuList.getTenure(),
						chosenAspirated, currentCost, bestCost);

			if(config.shouldPrint(iter))
			{
				System.out.printf("[TS] iter:%d | best:%.4f | current:%.4f | tenure:%d | tabu:%d | evals:%d%n",
						iter + 1, bestCost, currentCost, tabuList.getTenure(), tabuList.size(),
						evaluator.getNumEvaluations());
			}
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	public TabuConfig getConfig()
	{
		return config;
	}

	/**
	 * @return tabu list of the last run (null before the first run)
	 */
	public TabuList getTabuList()
	{
		return tabuList;
	}

	public FrequencyMemory getFrequencyMemory()
	{
		return frequency;
	}

	/**
	 * @return how many times the last run chose a tabu candidate through aspiration
	 */
	public int getAspirationCount()
	{
		return aspirationCount;
	}

	public int getCyclesDetected()
	{
		return reactiveTenure == null ? 0 : reactiveTenure.getCyclesDetected();
	}
}
