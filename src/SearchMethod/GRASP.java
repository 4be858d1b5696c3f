package SearchMethod;

import Auxiliary.RandomSource;
import Improvement.LocalSearch;
import Problem.ConstructFunction;
import Problem.Evaluator;
import Problem.NeighborFunction;
import Problem.ObjectiveFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Greedy Randomized Adaptive Search Procedure.
 *
 * Every iteration builds a fresh solution with the randomized greedy
 * constructor, improves it by local search and keeps the best.
 *
 * Reactive mode (Prais & Ribeiro, 2000) learns which RCL alpha pays off:
 * quality q_i = 1 / (1 + |mean_i - best|), where mean_i is the mean final cost
 * produced by alpha_i during the last block, and alphas are drawn by roulette
 * over q. An alpha not drawn during a block keeps its quality.
 */
public class GRASP<C>
{
	private final GRASPConfig config;
	private final RandomSource random;

	// Reactive state
	private double[] alphas;
	private double[] qualities;
	private double[] costSums;
	private int[] counts;

	public GRASP(GRASPConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	/**
	 * @param neighbor may be null to skip local search
	 */
	public OptResult run(int elementSize, int solutionSize, ObjectiveFunction<C> objective,
			ConstructFunction<C> construct, NeighborFunction<C> neighbor, C context)
	{
		if(elementSize <= 0 || solutionSize <= 0)
		{
			System.err.println("[GRASP] invalid solution shape: elementSize=" + elementSize + " solutionSize=" + solutionSize);
			return OptResult.empty();
		}
		if(objective == null || construct == null)
		{
			System.err.println("[GRASP] objective and construct functions are required");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		Direction direction = config.getDirection();
		Evaluator<C> evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		OptResult result = new OptResult(config.getMaxIterations());

		Solution current;
		LocalSearch<C> localSearch = null;
		try
		{
			current = new Solution(elementSize, solutionSize);
			if(neighbor != null)
				localSearch = new LocalSearch<>(evaluator, neighbor, direction, random,
						config.getLsMaxIterations(), config.getLsNeighbors(), current);
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[GRASP] could not allocate scratch buffers");
			return result;
		}

		initReactive();
		double bestCost = direction.worst();

		for(int iter = 0; iter < config.getMaxIterations(); iter++)
		{
			if(evaluator.isExhausted())
				break;

			int alphaIndex = -1;
			double alpha = config.getAlpha();
			if(config.isReactive())
			{
				if(iter > 0 && iter % config.getReactiveBlockSize() == 0)
					updateQualities(bestCost);
				alphaIndex = selectAlpha();
				alpha = alphas[alphaIndex];
			}

			construct.construct(current, alpha, random, context);
			double cost = evaluator.evaluate(current);
			if(localSearch != null)
				cost = localSearch.localSearch(current, cost);

			if(result.isEmpty() || direction.isBetter(cost, bestCost))
			{
				result.updateBest(current, cost);
				bestCost = cost;
			}

			if(alphaIndex >= 0)
			{
				costSums[alphaIndex] += cost;
				counts[alphaIndex]++;
			}

			result.recordIteration(iter, bestCost);

			if(config.shouldPrint(iter))
				System.out.printf("[GRASP] iter:%d | best:%.4f | alpha:%.3f | evals:%d%n",
						iter + 1, bestCost, alpha, evaluator.getNumEvaluations());
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	private void initReactive()
	{
		if(!config.isReactive())
		{
			alphas = null;
			qualities = null;
			return;
		}
		int m = config.getNumAlphas();
		alphas = new double[m];
		qualities = new double[m];
		costSums = new double[m];
		counts = new int[m];
		for(int i = 0; i < m; i++)
		{
			alphas[i] = (double) (i + 1) / (m + 1);
			qualities[i] = 1.0;
		}
	}

	private void updateQualities(double bestCost)
	{
		for(int i = 0; i < alphas.length; i++)
		{
			if(counts[i] > 0)
			{
				double mean = costSums[i] / counts[i];
				qualities[i] = 1.0 / (1.0 + Math.abs(mean - bestCost));
			}
			costSums[i] = 0;
			counts[i] = 0;
		}
	}

	private int selectAlpha()
	{
		double total = 0;
		for(double q : qualities)
			total += q;
		if(total <= 0)
			return random.nextInt(0, alphas.length - 1);

		double r = random.uniform() * total;
		double cumulative = 0;
		for(int i = 0; i < qualities.length; i++)
		{
			cumulative += qualities[i];
			if(r < cumulative)
				return i;
		}
		return qualities.length - 1;
	}

	/**
	 * @return candidate alphas of the last reactive run (null when not reactive)
	 */
	public double[] getAlphas()
	{
		return alphas == null ? null : alphas.clone();
	}

	/**
	 * @return selection probability of each candidate alpha at the end of the
	 *         last reactive run (null when not reactive)
	 */
	public double[] getAlphaProbabilities()
	{
		if(qualities == null)
			return null;
		double total = 0;
		for(double q : qualities)
			total += q;
		double[] probs = new double[qualities.length];
		for(int i = 0; i < qualities.length; i++)
			probs[i] = qualities[i] / total;
		return probs;
	}

	public GRASPConfig getConfig()
	{
		return config;
	}
}
