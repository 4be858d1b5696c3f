package Population;

import java.util.Arrays;

import Auxiliary.RandomSource;
import Problem.Evaluator;
import Problem.HeuristicFunction;
import Problem.ObjectiveFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Ant Colony Optimization for tours over n nodes (int permutations).
 *
 * Each ant starts at a random node and extends its tour to unvisited node j
 * with probability proportional to tau[i][j]^alpha * eta(i,j)^beta. After all
 * ants are evaluated every trail evaporates by (1 - rho), then the variant's
 * deposit rule reinforces the edges (both directions) of the depositing tours.
 */
public class ACO<C>
{
	// Deposits divide by the cost; costs below this are treated as this
	private static final double MIN_COST = 1e-15;

	private final ACOConfig config;
	private final RandomSource random;

	private double[][] tau;
	private double[] probabilities;
	private boolean[] visited;

	public ACO(ACOConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	public OptResult run(int numNodes, ObjectiveFunction<C> objective, HeuristicFunction<C> heuristic, C context)
	{
		if(numNodes <= 0)
		{
			System.err.println("[ACO] invalid number of nodes: " + numNodes);
			return OptResult.empty();
		}
		if(objective == null || heuristic == null)
		{
			System.err.println("[ACO] objective and heuristic functions are required");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		Direction direction = config.getDirection();
		Evaluator<C> evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		OptResult result = new OptResult(config.getMaxIterations());

		int n = numNodes;
		int ants = config.getNumAnts();
		Solution[] tours;
		double[] costs;
		try
		{
			tau = new double[n][n];
			probabilities = new double[n];
			visited = new boolean[n];
			tours = new Solution[ants];
			for(int k = 0; k < ants; k++)
				tours[k] = Solution.ofInts(n);
			costs = new double[ants];
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[ACO] could not allocate pheromone matrix for " + n + " nodes");
			return result;
		}

		for(int i = 0; i < n; i++)
			for(int j = 0; j < n; j++)
				tau[i][j] = config.getTau0();

		double bestCost = direction.worst();

		for(int iter = 0; iter < config.getMaxIterations(); iter++)
		{
			if(evaluator.isExhausted())
				break;

			int bestAnt = 0;
			for(int k = 0; k < ants; k++)
			{
				constructTour(tours[k], n, heuristic, context);
				costs[k] = evaluator.evaluate(tours[k]);
				if(direction.isBetter(costs[k], costs[bestAnt]))
					bestAnt = k;
			}

			if(result.isEmpty() || direction.isBetter(costs[bestAnt], bestCost))
			{
				result.updateBest(tours[bestAnt], costs[bestAnt]);
				bestCost = costs[bestAnt];
			}

			evaporate(n);

			switch(config.getVariant())
			{
				case AntSystem:
					for(int k = 0; k < ants; k++)
						deposit(tours[k], n, config.getQ() / Math.max(costs[k], MIN_COST));
					break;

				case Elitist:
					for(int k = 0; k < ants; k++)
						deposit(tours[k], n, config.getQ() / Math.max(costs[k], MIN_COST));
					deposit(result.getBest(), n,
							config.getElitistWeight() * config.getQ() / Math.max(bestCost, MIN_COST));
					break;

				case MaxMin:
					if(iter % 5 == 0)
						deposit(result.getBest(), n, config.getQ() / Math.max(bestCost, MIN_COST));
					else
						deposit(tours[bestAnt], n, config.getQ() / Math.max(costs[bestAnt], MIN_COST));
					clampTrails(n);
					break;
			}

			result.recordIteration(iter, bestCost);

			if(config.shouldPrint(iter))
				System.out.printf("[ACO] iter:%d | best:%.4f | iterBest:%.4f | evals:%d%n",
						iter + 1, bestCost, costs[bestAnt], evaluator.getNumEvaluations());
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	private void constructTour(Solution tour, int n, HeuristicFunction<C> heuristic, C context)
	{
		Arrays.fill(visited, false);
		int first = random.nextInt(0, n - 1);
		tour.setInt(0, first);
		visited[first] = true;

		for(int step = 1; step < n; step++)
		{
			int current = tour.getInt(step - 1);
			double total = 0;
			for(int j = 0; j < n; j++)
			{
				if(visited[j])
					probabilities[j] = 0;
				else
				{
					probabilities[j] = Math.pow(tau[current][j], config.getAlpha())
							* Math.pow(heuristic.desirability(current, j, context), config.getBeta());
					total += probabilities[j];
				}
			}

			int chosen = -1;
			if(total > MIN_COST)
			{
				double r = random.uniform() * total;
				double cumulative = 0;
				for(int j = 0; j < n; j++)
				{
					if(probabilities[j] > 0)
					{
						cumulative += probabilities[j];
						if(cumulative >= r)
						{
							chosen = j;
							break;
						}
					}
				}
			}

			// No usable weights: first unvisited node
			if(chosen < 0)
			{
				for(int j = 0; j < n; j++)
					if(!visited[j])
					{
						chosen = j;
						break;
					}
			}

			tour.setInt(step, chosen);
			visited[chosen] = true;
		}
	}

	private void evaporate(int n)
	{
		double keep = 1.0 - config.getRho();
		for(int i = 0; i < n; i++)
			for(int j = 0; j < n; j++)
				tau[i][j] *= keep;
	}

	private void deposit(Solution tour, int n, double amount)
	{
		for(int s = 0; s < n; s++)
		{
			int from = tour.getInt(s);
			int to = tour.getInt((s + 1) % n);
			tau[from][to] += amount;
			tau[to][from] += amount;
		}
	}

	private void clampTrails(int n)
	{
		for(int i = 0; i < n; i++)
			for(int j = 0; j < n; j++)
				tau[i][j] = Math.max(config.getTauMin(), Math.min(config.getTauMax(), tau[i][j]));
	}

	/**
	 * @return pheromone trail from i to j after the last run (0 before the first run)
	 */
	public double getPheromone(int i, int j)
	{
		return tau == null ? 0.0 : tau[i][j];
	}

	public ACOConfig getConfig()
	{
		return config;
	}
}
