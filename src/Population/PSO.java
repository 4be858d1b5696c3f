package Population;

import Auxiliary.RandomSource;
import Problem.Evaluator;
import Problem.ObjectiveFunction;
import Solution.Direction;
import Solution.OptResult;
import Solution.Solution;

/**
 * Particle Swarm Optimization over double vectors.
 *
 * v = w*v + c1*r1*(pbest - x) + c2*r2*(gbest - x), clamped to +-vMax,
 * x = clamp(x + v) into the bounds; r1 and r2 drawn per dimension.
 * vMax = vMaxRatio * (upperBound - lowerBound). For the Constriction schedule
 * w is the constriction factor.
 */
public class PSO<C>
{
	private final PSOConfig config;
	private final RandomSource random;

	public PSO(PSOConfig config)
	{
		this.config = config.copy();
		this.random = new RandomSource(config.getSeed());
	}

	/**
	 * @param dimension number of double coordinates per particle
	 */
	public OptResult run(int dimension, ObjectiveFunction<C> objective, C context)
	{
		if(dimension <= 0)
		{
			System.err.println("[PSO] invalid dimension: " + dimension);
			return OptResult.empty();
		}
		if(objective == null)
		{
			System.err.println("[PSO] objective function is required");
			return OptResult.empty();
		}

		long start = System.nanoTime();
		random.setSeed(config.getSeed());
		Direction direction = config.getDirection();
		Evaluator<C> evaluator = new Evaluator<>(objective, context, config.getMaxEvaluations());
		OptResult result = new OptResult(config.getMaxIterations());

		int n = config.getSwarmSize();
		double lower = config.getLowerBound();
		double upper = config.getUpperBound();
		double range = upper - lower;
		double vMax = config.getVMaxRatio() * range;

		Solution[] positions;
		Solution[] personalBest;
		double[] personalBestCost;
		double[][] velocities;
		double[] x;
		double[] gbest;
		try
		{
			positions = new Solution[n];
			personalBest = new Solution[n];
			for(int i = 0; i < n; i++)
			{
				positions[i] = Solution.ofDoubles(dimension);
				personalBest[i] = Solution.ofDoubles(dimension);
			}
			personalBestCost = new double[n];
			velocities = new double[n][dimension];
			x = new double[dimension];
			gbest = new double[dimension];
		}
		catch(OutOfMemoryError e)
		{
			System.err.println("[PSO] could not allocate a swarm of " + n);
			return result;
		}

		double bestCost = direction.worst();

		for(int i = 0; i < n; i++)
		{
			for(int d = 0; d < dimension; d++)
			{
				positions[i].setDouble(d, lower + random.uniform() * range);
				velocities[i][d] = -vMax + random.uniform() * 2.0 * vMax;
			}
			double cost = evaluator.evaluate(positions[i]);
			personalBest[i].copyFrom(positions[i]);
			personalBestCost[i] = cost;
			if(result.isEmpty() || direction.isBetter(cost, bestCost))
			{
				result.updateBest(positions[i], cost);
				bestCost = cost;
			}
		}

		for(int iter = 0; iter < config.getMaxIterations(); iter++)
		{
			if(evaluator.isExhausted())
				break;

			double w = config.inertiaAt(iter);
			for(int d = 0; d < dimension; d++)
				gbest[d] = result.getBest().getDouble(d);

			for(int i = 0; i < n; i++)
			{
				Solution particle = positions[i];
				Solution pbest = personalBest[i];
				double[] v = velocities[i];

				for(int d = 0; d < dimension; d++)
				{
					double r1 = random.uniform();
					double r2 = random.uniform();
					double xd = particle.getDouble(d);

					v[d] = w * v[d]
							+ config.getC1() * r1 * (pbest.getDouble(d) - xd)
							+ config.getC2() * r2 * (gbest[d] - xd);
					v[d] = clamp(v[d], -vMax, vMax);

					x[d] = clamp(xd + v[d], lower, upper);
				}
				particle.setDoubles(x);

				double cost = evaluator.evaluate(particle);
				if(direction.isBetter(cost, personalBestCost[i]))
				{
					pbest.copyFrom(particle);
					personalBestCost[i] = cost;

					if(direction.isBetter(cost, bestCost))
					{
						result.updateBest(particle, cost);
						bestCost = cost;
						for(int d = 0; d < dimension; d++)
							gbest[d] = x[d];
					}
				}
			}

			result.recordIteration(iter, bestCost);

			if(config.shouldPrint(iter))
				System.out.printf("[PSO] iter:%d | best:%.6f | w:%.4f | evals:%d%n",
						iter + 1, bestCost, w, evaluator.getNumEvaluations());
		}

		result.setNumEvaluations(evaluator.getNumEvaluations());
		result.setElapsedTimeMs((System.nanoTime() - start) / 1e6);
		return result;
	}

	static double clamp(double value, double lo, double hi)
	{
		if(value < lo)
			return lo;
		if(value > hi)
			return hi;
		return value;
	}

	public PSOConfig getConfig()
	{
		return config;
	}
}
