package Test;

import Problem.CrossoverFunction;
import Problem.GenerateFunction;
import Problem.MutationFunction;
import Problem.NeighborFunction;
import Problem.ObjectiveFunction;
import Problem.ShakeFunction;

/**
 * f(x) = sum x_i^2 over [-BOUND, BOUND]^D; minimum 0 at the origin.
 * Context is the Gaussian step size of the neighbor moves.
 */
public final class SphereFunction
{
	public static final double BOUND = 5.12;

	private SphereFunction()
	{
	}

	public static ObjectiveFunction<Double> objective()
	{
		return (solution, step) -> {
			double sum = 0;
			for(int i = 0; i < solution.getSize(); i++)
			{
				double v = solution.getDouble(i);
				sum += v * v;
			}
			return sum;
		};
	}

	public static GenerateFunction<Double> uniform()
	{
		return (out, random, step) -> {
			for(int i = 0; i < out.getSize(); i++)
				out.setDouble(i, -BOUND + random.uniform() * 2 * BOUND);
		};
	}

	public static NeighborFunction<Double> gaussianStep()
	{
		return (current, out, random, step) -> {
			out.copyFrom(current);
			int i = random.nextInt(0, out.getSize() - 1);
			out.setDouble(i, clamp(out.getDouble(i) + step * random.gaussian()));
		};
	}

	public static ShakeFunction<Double> gaussianShake()
	{
		return (current, out, k, random, step) -> {
			out.copyFrom(current);
			for(int i = 0; i < out.getSize(); i++)
				out.setDouble(i, clamp(out.getDouble(i) + k * step * random.gaussian()));
		};
	}

	public static CrossoverFunction<Double> blend()
	{
		return (p1, p2, c1, c2, random, step) -> {
			for(int i = 0; i < p1.getSize(); i++)
			{
				double w = random.uniform();
				double a = p1.getDouble(i);
				double b = p2.getDouble(i);
				c1.setDouble(i, w * a + (1 - w) * b);
				c2.setDouble(i, (1 - w) * a + w * b);
			}
		};
	}

	public static MutationFunction<Double> gaussianMutation()
	{
		return (solution, rate, random, step) -> {
			for(int i = 0; i < solution.getSize(); i++)
				if(random.uniform() < rate)
					solution.setDouble(i, clamp(solution.getDouble(i) + step * random.gaussian()));
		};
	}

	private static double clamp(double v)
	{
		return Math.max(-BOUND, Math.min(BOUND, v));
	}
}
