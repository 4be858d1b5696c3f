package Test;

import Auxiliary.RandomSource;
import Problem.ConstructFunction;
import Problem.CrossoverFunction;
import Problem.DestroyOperator;
import Problem.GenerateFunction;
import Problem.HeuristicFunction;
import Problem.MutationFunction;
import Problem.NeighborFunction;
import Problem.ObjectiveFunction;
import Problem.PerturbFunction;
import Problem.RepairOperator;
import Problem.ShakeFunction;
import Solution.Solution;

/**
 * Permutation strategies for {@link TSPInstance}. Tours are int solutions;
 * destroyed tours mark removed positions with {@link #REMOVED}.
 */
public final class TSPOperators
{
	public static final int REMOVED = -1;

	private TSPOperators()
	{
	}

	public static ObjectiveFunction<TSPInstance> tourLength()
	{
		return (solution, tsp) -> {
			double length = 0;
			int n = solution.getSize();
			for(int i = 0; i < n; i++)
				length += tsp.dist[solution.getInt(i)][solution.getInt((i + 1) % n)];
			return length;
		};
	}

	public static GenerateFunction<TSPInstance> randomTour()
	{
		return (out, random, tsp) -> {
			int tour[] = new int[tsp.n];
			for(int i = 0; i < tsp.n; i++)
				tour[i] = i;
			random.shuffle(tour, tsp.n);
			out.setInts(tour);
		};
	}

	public static NeighborFunction<TSPInstance> swap()
	{
		return (current, out, random, tsp) -> {
			out.copyFrom(current);
			randomSwap(out, random);
		};
	}

	public static NeighborFunction<TSPInstance> twoOpt()
	{
		return (current, out, random, tsp) -> {
			out.copyFrom(current);
			int n = out.getSize();
			int i = random.nextInt(0, n - 1);
			int j = random.nextInt(0, n - 1);
			if(i > j)
			{
				int tmp = i;
				i = j;
				j = tmp;
			}
			while(i < j)
				out.swapInts(i++, j--);
		};
	}

	public static PerturbFunction<TSPInstance> randomSwaps()
	{
		return (current, out, strength, random, tsp) -> {
			out.copyFrom(current);
			for(int s = 0; s < strength; s++)
				randomSwap(out, random);
		};
	}

	public static ShakeFunction<TSPInstance> shakeSwaps()
	{
		return (current, out, k, random, tsp) -> {
			out.copyFrom(current);
			for(int s = 0; s < k; s++)
				randomSwap(out, random);
		};
	}

	private static void randomSwap(Solution tour, RandomSource random)
	{
		int n = tour.getSize();
		int i = random.nextInt(0, n - 1);
		int j = random.nextInt(0, n - 2);
		if(j >= i)
			j++;
		tour.swapInts(i, j);
	}

	/**
	 * Nearest neighbor with a restricted candidate list: from the current city,
	 * any unvisited city within d_min + alpha * (d_max - d_min) may be next.
	 */
	public static ConstructFunction<TSPInstance> nearestNeighborRcl()
	{
		return (out, alpha, random, tsp) -> {
			int n = tsp.n;
			boolean visited[] = new boolean[n];
			int rcl[] = new int[n];
			int current = random.nextInt(0, n - 1);
			out.setInt(0, current);
			visited[current] = true;

			for(int step = 1; step < n; step++)
			{
				double dMin = Double.MAX_VALUE;
				double dMax = -Double.MAX_VALUE;
				for(int j = 0; j < n; j++)
				{
					if(visited[j])
						continue;
					dMin = Math.min(dMin, tsp.dist[current][j]);
					dMax = Math.max(dMax, tsp.dist[current][j]);
				}
				double threshold = dMin + alpha * (dMax - dMin);
				int size = 0;
				for(int j = 0; j < n; j++)
					if(!visited[j] && tsp.dist[current][j] <= threshold)
						rcl[size++] = j;

				current = rcl[random.nextInt(0, size - 1)];
				out.setInt(step, current);
				visited[current] = true;
			}
		};
	}

	public static DestroyOperator<TSPInstance> randomRemoval()
	{
		return (solution, destroyed, degree, random, tsp) -> {
			destroyed.copyFrom(solution);
			int n = solution.getSize();
			int positions[] = new int[n];
			for(int i = 0; i < n; i++)
				positions[i] = i;
			random.shuffle(positions, n);
			for(int r = 0; r < removalCount(n, degree); r++)
				destroyed.setInt(positions[r], REMOVED);
		};
	}

	/**
	 * Removes the cities whose detour (d(prev,c) + d(c,next) - d(prev,next)) is largest.
	 */
	public static DestroyOperator<TSPInstance> worstRemoval()
	{
		return (solution, destroyed, degree, random, tsp) -> {
			destroyed.copyFrom(solution);
			int n = solution.getSize();
			double detour[] = new double[n];
			for(int i = 0; i < n; i++)
			{
				int prev = solution.getInt((i - 1 + n) % n);
				int city = solution.getInt(i);
				int next = solution.getInt((i + 1) % n);
				detour[i] = tsp.dist[prev][city] + tsp.dist[city][next] - tsp.dist[prev][next];
			}
			for(int r = 0; r < removalCount(n, degree); r++)
			{
				int worst = -1;
				for(int i = 0; i < n; i++)
					if(destroyed.getInt(i) != REMOVED && (worst < 0 || detour[i] > detour[worst]))
						worst = i;
				destroyed.setInt(worst, REMOVED);
			}
		};
	}

	private static int removalCount(int n, double degree)
	{
		return Math.max(1, Math.min(n - 1, (int) Math.ceil(degree * n)));
	}

	/**
	 * Cheapest insertion of every removed city into the remaining partial tour.
	 */
	public static RepairOperator<TSPInstance> greedyInsertion()
	{
		return (destroyed, repaired, random, tsp) -> rebuild(destroyed, repaired, tsp, random, true);
	}

	public static RepairOperator<TSPInstance> randomInsertion()
	{
		return (destroyed, repaired, random, tsp) -> rebuild(destroyed, repaired, tsp, random, false);
	}

	private static void rebuild(Solution destroyed, Solution repaired, TSPInstance tsp, RandomSource random,
			boolean greedy)
	{
		int n = destroyed.getSize();
		int tour[] = new int[n];
		boolean present[] = new boolean[n];
		int length = 0;
		for(int i = 0; i < n; i++)
		{
			int city = destroyed.getInt(i);
			if(city != REMOVED)
			{
				tour[length++] = city;
				present[city] = true;
			}
		}

		for(int city = 0; city < n; city++)
		{
			if(present[city])
				continue;

			int position;
			if(length == 0)
				position = 0;
			else if(greedy)
			{
				position = 0;
				double bestIncrease = Double.MAX_VALUE;
				for(int p = 0; p < length; p++)
				{
					int a = tour[p];
					int b = tour[(p + 1) % length];
					double increase = tsp.dist[a][city] + tsp.dist[city][b] - tsp.dist[a][b];
					if(increase < bestIncrease)
					{
						bestIncrease = increase;
						position = p + 1;
					}
				}
			}
			else
				position = random.nextInt(0, length);

			System.arraycopy(tour, position, tour, position + 1, length - position);
			tour[position] = city;
			length++;
		}
		repaired.setInts(tour);
	}

	/**
	 * Order crossover (OX): a slice of one parent, the rest in the other's order.
	 */
	public static CrossoverFunction<TSPInstance> orderCrossover()
	{
		return (p1, p2, c1, c2, random, tsp) -> {
			int n = p1.getSize();
			int a = random.nextInt(0, n - 1);
			int b = random.nextInt(0, n - 1);
			if(a > b)
			{
				int tmp = a;
				a = b;
				b = tmp;
			}
			orderChild(p1, p2, c1, a, b);
			orderChild(p2, p1, c2, a, b);
		};
	}

	private static void orderChild(Solution slice, Solution order, Solution child, int a, int b)
	{
		int n = slice.getSize();
		boolean used[] = new boolean[n];
		for(int i = a; i <= b; i++)
		{
			child.setInt(i, slice.getInt(i));
			used[slice.getInt(i)] = true;
		}
		int pos = (b + 1) % n;
		for(int k = 0; k < n; k++)
		{
			int city = order.getInt((b + 1 + k) % n);
			if(used[city])
				continue;
			child.setInt(pos, city);
			used[city] = true;
			pos = (pos + 1) % n;
		}
	}

	public static MutationFunction<TSPInstance> swapMutation()
	{
		return (solution, rate, random, tsp) -> {
			for(int i = 0; i < solution.getSize(); i++)
				if(random.uniform() < rate)
					solution.swapInts(i, random.nextInt(0, solution.getSize() - 1));
		};
	}

	public static HeuristicFunction<TSPInstance> inverseDistance()
	{
		return (from, to, tsp) -> {
			double d = tsp.dist[from][to];
			return d > 1e-12 ? 1.0 / d : 1e12;
		};
	}
}
