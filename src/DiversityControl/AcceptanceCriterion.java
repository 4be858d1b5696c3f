package DiversityControl;

import Auxiliary.RandomSource;
import Solution.Direction;

/**
 * Acceptance criterion shared by ILS, LNS, ALNS, simulated annealing and
 * stochastic hill climbing.
 *
 * Called exactly once per outer iteration with the proposed cost and the
 * incumbent cost:
 * - Better:  accept iff strictly better
 * - Always:  accept unconditionally
 * - SALike:  accept if better, else with probability exp(-delta/T);
 *            T is multiplied by alpha on every call whatever the outcome,
 *            and T <= 0 behaves as Better
 * - Restart: Better, plus a count of consecutive non-improving calls; when the
 *            count reaches the threshold the decision is RestartFromBest and
 *            the count starts over
 *
 * The best-ever solution is not tracked here: drivers update it whenever an
 * evaluated candidate beats it, whatever this criterion decides.
 */
public class AcceptanceCriterion
{
	private final AcceptanceType type;
	private final Direction direction;
	private final RandomSource random;
	private final double initialTemperature;
	private final double alpha;
	private final int restartThreshold;

	private double temperature;
	private int noImprovementCount;

	public AcceptanceCriterion(AcceptanceType type, Direction direction, RandomSource random,
			double initialTemperature, double alpha, int restartThreshold)
	{
		this.type = type;
		this.direction = direction;
		this.random = random;
		this.initialTemperature = initialTemperature;
		this.alpha = alpha;
		this.restartThreshold = restartThreshold;
		reset();
	}

	/**
	 * Restore the initial temperature and clear the restart counter.
	 */
	public void reset()
	{
		this.temperature = initialTemperature;
		this.noImprovementCount = 0;
	}

	public AcceptanceDecision decide(double candidateCost, double incumbentCost)
	{
		boolean better = direction.isBetter(candidateCost, incumbentCost);

		switch(type)
		{
			case Always:
				return AcceptanceDecision.Accept;

			case SALike:
			{
				double t = temperature;
				temperature *= alpha;
				if(better)
					return AcceptanceDecision.Accept;
				if(t <= 0)
					return AcceptanceDecision.Reject;
				double delta = direction.delta(candidateCost, incumbentCost);
				double prob = Math.exp(-delta / t);
				return random.uniform() < prob ? AcceptanceDecision.Accept : AcceptanceDecision.Reject;
			}

			case Restart:
				if(better)
				{
					noImprovementCount = 0;
					return AcceptanceDecision.Accept;
				}
				noImprovementCount++;
				if(restartThreshold > 0 && noImprovementCount >= restartThreshold)
				{
					noImprovementCount = 0;
					return AcceptanceDecision.RestartFromBest;
				}
				return AcceptanceDecision.Reject;

			case Better:
			default:
				return better ? AcceptanceDecision.Accept : AcceptanceDecision.Reject;
		}
	}

	public AcceptanceType getType()
	{
		return type;
	}

	public double getTemperature()
	{
		return temperature;
	}

	/**
	 * Override the current temperature; drivers that run their own cooling
	 * schedule use alpha = 1 and set T between Markov chains.
	 */
	public void setTemperature(double temperature)
	{
		this.temperature = temperature;
	}

	public int getNoImprovementCount()
	{
		return noImprovementCount;
	}
}
