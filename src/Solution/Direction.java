package Solution;

/**
 * Optimization direction. {@link #isBetter(double, double)} is the single
 * comparison every engine uses; no engine compares costs with an inline sign.
 */
public enum Direction
{
	Minimize,
	Maximize;

	/**
	 * @return true when cost {@code a} is strictly better than cost {@code b}
	 */
	public boolean isBetter(double a, double b)
	{
		return (this == Minimize) ? (a < b) : (a > b);
	}

	/**
	 * Cost that every real cost beats.
	 */
	public double worst()
	{
		return (this == Minimize) ? Double.MAX_VALUE : -Double.MAX_VALUE;
	}

	/**
	 * How much worse {@code candidate} is than {@code reference}.
	 * Positive means worse, zero or negative means equal or better.
	 */
	public double delta(double candidate, double reference)
	{
		return (this == Minimize) ? (candidate - reference) : (reference - candidate);
	}

	/**
	 * Moves a cost in the worsening direction by {@code amount}.
	 */
	public double penalize(double cost, double amount)
	{
		return (this == Minimize) ? (cost + amount) : (cost - amount);
	}
}
