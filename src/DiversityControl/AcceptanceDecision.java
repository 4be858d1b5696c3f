package DiversityControl;

/**
 * Outcome of one acceptance test.
 *
 * RestartFromBest rejects the candidate and asks the driver to reset its
 * incumbent to the best-known solution.
 */
public enum AcceptanceDecision
{
	Accept,
	Reject,
	RestartFromBest;

	public boolean isAccepted()
	{
		return this == Accept;
	}
}
