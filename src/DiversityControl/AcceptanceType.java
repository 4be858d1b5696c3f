package DiversityControl;

public enum AcceptanceType
{
	Better,
	Always,
	SALike,
	Restart;
}
