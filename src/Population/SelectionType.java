package Population;

public enum SelectionType {
    Tournament,
    Roulette,
    Rank
}
