package Population;

import SearchMethod.SearchConfig;

/**
 * Configuration for the Memetic Algorithm (genetic algorithm + local search)
 *
 * maxIterations counts generations.
 */
public class MemeticConfig extends SearchConfig {

    public static final int MIN_POPULATION_SIZE = 4;

    private int populationSize;
    private double crossoverRate;
    private double mutationRate;
    private int elitismCount;
    private SelectionType selection;
    private int tournamentSize;
    private LearningType learning;

    // --------------------Local search-------------------
    private int lsMaxIterations;
    private int lsNeighbors;
    private double lsProbability;
    private boolean lsOnInitial;

    public MemeticConfig() {
        super(200);
        this.populationSize = 50;
        this.crossoverRate = 0.8;
        this.mutationRate = 0.05;
        this.elitismCount = 2;
        this.selection = SelectionType.Tournament;
        this.tournamentSize = 3;
        this.learning = LearningType.Lamarckian;
        this.lsMaxIterations = 50;
        this.lsNeighbors = 10;
        this.lsProbability = 1.0;
        this.lsOnInitial = true;
    }

    public int getPopulationSize() {
        return populationSize;
    }

    /**
     * Sizes below {@link #MIN_POPULATION_SIZE} are raised to it.
     */
    public void setPopulationSize(int size) {
        if (size < 1) throw new IllegalArgumentException("populationSize must be >= 1");
        this.populationSize = Math.max(MIN_POPULATION_SIZE, size);
    }

    public double getCrossoverRate() {
        return crossoverRate;
    }

    public void setCrossoverRate(double rate) {
        if (rate < 0 || rate > 1) throw new IllegalArgumentException("crossoverRate must be in [0,1]");
        this.crossoverRate = rate;
    }

    public double getMutationRate() {
        return mutationRate;
    }

    public void setMutationRate(double rate) {
        if (rate < 0 || rate > 1) throw new IllegalArgumentException("mutationRate must be in [0,1]");
        this.mutationRate = rate;
    }

    public int getElitismCount() {
        return elitismCount;
    }

    public void setElitismCount(int count) {
        if (count < 0) throw new IllegalArgumentException("elitismCount must be >= 0");
        this.elitismCount = count;
    }

    public SelectionType getSelection() {
        return selection;
    }

    public void setSelection(SelectionType selection) {
        if (selection == null) throw new IllegalArgumentException("selection must not be null");
        this.selection = selection;
    }

    public int getTournamentSize() {
        return tournamentSize;
    }

    public void setTournamentSize(int size) {
        if (size < 1) throw new IllegalArgumentException("tournamentSize must be >= 1");
        this.tournamentSize = size;
    }

    public LearningType getLearning() {
        return learning;
    }

    public void setLearning(LearningType learning) {
        if (learning == null) throw new IllegalArgumentException("learning must not be null");
        this.learning = learning;
    }

    public int getLsMaxIterations() {
        return lsMaxIterations;
    }

    public void setLsMaxIterations(int n) {
        if (n < 0) throw new IllegalArgumentException("lsMaxIterations must be >= 0");
        this.lsMaxIterations = n;
    }

    public int getLsNeighbors() {
        return lsNeighbors;
    }

    public void setLsNeighbors(int n) {
        if (n < 1) throw new IllegalArgumentException("lsNeighbors must be >= 1");
        this.lsNeighbors = n;
    }

    public double getLsProbability() {
        return lsProbability;
    }

    public void setLsProbability(double p) {
        if (p < 0 || p > 1) throw new IllegalArgumentException("lsProbability must be in [0,1]");
        this.lsProbability = p;
    }

    public boolean isLsOnInitial() {
        return lsOnInitial;
    }

    public void setLsOnInitial(boolean lsOnInitial) {
        this.lsOnInitial = lsOnInitial;
    }

    @Override
    public String toString() {
        return "Memetic: " + baseToString()
                + "\npopulationSize: " + populationSize
                + String.format("\ncrossover: %.2f | mutation: %.3f", crossoverRate, mutationRate)
                + "\nelitism: " + elitismCount
                + "\nselection: " + selection + (selection == SelectionType.Tournament ? " (k=" + tournamentSize + ")" : "")
                + "\nlearning: " + learning
                + "\nlocalSearch: " + lsMaxIterations + " rounds x " + lsNeighbors + " neighbors, p=" + lsProbability
                + (lsOnInitial ? ", initial population included" : "");
    }

    public MemeticConfig copy() {
        MemeticConfig copied = new MemeticConfig();
        copyBaseInto(copied);
        copied.populationSize = this.populationSize;
        copied.crossoverRate = this.crossoverRate;
        copied.mutationRate = this.mutationRate;
        copied.elitismCount = this.elitismCount;
        copied.selection = this.selection;
        copied.tournamentSize = this.tournamentSize;
        copied.learning = this.learning;
        copied.lsMaxIterations = this.lsMaxIterations;
        copied.lsNeighbors = this.lsNeighbors;
        copied.lsProbability = this.lsProbability;
        copied.lsOnInitial = this.lsOnInitial;
        return copied;
    }
}
