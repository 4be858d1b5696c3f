package Population;

import SearchMethod.SearchConfig;

/**
 * Configuration for Differential Evolution over a box [lowerBound, upperBound]^D.
 * maxIterations counts generations.
 */
public class DEConfig extends SearchConfig {

    public static final int MIN_POPULATION_SIZE = 4;

    private int populationSize;

    /** Differential weight F */
    private double weight;

    /** Binomial crossover rate CR */
    private double crossoverRate;
    private DEStrategy strategy;
    private double lowerBound;
    private double upperBound;

    public DEConfig() {
        super(1000);
        this.populationSize = 50;
        this.weight = 0.8;
        this.crossoverRate = 0.9;
        this.strategy = DEStrategy.Rand1;
        this.lowerBound = -5.12;
        this.upperBound = 5.12;
    }

    /**
     * Population actually used: at least MIN_POPULATION_SIZE and enough members
     * for the strategy's distinct random vectors.
     */
    public int effectivePopulationSize() {
        return Math.max(populationSize, Math.max(MIN_POPULATION_SIZE, strategy.getRandomVectors() + 1));
    }

    public int getPopulationSize() {
        return populationSize;
    }

    public void setPopulationSize(int size) {
        if (size < 1) throw new IllegalArgumentException("populationSize must be >= 1");
        this.populationSize = size;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double f) {
        if (f <= 0 || f > 2) throw new IllegalArgumentException("weight must be in (0,2]");
        this.weight = f;
    }

    public double getCrossoverRate() {
        return crossoverRate;
    }

    public void setCrossoverRate(double rate) {
        if (rate < 0 || rate > 1) throw new IllegalArgumentException("crossoverRate must be in [0,1]");
        this.crossoverRate = rate;
    }

    public DEStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(DEStrategy strategy) {
        if (strategy == null) throw new IllegalArgumentException("strategy must not be null");
        this.strategy = strategy;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public void setBounds(double lower, double upper) {
        if (!(upper > lower)) throw new IllegalArgumentException("upperBound must be > lowerBound");
        this.lowerBound = lower;
        this.upperBound = upper;
    }

    @Override
    public String toString() {
        return "DE: " + baseToString()
                + "\npopulationSize: " + populationSize
                + "\nstrategy: " + strategy
                + String.format("\nF: %.3f | CR: %.3f", weight, crossoverRate)
                + String.format("\nbounds: [%.3f, %.3f]", lowerBound, upperBound);
    }

    public DEConfig copy() {
        DEConfig copied = new DEConfig();
        copyBaseInto(copied);
        copied.populationSize = this.populationSize;
        copied.weight = this.weight;
        copied.crossoverRate = this.crossoverRate;
        copied.strategy = this.strategy;
        copied.lowerBound = this.lowerBound;
        copied.upperBound = this.upperBound;
        return copied;
    }
}
