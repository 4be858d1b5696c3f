package SearchMethod;

/**
 * Configuration for Variable Neighborhood Search
 */
public class VNSConfig extends SearchConfig {

    private VNSVariant variant;

    /** Largest shake neighborhood */
    private int kMax;

    // --------------------Local search-------------------
    private int lsMaxIterations;
    private int lsNeighbors;

    /** Neighborhoods of the descent used by the General variant */
    private int vndNeighborhoods;

    public VNSConfig() {
        super(1000);
        this.variant = VNSVariant.Basic;
        this.kMax = 5;
        this.lsMaxIterations = 200;
        this.lsNeighbors = 20;
        this.vndNeighborhoods = 3;
    }

    public VNSVariant getVariant() {
        return variant;
    }

    public void setVariant(VNSVariant variant) {
        if (variant == null) throw new IllegalArgumentException("variant must not be null");
        this.variant = variant;
    }

    public int getKMax() {
        return kMax;
    }

    public void setKMax(int kMax) {
        if (kMax < 1) throw new IllegalArgumentException("kMax must be >= 1");
        this.kMax = kMax;
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

    public int getVndNeighborhoods() {
        return vndNeighborhoods;
    }

    public void setVndNeighborhoods(int n) {
        if (n < 1) throw new IllegalArgumentException("vndNeighborhoods must be >= 1");
        this.vndNeighborhoods = n;
    }

    @Override
    public String toString() {
        return "VNS: " + baseToString()
                + "\nvariant: " + variant
                + "\nkMax: " + kMax
                + "\nlocalSearch: " + lsMaxIterations + " rounds x " + lsNeighbors + " neighbors"
                + "\nvndNeighborhoods: " + vndNeighborhoods;
    }

    public VNSConfig copy() {
        VNSConfig copied = new VNSConfig();
        copyBaseInto(copied);
        copied.variant = this.variant;
        copied.kMax = this.kMax;
        copied.lsMaxIterations = this.lsMaxIterations;
        copied.lsNeighbors = this.lsNeighbors;
        copied.vndNeighborhoods = this.vndNeighborhoods;
        return copied;
    }
}
