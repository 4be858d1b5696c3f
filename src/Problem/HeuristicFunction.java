package Problem;

/**
 * ACO heuristic information: desirability eta(i, j) of moving from node i to
 * node j (for a TSP, 1/distance).
 */
public interface HeuristicFunction<C> {

    double desirability(int from, int to, C context);
}
