package unionfind.algorithm;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import unionfind.Config;
import unionfind.DisjointSetForest;

import java.util.*;
import java.util.function.Function;

public class ConnectedComponents {
    private static final Logger logger = LogManager.getLogger(ConnectedComponents.class);

    /**
     * Groups the provided nodes into connected components, treating every relationship defined by `getNeighbours`
     * as undirected.
     * @param nodes The universe of nodes. Neighbours outside of it are ignored.
     * @param getNeighbours Function to retrieve adjacent nodes for a given node.
     * @return A forest in which two nodes are connected iff they are in the same component.
     */
    public static <N> DisjointSetForest<N> compute(Collection<N> nodes, Function<N, Iterator<N>> getNeighbours) {
        return compute(nodes, getNeighbours, Config.withDefaults());
    }

    public static <N> DisjointSetForest<N> compute(Collection<N> nodes, Function<N, Iterator<N>> getNeighbours, Config config) {
        DisjointSetForest<N> forest = new DisjointSetForest<>(nodes, config);
        int ignored = 0;
        for (N node : nodes) {
            Iterator<N> neighbours = getNeighbours.apply(node);
            while (neighbours.hasNext()) {
                N neighbour = neighbours.next();
                if (forest.contains(neighbour)) {
                    forest.union(node, neighbour);
                } else {
                    ignored++;
                }
            }
        }
        logger.debug("found {} components among {} nodes ({} neighbours outside the node set ignored)",
                forest.setCount(), forest.size(), ignored);
        return forest;
    }

    /**
     * @return The components, each as an immutable set, ordered by the position of their first node in `nodes`.
     */
    public static <N> Collection<Set<N>> components(Collection<N> nodes, Function<N, Iterator<N>> getNeighbours) {
        return compute(nodes, getNeighbours).equivalenceClasses();
    }
}
