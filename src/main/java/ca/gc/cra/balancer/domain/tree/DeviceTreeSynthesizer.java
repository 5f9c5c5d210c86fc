package ca.gc.cra.balancer.domain.tree;

import ca.gc.cra.balancer.domain.graph.BalancerGraph;
import ca.gc.cra.balancer.domain.graph.GraphNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Builds near-minimal trees of 2-way/3-way devices: split trees fanning one source out to
 * many destinations, and merge trees fanning many sources into one stream.
 * <p><strong>Role:</strong> Second stage of balancer synthesis, driven by {@code NetworkAssembler}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Group pending roots three at a time, two only when exactly two remain.</li>
 *   <li>Allocate device ids from the shared {@link DeviceCounter}.</li>
 *   <li>Record, per destination, which splitter ultimately emits to it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; bound to a single design call's graph builder and counter.</p>
 * <p><strong>Performance:</strong> {@code n} roots need {@code ceil((n-1)/2)} devices and as many grouping rounds.</p>
 *
 * <p>Each 3-way group removes two roots and each 2-way group removes one, so preferring 3-way
 * groups reaches a single root with the fewest devices. Roots are sorted by flow then id,
 * descending, before grouping so that equal inputs always yield the same graph.</p>
 *
 * @since 0.1.0
 */
public final class DeviceTreeSynthesizer {
  private static final Comparator<Map.Entry<Integer, Long>> DESTINATION_ORDER =
      Comparator.<Map.Entry<Integer, Long>>comparingLong(Map.Entry::getValue)
          .thenComparing(Map.Entry::getKey)
          .reversed();
  private static final Comparator<Feed> SOURCE_ORDER =
      Comparator.comparingLong(Feed::flow)
          .thenComparing(feed -> feed.node().id())
          .reversed();

  private final BalancerGraph.Builder graph;
  private final DeviceCounter counter;

  /**
   * Creates a synthesizer writing into {@code graph}.
   *
   * @param graph graph under construction for the current design
   * @param counter device numbering for the current design
   */
  public DeviceTreeSynthesizer(BalancerGraph.Builder graph, DeviceCounter counter) {
    this.graph = Objects.requireNonNull(graph, "graph");
    this.counter = Objects.requireNonNull(counter, "counter");
  }

  /**
   * Fans {@code source} out to {@code destinations}.
   *
   * <p>A single destination is fed directly and no device is created. Otherwise the splitters
   * and the internal splitter-to-splitter edges are added to the graph, together with the edge
   * from {@code source} into the tree; edges from the tree into the destinations are left to
   * the caller, which learns the feeding node from the returned map.</p>
   *
   * @param source node emitting the total flow
   * @param destinations destination index to flow; must not be empty
   * @return destination index to the node (and rate) that feeds it, in the iteration order of
   *     {@code destinations}
   * @throws IllegalArgumentException if {@code destinations} is empty
   */
  public Map<Integer, Feed> buildSplitTree(GraphNode source, Map<Integer, Long> destinations) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(destinations, "destinations");
    if (destinations.isEmpty()) {
      throw new IllegalArgumentException("split tree requires at least one destination");
    }
    if (destinations.size() == 1) {
      Map.Entry<Integer, Long> only = destinations.entrySet().iterator().next();
      return Map.of(only.getKey(), new Feed(source, only.getValue()));
    }

    List<Map.Entry<Integer, Long>> ordered = new ArrayList<>(destinations.entrySet());
    ordered.sort(DESTINATION_ORDER);
    Deque<TreeRoot> roots = new ArrayDeque<>(ordered.size());
    for (Map.Entry<Integer, Long> entry : ordered) {
      roots.addLast(new TreeRoot.Leaf(entry.getKey(), entry.getValue()));
    }

    Map<Integer, Feed> destinationFeeds = new HashMap<>();
    while (roots.size() > 1) {
      int groupSize = roots.size() >= 3 ? 3 : 2;
      GraphNode splitter = graph.addNode(GraphNode.splitter(counter.next()));
      Map<Integer, Long> merged = new HashMap<>();
      for (int i = 0; i < groupSize; i++) {
        TreeRoot child = roots.pollFirst();
        if (child instanceof TreeRoot.Leaf leaf) {
          destinationFeeds.put(leaf.destination(), new Feed(splitter, leaf.flow()));
        } else if (child instanceof TreeRoot.Device device) {
          graph.addEdge(splitter, device.node(), device.flow());
        }
        merged.putAll(child.destinations());
      }
      roots.addLast(new TreeRoot.Device(splitter, merged));
    }

    TreeRoot root = roots.getFirst();
    if (!(root instanceof TreeRoot.Device top)) {
      throw new IllegalStateException("split tree finished without placing a splitter");
    }
    graph.addEdge(source, top.node(), top.flow());

    Map<Integer, Feed> result = new LinkedHashMap<>();
    for (Integer destination : destinations.keySet()) {
      Feed feed = destinationFeeds.get(destination);
      if (feed == null) {
        throw new IllegalStateException("destination " + destination + " was never attached to a splitter");
      }
      result.put(destination, feed);
    }
    return result;
  }

  /**
   * Fans {@code sources} into a single stream.
   *
   * <p>Adds the mergers and every edge into them, including the edges from the sources. The
   * edge out of the returned node is left to the caller.</p>
   *
   * @param sources streams to combine; must contain more than one entry
   * @return the merger emitting the combined flow
   * @throws IllegalStateException if fewer than two sources are supplied
   */
  public GraphNode buildMergeTree(List<Feed> sources) {
    Objects.requireNonNull(sources, "sources");
    if (sources.size() <= 1) {
      throw new IllegalStateException("merge tree requires more than one source (was " + sources.size() + ")");
    }

    List<Feed> ordered = new ArrayList<>(sources);
    ordered.sort(SOURCE_ORDER);
    Deque<Feed> streams = new ArrayDeque<>(ordered);

    while (streams.size() > 1) {
      int groupSize = streams.size() >= 3 ? 3 : 2;
      GraphNode merger = graph.addNode(GraphNode.merger(counter.next()));
      long total = 0L;
      for (int i = 0; i < groupSize; i++) {
        Feed stream = streams.pollFirst();
        graph.addEdge(stream.node(), merger, stream.flow());
        total += stream.flow();
      }
      streams.addLast(new Feed(merger, total));
    }
    return streams.getFirst().node();
  }
}
