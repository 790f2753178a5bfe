package com.gentoro.graphdb.query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdb.model.Direction;
import com.gentoro.graphdb.store.EntityStore;
import com.gentoro.graphdb.store.Node;
import com.gentoro.graphdb.store.Relationship;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Enumerates the paths of an {@link EntityStore} that satisfy a pattern.
 *
 * <p>Every node satisfying the start condition seeds a frontier holding the one-node path. Each
 * step replaces the frontier by all one-hop extensions of its paths: relationships incident to
 * the path's last node, as seen through the store's topology for the requested direction, that
 * pass the step's type filter and lead to a node satisfying the step's condition. A path with no
 * extension is dropped; the paths left after the last step are the result.
 *
 * <p>No cycle detection is done: a node or relationship may appear several times in one path, and
 * the same relationship may be used by any number of paths. Cost is bounded only by the pattern
 * length and the branching factor.
 */
public class PathMatcher {
  private static final Logger log =
      com.gentoro.graphdb.logging.LoggingService.getLogger(PathMatcher.class);

  private final EntityStore store;

  public PathMatcher(EntityStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  public List<MatchedPath> match(PathQuery query) {
    return match(query.start(), query.steps(), query.direction());
  }

  public List<MatchedPath> match(Condition start, List<PatternStep> pattern, Direction direction) {
    Direction dir = direction != null ? direction : Direction.OUT;
    List<PatternStep> steps = pattern != null ? pattern : List.of();
    // Views are built once per node per query.
    Map<Object, ObjectNode> views = new HashMap<>();

    List<MatchedPath> results = new ArrayList<>();
    int seeds = 0;
    for (Node node : store.nodes()) {
      if (!ConditionEvaluator.evaluate(viewOf(node, views), start)) continue;
      seeds++;
      List<MatchedPath> frontier = List.of(MatchedPath.startingAt(node));
      for (PatternStep step : steps) {
        frontier = expand(frontier, step, dir, views);
        if (frontier.isEmpty()) break;
      }
      results.addAll(frontier);
    }
    log.debug(
        "Pattern of {} step(s), direction {}: {} start node(s), {} path(s)",
        steps.size(),
        dir,
        seeds,
        results.size());
    return results;
  }

  private List<MatchedPath> expand(
      List<MatchedPath> frontier,
      PatternStep step,
      Direction direction,
      Map<Object, ObjectNode> views) {
    List<MatchedPath> next = new ArrayList<>();
    for (MatchedPath path : frontier) {
      Object tailId = path.tail().id();
      for (Relationship rel : store.relationshipsOf(tailId, direction)) {
        if (!step.typeFilter().matches(rel.type())) continue;
        Node neighbor = store.node(rel.otherEnd(tailId));
        if (ConditionEvaluator.evaluate(viewOf(neighbor, views), step.nodeCondition())) {
          next.add(path.extend(rel, neighbor));
        }
      }
    }
    return next;
  }

  private static ObjectNode viewOf(Node node, Map<Object, ObjectNode> views) {
    return views.computeIfAbsent(node.id(), id -> node.toView());
  }
}
