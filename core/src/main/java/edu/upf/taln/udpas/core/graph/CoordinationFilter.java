package edu.upf.taln.udpas.core.graph;

import edu.upf.taln.udpas.core.structures.Edge;
import edu.upf.taln.udpas.core.structures.Graph;
import edu.upf.taln.udpas.core.structures.Node;
import edu.upf.taln.udpas.core.structures.RelationFamily;

import java.util.List;
import java.util.Set;

import static java.util.stream.Collectors.toList;
import static java.util.stream.Collectors.toSet;

/**
 * Enhanced graphs propagate dependencies to all conjuncts of a coordination. When counting the dependents of a
 * node, only the edge to the first conjunct should be considered.
 */
public final class CoordinationFilter
{
	private CoordinationFilter() {}

	/**
	 * Returns the outgoing edges of a node except those leading to a node which is also attached via 'conj' to
	 * another child of the same node. Order of edges is preserved.
	 */
	public static List<Edge> filter(Graph g, Node node)
	{
		final Set<String> children = node.getOutEdges().stream()
				.map(Edge::getId)
				.collect(toSet());

		return node.getOutEdges().stream()
				.filter(e -> !isPropagated(g, e.getId(), children))
				.collect(toList());
	}

	private static boolean isPropagated(Graph g, String target, Set<String> siblings)
	{
		return g.getNode(target)
				.map(t -> t.getInEdges().stream()
						.anyMatch(in -> RelationFamily.of(in.getRelation()) == RelationFamily.COORDINATION
								&& !in.getId().equals(target)
								&& siblings.contains(in.getId())))
				.orElse(false);
	}
}
