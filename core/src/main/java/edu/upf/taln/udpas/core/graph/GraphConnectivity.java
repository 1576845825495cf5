package edu.upf.taln.udpas.core.graph;

import edu.upf.taln.udpas.core.structures.Edge;
import edu.upf.taln.udpas.core.structures.Graph;
import edu.upf.taln.udpas.core.structures.NodeIds;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedPseudograph;

/**
 * Weak connectivity of the enhanced graph of a sentence. Multiword token lines take no part in it.
 */
public final class GraphConnectivity
{
	private GraphConnectivity() {}

	/**
	 * @return number of weakly connected components of the enhanced graph, including the artificial root, or 0
	 * if the sentence has no enhanced edges at all
	 */
	public static int countComponents(Graph g)
	{
		if (g.stream().allMatch(n -> n.getInEdges().isEmpty()))
			return 0;

		final DirectedPseudograph<String, DefaultEdge> enhanced = new DirectedPseudograph<>(DefaultEdge.class);
		enhanced.addVertex(NodeIds.ROOT);
		g.stream()
				.filter(n -> !NodeIds.isInterval(n.getId()))
				.forEach(n -> enhanced.addVertex(n.getId()));
		g.stream()
				.filter(n -> !NodeIds.isInterval(n.getId()))
				.forEach(n ->
				{
					for (Edge e : n.getInEdges())
						enhanced.addEdge(e.getId(), n.getId());
				});

		return new ConnectivityInspector<>(enhanced).connectedSets().size();
	}
}
