package edu.upf.taln.udpas.core.graph;

import edu.upf.taln.udpas.core.structures.*;

/**
 * Links nodes to their parents in the basic tree according to their HEAD and DEPREL columns.
 */
public final class BasicTreeBuilder
{
	public static final String EMPTY = "_";

	private BasicTreeBuilder() {}

	/**
	 * Links all nodes of a graph, in id order
	 */
	public static void build(Graph g)
	{
		g.getNodes().forEach(n -> link(g, n));
	}

	/**
	 * Links a node with its parent. Both must already be in the graph, and the parent must not already depend on
	 * the node. Nodes without a head, e.g. multiword tokens, get '_' as parent and relation so that the columns
	 * are preserved in the output.
	 */
	public static void link(Graph g, Node node)
	{
		final String id = node.getId();
		final String head = node.getHead();
		final String relation = node.getDeprel() == null || node.getDeprel().isEmpty() ? EMPTY : node.getDeprel();
		if (node.getBasicParent().isPresent())
			throw new IllegalStateException("Basic parent of node " + id + " already exists");

		if (head == null || head.isEmpty() || head.equals(EMPTY))
		{
			node.setBasicParent(EMPTY, EMPTY);
			return;
		}

		if (head.equals(id))
			throw new SelfAttachmentException(id);
		final Node parent = g.getNode(head).orElseThrow(() -> new MissingHeadException(id, head, relation));
		if (parent.basicDependsOn(id))
			throw new CycleException(id, head);

		node.setBasicParent(head, relation);
		parent.addBasicChild(id);
	}
}
