package edu.upf.taln.udpas.core.graph;

import com.google.common.base.Splitter;
import edu.upf.taln.udpas.core.diagnostics.DiagnosticsSink;
import edu.upf.taln.udpas.core.diagnostics.Warning;
import edu.upf.taln.udpas.core.structures.Graph;
import edu.upf.taln.udpas.core.structures.MissingHeadException;
import edu.upf.taln.udpas.core.structures.Node;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Creates the enhanced edges declared in the DEPS column of each node. Every edge is stored as incoming in the
 * dependent node and as outgoing in its head.
 */
public final class EnhancedEdgeIndex
{
	private static final Pattern DEP = Pattern.compile("^(\\d+(?:\\.\\d+)?):(.+)$");
	private static final Splitter splitter = Splitter.on('|').omitEmptyStrings();

	private EnhancedEdgeIndex() {}

	public static void build(Graph g, DiagnosticsSink diagnostics)
	{
		g.getNodes().forEach(n -> link(g, n, n.getDeps(), diagnostics));
	}

	/**
	 * Parses a list of head:relation pairs separated by '|' and adds the corresponding incoming edges to a node.
	 * Repeated edges are ignored.
	 * @return number of edges actually added
	 */
	public static int link(Graph g, Node node, String deps, DiagnosticsSink diagnostics)
	{
		if (deps == null || deps.isEmpty() || deps.equals("_"))
			return 0;

		int added = 0;
		for (String dep : splitter.split(deps))
		{
			final Matcher m = DEP.matcher(dep);
			if (!m.matches())
			{
				diagnostics.warn(Warning.UNPARSABLE_DEPENDENCY, "'" + dep + "' of node " + node.getId());
				continue;
			}

			final String head = m.group(1);
			final String relation = m.group(2);
			if (!g.hasNode(head))
				throw new MissingHeadException(node.getId(), head, relation);

			if (g.addEnhancedEdge(head, node.getId(), relation))
				++added;
			else
				diagnostics.warn(Warning.DUPLICATE_ENHANCED_EDGE, "'" + head + " --- " + relation + " ---> " + node.getId() + "'");
		}

		return added;
	}
}
