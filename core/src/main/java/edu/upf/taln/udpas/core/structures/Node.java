package edu.upf.taln.udpas.core.structures;

import java.util.*;

/**
 * A line of a CoNLL-U file: a word, an empty node or a multiword token.
 * Edges are stored in the nodes. Enhanced edges are recorded at both endpoints, the basic tree as a parent id
 * plus an ordered list of child ids.
 */
public final class Node
{
	private Graph graph; // graph (sentence) this node belongs to
	private final String id;
	private final String form;
	private final String lemma;
	private final String upos;
	private final String xpos;
	private final Map<String, String> feats = new HashMap<>();
	private final List<String> misc = new ArrayList<>();

	// HEAD, DEPREL and DEPS columns, kept until the graph structure is built
	private final String head;
	private final String deprel;
	private final String deps;

	private String basicParent = null;
	private String basicRelation = null;
	private final List<String> basicChildren = new ArrayList<>();
	private final List<Edge> inEdges = new ArrayList<>();
	private final List<Edge> outEdges = new ArrayList<>();

	private String predicate = null;
	private final List<ArgumentEdge> argumentEdges = new ArrayList<>();
	private String argumentPattern = null;

	public Node(String id)
	{
		this(id, null, null, null, null, null, null, null);
	}

	public Node(String id, String form, String lemma, String upos, String xpos, String head, String deprel, String deps)
	{
		if (!NodeIds.isValid(id))
			throw new IllegalArgumentException("Invalid node id '" + id + "'");
		this.id = id;
		this.form = form;
		this.lemma = lemma;
		this.upos = upos;
		this.xpos = xpos;
		this.head = head;
		this.deprel = deprel;
		this.deps = deps;
	}

	public Optional<Graph> getGraph() { return Optional.ofNullable(graph); }
	void setGraph(Graph graph) { this.graph = graph; }

	public String getId() { return id; }
	public String getForm() { return form; }
	public String getLemma() { return lemma; }
	public String getUPOS() { return upos; }
	public String getXPOS() { return xpos; }

	public Map<String, String> getFeats() { return Collections.unmodifiableMap(feats); }
	public void setFeats(Map<String, String> feats)
	{
		this.feats.clear();
		this.feats.putAll(feats);
	}

	public List<String> getMisc() { return Collections.unmodifiableList(misc); }
	public void setMisc(List<String> misc)
	{
		this.misc.clear();
		this.misc.addAll(misc);
	}

	public String getHead() { return head; }
	public String getDeprel() { return deprel; }
	public String getDeps() { return deps; }

	public Optional<String> getBasicParent() { return Optional.ofNullable(basicParent); }
	public Optional<String> getBasicRelation() { return Optional.ofNullable(basicRelation); }
	public void setBasicParent(String parent, String relation)
	{
		this.basicParent = parent;
		this.basicRelation = relation;
	}
	public List<String> getBasicChildren() { return Collections.unmodifiableList(basicChildren); }
	public void addBasicChild(String child) { basicChildren.add(child); }

	/**
	 * Checks whether this node depends, directly or indirectly, on the node with the given id in the basic tree.
	 * The walk up the parent chain is bounded by the number of nodes in the graph.
	 */
	public boolean basicDependsOn(String ancestor)
	{
		final Graph g = getGraph().orElseThrow(() -> new IllegalStateException("Node " + id + " is not member of a graph"));
		String current = basicParent;
		for (int steps = 0; steps <= g.size(); ++steps)
		{
			if (current == null || !g.hasNode(current))
				return false;
			if (current.equals(ancestor))
				return true;
			current = g.getNode(current).flatMap(Node::getBasicParent).orElse(null);
		}

		// Only reachable if the parent chain already contains a cycle not passing through the ancestor
		return false;
	}

	public List<Edge> getInEdges() { return Collections.unmodifiableList(inEdges); }
	public List<Edge> getOutEdges() { return Collections.unmodifiableList(outEdges); }
	public int getInDegree() { return inEdges.size(); }
	public boolean hasInEdge(String source, String relation) { return inEdges.contains(new Edge(source, relation)); }
	void addInEdge(Edge e) { inEdges.add(e); }
	void addOutEdge(Edge e) { outEdges.add(e); }

	public Optional<String> getPredicate() { return Optional.ofNullable(predicate); }
	public void setPredicate(String predicate) { this.predicate = predicate; }

	public List<ArgumentEdge> getArgumentEdges() { return Collections.unmodifiableList(argumentEdges); }
	public void addArgumentEdge(ArgumentEdge e)
	{
		if (graph != null)
			e.getTargets().stream()
					.filter(t -> !graph.hasNode(t))
					.findFirst()
					.ifPresent(t -> { throw new IllegalArgumentException("Argument " + e.getRole() + " of node " + id + " refers to non-existent node " + t); });
		argumentEdges.add(e);
	}

	public Optional<String> getArgumentPattern() { return Optional.ofNullable(argumentPattern); }
	public void setArgumentPattern(String pattern) { this.argumentPattern = pattern; }

	@Override
	public String toString()
	{
		return id + " " + form;
	}
}
