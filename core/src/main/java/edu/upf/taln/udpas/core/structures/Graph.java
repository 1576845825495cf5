package edu.upf.taln.udpas.core.structures;

import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Holds the nodes of one sentence and its comment lines. Nodes are indexed by their CoNLL-U id. An artificial
 * root node with id 0 is always present, but it is never returned by {@link #getNodes()}.
 * A graph lives as long as the processing of its sentence.
 */
public final class Graph
{
	private final List<String> comments = new ArrayList<>();
	private final Map<String, Node> nodes = new HashMap<>();

	public Graph()
	{
		final Node root = new Node(NodeIds.ROOT);
		root.setGraph(this);
		nodes.put(NodeIds.ROOT, root);
	}

	public List<String> getComments() { return Collections.unmodifiableList(comments); }
	public void addComment(String comment) { comments.add(comment); }

	/**
	 * @return value of the sent_id comment, if any
	 */
	public Optional<String> getSentenceId()
	{
		return comments.stream()
				.filter(c -> c.matches("^#\\s*sent_id\\s*=.*"))
				.map(c -> c.substring(c.indexOf('=') + 1).trim())
				.filter(s -> !s.isEmpty())
				.findFirst();
	}

	public boolean hasNode(String id)
	{
		return nodes.containsKey(Objects.requireNonNull(id, "Undefined id"));
	}

	public Optional<Node> getNode(String id)
	{
		return Optional.ofNullable(nodes.get(Objects.requireNonNull(id, "Undefined id")));
	}

	public Node getRoot() { return nodes.get(NodeIds.ROOT); }

	/**
	 * Adds a node to the graph. Ids must be unique within the sentence.
	 */
	public void addNode(Node node)
	{
		final String id = node.getId();
		if (hasNode(id))
			throw new DuplicateIdException(id);
		nodes.put(id, node);
		node.setGraph(this);
	}

	/**
	 * Records an enhanced edge at both of its endpoints.
	 * @return false if the same labelled edge already exists, in which case nothing is recorded
	 */
	public boolean addEnhancedEdge(String source, String target, String relation)
	{
		final Node head = getNode(source).orElseThrow(() -> new MissingHeadException(target, source, relation));
		final Node dependent = getNode(target).orElseThrow(() -> new IllegalArgumentException("No node with id " + target));
		if (dependent.hasInEdge(source, relation))
			return false;

		dependent.addInEdge(new Edge(source, relation));
		head.addOutEdge(new Edge(target, relation));
		return true;
	}

	/**
	 * Number of nodes, excluding the artificial root
	 */
	public int size() { return nodes.size() - 1; }

	/**
	 * All nodes but the artificial root, sorted by id. Each iteration reflects the current contents of the graph.
	 */
	public Iterable<Node> getNodes()
	{
		return () -> nodes.keySet().stream()
				.filter(id -> !id.equals(NodeIds.ROOT))
				.sorted(NodeIds.ORDER)
				.map(nodes::get)
				.iterator();
	}

	public Stream<Node> stream()
	{
		return StreamSupport.stream(getNodes().spliterator(), false);
	}

	@Override
	public String toString()
	{
		return "Graph " + getSentenceId().orElse("") + " with " + size() + " nodes";
	}
}
