package edu.upf.taln.udpas.core.structures;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static java.util.stream.Collectors.toList;

public class GraphTest
{
	@Test
	public void nodesAreSortedWithoutRoot()
	{
		Graph g = new Graph();
		g.addNode(new Node("2"));
		g.addNode(new Node("1-2"));
		g.addNode(new Node("1"));
		g.addNode(new Node("1.1"));

		List<String> ids = g.stream().map(Node::getId).collect(toList());
		Assert.assertEquals(List.of("1-2", "1", "1.1", "2"), ids);
		Assert.assertEquals(4, g.size());
		Assert.assertTrue(g.hasNode(NodeIds.ROOT));
		Assert.assertEquals(NodeIds.ROOT, g.getRoot().getId());
	}

	@Test
	public void nodeIterationIsRestartable()
	{
		Graph g = new Graph();
		g.addNode(new Node("1"));
		Iterable<Node> nodes = g.getNodes();
		List<String> first = new ArrayList<>();
		nodes.forEach(n -> first.add(n.getId()));

		g.addNode(new Node("2"));
		List<String> second = new ArrayList<>();
		nodes.forEach(n -> second.add(n.getId()));

		Assert.assertEquals(List.of("1"), first);
		Assert.assertEquals(List.of("1", "2"), second);
	}

	@Test
	public void duplicateIdFails()
	{
		Graph g = new Graph();
		g.addNode(new Node("1"));
		try
		{
			g.addNode(new Node("1"));
			Assert.fail("Duplicate id accepted");
		}
		catch (DuplicateIdException e)
		{
			Assert.assertEquals(List.of("1"), e.getIds());
		}
		Assert.assertEquals(1, g.size());
	}

	@Test(expected = DuplicateIdException.class)
	public void rootIdIsTaken()
	{
		new Graph().addNode(new Node("0"));
	}

	@Test
	public void getNodeOfUnknownIdIsEmpty()
	{
		Graph g = new Graph();
		Assert.assertFalse(g.getNode("7").isPresent());
	}

	@Test
	public void enhancedEdgesAreSymmetric()
	{
		Graph g = new Graph();
		g.addNode(new Node("1"));
		g.addNode(new Node("2"));

		Assert.assertTrue(g.addEnhancedEdge("2", "1", "nsubj"));
		Assert.assertFalse(g.addEnhancedEdge("2", "1", "nsubj"));
		Assert.assertTrue(g.addEnhancedEdge("2", "1", "obj"));

		Node n1 = g.getNode("1").orElseThrow();
		Node n2 = g.getNode("2").orElseThrow();
		Assert.assertEquals(List.of(new Edge("2", "nsubj"), new Edge("2", "obj")), n1.getInEdges());
		Assert.assertEquals(List.of(new Edge("1", "nsubj"), new Edge("1", "obj")), n2.getOutEdges());
	}

	@Test
	public void sentenceIdComesFromComment()
	{
		Graph g = new Graph();
		g.addComment("# text = Hello");
		Assert.assertFalse(g.getSentenceId().isPresent());
		g.addComment("# sent_id = s-12");
		Assert.assertEquals("s-12", g.getSentenceId().orElseThrow());
	}

	@Test(expected = IllegalArgumentException.class)
	public void argumentTargetsMustExist()
	{
		Graph g = new Graph();
		Node n = new Node("1");
		g.addNode(n);
		n.addArgumentEdge(new ArgumentEdge("arg2", List.of("5")));
	}
}
