package edu.upf.taln.udpas.core.io;

import edu.upf.taln.udpas.core.diagnostics.DiagnosticsSink;
import edu.upf.taln.udpas.core.structures.Graph;
import edu.upf.taln.udpas.core.structures.MalformedLineException;
import edu.upf.taln.udpas.core.structures.Node;
import edu.upf.taln.udpas.core.structures.NodeIds;

import java.util.*;

/**
 * Reads sentences from CoNLL-U files. Sentences are blocks of lines separated by empty lines. Within a block,
 * lines starting with '#' are comments and lines starting with a digit are nodes.
 */
public final class CoNLLUReader
{
	public static final int NUM_COLUMNS = 10;

	private CoNLLUReader() {}

	/**
	 * Splits a sequence of lines into sentence blocks. The last block need not be followed by an empty line.
	 */
	public static Iterator<List<String>> blocks(Iterator<String> lines)
	{
		return new Iterator<>()
		{
			private List<String> next = advance();

			private List<String> advance()
			{
				final List<String> block = new ArrayList<>();
				while (lines.hasNext())
				{
					final String line = stripEOL(lines.next());
					if (line.trim().isEmpty())
					{
						if (!block.isEmpty())
							return block;
					}
					else
						block.add(line);
				}
				return block.isEmpty() ? null : block;
			}

			@Override
			public boolean hasNext() { return next != null; }

			@Override
			public List<String> next()
			{
				if (next == null)
					throw new NoSuchElementException();
				final List<String> block = next;
				next = advance();
				return block;
			}
		};
	}

	public static List<List<String>> readBlocks(String conllu)
	{
		final List<List<String>> blocks = new ArrayList<>();
		blocks(Arrays.asList(conllu.split("\n", -1)).iterator()).forEachRemaining(blocks::add);
		return blocks;
	}

	/**
	 * Creates a graph from the lines of a sentence. Nodes are added but not linked: the HEAD, DEPREL and DEPS
	 * columns are kept in the nodes until the basic tree and enhanced edges are built.
	 */
	public static Graph parse(List<String> lines, DiagnosticsSink diagnostics)
	{
		final Graph g = new Graph();
		for (String line : lines)
		{
			final String l = stripEOL(line);
			if (l.startsWith("#"))
				g.addComment(l);
			else if (!l.isEmpty() && Character.isDigit(l.charAt(0)))
				g.addNode(parseNode(l, diagnostics));
		}
		return g;
	}

	private static Node parseNode(String line, DiagnosticsSink diagnostics)
	{
		final String[] fields = line.split("\t", -1);
		if (fields.length < NUM_COLUMNS)
			throw new MalformedLineException("Expected " + NUM_COLUMNS + " columns but found " + fields.length + ": " + line, fields[0]);
		if (!NodeIds.isValid(fields[0]))
			throw new MalformedLineException("Invalid node id '" + fields[0] + "'", fields[0]);

		final Node node = new Node(fields[0], fields[1], fields[2], fields[3], fields[4], fields[6], fields[7], fields[8]);
		node.setFeats(CoNLLUColumns.parseFeats(fields[5], diagnostics));
		node.setMisc(CoNLLUColumns.parseMisc(fields[9]));
		return node;
	}

	private static String stripEOL(String line)
	{
		return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
	}
}
