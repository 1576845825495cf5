package edu.upf.taln.udpas.core.pas;

import com.google.common.base.Stopwatch;
import edu.upf.taln.udpas.core.Options;
import edu.upf.taln.udpas.core.diagnostics.DiagnosticsSink;
import edu.upf.taln.udpas.core.diagnostics.FrequencyDiagnostics;
import edu.upf.taln.udpas.core.diagnostics.Warning;
import edu.upf.taln.udpas.core.graph.BasicTreeBuilder;
import edu.upf.taln.udpas.core.graph.EnhancedEdgeIndex;
import edu.upf.taln.udpas.core.graph.GraphConnectivity;
import edu.upf.taln.udpas.core.io.CoNLLUReader;
import edu.upf.taln.udpas.core.structures.ArgumentEdge;
import edu.upf.taln.udpas.core.structures.Graph;
import edu.upf.taln.udpas.core.structures.InvalidStructureException;
import edu.upf.taln.udpas.core.structures.Node;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toList;

/**
 * Infers the predicate-argument structure of sentences with enhanced dependencies.
 * Each sentence is processed independently of the others.
 */
public class PASAnnotator
{
	private final Options options;
	private final static Logger log = LogManager.getLogger();

	public PASAnnotator(Options options)
	{
		this.options = options;
	}

	/**
	 * Reads, links and annotates one sentence.
	 * @param lines comment and node lines of the sentence
	 * @param ordinal position of the sentence in its file, used to identify it in error messages
	 * @return the annotated graph, or empty if the sentence is structurally invalid and was skipped
	 * @throws AnnotationException if the sentence is invalid and errors must stop the run
	 */
	public Optional<Graph> annotate(List<String> lines, int ordinal, DiagnosticsSink diagnostics)
	{
		try
		{
			final Graph g = CoNLLUReader.parse(lines, diagnostics);

			// Once all nodes are in the graph, we can draw edges between them
			BasicTreeBuilder.build(g);
			EnhancedEdgeIndex.build(g, diagnostics);
			if (GraphConnectivity.countComponents(g) > 1)
				diagnostics.warn(Warning.DISCONNECTED_GRAPH, "in sentence " + describe(lines, ordinal));

			annotate(g, diagnostics);
			return Optional.of(g);
		}
		catch (InvalidStructureException e)
		{
			final String sentence = describe(lines, ordinal);
			if (options.abort_on_error)
				throw new AnnotationException(sentence, e);

			log.error("Skipping sentence " + sentence + ": " + e.getMessage() + " " + e.getIds());
			diagnostics.warn(Warning.SKIPPED_SENTENCE, "sentence " + sentence);
			return Optional.empty();
		}
	}

	/**
	 * Annotates the nodes of a graph whose basic tree and enhanced edges are already built.
	 */
	public void annotate(Graph g, DiagnosticsSink diagnostics)
	{
		for (Node node : g.getNodes())
		{
			final Optional<String> predicate = PredicateIdentifier.identify(g, node, diagnostics);
			node.setPredicate(predicate.orElse(options.empty));
			node.setArgumentPattern(options.empty);
			predicate.ifPresent(p ->
			{
				final PredicateArgumentStructure pas = RoleAssigner.assign(g, node, p, diagnostics);
				node.setArgumentPattern(pas.getPattern());
				pas.getSlots().forEach((slot, targets) ->
						node.addArgumentEdge(new ArgumentEdge(PredicateArgumentStructure.role(slot), targets)));
			});
		}
	}

	/**
	 * Annotates a batch of sentences, concurrently if so configured. Each sentence collects its own diagnostics,
	 * which are then added to the given ones in sentence order.
	 * @param first_ordinal ordinal of the first sentence in the batch
	 * @return annotated graphs in input order, without skipped sentences
	 */
	public List<Graph> annotate(List<List<String>> sentences, int first_ordinal, FrequencyDiagnostics diagnostics)
	{
		final Stopwatch timer = Stopwatch.createStarted();
		final Stream<Integer> indexes = IntStream.range(0, sentences.size()).boxed();
		final List<Pair<Optional<Graph>, FrequencyDiagnostics>> results = (options.parallel ? indexes.parallel() : indexes)
				.map(i ->
				{
					final FrequencyDiagnostics d = new FrequencyDiagnostics();
					return Pair.of(annotate(sentences.get(i), first_ordinal + i, d), d);
				})
				.collect(toList());

		results.forEach(r -> diagnostics.merge(r.getRight()));
		final List<Graph> graphs = results.stream()
				.map(Pair::getLeft)
				.flatMap(Optional::stream)
				.collect(toList());
		log.debug("Annotated " + graphs.size() + " out of " + sentences.size() + " sentences in " + timer.stop());

		return graphs;
	}

	private static String describe(List<String> lines, int ordinal)
	{
		final Graph comments = new Graph();
		lines.stream()
				.filter(l -> l.startsWith("#"))
				.forEach(comments::addComment);
		return "#" + ordinal + comments.getSentenceId().map(s -> " (" + s + ")").orElse("");
	}
}
