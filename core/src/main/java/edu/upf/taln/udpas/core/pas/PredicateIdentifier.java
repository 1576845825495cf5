package edu.upf.taln.udpas.core.pas;

import edu.upf.taln.udpas.core.diagnostics.CounterTable;
import edu.upf.taln.udpas.core.diagnostics.DiagnosticsSink;
import edu.upf.taln.udpas.core.structures.Edge;
import edu.upf.taln.udpas.core.structures.RelationFamily;
import edu.upf.taln.udpas.core.structures.Graph;
import edu.upf.taln.udpas.core.structures.Node;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

/**
 * Decides which nodes are verbal predicates and assigns them an identifier.
 * There is no valency lexicon to refer to, so the identifier is the lemma, extended with the forms of inherent
 * reflexives, verbal particles, light verb and serial verb compounds ("wash se", "laten zien").
 */
public final class PredicateIdentifier
{
	public static final String VERB = "VERB";

	private PredicateIdentifier() {}

	public static boolean isCandidate(Node node)
	{
		final String lemma = node.getLemma();
		return VERB.equals(node.getUPOS())
				&& lemma != null && !lemma.isEmpty() && !lemma.equals("_")
				&& !isCompoundDependent(node);
	}

	/**
	 * Verbs attached as compound to something else are not predicates on their own. In Dutch "laten zien",
	 * "zien" is attached as compound to "laten".
	 */
	private static boolean isCompoundDependent(Node node)
	{
		final boolean basic = node.getBasicRelation()
				.map(RelationFamily::of)
				.map(f -> f == RelationFamily.COMPOUND)
				.orElse(false);
		return basic || node.getInEdges().stream()
				.anyMatch(e -> RelationFamily.of(e.getRelation()) == RelationFamily.COMPOUND);
	}

	/**
	 * @return the predicate identifier of the node, or empty if the node is not a predicate
	 */
	public static Optional<String> identify(Graph g, Node node, DiagnosticsSink diagnostics)
	{
		if (!isCandidate(node))
			return Optional.empty();

		final List<Edge> extras = node.getOutEdges().stream()
				.filter(e -> isPartOfPredicate(e.getRelation()))
				.collect(toList());
		if (extras.isEmpty())
		{
			diagnostics.increment(CounterTable.PREDICATE, CounterTable.key(CounterTable.PLAIN_PREDICATE, node.getLemma()));
			return Optional.of(node.getLemma());
		}

		// TODO German and Dutch compound:prt should go as a prefix of the infinitive
		final String predicate = node.getLemma() + " " + extras.stream()
				.map(e -> g.getNode(e.getId())
						.map(Node::getForm)
						.map(f -> f.toLowerCase(Locale.ROOT))
						.orElse(""))
				.collect(joining(" "));
		extras.forEach(e -> diagnostics.increment(CounterTable.PREDICATE, CounterTable.key(e.getRelation(), predicate)));

		return Optional.of(predicate);
	}

	private static boolean isPartOfPredicate(String relation)
	{
		final RelationFamily f = RelationFamily.of(relation);
		return f == RelationFamily.REFLEXIVE || f == RelationFamily.COMPOUND;
	}
}
