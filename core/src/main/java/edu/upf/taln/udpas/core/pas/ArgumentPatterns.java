package edu.upf.taln.udpas.core.pas;

import edu.upf.taln.udpas.core.structures.Edge;
import edu.upf.taln.udpas.core.structures.RelationFamily;

import java.util.Collection;

import static java.util.stream.Collectors.joining;

/**
 * Patterns of argument-like relations observed with predicates. They help find suspicious clauses in the data and
 * could be used to establish a frame inventory.
 */
public final class ArgumentPatterns
{
	public static final String NO_ARGUMENTS = "<NOARG>"; // easier to search for than an underscore

	private ArgumentPatterns() {}

	/**
	 * @param filtered_edges outgoing edges of a predicate, without those propagated across coordination
	 * @return sorted and space-separated argument relations
	 */
	public static String pattern(Collection<Edge> filtered_edges)
	{
		final String pattern = filtered_edges.stream()
				.map(Edge::getRelation)
				.filter(RelationFamily::isArgumentLike)
				.map(ArgumentPatterns::stripEnhancedSubtypes)
				.sorted()
				.collect(joining(" "));
		return pattern.isEmpty() ? NO_ARGUMENTS : pattern;
	}

	/**
	 * Pattern prefixed with the predicate, whose spaces are replaced with underscores
	 */
	public static String predicatePattern(String predicate, String pattern)
	{
		return predicate.replaceAll("\\s+", "_") + " " + pattern;
	}

	// Enhanced subtypes for controlled and relativized arguments are irrelevant here
	static String stripEnhancedSubtypes(String relation)
	{
		return relation.replaceAll(":(xsubj|relsubj|relobj)(?=:|$)", "");
	}
}
