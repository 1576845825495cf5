package edu.upf.taln.udpas.core.pas;

import com.google.common.collect.ImmutableMap;
import edu.upf.taln.udpas.core.diagnostics.CounterTable;
import edu.upf.taln.udpas.core.diagnostics.DiagnosticsSink;
import edu.upf.taln.udpas.core.diagnostics.Warning;
import edu.upf.taln.udpas.core.graph.CoordinationFilter;
import edu.upf.taln.udpas.core.structures.Edge;
import edu.upf.taln.udpas.core.structures.RelationFamily;
import edu.upf.taln.udpas.core.structures.Graph;
import edu.upf.taln.udpas.core.structures.Node;

import java.util.*;
import java.util.function.Predicate;

/**
 * Identifies the arguments of verbal predicates and assigns them to numbered slots according to the diathesis of
 * the clause.
 * Arguments are counted without dependencies propagated across coordination, which allows spotting clauses with
 * several instances of the same argument. When marking the arguments, all conjuncts are included.
 */
public final class RoleAssigner
{
	private RoleAssigner() {}

	public static PredicateArgumentStructure assign(Graph g, Node node, String predicate, DiagnosticsSink diagnostics)
	{
		final List<Edge> filtered = CoordinationFilter.filter(g, node);
		final List<Edge> edges = node.getOutEdges();
		final Diathesis diathesis = Diathesis.of(filtered);
		final String context = context(g, node);

		// Uncoordinated instances of each argument type
		final int num_subj_active = count(filtered, RelationFamily.SUBJECT);
		final int num_subj_passive = count(filtered, RelationFamily.SUBJECT_PASSIVE);
		final int num_obj = count(filtered, RelationFamily.OBJECT);
		final int num_iobj = count(filtered, RelationFamily.IOBJ);
		final int num_agent = count(filtered, RelationFamily.OBLIQUE_AGENT);
		final int num_xcomp = count(filtered, RelationFamily.XCOMP);

		final Map<String, Integer> counts = ImmutableMap.of(
				"subj", diathesis == Diathesis.ACTIVE ? num_subj_active : num_subj_passive,
				"obj", num_obj,
				"iobj", num_iobj,
				"oblagent", num_agent,
				"xcomp", num_xcomp);
		diagnostics.increment(CounterTable.DIATHESIS, CounterTable.key(diathesis, CounterTable.PREDICATE_COUNT));
		counts.forEach((type, n) -> diagnostics.increment(CounterTable.DIATHESIS, CounterTable.key(diathesis, type, n)));

		if (num_subj_active + num_subj_passive > 1)
			diagnostics.warn(Warning.MULTIPLE_SUBJECTS, context);
		if (num_obj > 1)
			diagnostics.warn(Warning.MULTIPLE_OBJECTS, context);
		if (num_iobj > 1)
			diagnostics.warn(Warning.MULTIPLE_INDIRECT_OBJECTS, context);
		if (num_agent > 1)
			diagnostics.warn(Warning.MULTIPLE_AGENTS, context);
		if (num_xcomp > 1)
			diagnostics.warn(Warning.MULTIPLE_XCOMPS, context);
		if (diathesis == Diathesis.PASSIVE && num_subj_active > 0)
			diagnostics.warn(Warning.ACTIVE_SUBJECT_IN_PASSIVE, context);
		if (diathesis == Diathesis.PASSIVE && num_obj > 0)
			diagnostics.warn(Warning.OBJECT_IN_PASSIVE, context);

		final Map<Integer, Set<String>> slots = new HashMap<>();
		if (diathesis == Diathesis.ACTIVE)
		{
			fill(slots, 2, edges, RelationFamily::isSubject);
			fill(slots, 3, edges, f -> f == RelationFamily.OBJECT);
			fill(slots, 4, edges, f -> f == RelationFamily.IOBJ);

			// iobj together with xcomp seems to be an annotation error; iobj keeps the slot
			final Set<String> xcomps = targets(edges, f -> f == RelationFamily.XCOMP);
			if (!xcomps.isEmpty() && slots.containsKey(4))
				diagnostics.warn(Warning.IOBJ_XCOMP_CONFLICT, context);
			else if (!xcomps.isEmpty())
				slots.put(4, xcomps);
		}
		else
		{
			fill(slots, 1, edges, f -> f == RelationFamily.OBLIQUE_AGENT);
			fill(slots, 2, edges, f -> f == RelationFamily.SUBJECT_PASSIVE);
			fill(slots, 3, edges, f -> f == RelationFamily.IOBJ);
			fill(slots, 4, edges, f -> f == RelationFamily.XCOMP);
		}

		final String pattern = ArgumentPatterns.pattern(filtered);
		diagnostics.increment(CounterTable.ARGUMENT_PATTERN, pattern);
		diagnostics.increment(CounterTable.PREDICATE_PATTERN, ArgumentPatterns.predicatePattern(predicate, pattern));

		return new PredicateArgumentStructure(predicate, diathesis, slots, pattern);
	}

	private static int count(List<Edge> edges, RelationFamily family)
	{
		return (int) edges.stream()
				.filter(e -> RelationFamily.of(e.getRelation()) == family)
				.count();
	}

	private static Set<String> targets(List<Edge> edges, Predicate<RelationFamily> family)
	{
		final Set<String> targets = new LinkedHashSet<>();
		edges.stream()
				.filter(e -> family.test(RelationFamily.of(e.getRelation())))
				.map(Edge::getId)
				.forEach(targets::add);
		return targets;
	}

	private static void fill(Map<Integer, Set<String>> slots, int slot, List<Edge> edges, Predicate<RelationFamily> family)
	{
		final Set<String> targets = targets(edges, family);
		if (!targets.isEmpty())
			slots.put(slot, targets);
	}

	private static String context(Graph g, Node node)
	{
		return "in sentence " + g.getSentenceId().orElse("?") + " at node " + node.getId() + " '" + node.getForm() + "'";
	}
}
