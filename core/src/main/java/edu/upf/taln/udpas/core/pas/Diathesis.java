package edu.upf.taln.udpas.core.pas;

import edu.upf.taln.udpas.core.structures.Edge;
import edu.upf.taln.udpas.core.structures.RelationFamily;

import java.util.Collection;
import java.util.Locale;

public enum Diathesis
{
	ACTIVE, PASSIVE;

	/**
	 * A clause is passive if its predicate has a passive subject among its coordination-filtered dependents.
	 */
	public static Diathesis of(Collection<Edge> filtered_edges)
	{
		return filtered_edges.stream()
				.anyMatch(e -> RelationFamily.of(e.getRelation()) == RelationFamily.SUBJECT_PASSIVE) ? PASSIVE : ACTIVE;
	}

	@Override
	public String toString()
	{
		return name().toLowerCase(Locale.ROOT);
	}
}
