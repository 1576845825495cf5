package edu.upf.taln.udpas.core.structures;

import java.util.Objects;

/**
 * An enhanced dependency seen from one of its endpoints: the id of the node at the other end and the relation.
 */
public final class Edge
{
	private final String id;
	private final String relation;

	public Edge(String id, String relation)
	{
		this.id = Objects.requireNonNull(id);
		this.relation = Objects.requireNonNull(relation);
	}

	public String getId() { return id; }
	public String getRelation() { return relation; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Edge other = (Edge) o;
		return id.equals(other.id) && relation.equals(other.relation);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id, relation);
	}

	@Override
	public String toString()
	{
		return id + ":" + relation;
	}
}
