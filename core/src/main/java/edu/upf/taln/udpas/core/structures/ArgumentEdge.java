package edu.upf.taln.udpas.core.structures;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Collections.unmodifiableSet;

/**
 * Link from a predicate to the nodes filling one of its argument slots. Targets are kept as an ordered set even
 * when there is a single one.
 */
public final class ArgumentEdge
{
	private final String role;
	private final Set<String> targets;

	public ArgumentEdge(String role, Collection<String> targets)
	{
		if (targets.isEmpty())
			throw new IllegalArgumentException("Argument " + role + " has no targets");
		this.role = role;
		this.targets = unmodifiableSet(new LinkedHashSet<>(targets));
	}

	public String getRole() { return role; }
	public Set<String> getTargets() { return targets; }

	@Override
	public String toString()
	{
		return role + ":" + String.join(",", targets);
	}
}
