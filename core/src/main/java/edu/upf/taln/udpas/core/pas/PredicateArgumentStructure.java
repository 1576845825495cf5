package edu.upf.taln.udpas.core.pas;

import java.util.*;

/**
 * Arguments of a predicate, by slot number. Slot meanings depend on the diathesis of the clause:
 * <pre>
 *              1               2                   3               4
 *   active     -               subject             object, ccomp   iobj, otherwise xcomp
 *   passive    oblique agent   passive subject     iobj            xcomp
 * </pre>
 */
public final class PredicateArgumentStructure
{
	public static final String ROLE_PREFIX = "arg";

	private final String predicate;
	private final Diathesis diathesis;
	private final SortedMap<Integer, Set<String>> slots;
	private final String pattern;

	public PredicateArgumentStructure(String predicate, Diathesis diathesis, Map<Integer, Set<String>> slots, String pattern)
	{
		this.predicate = predicate;
		this.diathesis = diathesis;
		this.slots = Collections.unmodifiableSortedMap(new TreeMap<>(slots));
		this.pattern = pattern;
	}

	public String getPredicate() { return predicate; }
	public Diathesis getDiathesis() { return diathesis; }
	public SortedMap<Integer, Set<String>> getSlots() { return slots; }
	public Set<String> getSlot(int slot) { return slots.getOrDefault(slot, Set.of()); }
	public String getPattern() { return pattern; }

	public static String role(int slot) { return ROLE_PREFIX + slot; }

	@Override
	public String toString()
	{
		return predicate + " " + diathesis + " " + slots + " " + pattern;
	}
}
