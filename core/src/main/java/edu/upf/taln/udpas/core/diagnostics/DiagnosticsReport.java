package edu.upf.taln.udpas.core.diagnostics;

import com.google.common.collect.Multiset;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import static java.util.stream.Collectors.*;

/**
 * Formats the frequency tables collected during a run as a plain text report.
 */
public final class DiagnosticsReport
{
	private DiagnosticsReport() {}

	public static String format(FrequencyDiagnostics diagnostics)
	{
		final StringBuilder b = new StringBuilder();

		// Warnings, most frequent first
		final Multiset<Warning> warnings = diagnostics.getWarnings();
		warnings.elementSet().stream()
				.sorted(Comparator.<Warning>comparingInt(warnings::count).reversed().thenComparing(Warning::ordinal))
				.forEach(w -> b.append(w.getMessage()).append(" (").append(warnings.count(w)).append(" ×)\n"));

		// Argument patterns regardless of predicate
		b.append("\nObserved argument patterns (regardless of predicate):\n");
		final Multiset<String> patterns = diagnostics.getTable(CounterTable.ARGUMENT_PATTERN);
		patterns.elementSet().stream()
				.sorted(Comparator.<String>comparingInt(patterns::count).reversed().thenComparing(Comparator.naturalOrder()))
				.forEach(p -> b.append(p).append('\t').append(patterns.count(p)).append('\n'));

		// Predicates by type, plain ones first
		b.append("\nObserved predicates:\n");
		final Multiset<String> predicates = diagnostics.getTable(CounterTable.PREDICATE);
		final Map<String, List<String>> by_type = predicates.elementSet().stream()
				.map(CounterTable::parts)
				.collect(groupingBy(p -> p.get(0), TreeMap::new, mapping(p -> p.get(1), toList())));
		if (by_type.containsKey(CounterTable.PLAIN_PREDICATE))
			b.append(CounterTable.PLAIN_PREDICATE).append('\t').append(by_type.get(CounterTable.PLAIN_PREDICATE).size()).append('\n');
		by_type.forEach((type, list) ->
		{
			if (!type.equals(CounterTable.PLAIN_PREDICATE))
				b.append(type).append('\t').append(list.size()).append('\n');
		});
		b.append('\n');
		by_type.forEach((type, list) -> list.stream()
				.sorted()
				.forEach(p -> b.append(p).append('\t').append(type).append('\t')
						.append(predicates.count(CounterTable.key(type, p))).append('\n')));

		// Predicates with their argument patterns
		b.append("\nObserved predicate-argument patterns:\n");
		final Multiset<String> predicate_patterns = diagnostics.getTable(CounterTable.PREDICATE_PATTERN);
		new TreeSet<>(predicate_patterns.elementSet())
				.forEach(p -> b.append(p).append('\t').append(predicate_patterns.count(p)).append('\n'));

		// Argument counts per diathesis
		final Multiset<String> diathesis = diagnostics.getTable(CounterTable.DIATHESIS);
		final Map<String, List<List<String>>> by_diathesis = diathesis.elementSet().stream()
				.map(CounterTable::parts)
				.collect(groupingBy(p -> p.get(0), TreeMap::new, toList()));
		by_diathesis.forEach((type, keys) ->
		{
			final int num_clauses = diathesis.count(CounterTable.key(type, CounterTable.PREDICATE_COUNT));
			b.append("\nNumber of ").append(type).append(" verbal clauses: ").append(num_clauses).append('\n');
			for (String argument_type : CounterTable.ARGUMENT_TYPES)
			{
				keys.stream()
						.filter(k -> k.size() == 3 && k.get(1).equals(argument_type))
						.map(k -> Integer.parseInt(k.get(2)))
						.sorted()
						.forEach(n -> b.append("Number of ").append(type).append(" verbal clauses with ").append(n)
								.append(" uncoordinated '").append(argument_type).append("' arguments: ")
								.append(diathesis.count(CounterTable.key(type, argument_type, n))).append('\n'));
			}
		});

		return b.toString();
	}
}
