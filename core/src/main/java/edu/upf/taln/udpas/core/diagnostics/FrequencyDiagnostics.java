package edu.upf.taln.udpas.core.diagnostics;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregates warnings and counters into frequency tables instead of reporting every occurrence.
 * Not thread-safe: concurrent annotation uses one instance per sentence and merges them afterwards.
 */
public class FrequencyDiagnostics implements DiagnosticsSink
{
	private final Multiset<Warning> warnings = HashMultiset.create();
	private final Map<CounterTable, Multiset<String>> tables = new EnumMap<>(CounterTable.class);
	private final static Logger log = LogManager.getLogger();

	public FrequencyDiagnostics()
	{
		for (CounterTable t : CounterTable.values())
			tables.put(t, HashMultiset.create());
	}

	@Override
	public void warn(Warning kind, String context)
	{
		warnings.add(kind);
		log.debug("WARNING: " + kind.getMessage() + " " + context);
	}

	@Override
	public void increment(CounterTable table, String key)
	{
		tables.get(table).add(key);
	}

	public int getCount(Warning kind) { return warnings.count(kind); }
	public int getCount(CounterTable table, String key) { return tables.get(table).count(key); }
	public Multiset<Warning> getWarnings() { return ImmutableMultiset.copyOf(warnings); }
	public Multiset<String> getTable(CounterTable table) { return ImmutableMultiset.copyOf(tables.get(table)); }

	/**
	 * Adds the counts of another instance to this one.
	 */
	public void merge(FrequencyDiagnostics other)
	{
		warnings.addAll(other.warnings);
		other.tables.forEach((t, counts) -> tables.get(t).addAll(counts));
	}
}
