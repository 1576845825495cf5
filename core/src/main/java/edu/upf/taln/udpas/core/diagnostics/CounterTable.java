package edu.upf.taln.udpas.core.diagnostics;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import java.util.List;

/**
 * Frequency tables collected over a corpus. Keys with several parts are joined with tabs.
 */
public enum CounterTable
{
	ARGUMENT_PATTERN,   // key: argument pattern
	PREDICATE,          // key: predicate type, predicate
	PREDICATE_PATTERN,  // key: predicate and argument pattern
	DIATHESIS;          // key: diathesis, "pred" | argument type, number of uncoordinated instances

	public static final String PREDICATE_COUNT = "pred";
	public static final String PLAIN_PREDICATE = "plain";
	public static final List<String> ARGUMENT_TYPES = List.of("subj", "obj", "iobj", "oblagent", "xcomp");
	private static final Joiner joiner = Joiner.on('\t');
	private static final Splitter splitter = Splitter.on('\t');

	public static String key(Object... parts)
	{
		return joiner.join(parts);
	}

	public static List<String> parts(String key)
	{
		return splitter.splitToList(key);
	}
}
