package edu.upf.taln.udpas.core.io;

import com.google.common.base.Splitter;
import edu.upf.taln.udpas.core.diagnostics.DiagnosticsSink;
import edu.upf.taln.udpas.core.diagnostics.Warning;
import edu.upf.taln.udpas.core.structures.ArgumentEdge;
import edu.upf.taln.udpas.core.structures.Edge;
import edu.upf.taln.udpas.core.structures.Node;
import edu.upf.taln.udpas.core.structures.NodeIds;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.stream.Collectors.joining;

/**
 * Conversion between column values of a CoNLL-U (Plus) file and their node representation.
 */
public final class CoNLLUColumns
{
	public static final String UNDERSCORE = "_";
	private static final Pattern FEATURE = Pattern.compile("^([A-Za-z\\[\\]]+)=([A-Za-z0-9,]+)$");
	private static final Splitter bar = Splitter.on('|');

	private CoNLLUColumns() {}

	/**
	 * Parses the FEATS column. Pairs that are not well-formed are reported and ignored.
	 */
	public static Map<String, String> parseFeats(String feats, DiagnosticsSink diagnostics)
	{
		final Map<String, String> features = new HashMap<>();
		if (feats == null || feats.isEmpty() || feats.equals(UNDERSCORE))
			return features;

		for (String fv : bar.split(feats))
		{
			final Matcher m = FEATURE.matcher(fv);
			if (!m.matches())
			{
				diagnostics.warn(Warning.UNPARSABLE_FEATURE, "'" + fv + "'");
				continue;
			}

			final String f = m.group(1);
			final String v = m.group(2);
			if (features.containsKey(f))
				diagnostics.warn(Warning.DUPLICATE_FEATURE, "'" + f + "=" + features.get(f) + "' overwritten with '" + f + "=" + v + "'");
			features.put(f, v);
		}

		return features;
	}

	/**
	 * Features sorted case-insensitively by name, '_' if there are none
	 */
	public static String formatFeats(Map<String, String> feats)
	{
		if (feats.isEmpty())
			return UNDERSCORE;

		return feats.keySet().stream()
				.sorted(String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder()))
				.map(f -> f + "=" + feats.get(f))
				.collect(joining("|"));
	}

	/**
	 * MISC attributes are opaque. No field contains leading or trailing whitespace.
	 */
	public static List<String> parseMisc(String misc)
	{
		final String trimmed = misc == null ? "" : misc.trim();
		if (trimmed.isEmpty() || trimmed.equals(UNDERSCORE))
			return new ArrayList<>();
		return new ArrayList<>(bar.splitToList(trimmed));
	}

	public static String formatMisc(List<String> misc)
	{
		return misc.isEmpty() ? UNDERSCORE : String.join("|", misc);
	}

	/**
	 * Enhanced incoming edges sorted by head id and relation
	 */
	public static String formatDeps(Node node)
	{
		if (node.getInEdges().isEmpty())
			return UNDERSCORE;

		return node.getInEdges().stream()
				.sorted(Comparator.comparing(Edge::getId, NodeIds.ORDER).thenComparing(Edge::getRelation))
				.map(Edge::toString)
				.collect(joining("|"));
	}

	/**
	 * Argument links as role:id, or role:id1,id2 for coordinated arguments, separated with '|'
	 */
	public static String formatArgs(Node node, String empty)
	{
		final List<ArgumentEdge> args = node.getArgumentEdges();
		if (args.isEmpty())
			return empty;

		return args.stream()
				.map(ArgumentEdge::toString)
				.collect(joining("|"));
	}
}
