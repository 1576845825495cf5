package edu.upf.taln.udpas.core.structures;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Node ids as they appear in the first column of a CoNLL-U file: words (3), empty nodes (3.1) and multiword
 * token intervals (3-4).
 */
public final class NodeIds
{
	public static final String ROOT = "0";
	public static final Comparator<String> ORDER = NodeIds::compare;
	// 0 is the root, 3.1 an empty node (0.1 precedes the first word), 3-4 a multiword token
	private static final Pattern ID = Pattern.compile("^(0|[1-9]\\d*)(?:\\.([1-9]\\d*)|-([1-9]\\d*))?$");

	private NodeIds() {}

	public static boolean isValid(String id)
	{
		try
		{
			parse(id);
			return true;
		}
		catch (IllegalArgumentException e)
		{
			return false;
		}
	}

	public static boolean isInterval(String id)
	{
		return parse(id)[2] > 0;
	}

	public static boolean isEmptyNode(String id)
	{
		return parse(id)[1] > 0;
	}

	/**
	 * Compares two ids in the order in which their lines appear in a CoNLL-U file.
	 * Empty node minors are compared as integers, so 3.14 follows 3.2. An interval line precedes the lines of
	 * the words it spans.
	 */
	public static int compare(String a, String b)
	{
		final int[] x = parse(a);
		final int[] y = parse(b);
		int r = Integer.compare(x[0], y[0]);
		if (r == 0)
			r = Integer.compare(x[1], y[1]);
		if (r == 0)
			r = Integer.compare(y[2], x[2]); // any interval end is "smaller" than no interval
		return r;
	}

	// major, minor, interval end (0 when absent)
	private static int[] parse(String id)
	{
		if (id == null)
			throw new IllegalArgumentException("Undefined node id");
		final Matcher m = ID.matcher(id);
		if (!m.matches())
			throw new IllegalArgumentException("Unexpected node id '" + id + "'");

		final int[] parts;
		try
		{
			parts = new int[] { Integer.parseInt(m.group(1)),
					m.group(2) != null ? Integer.parseInt(m.group(2)) : 0,
					m.group(3) != null ? Integer.parseInt(m.group(3)) : 0 };
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Node id '" + id + "' out of range", e);
		}
		if (m.group(3) != null && (parts[0] == 0 || parts[2] <= parts[0]))
			throw new IllegalArgumentException("Invalid interval '" + id + "'");
		return parts;
	}
}
