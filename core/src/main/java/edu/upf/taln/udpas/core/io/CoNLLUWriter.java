package edu.upf.taln.udpas.core.io;

import edu.upf.taln.udpas.core.Options;
import edu.upf.taln.udpas.core.structures.Graph;
import edu.upf.taln.udpas.core.structures.Node;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes annotated sentences in CoNLL-U Plus format: the ten CoNLL-U columns followed by DEEP:PRED and DEEP:ARGS.
 * The column declaration is written before the first sentence only.
 */
public class CoNLLUWriter
{
	public static final String COLUMNS = "# global.columns = ID FORM LEMMA UPOS XPOS FEATS HEAD DEPREL DEPS MISC DEEP:PRED DEEP:ARGS";
	public static final String DEBUG_COLUMNS = "# global.columns = ID FORM DEEP:PRED DEEP:ARGS DEEP:ARGPATT FEATS HEAD DEPREL DEPS MISC LEMMA";
	private static final Pattern SENT_ID = Pattern.compile("^#\\s*sent_id\\s*=\\s*(\\S+)");

	private final Options options;
	private boolean first = true;

	public CoNLLUWriter(Options options)
	{
		this.options = options;
	}

	public String write(List<Graph> graphs)
	{
		final StringBuilder b = new StringBuilder();
		graphs.forEach(g -> b.append(write(g)));
		return b.toString();
	}

	public String write(Graph g)
	{
		final StringBuilder b = new StringBuilder(header());

		// Comments include the initial # but no line terminators
		for (String comment : g.getComments())
		{
			final Matcher m = SENT_ID.matcher(comment);
			if (options.hasSource() && m.find())
				b.append("# source_sent_id = conllu ").append(options.release).append(' ')
						.append(options.folder).append('/').append(options.file).append(' ').append(m.group(1)).append('\n');
			b.append(comment).append('\n');
		}

		if (options.debug)
			writeDebugNodes(g, b);
		else
			g.getNodes().forEach(n -> b.append(String.join("\t",
					n.getId(), n.getForm(), n.getLemma(), n.getUPOS(), n.getXPOS(),
					CoNLLUColumns.formatFeats(n.getFeats()),
					n.getBasicParent().orElse(CoNLLUColumns.UNDERSCORE),
					n.getBasicRelation().orElse(CoNLLUColumns.UNDERSCORE),
					CoNLLUColumns.formatDeps(n),
					CoNLLUColumns.formatMisc(n.getMisc()),
					n.getPredicate().orElse(options.empty),
					CoNLLUColumns.formatArgs(n, options.empty))).append('\n'));

		return b.append('\n').toString();
	}

	/**
	 * The column declaration if it has not been written yet, otherwise an empty string. Called at the end of a
	 * run so that the output declares its columns even if no sentence was written.
	 */
	public String header()
	{
		if (!first)
			return "";
		first = false;
		return (options.debug ? DEBUG_COLUMNS : COLUMNS) + "\n";
	}

	// New columns are moved closer to the beginning and padded with spaces for readability
	private void writeDebugNodes(Graph g, StringBuilder b)
	{
		final Function<Node, String> pred = n -> n.getPredicate().orElse(options.empty);
		final Function<Node, String> args = n -> CoNLLUColumns.formatArgs(n, options.empty);
		final Function<Node, String> pattern = n -> n.getArgumentPattern().orElse(options.empty);
		final Function<Node, String> feats = n -> CoNLLUColumns.formatFeats(n.getFeats());

		final int max_form = maxLength(g, Node::getForm);
		final int max_pred = maxLength(g, pred);
		final int max_args = maxLength(g, args);
		final int max_pattern = maxLength(g, pattern);
		final int max_feats = maxLength(g, feats);

		g.getNodes().forEach(n -> b.append(String.join("\t",
				n.getId(),
				StringUtils.rightPad(n.getForm(), max_form),
				n.getUPOS(),
				StringUtils.rightPad(pred.apply(n), max_pred),
				StringUtils.rightPad(args.apply(n), max_args),
				StringUtils.rightPad(pattern.apply(n), max_pattern),
				StringUtils.rightPad(feats.apply(n), max_feats),
				n.getBasicParent().orElse(CoNLLUColumns.UNDERSCORE),
				n.getBasicRelation().orElse(CoNLLUColumns.UNDERSCORE),
				CoNLLUColumns.formatDeps(n),
				CoNLLUColumns.formatMisc(n.getMisc()),
				n.getLemma())).append('\n'));
	}

	private static int maxLength(Graph g, Function<Node, String> column)
	{
		return g.stream()
				.map(column)
				.mapToInt(StringUtils::length)
				.max().orElse(0);
	}
}
