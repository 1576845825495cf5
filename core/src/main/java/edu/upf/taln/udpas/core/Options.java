package edu.upf.taln.udpas.core;

public class Options
{
	public boolean debug = false; // human-readable output: padded columns, new columns moved forward, argument patterns shown
	public String empty = "_"; // value of new columns when empty. CoNLL-U Plus recommends '*' for empty but known values.
	public boolean abort_on_error = false; // if true, a structurally invalid sentence stops the whole run instead of being skipped
	public boolean parallel = false; // annotate sentences concurrently
	public String release = null; // handle of the underlying UD release, e.g. http://hdl.handle.net/11234/1-2988
	public String folder = null; // UD treebank folder, e.g. UD_Czech-PUD
	public String file = null; // source file name, e.g. cs_pud-ud-test.conllu

	public Options() {}

	/**
	 * Whether there is enough information to refer to the source of each sentence
	 */
	public boolean hasSource()
	{
		return release != null && folder != null && file != null;
	}

	@Override
	public String toString()
	{
		return  "Options:" +
				"\n\tdebug = " + debug +
				"\n\tempty = " + empty +
				"\n\tabort_on_error = " + abort_on_error +
				"\n\tparallel = " + parallel +
				"\n\trelease = " + release +
				"\n\tfolder = " + folder +
				"\n\tfile = " + file;
	}
}
