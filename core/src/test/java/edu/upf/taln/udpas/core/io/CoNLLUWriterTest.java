package edu.upf.taln.udpas.core.io;

import edu.upf.taln.udpas.core.Options;
import edu.upf.taln.udpas.core.diagnostics.FrequencyDiagnostics;
import edu.upf.taln.udpas.core.pas.PASAnnotator;
import edu.upf.taln.udpas.core.structures.Graph;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static edu.upf.taln.udpas.core.TestGraphs.*;

public class CoNLLUWriterTest
{
	private static Graph annotate(Options options, String... rows)
	{
		return new PASAnnotator(options).annotate(List.of(rows), 1, new FrequencyDiagnostics()).orElseThrow();
	}

	@Test
	public void standardColumns()
	{
		Options options = new Options();
		String out = new CoNLLUWriter(options).write(annotate(options, ACTIVE));

		String expected = CoNLLUWriter.COLUMNS + "\n" +
				"# sent_id = active\n" +
				"1\tMary\tMary\tPROPN\t_\t_\t2\tnsubj\t2:nsubj\t_\t_\t_\n" +
				"2\tgave\tgive\tVERB\t_\t_\t0\troot\t0:root\t_\tgive\targ2:1|arg3:4|arg4:3\n" +
				"3\tJohn\tJohn\tPROPN\t_\t_\t2\tiobj\t2:iobj\t_\t_\t_\n" +
				"4\tbooks\tbook\tNOUN\t_\t_\t2\tobj\t2:obj\t_\t_\t_\n" +
				"\n";
		Assert.assertEquals(expected, out);
	}

	@Test
	public void headerIsWrittenOnce()
	{
		Options options = new Options();
		CoNLLUWriter writer = new CoNLLUWriter(options);
		String first = writer.write(annotate(options, ACTIVE));
		String second = writer.write(annotate(options, PASSIVE));
		String batch = writer.write(List.of(annotate(options, COORDINATION), annotate(options, ACTIVE)));

		Assert.assertTrue(first.startsWith(CoNLLUWriter.COLUMNS));
		Assert.assertTrue(second.startsWith("# sent_id = passive\n"));
		Assert.assertFalse(batch.contains("global.columns"));
		Assert.assertTrue(batch.endsWith("\n\n"));
	}

	@Test
	public void headerWithoutSentences()
	{
		Options options = new Options();
		options.debug = true;
		CoNLLUWriter writer = new CoNLLUWriter(options);
		Assert.assertEquals(CoNLLUWriter.DEBUG_COLUMNS + "\n", writer.header());
		Assert.assertEquals("", writer.header());
		Assert.assertEquals("", writer.write(List.of()));
		Assert.assertTrue(writer.write(annotate(options, ACTIVE)).startsWith("# sent_id = active\n"));
	}

	@Test
	public void headerAfterSentences()
	{
		Options options = new Options();
		CoNLLUWriter writer = new CoNLLUWriter(options);
		writer.write(annotate(options, ACTIVE));
		Assert.assertEquals("", writer.header());
	}

	@Test
	public void depsAreSorted()
	{
		Options options = new Options();
		String out = new CoNLLUWriter(options).write(annotate(options,
				row("1", "a", "a", "X", "3", "dep", "3:dep|10:dep|2.1:dep|2:obj|2:dep"),
				row("2", "b", "b", "X", "0", "root", "0:root"),
				row("2.1", "b", "b", "X", "_", "_", "_"),
				row("3", "c", "c", "X", "2", "dep", "2:dep"),
				row("4", "d", "d", "X", "2", "dep", "2:dep"),
				row("5", "e", "e", "X", "2", "dep", "2:dep"),
				row("6", "f", "f", "X", "2", "dep", "2:dep"),
				row("7", "g", "g", "X", "2", "dep", "2:dep"),
				row("8", "h", "h", "X", "2", "dep", "2:dep"),
				row("9", "i", "i", "X", "2", "dep", "2:dep"),
				row("10", "j", "j", "X", "2", "dep", "2:dep")));
		Assert.assertTrue(out.contains("\t2:dep|2:obj|2.1:dep|3:dep|10:dep\t"));
	}

	@Test
	public void sourceSentenceId()
	{
		Options options = new Options();
		options.release = "http://hdl.handle.net/11234/1-2988";
		options.folder = "UD_English-EWT";
		options.file = "en_ewt-ud-test.conllu";
		String out = new CoNLLUWriter(options).write(annotate(options, ACTIVE));

		Assert.assertTrue(out.contains("\n# source_sent_id = conllu http://hdl.handle.net/11234/1-2988 UD_English-EWT/en_ewt-ud-test.conllu active\n# sent_id = active\n"));
	}

	@Test
	public void noSourceWithoutRelease()
	{
		Options options = new Options();
		options.folder = "UD_English-EWT";
		options.file = "en_ewt-ud-test.conllu";
		Assert.assertFalse(new CoNLLUWriter(options).write(annotate(options, ACTIVE)).contains("source_sent_id"));
	}

	@Test
	public void debugLayout()
	{
		Options options = new Options();
		options.debug = true;
		String out = new CoNLLUWriter(options).write(annotate(options, PASSIVE));
		String[] lines = out.split("\n");

		Assert.assertEquals(CoNLLUWriter.DEBUG_COLUMNS, lines[0]);
		Assert.assertEquals("# sent_id = passive", lines[1]);
		String[] verb = lines[5].split("\t");
		Assert.assertEquals("4", verb[0]);
		Assert.assertEquals("written", verb[1]);
		Assert.assertEquals("VERB", verb[2]);
		Assert.assertEquals("write", verb[3]);
		Assert.assertEquals("arg1:6|arg2:2", verb[4]);
		Assert.assertEquals("nsubj:pass obl:agent", verb[5]);
		Assert.assertEquals("write", verb[11]);

		String[] det = lines[2].split("\t");
		Assert.assertEquals("The    ", det[1]);
		Assert.assertEquals("_    ", det[3]);
		Assert.assertEquals("_            ", det[4]);
	}
}
