package edu.upf.taln.udpas.core.diagnostics;

import edu.upf.taln.udpas.core.Options;
import edu.upf.taln.udpas.core.pas.PASAnnotator;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static edu.upf.taln.udpas.core.TestGraphs.*;

public class DiagnosticsReportTest
{
	@Test
	public void report()
	{
		FrequencyDiagnostics diagnostics = new FrequencyDiagnostics();
		new PASAnnotator(new Options()).annotate(List.of(List.of(ACTIVE), List.of(PASSIVE), List.of(COORDINATION),
				List.of(row("1", "Se", "se", "PRON", "2", "expl:pv", "2:expl:pv"),
						row("2", "umyl", "wash", "VERB", "0", "root", "0:root"))), 1, diagnostics);
		diagnostics.warn(Warning.MULTIPLE_OBJECTS, "x");
		diagnostics.warn(Warning.MULTIPLE_OBJECTS, "y");
		diagnostics.warn(Warning.MULTIPLE_AGENTS, "z");

		String report = DiagnosticsReport.format(diagnostics);

		Assert.assertTrue(report.startsWith(
				"More than 1 direct object, not in coordination. (2 ×)\n" +
				"More than 1 oblique agent, not in coordination. (1 ×)\n"));
		Assert.assertTrue(report.contains(
				"\nObserved argument patterns (regardless of predicate):\n" +
				"<NOARG>\t1\n" +
				"iobj nsubj obj\t1\n" +
				"nsubj\t1\n" +
				"nsubj:pass obl:agent\t1\n"));
		Assert.assertTrue(report.contains(
				"\nObserved predicates:\n" +
				"plain\t3\n" +
				"expl:pv\t1\n" +
				"\n"));
		Assert.assertTrue(report.contains("wash se\texpl:pv\t1\n"));
		Assert.assertTrue(report.contains("give\tplain\t1\n"));
		Assert.assertTrue(report.contains(
				"\nObserved predicate-argument patterns:\n" +
				"give iobj nsubj obj\t1\n" +
				"sleep nsubj\t1\n" +
				"wash_se <NOARG>\t1\n" +
				"write nsubj:pass obl:agent\t1\n"));
		Assert.assertTrue(report.contains("\nNumber of active verbal clauses: 3\n"));
		Assert.assertTrue(report.contains("Number of active verbal clauses with 1 uncoordinated 'subj' arguments: 2\n"));
		Assert.assertTrue(report.contains("Number of active verbal clauses with 0 uncoordinated 'subj' arguments: 1\n"));
		Assert.assertTrue(report.contains("\nNumber of passive verbal clauses: 1\n"));
		Assert.assertTrue(report.contains("Number of passive verbal clauses with 1 uncoordinated 'oblagent' arguments: 1\n"));
	}

	@Test
	public void emptyReport()
	{
		String report = DiagnosticsReport.format(new FrequencyDiagnostics());
		Assert.assertTrue(report.startsWith("\nObserved argument patterns (regardless of predicate):\n"));
		Assert.assertFalse(report.contains("verbal clauses"));
	}
}
