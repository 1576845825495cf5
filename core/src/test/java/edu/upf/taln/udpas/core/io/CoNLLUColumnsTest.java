package edu.upf.taln.udpas.core.io;

import edu.upf.taln.udpas.core.diagnostics.DiagnosticsSink;
import edu.upf.taln.udpas.core.diagnostics.FrequencyDiagnostics;
import edu.upf.taln.udpas.core.diagnostics.Warning;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class CoNLLUColumnsTest
{
	@Test
	public void features()
	{
		Map<String, String> feats = CoNLLUColumns.parseFeats("Number=Sing|Case=Nom", DiagnosticsSink.NONE);
		Assert.assertEquals(Map.of("Case", "Nom", "Number", "Sing"), feats);
		Assert.assertEquals("Case=Nom|Number=Sing", CoNLLUColumns.formatFeats(feats));
	}

	@Test
	public void layeredFeaturesAndMultipleValues()
	{
		Map<String, String> feats = CoNLLUColumns.parseFeats("PronType=Int,Rel|Gender[psor]=Masc|gender=X", DiagnosticsSink.NONE);
		Assert.assertEquals("Int,Rel", feats.get("PronType"));
		Assert.assertEquals("gender=X|Gender[psor]=Masc|PronType=Int,Rel", CoNLLUColumns.formatFeats(feats));
	}

	@Test
	public void noFeatures()
	{
		Assert.assertTrue(CoNLLUColumns.parseFeats("_", DiagnosticsSink.NONE).isEmpty());
		Assert.assertEquals("_", CoNLLUColumns.formatFeats(Map.of()));
	}

	@Test
	public void badFeatures()
	{
		FrequencyDiagnostics diagnostics = new FrequencyDiagnostics();
		Map<String, String> feats = CoNLLUColumns.parseFeats("Case=Nom|Number|Case=Acc|Foo=b-r", diagnostics);
		Assert.assertEquals(Map.of("Case", "Acc"), feats);
		Assert.assertEquals(2, diagnostics.getCount(Warning.UNPARSABLE_FEATURE));
		Assert.assertEquals(1, diagnostics.getCount(Warning.DUPLICATE_FEATURE));
	}

	@Test
	public void misc()
	{
		Assert.assertEquals(List.of("SpaceAfter=No", "Gloss=x"), CoNLLUColumns.parseMisc(" SpaceAfter=No|Gloss=x \r"));
		Assert.assertTrue(CoNLLUColumns.parseMisc("_").isEmpty());
		Assert.assertEquals("_", CoNLLUColumns.formatMisc(List.of()));
		Assert.assertEquals("SpaceAfter=No|Gloss=x", CoNLLUColumns.formatMisc(List.of("SpaceAfter=No", "Gloss=x")));
	}
}
