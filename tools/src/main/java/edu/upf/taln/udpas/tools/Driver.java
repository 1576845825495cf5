package edu.upf.taln.udpas.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.base.Stopwatch;
import edu.upf.taln.udpas.core.Options;
import edu.upf.taln.udpas.core.diagnostics.DiagnosticsReport;
import edu.upf.taln.udpas.core.diagnostics.FrequencyDiagnostics;
import edu.upf.taln.udpas.core.io.CoNLLUReader;
import edu.upf.taln.udpas.core.io.CoNLLUWriter;
import edu.upf.taln.udpas.core.pas.PASAnnotator;
import edu.upf.taln.udpas.core.structures.Graph;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.output.CloseShieldOutputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reads CoNLL-U with enhanced dependencies, infers predicate-argument structures and writes them in new columns
 * (CoNLL-U Plus). Statistics of the corpus are reported at the end of the run.
 */
public class Driver
{
	private static final String annotate_command = "annotate";
	private final static Logger log = LogManager.getLogger();

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Add predicate-argument structure to a CoNLL-U file")
	static class AnnotateCommand
	{
		@Parameter(names = {"-i", "-input"}, description = "Path to input CoNLL-U file. Standard input is read if neither this nor -udpath is given", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		Path input;
		@Parameter(names = {"-u", "-udpath"}, description = "Path to the folder with all UD treebank folders. The input is <udpath>/<folder>/<name>", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFolder.class)
		Path udpath;
		@Parameter(names = {"-f", "-folder"}, description = "UD treebank folder, e.g. UD_German-GSD", arity = 1,
				validateWith = CMLCheckers.TreebankFolder.class)
		String folder;
		@Parameter(names = {"-n", "-name"}, description = "Source file name, e.g. de_gsd-ud-train.conllu", arity = 1,
				validateWith = CMLCheckers.TreebankFileName.class)
		String name;
		@Parameter(names = {"-r", "-release"}, description = "Handle of the underlying UD release, e.g. http://hdl.handle.net/11234/1-2837", arity = 1,
				validateWith = CMLCheckers.ReleaseHandle.class)
		String release;
		@Parameter(names = {"-o", "-output"}, description = "Path to output file. Standard output is used if absent", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		Path output;
		@Parameter(names = {"-s", "-stats"}, description = "Path to file where statistics are written. Standard error is used if absent", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		Path stats;
		@Parameter(names = {"-e", "-empty"}, description = "Value of new columns when empty", arity = 1)
		String empty;
		@Parameter(names = {"-b", "-batch"}, description = "Number of sentences annotated together", arity = 1,
				converter = CMLCheckers.IntegerConverter.class, validateWith = CMLCheckers.IntegerGreaterThanZero.class)
		Integer batch;
		@Parameter(names = {"-d", "-debug"}, description = "Human-readable output with padded columns and argument patterns")
		boolean debug = false;
		@Parameter(names = {"-a", "-abort"}, description = "Stop at the first structurally invalid sentence instead of skipping it")
		boolean abort = false;
		@Parameter(names = {"-p", "-parallel"}, description = "Annotate sentences concurrently")
		boolean parallel = false;
	}

	public static void main(String[] args) throws Exception
	{
		AnnotateCommand annotate = new AnnotateCommand();
		JCommander jc = new JCommander();
		jc.addCommand(annotate_command, annotate);
		jc.parse(args);

		log.info("Running \n\t" + String.join("\n\t", args));

		if (annotate_command.equals(jc.getParsedCommand()))
		{
			AnnotationProperties properties = new AnnotationProperties();
			Options options = createOptions(annotate, properties);
			int batch_size = annotate.batch != null ? annotate.batch : properties.getBatchSize();
			Path input = resolveInput(annotate);
			log.info(options);

			FrequencyDiagnostics diagnostics;
			try (InputStream in = input != null ? Files.newInputStream(input) : System.in;
			     Writer out = new BufferedWriter(new OutputStreamWriter(annotate.output != null ?
					     Files.newOutputStream(annotate.output) : CloseShieldOutputStream.wrap(System.out), StandardCharsets.UTF_8)))
			{
				diagnostics = annotate(IOUtils.lineIterator(in, StandardCharsets.UTF_8), out, options, batch_size);
			}

			String report = DiagnosticsReport.format(diagnostics);
			if (annotate.stats != null)
				Files.writeString(annotate.stats, report, StandardCharsets.UTF_8);
			else
				System.err.print(report);
		}
		else
			jc.usage();
	}

	static Options createOptions(AnnotateCommand command, AnnotationProperties properties)
	{
		Options options = properties.toOptions();
		options.debug = command.debug;
		options.abort_on_error = command.abort || options.abort_on_error;
		options.parallel = command.parallel || options.parallel;
		if (command.empty != null)
			options.empty = command.empty;
		if (command.release != null)
			options.release = command.release;
		options.folder = command.folder;
		options.file = command.name != null ? command.name :
				command.input != null ? command.input.getFileName().toString() : null;
		return options;
	}

	static Path resolveInput(AnnotateCommand command)
	{
		if (command.input != null)
			return command.input;
		if (command.udpath == null)
			return null;
		if (command.folder == null || command.name == null)
			throw new ParameterException("-udpath requires both -folder and -name");

		Path input = command.udpath.resolve(command.folder).resolve(command.name);
		if (!Files.isRegularFile(input))
			throw new ParameterException("Cannot open file " + input);
		return input;
	}

	/**
	 * Annotates all sentences read from the given lines, in batches, and writes them to out.
	 * @return statistics collected from all sentences
	 */
	static FrequencyDiagnostics annotate(Iterator<String> lines, Writer out, Options options, int batch_size) throws IOException
	{
		Stopwatch timer = Stopwatch.createStarted();
		PASAnnotator annotator = new PASAnnotator(options);
		CoNLLUWriter writer = new CoNLLUWriter(options);
		FrequencyDiagnostics diagnostics = new FrequencyDiagnostics();

		Iterator<List<String>> blocks = CoNLLUReader.blocks(lines);
		List<List<String>> batch = new ArrayList<>();
		int num_read = 0;
		int num_written = 0;
		while (blocks.hasNext())
		{
			batch.add(blocks.next());
			if (batch.size() == batch_size || !blocks.hasNext())
			{
				List<Graph> graphs = annotator.annotate(batch, num_read + 1, diagnostics);
				out.write(writer.write(graphs));
				num_read += batch.size();
				num_written += graphs.size();
				batch.clear();
			}
		}
		if (num_written == 0)
			log.warn("No sentence written out of " + num_read);
		out.write(writer.header());
		out.flush();

		log.info("Annotated " + num_written + " sentences out of " + num_read + " in " + timer.stop());
		return diagnostics;
	}
}
