package edu.uw.treetyper.main;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;

import uk.co.flamingpenguin.jewel.cli.ArgumentValidationException;
import uk.co.flamingpenguin.jewel.cli.CliFactory;
import uk.co.flamingpenguin.jewel.cli.Option;

import com.google.common.base.Stopwatch;

import edu.uw.treetyper.corpora.TreeParseException;
import edu.uw.treetyper.semantics.lexicon.Lexicon;
import edu.uw.treetyper.semantics.lexicon.ManualLexicon;
import edu.uw.treetyper.syntax.parser.AnnotatedTree;
import edu.uw.treetyper.syntax.parser.CompositionConfig;
import edu.uw.treetyper.syntax.parser.Diagnostic;
import edu.uw.treetyper.syntax.parser.TreeAnnotator;
import edu.uw.treetyper.syntax.parser.UnresolvedAmbiguityException;
import edu.uw.treetyper.util.Util;

public class TreeTyper {

	/**
	 * Command Line Interface
	 */
	public interface CommandLineArguments {
		@Option(shortName = "l", description = "Lexicon files: each line is a semantic type followed by the labels that have it, tab-separated")
		List<String> getLexicon();

		@Option(shortName = "f", defaultValue = "", description = "(Optional) File of qtree trees, one per line. Otherwise, trees are read from stdin.")
		String getInputFile();

		@Option(defaultValue = "", description = "(Optional) File to write to. Otherwise, output goes to stdout.")
		String getOutputFile();

		@Option(shortName = "o", defaultValue = "example", description = "(Optional) Output Format: one of \"example\" (gb4e example with the plain and annotated tree), \"full\" (types and rules), \"types\" or \"plain\"")
		String getOutputFormat();

		@Option(defaultValue = "100", description = "(Optional) Maximum number of composition passes per tree. Defaults to 100.")
		int getMaxPasses();

		@Option(description = "Reject trees with ambiguous words that cannot be resolved, instead of marking them as errors")
		boolean getFailOnAmbiguity();

		@Option(description = "Reject closing brackets that are not preceded by white space")
		boolean getStrict();

		@Option(defaultValue = "", description = "(Optional) Also write diagnostics to this file")
		String getLogFile();

		@Option(helpRequest = true, description = "Display this message", shortName = "h")
		boolean getHelp();
	}

	public enum OutputFormat {
		EXAMPLE, FULL, TYPES, PLAIN
	}

	public static void main(final String[] args) throws IOException {
		try {
			final CommandLineArguments commandLineOptions = CliFactory.parseArguments(CommandLineArguments.class, args);
			final OutputFormat outputFormat = OutputFormat.valueOf(commandLineOptions.getOutputFormat().toUpperCase());
			final Util.Logger logger = commandLineOptions.getLogFile().isEmpty() ? new Util.Logger()
					: new Util.Logger(Util.getFile(commandLineOptions.getLogFile()));

			final File[] lexiconFiles = commandLineOptions.getLexicon().stream().map(Util::getFile)
					.toArray(File[]::new);
			final Lexicon lexicon = ManualLexicon.load(lexiconFiles);
			logger.log("Loaded lexicon with " + lexicon.getKeys().size() + " entries");

			final CompositionConfig config = CompositionConfig.builder().maxPasses(commandLineOptions.getMaxPasses())
					.failOnUnresolvedAmbiguity(commandLineOptions.getFailOnAmbiguity())
					.strictBracketSpacing(commandLineOptions.getStrict()).build();

			final Iterator<String> inputLines;
			if (commandLineOptions.getInputFile().isEmpty()) {
				inputLines = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).lines()
						.iterator();
			} else {
				inputLines = Util.readFile(Util.getFile(commandLineOptions.getInputFile())).iterator();
			}

			final OutputStream outputStream = commandLineOptions.getOutputFile().isEmpty() ? System.out
					: new FileOutputStream(Util.getFile(commandLineOptions.getOutputFile()));
			final Writer out = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
			try {
				run(new TreeAnnotator(lexicon, config), outputFormat, inputLines, out, logger);
			} finally {
				out.flush();
				if (outputStream != System.out) {
					out.close();
				}
			}

		} catch (final ArgumentValidationException e) {
			System.err.println(e.getMessage());
			System.err.println(CliFactory.createCli(CommandLineArguments.class).getHelpMessage());
		}
	}

	/**
	 * Annotates each tree in the input and writes it out. Trees that cannot be read are reported and skipped.
	 *
	 * @return the number of trees written
	 */
	static int run(final TreeAnnotator annotator, final OutputFormat outputFormat, final Iterator<String> inputLines,
			final Writer out, final Util.Logger logger) throws IOException {
		final Stopwatch timer = Stopwatch.createStarted();
		int id = 0;
		int written = 0;
		while (inputLines.hasNext()) {
			final String line = inputLines.next().trim();
			if (line.isEmpty() || line.startsWith("%")) {
				continue;
			}
			id++;

			final AnnotatedTree tree;
			try {
				tree = annotator.annotate(line);
			} catch (final TreeParseException | UnresolvedAmbiguityException e) {
				logger.log("Tree " + id + ": " + e.getMessage());
				continue;
			}

			for (final Diagnostic diagnostic : tree.getDiagnostics()) {
				logger.log("Tree " + id + ": " + diagnostic);
			}

			out.write(print(tree, outputFormat));
			out.write("\n");
			written++;
		}

		logger.log("Trees annotated: " + written + " of " + id + " in " + timer.elapsed(TimeUnit.MILLISECONDS)
				+ "ms");
		return written;
	}

	static String print(final AnnotatedTree tree, final OutputFormat outputFormat) {
		switch (outputFormat) {
		case EXAMPLE:
			return QtreePrinter.printExample(tree, QtreePrinter.FULL_PRINTER);
		case FULL:
			return QtreePrinter.FULL_PRINTER.print(tree.getRoot());
		case TYPES:
			return QtreePrinter.TYPES_PRINTER.print(tree.getRoot());
		case PLAIN:
			return QtreePrinter.PLAIN_PRINTER.print(tree.getRoot());
		default:
			throw new IllegalArgumentException("Unknown output format: " + outputFormat);
		}
	}
}
