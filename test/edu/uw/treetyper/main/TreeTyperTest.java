package edu.uw.treetyper.main;

import static com.google.common.truth.Truth.assertThat;

import java.io.File;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.ImmutableMap;

import edu.uw.treetyper.main.TreeTyper.OutputFormat;
import edu.uw.treetyper.semantics.lexicon.ManualLexicon;
import edu.uw.treetyper.syntax.parser.CompositionConfig;
import edu.uw.treetyper.syntax.parser.TreeAnnotator;
import edu.uw.treetyper.util.Util;

public class TreeTyperTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static final ManualLexicon LEXICON = new ManualLexicon(ImmutableMap.<String, List<String>> of("e",
			Arrays.asList("Andrew", "run"), "<e,t>", Arrays.asList("sleeps", "run")));

	@Test
	public void skipsBadTreesAndComments() throws Exception {
		final StringWriter out = new StringWriter();
		final int written = TreeTyper.run(new TreeAnnotator(LEXICON), OutputFormat.TYPES, Arrays.asList(
				"% a comment", "", "[.S Andrew sleeps ]", "[.S [.NP Andrew ]", "[.S Bob sleeps ]").iterator(), out,
				new Util.Logger());

		assertThat(written).isEqualTo(2);
		assertThat(out.toString()).isEqualTo("[.S_{t} Andrew_{e} sleeps_{\\langle e,\\,t\\rangle} ]\n"
				+ "[.S_{\\bot} Bob_{\\bot} sleeps_{\\langle e,\\,t\\rangle} ]\n");
	}

	@Test
	public void unresolvedAmbiguityCanSkipTree() throws Exception {
		final TreeAnnotator annotator = new TreeAnnotator(LEXICON, CompositionConfig.builder()
				.failOnUnresolvedAmbiguity(true).build());
		final File log = folder.newFile("log.txt");
		final StringWriter out = new StringWriter();
		final int written = TreeTyper.run(annotator, OutputFormat.PLAIN, Arrays.asList("[.S run run ]",
				"[.S Andrew run ]").iterator(), out, new Util.Logger(log));

		assertThat(written).isEqualTo(1);
		assertThat(out.toString()).isEqualTo("[.S Andrew run ]\n");
		assertThat(new String(Files.readAllBytes(log.toPath()), StandardCharsets.UTF_8)).contains("Tree 1");
	}

	@Test
	public void commandLine() throws Exception {
		final File lexicon = folder.newFile("lexicon.txt");
		Files.write(lexicon.toPath(), "e\tAndrew\n<e,t>\tsleeps\n".getBytes(StandardCharsets.UTF_8));
		final File input = folder.newFile("trees.txt");
		Files.write(input.toPath(), "[.\\node(top){S }; Andrew sleeps ]\n".getBytes(StandardCharsets.UTF_8));
		final File output = new File(folder.getRoot(), "out.tex");

		TreeTyper.main(new String[] { "--lexicon", lexicon.getPath(), "--inputFile", input.getPath(),
				"--outputFile", output.getPath() });

		final String result = new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8);
		assertThat(result).startsWith("\\begin{exe}\n    \\ex Andrew sleeps.\n");
		assertThat(result).contains("\\mathtt{FA\\shortleftarrow}");
	}

	@Test
	public void print() {
		assertThat(TreeTyper.print(TreeAnnotator.annotate("[.S Andrew sleeps ]", LEXICON), OutputFormat.PLAIN))
				.isEqualTo("[.S Andrew sleeps ]");
	}
}
