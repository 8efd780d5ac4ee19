package edu.uw.treetyper.main;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import edu.uw.treetyper.semantics.SemanticType;
import edu.uw.treetyper.semantics.lexicon.Lexicon;
import edu.uw.treetyper.semantics.lexicon.ManualLexicon;
import edu.uw.treetyper.syntax.grammar.Combinator.RuleType;
import edu.uw.treetyper.syntax.parser.AnnotatedTree;
import edu.uw.treetyper.syntax.parser.TreeAnnotator;

public class QtreePrinterTest {

	private static final Lexicon LEXICON = new ManualLexicon(ImmutableMap.<String, List<String>> of("e",
			Arrays.asList("Andrew"), "<e,t>", Arrays.asList("sleeps"), "index", Arrays.asList("1")));

	private static AnnotatedTree annotate(final String tree) {
		return TreeAnnotator.annotate(tree, LEXICON);
	}

	@Test
	public void plain() {
		final String tree = "[.\\node(top){S }; [.NP^2 Andrew ] sleeps ]";
		assertThat(QtreePrinter.PLAIN_PRINTER.print(annotate(tree).getRoot())).isEqualTo(tree);
	}

	@Test
	public void types() {
		assertThat(QtreePrinter.TYPES_PRINTER.print(annotate("[.S Andrew sleeps ]").getRoot()))
				.isEqualTo("[.S_{t} Andrew_{e} sleeps_{\\langle e,\\,t\\rangle} ]");
	}

	@Test
	public void full() {
		final String printed = QtreePrinter.FULL_PRINTER.print(annotate("[.\\node(top){S }; Andrew sleeps ]")
				.getRoot());
		assertThat(printed).startsWith("[.\\node(top){S\\,^{{\\color{mygreen}\\mathtt{FA\\shortleftarrow}}}"
				+ "_{{\\color{myred}t}} }; Andrew\\,^{{\\color{mygreen}\\mathtt{TN_1}}}_{{\\color{myred}e}} ");
	}

	@Test
	public void customColors() {
		final QtreePrinter printer = new QtreePrinter.FullPrinter("blue", "red");
		assertThat(printer.print(annotate("[.S Andrew sleeps ]").getRoot())).contains("\\color{blue}");
	}

	@Test
	public void bracketedLeaf() {
		final AnnotatedTree tree = annotate("[.S [.1 ] sleeps ]");
		assertThat(QtreePrinter.TYPES_PRINTER.print(tree.getRoot())).startsWith("[.S_{\\langle e,\\,\\langle e,\\,t\\rangle\\rangle} [.1_{-} ]");
	}

	@Test
	public void errors() {
		final AnnotatedTree tree = annotate("[.S Bob sleeps ]");
		assertThat(QtreePrinter.FULL_PRINTER.print(tree.getRoot())).contains("\\mathtt{ERR}}}_{{\\color{myred}\\bot}}");
	}

	@Test
	public void formatType() {
		assertThat(QtreePrinter.formatType(SemanticType.valueOf("<<e,t>,t>")))
				.isEqualTo("\\langle \\langle e,\\,t\\rangle,\\,t\\rangle");
		assertThat(QtreePrinter.formatType(SemanticType.VACUOUS)).isEqualTo("-");
		assertThat(QtreePrinter.formatType(SemanticType.ERROR)).isEqualTo("\\bot");
	}

	@Test
	public void formatRule() {
		assertThat(QtreePrinter.formatRule(RuleType.FORWARD_APPLICATION)).isEqualTo("FA\\shortrightarrow");
		assertThat(QtreePrinter.formatRule(RuleType.PREDICATE_MODIFICATION)).isEqualTo("PM");
		assertThat(QtreePrinter.formatRule(RuleType.EMPTY)).isEqualTo("-");
	}

	@Test
	public void sentence() {
		assertThat(QtreePrinter.getSentence(annotate("[.S [.1 ] [.S andrew sleeps ] ]").getRoot()))
				.isEqualTo("Andrew sleeps.");
	}

	@Test
	public void example() {
		final String example = QtreePrinter.printExample(annotate("[.\\node(top){S }; Andrew sleeps ]"),
				QtreePrinter.FULL_PRINTER);
		assertThat(example).startsWith("\\begin{exe}\n    \\ex Andrew sleeps.\n");
		assertThat(example).contains("\\begin{tikzpicture}[baseline=(top.base)]");
		assertThat(example).contains("\\Tree [.\\node(top){S }; Andrew sleeps ]");
		assertThat(example).endsWith("\\end{exe}\n\n");
	}
}
