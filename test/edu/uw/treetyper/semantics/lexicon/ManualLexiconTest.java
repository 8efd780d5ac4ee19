package edu.uw.treetyper.semantics.lexicon;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.util.Arrays;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import edu.uw.treetyper.semantics.SemanticType;
import edu.uw.treetyper.syntax.grammar.Combinator.RuleType;

public class ManualLexiconTest {

	private static File resource(final String name) throws URISyntaxException {
		return new File(ManualLexiconTest.class.getResource("/" + name).toURI());
	}

	@Test
	public void invertsTypesToKeys() {
		final Lexicon lexicon = new ManualLexicon(ImmutableMap.of("e", Arrays.asList("Andrew", "Mathis"), "<e,t>",
				Arrays.asList("hits")));
		assertThat(lexicon.getKeys()).containsExactly("Andrew", "Mathis", "hits");
		assertThat(lexicon.getCandidateTypes("Andrew")).containsExactly(SemanticType.E);
		assertThat(lexicon.getEntries("hits")).containsExactly(new LexicalEntry(SemanticType.EtoT, RuleType.LEXICAL));
		assertThat(lexicon.getCandidateTypes("nobody")).isEmpty();
	}

	@Test
	public void loadsFile() throws Exception {
		final Lexicon lexicon = ManualLexicon.load(resource("lexicon.txt"));
		assertThat(lexicon.getCandidateTypes("hits")).containsExactly(SemanticType.valueOf("<e,<e,t>>"));
		assertThat(lexicon.getCandidateTypes("run")).containsExactly(SemanticType.EtoT, SemanticType.E).inOrder();
		assertThat(lexicon.getEntry("she", SemanticType.E).getRuleType()).isEqualTo(RuleType.ASSIGNMENT);
		assertThat(lexicon.getEntry("$t$", SemanticType.E).getRuleType()).isEqualTo(RuleType.ASSIGNMENT);
		assertThat(lexicon.getEntry("1", SemanticType.INDEX).getRuleType()).isEqualTo(RuleType.EMPTY);
		assertThat(lexicon.getCandidateTypes("of")).containsExactly(SemanticType.VACUOUS);
		assertThat(lexicon.getKeys()).doesNotContain("transitive");
	}

	@Test
	public void mergesFiles() throws Exception {
		final File file = resource("lexicon.txt");
		final Lexicon lexicon = ManualLexicon.load(file, file);
		assertThat(lexicon.getEntries("Andrew")).hasSize(1);
	}

	@Test
	public void caseVariants() throws Exception {
		final Lexicon lexicon = ManualLexicon.load(resource("lexicon.txt"));
		assertThat(lexicon.getCaseVariants("andrew")).containsExactly("Andrew");
		assertThat(lexicon.getCaseVariants("Andrew")).isEmpty();
	}

	@Test
	public void rejectsBadType() throws Exception {
		final File file = resource("malformed-lexicon.txt");
		final IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ManualLexicon.load(file));
		assertThat(e).hasMessageThat().contains("<e,t");
	}

	@Test
	public void missingFile() {
		assertThrows(IOException.class, () -> ManualLexicon.load(new File("no-such-lexicon.txt")));
	}

	@Test
	public void unknownTypeForKey() {
		final Lexicon lexicon = new ManualLexicon(ImmutableMap.of("e", Arrays.asList("Andrew")));
		assertThrows(IllegalArgumentException.class, () -> lexicon.getEntry("Andrew", SemanticType.T));
	}
}
