package edu.uw.treetyper.semantics.lexicon;

import java.io.File;
import java.io.IOException;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import edu.uw.treetyper.semantics.SemanticType;
import edu.uw.treetyper.syntax.grammar.Combinator.RuleType;
import edu.uw.treetyper.util.Util;

/**
 * A lexicon written by the user as a mapping from semantic types to the labels that have them, e.g.
 *
 * <pre>
 * e        Andrew  Mathis
 * &lt;e,t&gt;    sleeps  that_{RP}
 * pron     she
 * index    1  2
 * </pre>
 *
 * The mapping is inverted when loaded. Labels registered under several types are ambiguous.
 */
public class ManualLexicon extends Lexicon {

	private static final String PRONOUN = "pron";
	private static final String TRACE = "trace";
	private static final String INDEX = "index";
	private static final String VACUOUS = "vacuous";

	private final ImmutableSetMultimap<String, LexicalEntry> keyToEntries;
	private final ImmutableSetMultimap<String, String> lowerCaseToKeys;

	/**
	 * @param typeToKeys
	 *            semantic type strings (or one of the keywords pron, trace, index, vacuous) to lookup keys
	 */
	public ManualLexicon(final Map<String, ? extends Collection<String>> typeToKeys) {
		this(invert(typeToKeys));
	}

	private ManualLexicon(final SetMultimap<String, LexicalEntry> keyToEntries) {
		this.keyToEntries = ImmutableSetMultimap.copyOf(keyToEntries);
		final ImmutableSetMultimap.Builder<String, String> lowerCase = ImmutableSetMultimap.builder();
		for (final String key : keyToEntries.keySet()) {
			lowerCase.put(key.toLowerCase(Locale.ROOT), key);
		}
		this.lowerCaseToKeys = lowerCase.build();
	}

	/**
	 * Loads one or more lexicon files and merges them.
	 */
	public static ManualLexicon load(final File... lexiconFiles) throws IOException {
		final SetMultimap<String, LexicalEntry> result = LinkedHashMultimap.create();
		for (final File file : lexiconFiles) {
			loadLexicon(file, result);
		}
		return new ManualLexicon(result);
	}

	@Override
	public ImmutableSet<LexicalEntry> getEntries(final String lookupKey) {
		return keyToEntries.get(lookupKey);
	}

	@Override
	public ImmutableSet<String> getCaseVariants(final String lookupKey) {
		final ImmutableSet.Builder<String> result = ImmutableSet.builder();
		for (final String key : lowerCaseToKeys.get(lookupKey.toLowerCase(Locale.ROOT))) {
			if (!key.equals(lookupKey)) {
				result.add(key);
			}
		}
		return result.build();
	}

	@Override
	public ImmutableSet<String> getKeys() {
		return keyToEntries.keySet();
	}

	private static SetMultimap<String, LexicalEntry> invert(final Map<String, ? extends Collection<String>> typeToKeys) {
		final SetMultimap<String, LexicalEntry> result = LinkedHashMultimap.create();
		for (final Map.Entry<String, ? extends Collection<String>> entry : typeToKeys.entrySet()) {
			final LexicalEntry lexicalEntry = makeEntry(entry.getKey());
			for (final String key : entry.getValue()) {
				result.put(key, lexicalEntry);
			}
		}
		return result;
	}

	static LexicalEntry makeEntry(final String type) {
		final String name = type.trim();
		if (name.equals(PRONOUN) || name.equals(TRACE)) {
			// Interpreted by the assignment function
			return new LexicalEntry(SemanticType.E, RuleType.ASSIGNMENT);
		} else if (name.equals(INDEX)) {
			return new LexicalEntry(SemanticType.INDEX, RuleType.EMPTY);
		} else if (name.equals(VACUOUS) || name.isEmpty()) {
			return new LexicalEntry(SemanticType.VACUOUS, RuleType.EMPTY);
		}
		return new LexicalEntry(SemanticType.valueOf(name), RuleType.LEXICAL);
	}

	/**
	 * Load a lexicon file: one type per line followed by its keys, tab-separated. // starts a comment.
	 */
	private static void loadLexicon(final File file, final SetMultimap<String, LexicalEntry> result)
			throws IOException {
		for (final String line2 : Util.readFile(file)) {
			final int commentIndex = line2.indexOf("//");
			final String line = (commentIndex > -1 ? line2.substring(0, commentIndex) : line2).trim();

			if (line.isEmpty()) {
				continue;
			}
			final String[] fields = line.split("\t+");
			if (fields.length < 2) {
				throw new IllegalArgumentException("Must be at least two tab-separated fields on line: \"" + line2
						+ "\" in file: " + file.getPath());
			}

			final LexicalEntry entry;
			try {
				entry = makeEntry(fields[0]);
			} catch (final IllegalArgumentException e) {
				throw new IllegalArgumentException("Unable to interpret type: \"" + fields[0] + "\" on line \""
						+ line2 + "\" in file: " + file.getPath(), e);
			}

			for (int i = 1; i < fields.length; i++) {
				result.put(fields[i].trim(), entry);
			}
		}
	}

}
