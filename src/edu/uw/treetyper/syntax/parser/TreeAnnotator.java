package edu.uw.treetyper.syntax.parser;

import edu.uw.treetyper.corpora.QtreeReader;
import edu.uw.treetyper.corpora.TreeParseException;
import edu.uw.treetyper.semantics.lexicon.Lexicon;
import edu.uw.treetyper.syntax.grammar.TreeNode;

/**
 * Reads a qtree bracket string and annotates every node with its semantic type and composition rule.
 */
public class TreeAnnotator {
	private final Lexicon lexicon;
	private final CompositionConfig config;
	private final QtreeReader reader;

	public TreeAnnotator(final Lexicon lexicon, final CompositionConfig config) {
		this.lexicon = lexicon;
		this.config = config;
		this.reader = new QtreeReader(config.isStrictBracketSpacing());
	}

	public TreeAnnotator(final Lexicon lexicon) {
		this(lexicon, CompositionConfig.defaults());
	}

	/**
	 * @throws TreeParseException
	 *             if the string is not a well-formed tree. Problems with individual nodes are reported as diagnostics
	 *             instead.
	 * @throws UnresolvedAmbiguityException
	 *             if the configuration asks for it and an ambiguous leaf could not be resolved
	 */
	public AnnotatedTree annotate(final String tree) {
		final TreeNode root = reader.read(tree);
		return new CompositionEngine(lexicon, config).compose(root);
	}

	public static AnnotatedTree annotate(final String tree, final Lexicon lexicon) {
		return new TreeAnnotator(lexicon).annotate(tree);
	}

	public static AnnotatedTree annotate(final String tree, final Lexicon lexicon, final CompositionConfig config) {
		return new TreeAnnotator(lexicon, config).annotate(tree);
	}
}
