package edu.uw.treetyper.syntax.parser;

/**
 * Thrown instead of returning a tree with unresolved ambiguous leaves, if the configuration asks for it.
 */
public class UnresolvedAmbiguityException extends IllegalStateException {
	private static final long serialVersionUID = 1L;
	private final transient AnnotatedTree tree;

	public UnresolvedAmbiguityException(final AnnotatedTree tree) {
		super("Ambiguity could not be resolved: " + tree.getDiagnostics(Diagnostic.Kind.UNRESOLVED_AMBIGUITY));
		this.tree = tree;
	}

	/**
	 * The fully annotated tree, with the unresolved nodes marked as errors.
	 */
	public AnnotatedTree getTree() {
		return tree;
	}
}
