package edu.uw.treetyper.syntax.parser;

import edu.uw.treetyper.syntax.grammar.TreeNode;

/**
 * A problem found while annotating one node. None of these stop the rest of the tree from being annotated.
 */
public class Diagnostic {
	public enum Kind {
		// No lexicon entry for a leaf.
		LEXICAL_GAP,
		// Reported with a lexical gap when the lexicon has the key in a different case.
		CASE_MISMATCH,
		// Two daughters whose types do not combine under any rule.
		COMPOSITION_FAILURE,
		// An ambiguous leaf, or the node that had to choose between its readings, that never got down to one reading.
		UNRESOLVED_AMBIGUITY,
		// Nodes with the same lookup key that ended up with different types or rules.
		LABEL_COLLISION,
		// More than two daughters.
		BRANCHING_FACTOR,
		// Composition stopped at the configured number of passes.
		PASS_LIMIT
	}

	private final Kind kind;
	private final TreeNode node;
	private final String message;

	public Diagnostic(final Kind kind, final TreeNode node, final String message) {
		this.kind = kind;
		this.node = node;
		this.message = message;
	}

	public Kind getKind() {
		return kind;
	}

	public TreeNode getNode() {
		return node;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return kind + " at node " + node.getId() + " (" + node.getDisplayLabel() + "): " + message;
	}
}
