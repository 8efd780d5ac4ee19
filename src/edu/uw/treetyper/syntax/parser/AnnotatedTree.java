package edu.uw.treetyper.syntax.parser;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.uw.treetyper.syntax.grammar.TreeNode;

/**
 * The result of annotating a tree: every node has a type and rule, possibly the error marker.
 */
public class AnnotatedTree {
	private final TreeNode root;
	private final List<Diagnostic> diagnostics;
	private final int passes;

	AnnotatedTree(final TreeNode root, final List<Diagnostic> diagnostics, final int passes) {
		this.root = root;
		this.diagnostics = ImmutableList.copyOf(diagnostics);
		this.passes = passes;
	}

	public TreeNode getRoot() {
		return root;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	public List<Diagnostic> getDiagnostics(final Diagnostic.Kind kind) {
		return diagnostics.stream().filter(d -> d.getKind() == kind).collect(ImmutableList.toImmutableList());
	}

	/**
	 * Number of passes over the tree, including the final pass that marks unresolved nodes.
	 */
	public int getPasses() {
		return passes;
	}

	public boolean hasErrors() {
		return root.getNodes().stream().anyMatch(TreeNode::isError);
	}

	/**
	 * The node with this pre-order id.
	 */
	public TreeNode getNode(final int id) {
		return root.getNodes().get(id);
	}
}
