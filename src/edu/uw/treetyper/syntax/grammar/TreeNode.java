package edu.uw.treetyper.syntax.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.uw.treetyper.semantics.SemanticType;
import edu.uw.treetyper.syntax.grammar.Combinator.RuleType;

/**
 * A node of a qtree bracket tree. The labels and the shape are fixed when the tree is read; the semantic type, rule
 * and iteration count are filled in by composition.
 */
public abstract class TreeNode {

	private final int id;
	private final String rawLabel;
	private final String displayLabel;
	private final String lookupKey;

	private SemanticType type;
	private RuleType ruleType;
	private boolean resolved;
	private int iterationsToResolve;

	private TreeNode(final int id, final String rawLabel) {
		this.id = id;
		this.rawLabel = rawLabel;
		this.displayLabel = LabelNormalizer.displayLabel(rawLabel);
		this.lookupKey = LabelNormalizer.lookupKey(displayLabel);
	}

	public abstract List<TreeNode> getChildren();

	public abstract boolean isLeaf();

	public abstract void accept(TreeNodeVisitor v);

	/**
	 * Pre-order position of this node in its tree, starting at 0 for the root.
	 */
	public int getId() {
		return id;
	}

	/**
	 * The label as written, including a \node command on the root.
	 */
	public String getRawLabel() {
		return rawLabel;
	}

	public String getDisplayLabel() {
		return displayLabel;
	}

	/**
	 * The label without superscripts and numeric subscripts, used for lexicon lookup.
	 */
	public String getLookupKey() {
		return lookupKey;
	}

	/**
	 * The tikz node name of a root written as \node(name){label};
	 */
	public Optional<String> getNodeName() {
		return LabelNormalizer.nodeName(rawLabel);
	}

	public SemanticType getType() {
		return type;
	}

	public RuleType getRuleType() {
		return ruleType;
	}

	public boolean isResolved() {
		return resolved;
	}

	public boolean isError() {
		return resolved && type == SemanticType.ERROR;
	}

	public int getIterationsToResolve() {
		return iterationsToResolve;
	}

	public void resolve(final SemanticType type, final RuleType ruleType, final int iteration) {
		Preconditions.checkState(!resolved, "Node already resolved: %s", this);
		Preconditions.checkArgument(iteration >= 0);
		this.type = type;
		this.ruleType = ruleType;
		this.iterationsToResolve = iteration;
		this.resolved = true;
	}

	public TreeNode getChild(final int index) {
		return getChildren().get(index);
	}

	/**
	 * All nodes of the tree rooted here, in pre-order.
	 */
	public List<TreeNode> getNodes() {
		final List<TreeNode> result = new ArrayList<>();
		getNodes(result);
		return result;
	}

	private void getNodes(final List<TreeNode> result) {
		result.add(this);
		for (final TreeNode child : getChildren()) {
			child.getNodes(result);
		}
	}

	public List<TreeNodeLeaf> getLeaves() {
		final List<TreeNodeLeaf> result = new ArrayList<>();
		for (final TreeNode node : getNodes()) {
			if (node.isLeaf()) {
				result.add((TreeNodeLeaf) node);
			}
		}
		return result;
	}

	@Override
	public String toString() {
		return displayLabel + "#" + id + (resolved ? ":" + type + "/" + ruleType.getLabel() : "");
	}

	public static class TreeNodeLeaf extends TreeNode {
		private final boolean bracketed;

		/**
		 * @param bracketed
		 *            true for a leaf written as its own bracket, e.g. [.$t$ ], false for a bare token.
		 */
		public TreeNodeLeaf(final int id, final String word, final boolean bracketed) {
			super(id, word);
			this.bracketed = bracketed;
		}

		public boolean isBracketed() {
			return bracketed;
		}

		@Override
		public List<TreeNode> getChildren() {
			return Collections.emptyList();
		}

		@Override
		public boolean isLeaf() {
			return true;
		}

		@Override
		public void accept(final TreeNodeVisitor v) {
			v.visit(this);
		}
	}

	public static class TreeNodeInternal extends TreeNode {
		private final List<TreeNode> children;

		public TreeNodeInternal(final int id, final String label, final List<TreeNode> children) {
			super(id, label);
			Preconditions.checkArgument(!children.isEmpty(), "An internal node needs children: %s", label);
			this.children = ImmutableList.copyOf(children);
		}

		@Override
		public List<TreeNode> getChildren() {
			return children;
		}

		@Override
		public boolean isLeaf() {
			return false;
		}

		@Override
		public void accept(final TreeNodeVisitor v) {
			v.visit(this);
		}
	}

	public interface TreeNodeVisitor {
		void visit(TreeNodeLeaf node);

		void visit(TreeNodeInternal node);
	}
}
