package edu.uw.treetyper.main;

import java.util.Optional;
import java.util.stream.Collectors;

import edu.uw.treetyper.semantics.SemanticType;
import edu.uw.treetyper.syntax.grammar.Combinator.RuleType;
import edu.uw.treetyper.syntax.grammar.TreeNode;
import edu.uw.treetyper.syntax.grammar.TreeNode.TreeNodeInternal;
import edu.uw.treetyper.syntax.grammar.TreeNode.TreeNodeLeaf;
import edu.uw.treetyper.syntax.grammar.TreeNode.TreeNodeVisitor;
import edu.uw.treetyper.syntax.parser.AnnotatedTree;
import edu.uw.treetyper.util.Util;

/**
 * Writes trees back out as tikz-qtree source, optionally with their types and rules.
 */
public abstract class QtreePrinter {
	public final static String DEFAULT_RULE_COLOR = "mygreen";
	public final static String DEFAULT_TYPE_COLOR = "myred";

	public final static QtreePrinter PLAIN_PRINTER = new PlainPrinter();
	public final static QtreePrinter TYPES_PRINTER = new TypesPrinter();
	public final static QtreePrinter FULL_PRINTER = new FullPrinter(DEFAULT_RULE_COLOR, DEFAULT_TYPE_COLOR);

	public String print(final TreeNode root) {
		final StringBuilder result = new StringBuilder();
		root.accept(new QtreePrinterVisitor(result, root));
		return result.toString();
	}

	/**
	 * The label of a node as it appears in the output.
	 */
	protected abstract String printLabel(TreeNode node);

	private class QtreePrinterVisitor implements TreeNodeVisitor {
		private final StringBuilder result;
		private final TreeNode root;

		private QtreePrinterVisitor(final StringBuilder result, final TreeNode root) {
			this.result = result;
			this.root = root;
		}

		@Override
		public void visit(final TreeNodeLeaf node) {
			if (node.isBracketed()) {
				result.append("[.");
				appendLabel(node);
				result.append(" ]");
			} else {
				result.append(printLabel(node));
			}
		}

		@Override
		public void visit(final TreeNodeInternal node) {
			result.append("[.");
			appendLabel(node);
			for (final TreeNode child : node.getChildren()) {
				result.append(" ");
				child.accept(this);
			}
			result.append(" ]");
		}

		private void appendLabel(final TreeNode node) {
			final Optional<String> nodeName = node.getNodeName();
			if (node == root && nodeName.isPresent()) {
				result.append("\\node(" + nodeName.get() + "){" + printLabel(node) + " };");
			} else {
				result.append(printLabel(node));
			}
		}
	}

	public static class PlainPrinter extends QtreePrinter {
		@Override
		protected String printLabel(final TreeNode node) {
			return node.getDisplayLabel();
		}
	}

	/**
	 * Types as subscripts: NP_{e}
	 */
	public static class TypesPrinter extends QtreePrinter {
		@Override
		protected String printLabel(final TreeNode node) {
			return node.getDisplayLabel() + "_{" + formatType(node.getType()) + "}";
		}
	}

	/**
	 * Rules as coloured superscripts and types as coloured subscripts.
	 */
	public static class FullPrinter extends QtreePrinter {
		private final String ruleColor;
		private final String typeColor;

		public FullPrinter(final String ruleColor, final String typeColor) {
			this.ruleColor = ruleColor;
			this.typeColor = typeColor;
		}

		@Override
		protected String printLabel(final TreeNode node) {
			return node.getDisplayLabel() + "\\,^{{\\color{" + ruleColor + "}\\mathtt{" + formatRule(node.getRuleType())
					+ "}}}_{{\\color{" + typeColor + "}" + formatType(node.getType()) + "}}";
		}
	}

	static String formatType(final SemanticType type) {
		if (type == null || type == SemanticType.INDEX || type == SemanticType.VACUOUS) {
			return "-";
		} else if (type == SemanticType.ERROR) {
			return "\\bot";
		}
		return type.toString().replace("<", "\\langle ").replace(">", "\\rangle").replace(",", ",\\,");
	}

	static String formatRule(final RuleType rule) {
		if (rule == null) {
			return "-";
		}
		switch (rule) {
		case FORWARD_APPLICATION:
			return "FA\\shortrightarrow";
		case BACKWARD_APPLICATION:
			return "FA\\shortleftarrow";
		case ERROR:
			return "ERR";
		default:
			return rule.getLabel();
		}
	}

	/**
	 * The words of the tree as a sentence: bare leaf tokens, capitalised, with a full stop.
	 */
	public static String getSentence(final TreeNode root) {
		final String words = root.getLeaves().stream().filter(leaf -> !leaf.isBracketed())
				.map(TreeNode::getDisplayLabel).collect(Collectors.joining(" "));
		return Util.capitalize(words) + ".";
	}

	/**
	 * A gb4e example with the sentence, the plain tree and the annotated tree.
	 */
	public static String printExample(final AnnotatedTree tree, final QtreePrinter annotatedPrinter) {
		final TreeNode root = tree.getRoot();
		final StringBuilder result = new StringBuilder();
		result.append("\\begin{exe}\n");
		result.append("    \\ex " + getSentence(root) + "\n");
		result.append("        \\begin{xlist}\n");
		result.append("            \\ex " + printTikz(root, PLAIN_PRINTER) + "\n");
		result.append("            \\ex " + printTikz(root, annotatedPrinter) + "\n");
		result.append("        \\end{xlist}\n");
		result.append("    \\end{exe}\n\n");
		return result.toString();
	}

	private static String printTikz(final TreeNode root, final QtreePrinter printer) {
		final Optional<String> nodeName = root.getNodeName();
		final String baseline = nodeName.isPresent() ? "[baseline=(" + nodeName.get() + ".base)]" : "";
		return "\\begin{tikzpicture}" + baseline + "\n                    \\Tree " + printer.print(root)
				+ "\n                \\end{tikzpicture}";
	}
}
