package edu.uw.treetyper.syntax.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;

import edu.uw.treetyper.semantics.SemanticType;
import edu.uw.treetyper.semantics.lexicon.LexicalEntry;
import edu.uw.treetyper.semantics.lexicon.Lexicon;
import edu.uw.treetyper.syntax.grammar.Combinator;
import edu.uw.treetyper.syntax.grammar.Combinator.RuleProduction;
import edu.uw.treetyper.syntax.grammar.Combinator.RuleType;
import edu.uw.treetyper.syntax.grammar.TreeNode;
import edu.uw.treetyper.syntax.parser.Diagnostic.Kind;

/**
 * Assigns a semantic type and rule to every node of a tree, bottom-up.
 *
 * Leaves are typed from the lexicon on pass 0. Each later pass resolves the internal nodes whose daughters were
 * resolved before the pass started, so a node resolves one pass after its last daughter. An ambiguous leaf stays open
 * until the node that combines it with its sister finds that exactly one of its readings composes; that reading is
 * then fixed for the leaf and any unary nodes above it. When a pass resolves nothing, a final pass marks everything
 * still open as an error.
 */
public class CompositionEngine {

	private final Lexicon lexicon;
	private final CompositionConfig config;

	public CompositionEngine(final Lexicon lexicon, final CompositionConfig config) {
		this.lexicon = lexicon;
		this.config = config;
	}

	/**
	 * Annotates the tree in place. A tree can only be composed once.
	 *
	 * @throws IllegalArgumentException
	 *             if any node of the tree is already annotated
	 */
	public AnnotatedTree compose(final TreeNode root) {
		Preconditions.checkArgument(root.getNodes().stream().noneMatch(TreeNode::isResolved),
				"Tree has already been annotated: %s", root);
		return new Composition(root).run();
	}

	/**
	 * The decision for one node on one pass. Applied after all nodes have been looked at, so that every decision on a
	 * pass sees the same state.
	 */
	private static class Resolution {
		private final TreeNode node;
		private final RuleProduction production;
		private final Map<TreeNode, SemanticType> choices;

		private Resolution(final TreeNode node, final RuleProduction production,
				final Map<TreeNode, SemanticType> choices) {
			this.node = node;
			this.production = production;
			this.choices = choices;
		}

		private Resolution(final TreeNode node, final RuleProduction production) {
			this(node, production, Collections.emptyMap());
		}
	}

	/**
	 * One reading tried for an ambiguous daughter.
	 */
	private static class Trial {
		private final SemanticType left;
		private final SemanticType right;
		private final RuleProduction production;

		private Trial(final SemanticType left, final SemanticType right, final RuleProduction production) {
			this.left = left;
			this.right = right;
			this.production = production;
		}
	}

	private class Composition {
		private final TreeNode root;
		private final List<TreeNode> nodes;
		private final Map<TreeNode, ImmutableSet<SemanticType>> ambiguousLeaves = new HashMap<>();
		// Nodes that tried their daughters' readings and did not find exactly one that composes.
		private final Map<TreeNode, Integer> deferred = new HashMap<>();
		private final List<Diagnostic> diagnostics = new ArrayList<>();

		private Composition(final TreeNode root) {
			this.root = root;
			this.nodes = root.getNodes();
		}

		private AnnotatedTree run() {
			for (final TreeNode node : nodes) {
				if (node.isLeaf()) {
					resolveLeaf(node);
				} else if (node.getChildren().size() > 2) {
					node.resolve(SemanticType.ERROR, RuleType.ERROR, 0);
					diagnostics.add(new Diagnostic(Kind.BRANCHING_FACTOR, node, "Node has "
							+ node.getChildren().size() + " daughters, only unary and binary nodes can be composed"));
				}
			}

			int pass = 0;
			while (hasUnresolvedNodes()) {
				pass++;
				if (pass > config.getMaxPasses()) {
					diagnostics.add(new Diagnostic(Kind.PASS_LIMIT, root, "Stopped after " + config.getMaxPasses()
							+ " passes"));
					markUnresolved(pass);
					break;
				}

				final List<Resolution> resolutions = new ArrayList<>();
				for (final TreeNode node : nodes) {
					if (!node.isResolved() && !node.isLeaf()) {
						final Resolution resolution = attempt(node);
						if (resolution != null) {
							resolutions.add(resolution);
						}
					}
				}

				if (resolutions.isEmpty()) {
					pass++;
					markUnresolved(pass);
					break;
				}

				for (final Resolution resolution : resolutions) {
					apply(resolution, pass);
				}
			}

			checkLabelCollisions();

			final AnnotatedTree result = new AnnotatedTree(root, diagnostics, pass);
			if (config.isFailOnUnresolvedAmbiguity() && !result.getDiagnostics(Kind.UNRESOLVED_AMBIGUITY).isEmpty()) {
				throw new UnresolvedAmbiguityException(result);
			}
			return result;
		}

		private void resolveLeaf(final TreeNode leaf) {
			final String key = leaf.getLookupKey();
			final ImmutableSet<SemanticType> candidates = lexicon.getCandidateTypes(key);
			if (candidates.isEmpty()) {
				leaf.resolve(SemanticType.ERROR, RuleType.ERROR, 0);
				diagnostics.add(new Diagnostic(Kind.LEXICAL_GAP, leaf, "No lexicon entry for: " + key));
				final Collection<String> variants = lexicon.getCaseVariants(key);
				if (!variants.isEmpty()) {
					diagnostics.add(new Diagnostic(Kind.CASE_MISMATCH, leaf, "Lexicon has " + variants
							+ " but lookup is case-sensitive: " + key));
				}
			} else if (candidates.size() == 1) {
				final LexicalEntry entry = lexicon.getEntry(key, candidates.iterator().next());
				leaf.resolve(entry.getType(), entry.getRuleType(), 0);
			} else {
				ambiguousLeaves.put(leaf, candidates);
			}
		}

		private boolean hasUnresolvedNodes() {
			return nodes.stream().anyMatch(node -> !node.isResolved());
		}

		private Resolution attempt(final TreeNode node) {
			final List<TreeNode> children = node.getChildren();
			if (children.size() == 1) {
				final TreeNode child = children.get(0);
				if (!child.isResolved()) {
					return null;
				}
				return new Resolution(node, child.isError() ? Combinator.error() : Combinator.nonBranching(child
						.getType()));
			}

			final TreeNode left = children.get(0);
			final TreeNode right = children.get(1);
			if (left.isError() || right.isError()) {
				if (!left.isResolved() || !right.isResolved()) {
					// Waiting for the other daughter
					return null;
				}
				return new Resolution(node, Combinator.error());
			}

			final ImmutableSet<SemanticType> leftOptions = readings(left);
			final ImmutableSet<SemanticType> rightOptions = readings(right);
			if (leftOptions == null || rightOptions == null) {
				// Waiting for a daughter
				return null;
			}

			if (left.isResolved() && right.isResolved()) {
				final Optional<RuleProduction> production = combine(left.getType(), right.getType());
				if (production.isPresent()) {
					return new Resolution(node, production.get());
				}
				diagnostics.add(new Diagnostic(Kind.COMPOSITION_FAILURE, node, "Cannot combine " + left.getType()
						+ " with " + right.getType()));
				return new Resolution(node, Combinator.error());
			}

			final List<Trial> successes = new ArrayList<>();
			for (final SemanticType leftType : leftOptions) {
				for (final SemanticType rightType : rightOptions) {
					final Optional<RuleProduction> production = combine(leftType, rightType);
					if (production.isPresent()) {
						successes.add(new Trial(leftType, rightType, production.get()));
					}
				}
			}

			if (successes.size() != 1) {
				// More than one reading composes, or none does. Nothing later in the tree can change that, but the
				// node stays open until the final pass.
				deferred.put(node, successes.size());
				return null;
			}

			final Trial trial = successes.get(0);
			final Map<TreeNode, SemanticType> choices = new HashMap<>();
			if (!left.isResolved()) {
				choices.put(left, trial.left);
			}
			if (!right.isResolved()) {
				choices.put(right, trial.right);
			}
			return new Resolution(node, trial.production, choices);
		}

		/**
		 * The possible types of a node: its type if resolved, the readings of an ambiguous leaf (possibly below unary
		 * nodes), or null if the node is still waiting for its daughters.
		 */
		private ImmutableSet<SemanticType> readings(final TreeNode node) {
			if (node.isResolved()) {
				return ImmutableSet.of(node.getType());
			} else if (node.isLeaf()) {
				return ambiguousLeaves.get(node);
			} else if (node.getChildren().size() == 1 && !node.getChild(0).isResolved()) {
				// A unary node over a resolved daughter resolves by itself on this pass.
				return readings(node.getChild(0));
			}
			return null;
		}

		private Optional<RuleProduction> combine(final SemanticType left, final SemanticType right) {
			return Combinator.combine(left, right, Combinator.STANDARD_COMBINATORS, config.getOptionalRules());
		}

		private void apply(final Resolution resolution, final int pass) {
			for (final Map.Entry<TreeNode, SemanticType> choice : resolution.choices.entrySet()) {
				choose(choice.getKey(), choice.getValue(), pass);
			}
			resolution.node.resolve(resolution.production.getType(), resolution.production.getRuleType(), pass);
		}

		/**
		 * Fixes the reading of an ambiguous leaf, and of the unary nodes between it and the node that chose it.
		 */
		private void choose(final TreeNode node, final SemanticType type, final int pass) {
			if (node.isLeaf()) {
				final LexicalEntry entry = lexicon.getEntry(node.getLookupKey(), type);
				node.resolve(type, entry.getRuleType(), pass);
			} else {
				choose(node.getChild(0), type, pass);
				node.resolve(type, RuleType.NON_BRANCHING, pass);
			}
		}

		private void markUnresolved(final int pass) {
			for (final TreeNode node : nodes) {
				if (node.isResolved()) {
					continue;
				}

				if (ambiguousLeaves.containsKey(node)) {
					diagnostics.add(new Diagnostic(Kind.UNRESOLVED_AMBIGUITY, node, "Readings "
							+ ambiguousLeaves.get(node) + " never narrowed down to one"));
				} else if (deferred.containsKey(node)) {
					final int successes = deferred.get(node);
					diagnostics.add(new Diagnostic(Kind.UNRESOLVED_AMBIGUITY, node, successes == 0
							? "No reading of the daughters composes"
							: successes + " readings of the daughters compose"));
				}
				node.resolve(SemanticType.ERROR, RuleType.ERROR, pass);
			}
		}

		/**
		 * Nodes that share a lookup key have to agree on their type and rule.
		 */
		private void checkLabelCollisions() {
			final ListMultimap<String, TreeNode> byKey = LinkedListMultimap.create();
			for (final TreeNode node : nodes) {
				byKey.put(node.getLookupKey(), node);
			}

			for (final String key : byKey.keySet()) {
				final List<TreeNode> sharing = byKey.get(key);
				final long distinct = sharing.stream().map(node -> node.getType() + "/" + node.getRuleType()).distinct()
						.count();
				if (distinct > 1) {
					final String summary = sharing.stream().map(TreeNode::toString).collect(Collectors.joining(", "));
					for (final TreeNode node : sharing) {
						diagnostics.add(new Diagnostic(Kind.LABEL_COLLISION, node, "Label " + key
								+ " is used for nodes with different annotations: " + summary));
					}
				}
			}
		}
	}
}
