package edu.uw.treetyper.syntax.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import edu.uw.treetyper.semantics.SemanticType;

/**
 * Rules for combining the types of two sister nodes.
 */
public abstract class Combinator {
	public enum RuleType {
		// Leaves
		LEXICAL("TN_1"), ASSIGNMENT("TN_2"), EMPTY("-"),
		// Unary
		NON_BRANCHING("NN"),
		// Binary
		FORWARD_APPLICATION("FA"), BACKWARD_APPLICATION("FA"), PREDICATE_MODIFICATION("PM"), PREDICATE_ABSTRACTION(
				"PA"),
		ERROR("ERROR");

		private final String label;

		RuleType(final String label) {
			this.label = label;
		}

		public String getLabel() {
			return label;
		}

		public boolean isFunctionalApplication() {
			return this == FORWARD_APPLICATION || this == BACKWARD_APPLICATION;
		}

		/**
		 * Rules that can be switched off in a CompositionConfig.
		 */
		public boolean isOptional() {
			return this == PREDICATE_MODIFICATION || this == PREDICATE_ABSTRACTION;
		}
	}

	public static class RuleProduction {
		private final RuleType ruleType;
		private final SemanticType type;

		private RuleProduction(final RuleType ruleType, final SemanticType type) {
			this.ruleType = ruleType;
			this.type = type;
		}

		public RuleType getRuleType() {
			return ruleType;
		}

		public SemanticType getType() {
			return type;
		}

		@Override
		public String toString() {
			return type + " (" + ruleType + ")";
		}
	}

	private final RuleType ruleType;

	private Combinator(final RuleType ruleType) {
		this.ruleType = ruleType;
	}

	public RuleType getRuleType() {
		return ruleType;
	}

	public abstract boolean canApply(SemanticType left, SemanticType right);

	public abstract SemanticType apply(SemanticType left, SemanticType right);

	/**
	 * In priority order: the first combinator that can apply is used.
	 */
	public final static List<Combinator> STANDARD_COMBINATORS = Collections.unmodifiableList(new ArrayList<>(Arrays
			.asList(new VacuousDaughter(), new ForwardApplication(), new BackwardApplication(),
					new PredicateAbstraction(), new PredicateModification())));

	/**
	 * Combines two contentful or index types with the first applicable combinator whose rule is enabled. Vacuous
	 * daughters are always handled. Returns empty if nothing applies.
	 */
	public static Optional<RuleProduction> combine(final SemanticType left, final SemanticType right,
			final Collection<Combinator> combinators, final Set<RuleType> enabledOptionalRules) {
		for (final Combinator combinator : combinators) {
			final RuleType rule = combinator.getRuleType();
			if (rule.isOptional() && !enabledOptionalRules.contains(rule)) {
				continue;
			}
			if (combinator.canApply(left, right)) {
				return Optional.of(new RuleProduction(rule, combinator.apply(left, right)));
			}
		}

		return Optional.empty();
	}

	/**
	 * Unary composition: the mother inherits the daughter's type.
	 */
	public static RuleProduction nonBranching(final SemanticType child) {
		return new RuleProduction(RuleType.NON_BRANCHING, child);
	}

	public static RuleProduction error() {
		return new RuleProduction(RuleType.ERROR, SemanticType.ERROR);
	}

	static boolean isContentful(final SemanticType type) {
		return !type.isMarker();
	}

	/**
	 * A semantically empty daughter is skipped: X vacuous --> X
	 */
	private static class VacuousDaughter extends Combinator {
		private VacuousDaughter() {
			super(RuleType.NON_BRANCHING);
		}

		@Override
		public boolean canApply(final SemanticType left, final SemanticType right) {
			return left == SemanticType.VACUOUS || right == SemanticType.VACUOUS;
		}

		@Override
		public SemanticType apply(final SemanticType left, final SemanticType right) {
			return left == SemanticType.VACUOUS ? right : left;
		}
	}

	/**
	 * <A,B> A --> B
	 */
	private static class ForwardApplication extends Combinator {
		private ForwardApplication() {
			super(RuleType.FORWARD_APPLICATION);
		}

		@Override
		public boolean canApply(final SemanticType left, final SemanticType right) {
			return left.takesArgument(right);
		}

		@Override
		public SemanticType apply(final SemanticType left, final SemanticType right) {
			return left.getTo();
		}
	}

	/**
	 * A <A,B> --> B
	 */
	private static class BackwardApplication extends Combinator {
		private BackwardApplication() {
			super(RuleType.BACKWARD_APPLICATION);
		}

		@Override
		public boolean canApply(final SemanticType left, final SemanticType right) {
			return right.takesArgument(left);
		}

		@Override
		public SemanticType apply(final SemanticType left, final SemanticType right) {
			return right.getTo();
		}
	}

	/**
	 * index X --> <e,X>, in either order.
	 */
	private static class PredicateAbstraction extends Combinator {
		private PredicateAbstraction() {
			super(RuleType.PREDICATE_ABSTRACTION);
		}

		@Override
		public boolean canApply(final SemanticType left, final SemanticType right) {
			return (left == SemanticType.INDEX && isContentful(right))
					|| (right == SemanticType.INDEX && isContentful(left));
		}

		@Override
		public SemanticType apply(final SemanticType left, final SemanticType right) {
			return SemanticType.make(SemanticType.E, left == SemanticType.INDEX ? right : left);
		}
	}

	/**
	 * <e,t> <e,t> --> <e,t>
	 */
	private static class PredicateModification extends Combinator {
		private PredicateModification() {
			super(RuleType.PREDICATE_MODIFICATION);
		}

		@Override
		public boolean canApply(final SemanticType left, final SemanticType right) {
			return left == SemanticType.EtoT && right == SemanticType.EtoT;
		}

		@Override
		public SemanticType apply(final SemanticType left, final SemanticType right) {
			return SemanticType.EtoT;
		}
	}
}
