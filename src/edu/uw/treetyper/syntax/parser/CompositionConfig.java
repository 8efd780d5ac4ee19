package edu.uw.treetyper.syntax.parser;

import java.util.EnumSet;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;

import edu.uw.treetyper.syntax.grammar.Combinator.RuleType;

/**
 * Options for reading and composing a tree.
 */
public class CompositionConfig {
	public static final int DEFAULT_MAX_PASSES = 100;

	private final int maxPasses;
	private final boolean failOnUnresolvedAmbiguity;
	private final boolean strictBracketSpacing;
	private final Set<RuleType> optionalRules;

	private CompositionConfig(final Builder builder) {
		this.maxPasses = builder.maxPasses;
		this.failOnUnresolvedAmbiguity = builder.failOnUnresolvedAmbiguity;
		this.strictBracketSpacing = builder.strictBracketSpacing;
		this.optionalRules = Sets.immutableEnumSet(builder.optionalRules);
	}

	public static CompositionConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public int getMaxPasses() {
		return maxPasses;
	}

	public boolean isFailOnUnresolvedAmbiguity() {
		return failOnUnresolvedAmbiguity;
	}

	public boolean isStrictBracketSpacing() {
		return strictBracketSpacing;
	}

	/**
	 * The enabled rules among Predicate Modification and Predicate Abstraction.
	 */
	public Set<RuleType> getOptionalRules() {
		return optionalRules;
	}

	public static class Builder {
		private int maxPasses = DEFAULT_MAX_PASSES;
		private boolean failOnUnresolvedAmbiguity = false;
		private boolean strictBracketSpacing = false;
		private final Set<RuleType> optionalRules = EnumSet.of(RuleType.PREDICATE_MODIFICATION,
				RuleType.PREDICATE_ABSTRACTION);

		private Builder() {
		}

		public Builder maxPasses(final int maxPasses) {
			Preconditions.checkArgument(maxPasses > 0, "maxPasses must be positive: %s", maxPasses);
			this.maxPasses = maxPasses;
			return this;
		}

		public Builder failOnUnresolvedAmbiguity(final boolean failOnUnresolvedAmbiguity) {
			this.failOnUnresolvedAmbiguity = failOnUnresolvedAmbiguity;
			return this;
		}

		public Builder strictBracketSpacing(final boolean strictBracketSpacing) {
			this.strictBracketSpacing = strictBracketSpacing;
			return this;
		}

		public Builder disableRule(final RuleType rule) {
			Preconditions.checkArgument(rule.isOptional(), "Rule cannot be disabled: %s", rule);
			optionalRules.remove(rule);
			return this;
		}

		public CompositionConfig build() {
			return new CompositionConfig(this);
		}
	}
}
