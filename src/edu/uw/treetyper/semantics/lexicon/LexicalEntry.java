package edu.uw.treetyper.semantics.lexicon;

import java.util.Objects;

import edu.uw.treetyper.semantics.SemanticType;
import edu.uw.treetyper.syntax.grammar.Combinator.RuleType;

/**
 * A type registered for a lexicon key, with the rule that introduces it at a leaf.
 */
public class LexicalEntry {
	private final SemanticType type;
	private final RuleType ruleType;

	public LexicalEntry(final SemanticType type, final RuleType ruleType) {
		this.type = type;
		this.ruleType = ruleType;
	}

	public SemanticType getType() {
		return type;
	}

	public RuleType getRuleType() {
		return ruleType;
	}

	@Override
	public boolean equals(final Object other) {
		if (!(other instanceof LexicalEntry)) {
			return false;
		}
		final LexicalEntry entry = (LexicalEntry) other;
		return type == entry.type && ruleType == entry.ruleType;
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, ruleType);
	}

	@Override
	public String toString() {
		return type + " (" + ruleType.getLabel() + ")";
	}
}
