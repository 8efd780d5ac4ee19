package edu.uw.treetyper.semantics.lexicon;

import com.google.common.collect.ImmutableSet;

import edu.uw.treetyper.semantics.SemanticType;

/**
 * Looks up the semantic types of leaf labels.
 */
public abstract class Lexicon {

	/**
	 * All entries registered under exactly this key, in the order they were added. Empty if the key is unknown.
	 */
	public abstract ImmutableSet<LexicalEntry> getEntries(String lookupKey);

	/**
	 * Registered keys that are equal to this one ignoring case, but not identical to it.
	 */
	public abstract ImmutableSet<String> getCaseVariants(String lookupKey);

	public abstract ImmutableSet<String> getKeys();

	/**
	 * The distinct candidate types for a key. More than one means the leaf is ambiguous.
	 */
	public ImmutableSet<SemanticType> getCandidateTypes(final String lookupKey) {
		final ImmutableSet.Builder<SemanticType> result = ImmutableSet.builder();
		for (final LexicalEntry entry : getEntries(lookupKey)) {
			result.add(entry.getType());
		}
		return result.build();
	}

	/**
	 * The first entry for the key with the given type.
	 */
	public LexicalEntry getEntry(final String lookupKey, final SemanticType type) {
		for (final LexicalEntry entry : getEntries(lookupKey)) {
			if (entry.getType() == type) {
				return entry;
			}
		}
		throw new IllegalArgumentException("No entry of type " + type + " for: " + lookupKey);
	}
}
