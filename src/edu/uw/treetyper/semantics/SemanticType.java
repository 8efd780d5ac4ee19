package edu.uw.treetyper.semantics;

import java.util.HashMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

import edu.uw.treetyper.util.Util;

/**
 * Represents the semantic type of a node: atomic types such as entities (e) and truth values (t), and function types
 * written <A,B>. Types are interned, so two equal types are always the same object.
 */
public abstract class SemanticType {
	private final static Table<SemanticType, SemanticType, SemanticType> cache = HashBasedTable.create();
	private final static Map<String, SemanticType> atomicCache = new HashMap<>();

	public final static SemanticType E = atomic("e");
	public final static SemanticType T = atomic("t");
	public static final SemanticType EtoT = make(E, T);

	/**
	 * Type of a movement index, the binder for Predicate Abstraction.
	 */
	public static final SemanticType INDEX = new MarkerSemanticType("index");

	/**
	 * Type of a semantically vacuous item, which is ignored when composing.
	 */
	public static final SemanticType VACUOUS = new MarkerSemanticType("vacuous");

	/**
	 * Marks a node whose type could not be resolved.
	 */
	public static final SemanticType ERROR = new MarkerSemanticType("ERROR");

	static class AtomicSemanticType extends SemanticType {
		private final String type;

		private AtomicSemanticType(final String type) {
			super();
			this.type = type;
		}

		@Override
		public SemanticType getFrom() {
			throw new UnsupportedOperationException();
		}

		@Override
		public SemanticType getTo() {
			throw new UnsupportedOperationException();
		}

		@Override
		public boolean isComplex() {
			return false;
		}

		@Override
		public String toString() {
			return type;
		}
	}

	/**
	 * Index, vacuous and error markers. These never appear inside a function type.
	 */
	static class MarkerSemanticType extends AtomicSemanticType {
		private MarkerSemanticType(final String name) {
			super(name);
		}

		@Override
		public boolean isMarker() {
			return true;
		}
	}

	static class ComplexSemanticType extends SemanticType {
		private final SemanticType from;
		private final SemanticType to;

		private ComplexSemanticType(final SemanticType from, final SemanticType to) {
			super();
			this.from = from;
			this.to = to;
		}

		@Override
		public SemanticType getFrom() {
			return from;
		}

		@Override
		public SemanticType getTo() {
			return to;
		}

		@Override
		public boolean isComplex() {
			return true;
		}

		@Override
		public String toString() {
			return "<" + from + "," + to + ">";
		}
	}

	private static SemanticType atomic(final String name) {
		synchronized (atomicCache) {
			SemanticType result = atomicCache.get(name);
			if (result == null) {
				result = new AtomicSemanticType(name);
				atomicCache.put(name, result);
			}
			return result;
		}
	}

	public static SemanticType make(final SemanticType from, final SemanticType to) {
		Preconditions.checkArgument(!from.isMarker() && !to.isMarker(), "Not a contentful type: <%s,%s>", from, to);
		synchronized (cache) {
			SemanticType result = cache.get(from, to);
			if (result == null) {
				result = new ComplexSemanticType(from, to);
				cache.put(from, to, result);
			}
			return result;
		}
	}

	/**
	 * Builds a type from its string form, e.g. "e", "<e,t>" or "<<e, t>, e>".
	 */
	public static SemanticType valueOf(final String source) {
		final String type = source.trim();
		if (type.startsWith("<")) {
			if (Util.findClosingBracket(type, 0, '<', '>') != type.length() - 1) {
				throw new IllegalArgumentException("Unbalanced angle brackets in semantic type: " + source);
			}
			final String inner = type.substring(1, type.length() - 1);
			final int comma = Util.findNonNestedChar(inner, ",");
			if (comma == -1) {
				throw new IllegalArgumentException("Function type needs two comma-separated parts: " + source);
			}
			return make(valueOf(inner.substring(0, comma)), valueOf(inner.substring(comma + 1)));
		}

		if (!type.matches("[a-zA-Z][a-zA-Z0-9]*")) {
			throw new IllegalArgumentException("Unable to interpret semantic type: \"" + source + "\"");
		}
		return atomic(type);
	}

	public abstract SemanticType getFrom();

	public abstract SemanticType getTo();

	public abstract boolean isComplex();

	public boolean isMarker() {
		return false;
	}

	/**
	 * True if this is a function type taking the given argument.
	 */
	public boolean takesArgument(final SemanticType argument) {
		return isComplex() && getFrom() == argument;
	}

}
