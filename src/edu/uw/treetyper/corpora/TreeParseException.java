package edu.uw.treetyper.corpora;

/**
 * Thrown when a string cannot be read as a qtree bracket tree.
 */
public class TreeParseException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	public enum Kind {
		EMPTY_INPUT, NOT_A_TREE, UNBALANCED_BRACKETS, MISSING_LABEL, UNEXPECTED_BRACKET, UNTERMINATED_GROUP, MISPLACED_ROOT_COMMAND, TRAILING_INPUT, UNESCAPED_COMMAND, BRACKET_SPACING
	}

	private final Kind kind;
	private final int offset;

	public TreeParseException(final Kind kind, final int offset, final String message) {
		super(message + " (" + kind + " at offset " + offset + ")");
		this.kind = kind;
		this.offset = offset;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Character offset in the input where the problem was found.
	 */
	public int getOffset() {
		return offset;
	}
}
