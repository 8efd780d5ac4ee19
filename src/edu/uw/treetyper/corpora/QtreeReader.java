package edu.uw.treetyper.corpora;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import edu.uw.treetyper.corpora.TreeParseException.Kind;
import edu.uw.treetyper.syntax.grammar.LabelNormalizer;
import edu.uw.treetyper.syntax.grammar.TreeNode;
import edu.uw.treetyper.syntax.grammar.TreeNode.TreeNodeInternal;
import edu.uw.treetyper.syntax.grammar.TreeNode.TreeNodeLeaf;

/**
 * Reads trees in qtree bracket notation, e.g.
 *
 * [.\node(top){S }; [.NP [.N Andrew ] ] [.VP [.V hits ] [.NP^2 [.N^2 Mathis ] ] ] ]
 *
 * Every bracket opens with "[." directly followed by its label. Children are nested brackets or bare tokens. A
 * bracket without children, such as [.$t$ ], is a leaf. The root may be labelled with a tikz \node command.
 */
public class QtreeReader {

	private enum TokenType {
		OPEN, CLOSE, WORD
	}

	private static class Token {
		private final TokenType type;
		private final String text;
		private final int offset;

		private Token(final TokenType type, final String text, final int offset) {
			this.type = type;
			this.text = text;
			this.offset = offset;
		}
	}

	private final boolean strictBracketSpacing;

	/**
	 * @param strictBracketSpacing
	 *            if true, reject closing brackets that are not preceded by whitespace. tikz-qtree cannot draw these.
	 */
	public QtreeReader(final boolean strictBracketSpacing) {
		this.strictBracketSpacing = strictBracketSpacing;
	}

	public static TreeNode parse(final String input) {
		return new QtreeReader(false).read(input);
	}

	public TreeNode read(final String input) {
		// "\node" in a source string where the backslash was not doubled.
		final int unescaped = input.indexOf("\n" + "ode(");
		if (unescaped > -1) {
			throw new TreeParseException(Kind.UNESCAPED_COMMAND, unescaped,
					"Line break followed by \"ode(\": backslashes in the tree string need to be escaped");
		}

		final List<Token> tokens = tokenize(input);
		if (tokens.isEmpty()) {
			throw new TreeParseException(Kind.EMPTY_INPUT, 0, "No tree in input");
		}

		final Token first = tokens.get(0);
		if (first.type == TokenType.CLOSE) {
			throw new TreeParseException(Kind.UNBALANCED_BRACKETS, first.offset, "Closing bracket without opening bracket");
		} else if (first.type == TokenType.WORD) {
			throw new TreeParseException(Kind.NOT_A_TREE, first.offset, "Expected \"[.\" but found: " + first.text);
		}

		final TokenStream stream = new TokenStream(tokens);
		final TreeNode root = readTree(stream, new AtomicInteger(0), true);

		if (stream.hasNext()) {
			final Token extra = stream.next();
			if (extra.type == TokenType.CLOSE) {
				throw new TreeParseException(Kind.UNBALANCED_BRACKETS, extra.offset, "Extra closing bracket");
			}
			throw new TreeParseException(Kind.TRAILING_INPUT, extra.offset, "Input continues after the tree: "
					+ input.substring(extra.offset).trim());
		}

		return root;
	}

	private static class TokenStream {
		private final List<Token> tokens;
		private int index = 0;

		private TokenStream(final List<Token> tokens) {
			this.tokens = tokens;
		}

		boolean hasNext() {
			return index < tokens.size();
		}

		Token peek() {
			return tokens.get(index);
		}

		Token next() {
			return tokens.get(index++);
		}
	}

	private TreeNode readTree(final TokenStream stream, final AtomicInteger nodeIndex, final boolean isRoot) {
		final Token open = stream.next();
		// The tokenizer always puts the label straight after an opening bracket.
		final Token label = stream.next();
		checkLabel(label, isRoot);

		final int id = nodeIndex.getAndIncrement();
		final List<TreeNode> children = new ArrayList<>();
		while (true) {
			if (!stream.hasNext()) {
				throw new TreeParseException(Kind.UNBALANCED_BRACKETS, open.offset, "No closing bracket for: [."
						+ label.text);
			}

			final Token token = stream.peek();
			if (token.type == TokenType.CLOSE) {
				stream.next();
				break;
			} else if (token.type == TokenType.OPEN) {
				children.add(readTree(stream, nodeIndex, false));
			} else {
				stream.next();
				checkLabel(token, false);
				children.add(new TreeNodeLeaf(nodeIndex.getAndIncrement(), token.text, false));
			}
		}

		if (children.isEmpty()) {
			return new TreeNodeLeaf(id, label.text, true);
		}
		return new TreeNodeInternal(id, label.text, children);
	}

	private static void checkLabel(final Token label, final boolean isRoot) {
		if (!LabelNormalizer.isRootCommand(label.text)) {
			return;
		}

		if (!isRoot) {
			throw new TreeParseException(Kind.MISPLACED_ROOT_COMMAND, label.offset,
					"A \\node command can only label the root: " + label.text);
		}
		if (!LabelNormalizer.isWellFormedRootCommand(label.text)
				|| LabelNormalizer.displayLabel(label.text).isEmpty()) {
			throw new TreeParseException(Kind.MISSING_LABEL, label.offset, "Expected \\node(name){label}; but found: "
					+ label.text);
		}
	}

	private List<Token> tokenize(final String input) {
		final List<Token> result = new ArrayList<>();
		int i = 0;
		while (i < input.length()) {
			final char c = input.charAt(i);
			if (Character.isWhitespace(c)) {
				i++;
			} else if (c == '[') {
				if (i + 1 >= input.length() || input.charAt(i + 1) != '.') {
					throw new TreeParseException(Kind.MISSING_LABEL, i, "Opening bracket must be followed by \".\" and a label");
				}
				final int labelStart = i + 2;
				if (labelStart >= input.length() || isBoundary(input.charAt(labelStart))) {
					throw new TreeParseException(Kind.MISSING_LABEL, i, "No label after opening bracket");
				}
				result.add(new Token(TokenType.OPEN, "[.", i));
				i = readWord(input, labelStart, result);
			} else if (c == ']') {
				if (strictBracketSpacing && i > 0 && !Character.isWhitespace(input.charAt(i - 1))) {
					throw new TreeParseException(Kind.BRACKET_SPACING, i,
							"Closing brackets need to be preceded by white space");
				}
				result.add(new Token(TokenType.CLOSE, "]", i));
				i++;
			} else {
				i = readWord(input, i, result);
			}
		}

		return result;
	}

	/**
	 * Reads a label or leaf token. Text inside {} or () belongs to the token even if it contains spaces or brackets,
	 * so that \node(top){S }; stays in one piece.
	 */
	private static int readWord(final String input, final int start, final List<Token> result) {
		int depth = 0;
		int i = start;
		while (i < input.length()) {
			final char c = input.charAt(i);
			if (c == '{' || c == '(') {
				depth++;
			} else if ((c == '}' || c == ')') && depth > 0) {
				depth--;
			} else if (depth == 0 && isBoundary(c)) {
				break;
			}
			i++;
		}

		if (depth > 0) {
			throw new TreeParseException(Kind.UNTERMINATED_GROUP, start, "Unclosed brace or parenthesis in: "
					+ input.substring(start));
		}
		if (i < input.length() && input.charAt(i) == '[') {
			throw new TreeParseException(Kind.UNEXPECTED_BRACKET, i, "Opening bracket directly after: "
					+ input.substring(start, i));
		}

		result.add(new Token(TokenType.WORD, input.substring(start, i), start));
		return i;
	}

	private static boolean isBoundary(final char c) {
		return Character.isWhitespace(c) || c == '[' || c == ']';
	}
}
