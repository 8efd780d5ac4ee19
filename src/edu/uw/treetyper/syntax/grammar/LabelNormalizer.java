package edu.uw.treetyper.syntax.grammar;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives display labels and lexicon keys from node labels.
 *
 * Superscripts (NP^2) and numeric subscripts (NP_1) only tell apart nodes that would otherwise look the same, so
 * they are dropped from the lookup key. Other subscripts (that_{RP}) pick out one reading of an ambiguous word and
 * are kept.
 */
public class LabelNormalizer {

	// \node(top){S };
	private final static Pattern ROOT_COMMAND = Pattern.compile("\\\\node\\(([^)]*)\\)\\{(.*)\\};?", Pattern.DOTALL);
	private final static Pattern SUPERSCRIPT = Pattern.compile("\\^(\\{[^{}]*\\}|[^\\s^_{}$]+)");
	private final static Pattern NUMERIC_SUBSCRIPT = Pattern.compile("_(\\{[0-9]+\\}|[0-9]+)(?=$|_|\\$$)");

	private LabelNormalizer() {
	}

	public static boolean isRootCommand(final String rawLabel) {
		return rawLabel.startsWith("\\node");
	}

	public static boolean isWellFormedRootCommand(final String rawLabel) {
		return ROOT_COMMAND.matcher(rawLabel).matches();
	}

	/**
	 * The label to show for a node: the text inside a \node command, otherwise the label as written.
	 */
	public static String displayLabel(final String rawLabel) {
		final Matcher matcher = ROOT_COMMAND.matcher(rawLabel);
		if (matcher.matches()) {
			return matcher.group(2).trim();
		}
		return rawLabel;
	}

	public static Optional<String> nodeName(final String rawLabel) {
		final Matcher matcher = ROOT_COMMAND.matcher(rawLabel);
		return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
	}

	public static String lookupKey(final String displayLabel) {
		final String withoutSuperscripts = SUPERSCRIPT.matcher(displayLabel).replaceAll("");
		return NUMERIC_SUBSCRIPT.matcher(withoutSuperscripts).replaceAll("");
	}
}
