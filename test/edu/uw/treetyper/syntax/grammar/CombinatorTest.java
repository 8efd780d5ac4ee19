package edu.uw.treetyper.syntax.grammar;

import static com.google.common.truth.Truth.assertThat;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import org.junit.Test;

import edu.uw.treetyper.semantics.SemanticType;
import edu.uw.treetyper.syntax.grammar.Combinator.RuleProduction;
import edu.uw.treetyper.syntax.grammar.Combinator.RuleType;

public class CombinatorTest {
	private static final Set<RuleType> ALL_RULES = EnumSet.of(RuleType.PREDICATE_MODIFICATION,
			RuleType.PREDICATE_ABSTRACTION);

	private static Optional<RuleProduction> combine(final String left, final String right,
			final Set<RuleType> enabled) {
		return combine(SemanticType.valueOf(left), SemanticType.valueOf(right), enabled);
	}

	private static Optional<RuleProduction> combine(final SemanticType left, final SemanticType right,
			final Set<RuleType> enabled) {
		return Combinator.combine(left, right, Combinator.STANDARD_COMBINATORS, enabled);
	}

	private static RuleProduction combine(final String left, final String right) {
		return combine(left, right, ALL_RULES).get();
	}

	@Test
	public void functionalApplication() {
		final RuleProduction forward = combine("<e,t>", "e");
		assertThat(forward.getRuleType()).isEqualTo(RuleType.FORWARD_APPLICATION);
		assertThat(forward.getType()).isSameInstanceAs(SemanticType.T);

		final RuleProduction backward = combine("e", "<e,t>");
		assertThat(backward.getRuleType()).isEqualTo(RuleType.BACKWARD_APPLICATION);
		assertThat(backward.getType()).isSameInstanceAs(SemanticType.T);
		assertThat(backward.getRuleType().getLabel()).isEqualTo("FA");
	}

	@Test
	public void higherOrderApplication() {
		assertThat(combine("<<e,t>,e>", "<e,t>").getType()).isSameInstanceAs(SemanticType.E);
		assertThat(combine("<e,<e,t>>", "e").getType()).isSameInstanceAs(SemanticType.EtoT);
	}

	@Test
	public void quantifierTakesPredicate() {
		assertThat(combine("<<e,t>,t>", "<<<e,t>,t>,t>").getRuleType()).isEqualTo(RuleType.BACKWARD_APPLICATION);
		assertThat(combine("<t,t>", "t").getRuleType()).isEqualTo(RuleType.FORWARD_APPLICATION);
	}

	@Test
	public void predicateModification() {
		final RuleProduction production = combine("<e,t>", "<e,t>");
		assertThat(production.getRuleType()).isEqualTo(RuleType.PREDICATE_MODIFICATION);
		assertThat(production.getType()).isSameInstanceAs(SemanticType.EtoT);
		assertThat(combine("<e,t>", "<e,t>", EnumSet.noneOf(RuleType.class)).isPresent()).isFalse();
	}

	@Test
	public void predicateAbstraction() {
		final RuleProduction production = combine(SemanticType.INDEX, SemanticType.T, ALL_RULES).get();
		assertThat(production.getRuleType()).isEqualTo(RuleType.PREDICATE_ABSTRACTION);
		assertThat(production.getType()).isSameInstanceAs(SemanticType.EtoT);
		assertThat(combine(SemanticType.INDEX, SemanticType.T, EnumSet.of(RuleType.PREDICATE_MODIFICATION)).isPresent()).isFalse();
	}

	@Test
	public void vacuousDaughter() {
		final RuleProduction production = combine(SemanticType.VACUOUS, SemanticType.EtoT, EnumSet.noneOf(RuleType.class)).get();
		assertThat(production.getRuleType()).isEqualTo(RuleType.NON_BRANCHING);
		assertThat(production.getType()).isSameInstanceAs(SemanticType.EtoT);
	}

	@Test
	public void noRuleApplies() {
		assertThat(combine("e", "t", ALL_RULES).isPresent()).isFalse();
		assertThat(combine("e", "e", ALL_RULES).isPresent()).isFalse();
	}
}
