package edu.uw.treetyper.syntax.grammar;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;

public class LabelNormalizerTest {

	@Test
	public void superscriptsAreDropped() {
		assertThat(LabelNormalizer.lookupKey("NP^2")).isEqualTo("NP");
		assertThat(LabelNormalizer.lookupKey("N$'$^2")).isEqualTo("N$'$");
		assertThat(LabelNormalizer.lookupKey("A^{12}")).isEqualTo("A");
	}

	@Test
	public void numericSubscriptsAreDropped() {
		assertThat(LabelNormalizer.lookupKey("NP_1")).isEqualTo("NP");
		assertThat(LabelNormalizer.lookupKey("NP_{12}")).isEqualTo("NP");
		assertThat(LabelNormalizer.lookupKey("N^2_1")).isEqualTo("N");
	}

	@Test
	public void indicesInsideMathMode() {
		assertThat(LabelNormalizer.lookupKey("$t_1$")).isEqualTo("$t$");
		assertThat(LabelNormalizer.lookupKey("$t_{12}$")).isEqualTo("$t$");
		assertThat(LabelNormalizer.lookupKey("$t^2$")).isEqualTo("$t$");
		assertThat(LabelNormalizer.lookupKey("$t_x$")).isEqualTo("$t_x$");
	}

	@Test
	public void otherSubscriptsAreKept() {
		assertThat(LabelNormalizer.lookupKey("der_{RP}")).isEqualTo("der_{RP}");
		assertThat(LabelNormalizer.lookupKey("that_{dem}^2")).isEqualTo("that_{dem}");
		assertThat(LabelNormalizer.lookupKey("und_{ind}")).isEqualTo("und_{ind}");
	}

	@Test
	public void plainLabelsAreUnchanged() {
		assertThat(LabelNormalizer.lookupKey("Andrew")).isEqualTo("Andrew");
		assertThat(LabelNormalizer.lookupKey("$t$")).isEqualTo("$t$");
		assertThat(LabelNormalizer.lookupKey("1")).isEqualTo("1");
	}

	@Test
	public void rootCommand() {
		final String raw = "\\node(top){S$'$ };";
		assertThat(LabelNormalizer.isRootCommand(raw)).isTrue();
		assertThat(LabelNormalizer.isWellFormedRootCommand(raw)).isTrue();
		assertThat(LabelNormalizer.displayLabel(raw)).isEqualTo("S$'$");
		assertThat(LabelNormalizer.nodeName(raw).get()).isEqualTo("top");
	}

	@Test
	public void ordinaryLabelIsItsOwnDisplayLabel() {
		assertThat(LabelNormalizer.displayLabel("NP^2")).isEqualTo("NP^2");
		assertThat(LabelNormalizer.nodeName("NP^2").isPresent()).isFalse();
		assertThat(LabelNormalizer.isRootCommand("NP^2")).isFalse();
	}
}
