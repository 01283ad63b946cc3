package org.javai.twine.harlowe;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.twine.ast.Node;
import org.javai.twine.ast.Nodes;
import org.junit.jupiter.api.Test;

class PossessiveResolverTest {

	private final PossessiveResolver resolver = new PossessiveResolver();
	private final Node arr = Nodes.storyVariable("arr");

	@Test
	void ordinalsBecomeZeroBasedIndices() {
		assertThat(resolver.resolve("$arr's 1st")).contains(Nodes.arrayAccess(arr, Nodes.number(0)));
		assertThat(resolver.resolve("$arr's 2nd")).contains(Nodes.arrayAccess(arr, Nodes.number(1)));
		assertThat(resolver.resolve("$arr's 22nd")).contains(Nodes.arrayAccess(arr, Nodes.number(21)));
	}

	@Test
	void ordinalSuffixIsNotValidated() {
		assertThat(resolver.resolve("$arr's 1nd")).contains(Nodes.arrayAccess(arr, Nodes.number(0)));
	}

	@Test
	void specialProperties() {
		assertThat(resolver.resolve("$arr's length")).contains(Nodes.lengthOf(arr));
		assertThat(resolver.resolve("$arr's keys")).contains(Nodes.datamapKeys(arr));
		assertThat(resolver.resolve("$arr's values")).contains(Nodes.datamapValues(arr));
		assertThat(resolver.resolve("$arr's last")).contains(Nodes.arrayLast(arr));
	}

	@Test
	void otherPropertiesFallBackToPropertyAccess() {
		assertThat(resolver.resolve("$arr's name ")).contains(Nodes.propertyAccess(arr, "name"));
		assertThat(resolver.resolve("$arr's 99999999999th"))
				.contains(Nodes.propertyAccess(arr, "99999999999th"));
	}

	@Test
	void nonPossessiveExpressionsAreIgnored() {
		assertThat(resolver.resolve("$arr + 1")).isEmpty();
		assertThat(resolver.resolve("_tmp's 1st")).isEmpty();
		assertThat(resolver.resolve("$arr's")).isEmpty();
		assertThat(resolver.resolve(null)).isEmpty();
	}
}
