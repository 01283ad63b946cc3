package org.javai.twine.harlowe;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class DelimiterScannerTest {

	@Test
	void findsMatchingCloserPastNestedGroups() {
		String text = "(if: (num: 5) > 3)[shown]";

		assertThat(DelimiterScanner.findMatching(text, 0, '(', ')')).isEqualTo(17);
		assertThat(DelimiterScanner.findMatching(text, 5, '(', ')')).isEqualTo(12);
		assertThat(DelimiterScanner.findMatching(text, 18, '[', ']')).isEqualTo(text.length() - 1);
	}

	@Test
	void delimitersInsideStringsAreInert() {
		String text = "(set: $x to \"a) (b\")";

		assertThat(DelimiterScanner.findMatching(text, 0, '(', ')')).isEqualTo(text.length() - 1);
	}

	@Test
	void escapedQuoteDoesNotCloseString() {
		String text = "(print: \"say \\\")\")";

		assertThat(DelimiterScanner.findMatching(text, 0, '(', ')')).isEqualTo(text.length() - 1);
	}

	@Test
	void apostropheDoesNotOpenString() {
		String text = "(if: $bag's length > 0)[Don't (stop)]";

		assertThat(DelimiterScanner.findMatching(text, 0, '(', ')')).isEqualTo(22);
		assertThat(DelimiterScanner.findMatching(text, 23, '[', ']')).isEqualTo(text.length() - 1);
	}

	@Test
	void unclosedDelimiterReturnsMinusOne() {
		assertThat(DelimiterScanner.findMatching("(if: $x [a]", 0, '(', ')')).isEqualTo(-1);
		assertThat(DelimiterScanner.findMatching("(a: \")\"", 0, '(', ')')).isEqualTo(-1);
	}

	@Test
	void failedSearchRecordsOpenersLeftUnclosed() {
		String text = "((a) (b \")\" (c";
		BitSet unclosed = new BitSet();

		assertThat(DelimiterScanner.findMatching(text, 0, '(', ')', unclosed)).isEqualTo(-1);

		assertThat(unclosed.stream().toArray()).containsExactly(0, 5, 12);
		assertThat(DelimiterScanner.findMatching(text, 1, '(', ')')).isEqualTo(3);
		assertThat(DelimiterScanner.findMatching(text, 5, '(', ')')).isEqualTo(-1);
		assertThat(DelimiterScanner.findMatching(text, 12, '(', ')')).isEqualTo(-1);
	}

	@Test
	void successfulSearchRecordsNothing() {
		BitSet unclosed = new BitSet();

		assertThat(DelimiterScanner.findMatching("(a (b) c)", 0, '(', ')', unclosed)).isEqualTo(8);
		assertThat(unclosed.isEmpty()).isTrue();
	}

	@Test
	void findMatchingRejectsWrongStartCharacter() {
		assertThat(DelimiterScanner.findMatching("abc", 0, '(', ')')).isEqualTo(-1);
		assertThat(DelimiterScanner.findMatching("abc", 7, '(', ')')).isEqualTo(-1);
		assertThat(DelimiterScanner.findMatching(null, 0, '(', ')')).isEqualTo(-1);
	}

	@Test
	void splitsOnlyOnTopLevelSeparators() {
		List<String> pieces = DelimiterScanner.splitTopLevel("\"a, b\", (a: 1, 2), [x, y], 3", ',');

		assertThat(pieces).containsExactly("\"a, b\"", " (a: 1, 2)", " [x, y]", " 3");
	}

	@Test
	void keywordMustStandAlone() {
		assertThat(DelimiterScanner.indexOfKeyword("$total to 5", "to")).isEqualTo(7);
		assertThat(DelimiterScanner.indexOfKeyword("$tomato", "to")).isEqualTo(-1);
		assertThat(DelimiterScanner.indexOfKeyword("$x to \"go to bed\"", "to")).isEqualTo(3);
	}

	@Test
	void lastKeywordSkipsEarlierOccurrences() {
		String text = "\"into\" + $a into $b";

		assertThat(DelimiterScanner.lastIndexOfKeyword(text, "into")).isEqualTo(12);
	}

	@Test
	void operatorSearchHonoursExclusion() {
		assertThat(DelimiterScanner.indexOfOperator("$a >= 3", ">", '=')).isEqualTo(-1);
		assertThat(DelimiterScanner.indexOfOperator("$a >= 3", ">=", (char) 0)).isEqualTo(3);
		assertThat(DelimiterScanner.indexOfOperator("\"<\" < $b", "<", '=')).isEqualTo(4);
	}
}
