package org.javai.twine.ast;

import java.util.Objects;

/**
 * A single macro argument after classification.
 * <p>
 * Arguments are classified once by the scanner; translators inspect the variant
 * instead of re-parsing text. Values that match no simple form stay as an
 * {@link ExpressionValue} and are examined later by the expression builder.
 */
public sealed interface ClassifiedValue {

	/**
	 * The argument's textual value: string contents without quotes, numbers in
	 * their shortest form, variables with their sigil, expressions verbatim.
	 */
	String text();

	record NumberValue(double value) implements ClassifiedValue {
		@Override
		public String text() {
			return formatNumber(value);
		}
	}

	record StringValue(String value) implements ClassifiedValue {
		public StringValue {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public String text() {
			return value;
		}
	}

	record BooleanValue(boolean value) implements ClassifiedValue {
		@Override
		public String text() {
			return Boolean.toString(value);
		}
	}

	record VariableValue(VariableScope scope, String name) implements ClassifiedValue {
		public VariableValue {
			Objects.requireNonNull(scope, "scope must not be null");
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public String text() {
			return scope.sigil() + name;
		}
	}

	record ExpressionValue(String expression) implements ClassifiedValue {
		public ExpressionValue {
			Objects.requireNonNull(expression, "expression must not be null");
		}

		@Override
		public String text() {
			return expression;
		}
	}

	/**
	 * Formats a number without a trailing {@code .0} when it is integral.
	 */
	static String formatNumber(double value) {
		if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
			return Long.toString((long) value);
		}
		return Double.toString(value);
	}
}
