package org.javai.twine.harlowe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import java.time.Duration;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.twine.ast.ClassifiedValue;
import org.javai.twine.ast.Diagnostic;
import org.javai.twine.ast.MacroCall;
import org.javai.twine.ast.Node;
import org.javai.twine.ast.NodeWalker;
import org.javai.twine.ast.Nodes;
import org.javai.twine.ast.TableEntry;
import org.javai.twine.ast.VariableScope;
import org.javai.twine.harlowe.config.HarloweParserConfig;
import org.javai.twine.harlowe.macro.DefaultMacroRegistry;
import org.javai.twine.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Scanner behaviour over whole passages, using the standard macro sets.
 */
class MacroScannerTest {

	private DefaultMacroRegistry registry;
	private MacroScanner scanner;

	@BeforeEach
	void setUp() {
		registry = DefaultMacroRegistry.standard(HarloweParserConfig.defaults());
		scanner = new MacroScanner(registry, HarloweParserConfig.defaults());
	}

	@Test
	void plainTextIsOneTextNode() {
		assertThat(scanner.parsePassage("You are in a dark room.")).containsExactly(Nodes.text("You are in a dark room."));
	}

	@Test
	void emptyPassageYieldsNoNodes() {
		assertThat(scanner.parsePassage("")).isEmpty();
		assertThat(scanner.parsePassage(null)).isEmpty();
	}

	@Test
	void textWithoutMacrosIsKeptCharacterForCharacter() {
		List<String> inputs = List.of(
				"a ( b ) ( c",
				"(hello world) and (",
				"Unclosed (if: $x [world",
				"))((][",
				"Don't \"quote\" me (or do)",
				"(: nothing) (1st try)");

		for (String input : inputs) {
			List<Node> nodes = scanner.parsePassage(input);
			StringBuilder joined = new StringBuilder();
			for (Node node : nodes) {
				assertThat(node).isInstanceOf(Node.Text.class);
				joined.append(((Node.Text) node).content());
			}
			assertThat(joined.toString()).as(input).isEqualTo(input);
		}
	}

	@Test
	void textAroundMacrosIsPreserved() {
		List<Node> nodes = scanner.parsePassage("You have (print: $gold) gold.");

		assertThat(nodes).containsExactly(
				Nodes.text("You have "),
				Nodes.print(Nodes.storyVariable("gold")),
				Nodes.text(" gold."));
	}

	@Test
	void nestedMacroDoesNotCloseOuterMacro() {
		List<Node> nodes = scanner.parsePassage("(if: (num: 5) > 3)[shown]");

		MacroCall num = MacroCall.of("num", new ClassifiedValue.NumberValue(5));
		assertThat(nodes).containsExactly(Nodes.conditional(
				Nodes.binary(">", Nodes.unsupportedMacro(num), Nodes.number(3)),
				List.of(Nodes.text("shown"))));
	}

	@Test
	void parenthesesInsideStringsAreInert() {
		List<Node> nodes = scanner.parsePassage("(set: $x to \"a) (b\")");

		assertThat(nodes).containsExactly(Nodes.assignment("x", VariableScope.STORY, Nodes.string("a) (b")));
	}

	@Test
	void unknownMacroDegradesToWarning() {
		List<Node> nodes = scanner.parsePassage("(totallyUnknownMacro: 1, 2)[x]");

		assertThat(nodes).hasSize(1);
		Node.Warning warning = (Node.Warning) nodes.get(0);
		assertThat(warning.message()).contains("totallyUnknownMacro");
		assertThat(warning.original().name()).isEqualTo("totallyUnknownMacro");
		assertThat(warning.original().arguments()).containsExactly(
				new ClassifiedValue.NumberValue(1), new ClassifiedValue.NumberValue(2));
		assertThat(warning.original().hook()).isEqualTo("x");
	}

	@Test
	void ordinalPossessivesAreZeroBased() {
		List<Node> nodes = scanner.parsePassage("(print: $arr's 1st)(print: $arr's 2nd)");

		assertThat(nodes).containsExactly(
				Nodes.print(Nodes.arrayAccess(Nodes.storyVariable("arr"), Nodes.number(0))),
				Nodes.print(Nodes.arrayAccess(Nodes.storyVariable("arr"), Nodes.number(1))));
	}

	@Test
	void hookAttachesOnlyWhenAdjacent() {
		assertThat(scanner.parsePassage("(if: $x)[a]")).containsExactly(
				Nodes.conditional(Nodes.storyVariable("x"), List.of(Nodes.text("a"))));

		assertThat(scanner.parsePassage("(if: $x) [a]")).containsExactly(
				Nodes.conditional(Nodes.storyVariable("x"), List.of()),
				Nodes.text(" [a]"));
	}

	@Test
	void malformedMacroDoesNotAffectSiblings() {
		List<Node> nodes = scanner.parsePassage("(set: $a to 1)(set:)(set: $b to 2)");

		assertThat(nodes).hasSize(3);
		assertThat(nodes.get(0)).isEqualTo(Nodes.assignment("a", VariableScope.STORY, Nodes.number(1)));
		assertThat(nodes.get(1)).isInstanceOf(Node.Error.class);
		assertThat(((Node.Error) nodes.get(1)).original()).isEqualTo(MacroCall.of("set"));
		assertThat(nodes.get(2)).isEqualTo(Nodes.assignment("b", VariableScope.STORY, Nodes.number(2)));
	}

	@Test
	void datamapRequiresPairs() {
		assertThat(scanner.parsePassage("(dm: \"a\", 1, \"b\")").get(0)).isInstanceOf(Node.Error.class);

		assertThat(scanner.parsePassage("(dm: \"a\", 1, \"b\", 2)")).containsExactly(Nodes.tableLiteral(List.of(
				new TableEntry("a", Nodes.number(1)),
				new TableEntry("b", Nodes.number(2)))));
	}

	@Test
	void emptyArgumentListWithSeparator() {
		assertThat(scanner.parsePassage("(else:)[no]")).containsExactly(Nodes.otherwise(List.of(Nodes.text("no"))));
		assertThat(scanner.parsePassage("(else)[no]")).containsExactly(Nodes.otherwise(List.of(Nodes.text("no"))));
	}

	@Test
	void macroNamesAreCaseInsensitive() {
		assertThat(scanner.parsePassage("(IF: true)[x](Else-If: $y)[z]")).containsExactly(
				Nodes.conditional(Nodes.bool(true), List.of(Nodes.text("x"))),
				Nodes.elsif(Nodes.storyVariable("y"), List.of(Nodes.text("z"))));
	}

	@Test
	void configuredAliasesResolve() {
		assertThat(scanner.parsePassage("(array: 1)")).containsExactly(Nodes.arrayLiteral(List.of(Nodes.number(1))));
	}

	@Test
	void macroCallsInsideArgumentsAreTranslated() {
		List<Node> nodes = scanner.parsePassage("(set: $inv to (a: \"sword\", \"shield\"))");

		assertThat(nodes).containsExactly(Nodes.assignment("inv", VariableScope.STORY,
				Nodes.arrayLiteral(List.of(Nodes.string("sword"), Nodes.string("shield")))));
	}

	@Test
	void namedHooksArePrependedAndParsed() {
		List<Node> nodes = scanner.parsePassage("Intro |door>[Shut (if: $open)[open]] end");

		assertThat(nodes).containsExactly(
				Nodes.namedHook("door", List.of(
						Nodes.text("Shut "),
						Nodes.conditional(Nodes.storyVariable("open"), List.of(Nodes.text("open")))), false),
				Nodes.text("Intro  end"));
	}

	@Test
	void namedHooksInsideHookBodiesBelongToTheBody() {
		List<Node> nodes = scanner.parsePassage("(if: $x)[|msg)[hi]]");

		assertThat(nodes).containsExactly(Nodes.conditional(Nodes.storyVariable("x"),
				List.of(Nodes.namedHook("msg", List.of(Nodes.text("hi")), true))));
	}

	@Test
	void excessiveNestingBecomesAnErrorNode() {
		MacroScanner shallow = new MacroScanner(registry, HarloweParserConfig.defaults().withMaxNestingDepth(2));

		try (LogCaptorAppender captor = LogCaptorAppender.capture(MacroScanner.class, Level.WARN)) {
			List<Node> nodes = shallow.parsePassage("(if: true)[(if: true)[(if: true)[deep]]]");

			Node innermost = Nodes.conditional(Nodes.bool(true), List.of(Nodes.error("Maximum nesting depth 2 exceeded")));
			assertThat(nodes).containsExactly(Nodes.conditional(Nodes.bool(true), List.of(
					Nodes.conditional(Nodes.bool(true), List.of(innermost)))));
			assertThat(captor.messagesAt(Level.WARN)).anyMatch(msg -> msg.contains("exceeds limit 2"));
		}
	}

	@Test
	void pathologicalNestingTerminatesWithDiagnostics() {
		String passage = "(if: true)[".repeat(5_000) + "x" + "]".repeat(5_000);

		List<Node> nodes = scanner.parsePassage(passage);

		assertThat(NodeWalker.hasErrors(nodes)).isTrue();
	}

	@Test
	void deeplyNestedMacroArgumentsTerminate() {
		String passage = "(print: " + "(a: ".repeat(500) + "1" + ")".repeat(500) + ")";

		assertThatCode(() -> scanner.parsePassage(passage)).doesNotThrowAnyException();
		assertThat(NodeWalker.hasErrors(scanner.parsePassage(passage))).isTrue();
	}

	@Test
	void groupsAndNestedMacrosShareOneDepthBudget() {
		String layer = "((((" + "(a: ";
		String layered = "(print: " + layer.repeat(40) + "1" + ")))))".repeat(40) + ")";

		List<Node> nodes = scanner.parsePassage(layered);

		assertThat(nodes).hasSize(1).first().isInstanceOf(Node.Print.class);
		assertThat(NodeWalker.diagnostics(nodes)).extracting(Diagnostic::message)
				.containsExactly("Maximum nesting depth 64 exceeded");
	}

	@Test
	void deepGroupsAroundNestedPrintsTerminate() {
		String passage = "1";
		for (int i = 0; i < 70; i++) {
			passage = "(print: " + "(".repeat(125) + passage + ")".repeat(125) + ")";
		}
		String nested = passage;

		assertThatCode(() -> scanner.parsePassage(nested)).doesNotThrowAnyException();
		assertThat(scanner.parsePassage(nested)).hasSize(1).first().isInstanceOf(Node.Print.class);
	}

	@Test
	void longRunsOfUnclosedOpenersStayText() {
		String passage = "(a: ".repeat(50_000) + "[(".repeat(50_000);

		List<Node> nodes = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> scanner.parsePassage(passage));

		assertThat(nodes).containsExactly(Nodes.text(passage));
	}

	@Test
	void unclosedHookIsLeftAsTextAndLogged() {
		try (LogCaptorAppender captor = LogCaptorAppender.capture(MacroScanner.class, Level.WARN)) {
			List<Node> nodes = scanner.parsePassage("(if: $x)[The '90s] tail");

			assertThat(nodes).containsExactly(
					Nodes.conditional(Nodes.storyVariable("x"), List.of()),
					Nodes.text("[The '90s] tail"));
			assertThat(captor.messagesAt(Level.WARN))
					.containsExactly("Hook after macro 'if' at offset 8 is never closed; left as text");
		}
	}

	@Test
	void throwingTranslatorBecomesAnErrorNode() {
		registry.register("boom", (call, context) -> {
			throw new IllegalStateException("kaboom");
		});

		try (LogCaptorAppender captor = LogCaptorAppender.capture(MacroScanner.class, Level.WARN)) {
			List<Node> nodes = scanner.parsePassage("before (boom: 1) after");

			assertThat(nodes).hasSize(3);
			Node.Error error = (Node.Error) nodes.get(1);
			assertThat(error.message()).isEqualTo("Failed to translate macro 'boom': kaboom");
			assertThat(error.original().name()).isEqualTo("boom");
			assertThat(nodes.get(2)).isEqualTo(Nodes.text(" after"));
			assertThat(captor.messagesAt(Level.WARN)).containsExactly("Translator for macro 'boom' failed");
		}
	}

	@Test
	void nullFromTranslatorBecomesAnErrorNode() {
		registry.register("nothing", (call, context) -> null);

		List<Node> nodes = scanner.parsePassage("(nothing:)");

		assertThat(nodes).containsExactly(Nodes.error("Translator for macro 'nothing' produced no node",
				MacroCall.of("nothing")));
	}

	@Test
	void parseArgumentsDropsBlankPieces() {
		assertThat(scanner.parseArguments("1, \"a, b\", $c,")).containsExactly(
				new ClassifiedValue.NumberValue(1),
				new ClassifiedValue.StringValue("a, b"),
				new ClassifiedValue.VariableValue(VariableScope.STORY, "c"));
		assertThat(scanner.parseArguments("  ")).isEmpty();
	}

	@Test
	void requiresRegistryAndConfig() {
		assertThatThrownBy(() -> new MacroScanner(null, HarloweParserConfig.defaults()))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
