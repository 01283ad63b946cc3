package org.javai.twine.harlowe.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;

class HarloweParserConfigLoaderTest {

	private final HarloweParserConfigLoader loader = new HarloweParserConfigLoader();

	@Test
	void bundledResourceMatchesDefaults() {
		HarloweParserConfig config = loader.loadDefault();

		assertThat(config).isEqualTo(HarloweParserConfig.defaults());
	}

	@Test
	void loadsClasspathResource() {
		HarloweParserConfig config = loader.loadResource("config/custom-parser.yml", getClass().getClassLoader());

		assertThat(config.maxNestingDepth()).isEqualTo(8);
		assertThat(config.aliases()).containsExactlyInAnyOrderEntriesOf(Map.of("array", "a", "when", "if"));
	}

	@Test
	void missingResourceIsRejected() {
		assertThatThrownBy(() -> loader.loadResource("config/nope.yml", getClass().getClassLoader()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("config/nope.yml");
	}

	@Test
	void missingSectionsFallBackToDefaults() {
		HarloweParserConfig config = loader.loadString("parser:\n  max_nesting_depth: 10\n");

		assertThat(config.maxNestingDepth()).isEqualTo(10);
		assertThat(config.aliases()).isEqualTo(HarloweParserConfig.defaults().aliases());
		assertThat(loader.loadString("")).isEqualTo(HarloweParserConfig.defaults());
	}

	@Test
	void presentAliasSectionReplacesDefaults() {
		HarloweParserConfig config = loader.loadString("macros:\n  aliases: {}\n");

		assertThat(config.aliases()).isEmpty();
	}

	@Test
	void loadsFromStreamAndPath(@TempDir Path dir) throws IOException {
		String yaml = "parser:\n  max_nesting_depth: 3\n";
		Path file = dir.resolve("parser.yml");
		Files.writeString(file, yaml);

		assertThat(loader.load(file).maxNestingDepth()).isEqualTo(3);
		assertThat(loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))).maxNestingDepth())
				.isEqualTo(3);
	}

	@Test
	void invalidValuesAreReported() {
		assertThatThrownBy(() -> loader.loadString("parser:\n  max_nesting_depth: deep\n"))
				.isInstanceOf(HarloweConfigException.class)
				.hasMessageContaining("must be a number");
		assertThatThrownBy(() -> loader.loadString("parser:\n  max_nesting_depth: 0\n"))
				.isInstanceOf(HarloweConfigException.class)
				.hasMessageContaining("maxNestingDepth");
		assertThatThrownBy(() -> loader.loadString("macros: [a, b]\n"))
				.isInstanceOf(HarloweConfigException.class)
				.hasMessageContaining("'macros' must be a mapping");
		assertThatThrownBy(() -> loader.loadString("parser: [unclosed\n"))
				.isInstanceOf(HarloweConfigException.class)
				.hasCauseInstanceOf(YAMLException.class);
	}

	@Test
	void missingFileIsWrapped(@TempDir Path dir) {
		assertThatThrownBy(() -> loader.load(dir.resolve("absent.yml")))
				.isInstanceOf(HarloweConfigException.class)
				.hasMessageContaining("absent.yml");
	}
}
