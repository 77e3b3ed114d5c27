package org.lumina.atlas.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
@DisplayName("AtlasConfigLoader Unit Tests")
class AtlasConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("reference.conf provides a complete atlas block")
    void referenceDefaults() {
        AtlasSettings settings = AtlasConfigLoader.settings(AtlasConfigLoader.layered(ConfigFactory.empty()));

        assertThat(settings).usingRecursiveComparison().isEqualTo(AtlasSettings.defaults());
    }

    @Test
    @DisplayName("An explicit file overrides the reference values it names")
    void explicitFile() throws IOException {
        File file = tempDir.resolve("lumina-atlas.conf").toFile();
        Files.writeString(file.toPath(), """
            lumina.atlas {
              packing.padding = 6
              streaming.visible-window = 3
            }
            """, StandardCharsets.UTF_8);
        List<String> messages = new ArrayList<>();

        Config config = AtlasConfigLoader.resolve(file, (level, message) -> messages.add(level + " " + message));
        AtlasSettings settings = AtlasConfigLoader.settings(config);

        assertThat(settings.distribution().padding()).isEqualTo(6);
        assertThat(settings.visibleWindow()).isEqualTo(3);
        assertThat(settings.decodeRetries()).isEqualTo(1);
        assertThat(messages).singleElement().asString().startsWith("INFO").contains(file.getAbsolutePath());
    }

    @Test
    @DisplayName("Without a file the classpath resource of the application is used")
    void classpathResource() {
        List<String> messages = new ArrayList<>();

        Config config = AtlasConfigLoader.resolve(null, (level, message) -> messages.add(level + " " + message));

        assertThat(AtlasConfigLoader.settings(config).visibleWindow()).isEqualTo(4);
        assertThat(messages).singleElement().asString().contains("classpath resource");
    }

    @Test
    @DisplayName("An application config is layered over the reference defaults")
    void applicationConfig() {
        Config application = ConfigFactory.parseString("lumina.atlas.streaming.decode-retries = 3");

        AtlasSettings settings = AtlasConfigLoader.settings(AtlasConfigLoader.layered(application));

        assertThat(settings.decodeRetries()).isEqualTo(3);
        assertThat(settings.visibleWindow()).isEqualTo(2);
    }

    @Test
    @DisplayName("A missing explicit file is an error")
    void missingExplicitFile() {
        File missing = tempDir.resolve("nope.conf").toFile();

        assertThatThrownBy(() -> AtlasConfigLoader.resolve(missing, AtlasConfigLoader.loggingHandler()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope.conf");
    }

    @Test
    @DisplayName("Invalid values in a file surface as IllegalArgumentException")
    void invalidFile() throws IOException {
        File file = tempDir.resolve("bad.conf").toFile();
        Files.writeString(file.toPath(), "lumina.atlas.streaming.decode-retries = lots\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> AtlasConfigLoader.loadSettings(file))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
