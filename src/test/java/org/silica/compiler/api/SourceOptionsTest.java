package org.silica.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SourceOptionsTest {

    @TempDir
    Path tempDir;

    @Test
    void referenceConfMatchesDefaults() {
        SourceOptions options = SourceOptions.fromConfig(ConfigFactory.load());

        assertThat(options).isEqualTo(SourceOptions.defaults());
    }

    @Test
    void readsEveryKey() {
        Config config = ConfigFactory.parseString("""
                silica.sources {
                  num-threads = 3
                  single-unit = true
                  only-lint = true
                  libraries-inherit-macros = true
                  min-files-for-threading = 10
                  search-extensions = [".vh", ".svh"]
                }
                """);

        SourceOptions options = SourceOptions.fromConfig(config);

        assertThat(options).isEqualTo(new SourceOptions(3, true, true, true, 10, List.of(".vh", ".svh")));
        assertThat(options.effectiveThreads()).isEqualTo(3);
    }

    @Test
    void zeroThreadsMeansEveryProcessor() {
        assertThat(SourceOptions.defaults().effectiveThreads()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void inconsistentValuesAreRejected() {
        assertThatThrownBy(() -> SourceOptions.defaults().withNumThreads(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("num-threads");
        assertThatThrownBy(() -> SourceOptions.defaults().withMinFilesForThreading(-2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SourceOptions.defaults().withLibrariesInheritMacros(true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("single-unit");
    }

    @Test
    void explicitFileOverridesReferenceDefaults() throws IOException, CompilationException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "silica.sources.num-threads = 1\nsilica.sources.search-extensions = [\".vh\"]\n");

        SourceOptions options = SourceOptionsLoader.loadOptions(file.toFile());

        assertThat(options.numThreads()).isEqualTo(1);
        assertThat(options.searchExtensions()).containsExactly(".vh");
        assertThat(options.minFilesForThreading()).isEqualTo(4);
    }

    @Test
    void missingExplicitFileFails() {
        File missing = tempDir.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> SourceOptionsLoader.load(missing))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void malformedFileFails() throws IOException {
        Path file = tempDir.resolve("broken.conf");
        Files.writeString(file, "silica.sources { num-threads = \n");

        assertThatThrownBy(() -> SourceOptionsLoader.load(file.toFile()))
                .isInstanceOf(CompilationException.class);
    }

    @Test
    void invalidValuesInFileFail() throws IOException {
        Path file = tempDir.resolve("invalid.conf");
        Files.writeString(file, "silica.sources.libraries-inherit-macros = true\n");

        assertThatThrownBy(() -> SourceOptionsLoader.loadOptions(file.toFile()))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Invalid source options");
    }
}
