package org.silica.compiler.frontend.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Pattern expansion against a small directory tree:
 * <pre>
 *   rtl/a.v, rtl/b.v, rtl/notes.txt, rtl/sub/c.v, tb/tb.sv
 * </pre>
 */
@Tag("integration")
class PathGlobTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tempDir.resolve("rtl/sub"));
        Files.createDirectories(tempDir.resolve("tb"));
        Files.writeString(tempDir.resolve("rtl/a.v"), "module a; endmodule");
        Files.writeString(tempDir.resolve("rtl/b.v"), "module b; endmodule");
        Files.writeString(tempDir.resolve("rtl/notes.txt"), "notes");
        Files.writeString(tempDir.resolve("rtl/sub/c.v"), "module c; endmodule");
        Files.writeString(tempDir.resolve("tb/tb.sv"), "module tb; endmodule");
    }

    @Test
    void literalFileIsExactPath() throws IOException {
        GlobResult result = PathGlob.expand(tempDir, "rtl/a.v", GlobMode.FILES, false);

        assertThat(result.rank()).isEqualTo(GlobRank.EXACT_PATH);
        assertThat(result.paths()).containsExactly(tempDir.resolve("rtl/a.v").toAbsolutePath().normalize());
    }

    @Test
    void wildcardInFileNameMatchesWithinOneDirectory() throws IOException {
        GlobResult result = PathGlob.expand(tempDir, "rtl/*.v", GlobMode.FILES, false);

        assertThat(result.rank()).isEqualTo(GlobRank.WILDCARD_NAME);
        assertThat(result.paths()).extracting(p -> p.getFileName().toString()).containsExactly("a.v", "b.v");
    }

    @Test
    void wildcardOnlyInDirectoryIsSimpleName() throws IOException {
        GlobResult result = PathGlob.expand(tempDir, "*/tb.sv", GlobMode.FILES, false);

        assertThat(result.rank()).isEqualTo(GlobRank.SIMPLE_NAME);
        assertThat(result.paths()).containsExactly(tempDir.resolve("tb/tb.sv").toAbsolutePath().normalize());
    }

    @Test
    void recursiveSegmentDescendsIntoSubdirectories() throws IOException {
        GlobResult result = PathGlob.expand(tempDir, "rtl/.../*.v", GlobMode.FILES, false);

        assertThat(result.paths()).extracting(p -> p.getFileName().toString())
                .containsExactlyInAnyOrder("a.v", "b.v", "c.v");
    }

    @Test
    void trailingSlashNamesEveryFileOfTheDirectory() throws IOException {
        GlobResult result = PathGlob.expand(tempDir, "rtl/", GlobMode.FILES, false);

        assertThat(result.rank()).isEqualTo(GlobRank.DIRECTORY);
        assertThat(result.paths()).extracting(p -> p.getFileName().toString())
                .containsExactly("a.v", "b.v", "notes.txt");
    }

    @Test
    void directoryModeReturnsDirectories() throws IOException {
        GlobResult result = PathGlob.expand(tempDir, "*", GlobMode.DIRECTORIES, false);

        assertThat(result.paths()).extracting(p -> p.getFileName().toString()).containsExactly("rtl", "tb");
    }

    @Test
    void missingLiteralFileIsAnError() {
        assertThatThrownBy(() -> PathGlob.expand(tempDir, "rtl/missing.v", GlobMode.FILES, false))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void unmatchedWildcardIsEmptyNotAnError() throws IOException {
        GlobResult result = PathGlob.expand(tempDir, "rtl/*.vhd", GlobMode.FILES, false);

        assertThat(result.paths()).isEmpty();
    }

    @Test
    void blankPatternIsAnError() {
        assertThatThrownBy(() -> PathGlob.expand(tempDir, "  ", GlobMode.FILES, false))
                .isInstanceOf(IOException.class);
    }

    @Test
    void environmentVariablesAreSubstitutedInAllThreeForms() {
        Map<String, String> env = Map.of("ROOT", "/proj", "SUB", "rtl");

        assertThat(PathGlob.expandEnvVars("$ROOT/${SUB}/$(SUB)/$UNSET/x.v", env::get))
                .isEqualTo("/proj/rtl/rtl//x.v");
    }

    @Test
    void environmentExpansionResolvesAgainstBase() throws IOException {
        GlobResult result = PathGlob.expand(tempDir, "$DIR/a.v", GlobMode.FILES, true, Map.of("DIR", "rtl")::get);

        assertThat(result.paths()).containsExactly(tempDir.resolve("rtl/a.v").toAbsolutePath().normalize());
    }
}
