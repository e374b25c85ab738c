package org.silica.compiler.frontend.io;

import org.silica.compiler.frontend.library.SourceLibrary;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class SourceCacheTest {

    @TempDir
    Path tempDir;

    @Test
    void readsEachPathOnlyOnce() throws IOException {
        Path file = tempDir.resolve("top.sv");
        Files.writeString(file, "module top;\r\nendmodule\r\n");
        SourceCache cache = new SourceCache();

        SourceBuffer first = cache.readSource(file, null);
        Files.writeString(file, "changed");
        SourceBuffer second = cache.readSource(tempDir.resolve("./top.sv"), new SourceLibrary("lib", 0));

        assertThat(second).isSameAs(first);
        assertThat(first.content()).isEqualTo("module top;\nendmodule\n");
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void failedReadsAreNotCached() {
        SourceCache cache = new SourceCache();
        Path missing = tempDir.resolve("missing.v");

        assertThatThrownBy(() -> cache.readSource(missing, null)).isInstanceOf(IOException.class);
        assertThat(cache.isCached(missing)).isFalse();
    }

    @Test
    void assignedTextBehavesLikeAReadFile() throws IOException {
        SourceCache cache = new SourceCache();
        Path path = tempDir.resolve("virtual.v");

        SourceBuffer assigned = cache.assignText(path, "module v; endmodule");

        assertThat(cache.isCached(path)).isTrue();
        assertThat(cache.readSource(path, null)).isSameAs(assigned);
        assertThat(assigned.library()).isNull();
    }
}
