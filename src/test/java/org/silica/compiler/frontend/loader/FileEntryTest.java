package org.silica.compiler.frontend.loader;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.silica.compiler.frontend.io.GlobRank;
import org.silica.compiler.frontend.library.SourceLibrary;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class FileEntryTest {

    private static final SourceLibrary ALPHA = new SourceLibrary("alpha", 0);
    private static final SourceLibrary BETA = new SourceLibrary("beta", 1);

    private static FileEntry unowned() {
        return new FileEntry(Path.of("/src/a.v"), true, null, null);
    }

    @Test
    void libraryFlagOnlyEverClears() {
        FileEntry entry = unowned();

        entry.mergeLibraryFlag(true);
        assertThat(entry.isLibraryFile()).isTrue();
        entry.mergeLibraryFlag(false);
        assertThat(entry.isLibraryFile()).isFalse();
        entry.mergeLibraryFlag(true);
        assertThat(entry.isLibraryFile()).isFalse();
    }

    @Test
    void firstClaimAssigns() {
        FileEntry entry = unowned();

        assertThat(entry.claim(ALPHA, GlobRank.WILDCARD_NAME)).isEqualTo(FileEntry.ClaimOutcome.ASSIGNED);
        assertThat(entry.libraryHandle()).isEqualTo(ALPHA.handle());
        assertThat(entry.libraryRank()).isEqualTo(GlobRank.WILDCARD_NAME);
    }

    @Test
    void moreSpecificClaimWinsAndClearsConflict() {
        FileEntry entry = unowned();
        entry.claim(ALPHA, GlobRank.DIRECTORY);
        entry.claim(BETA, GlobRank.DIRECTORY);
        assertThat(entry.hasLibraryConflict()).isTrue();

        assertThat(entry.claim(BETA, GlobRank.EXACT_PATH)).isEqualTo(FileEntry.ClaimOutcome.ASSIGNED);
        assertThat(entry.libraryHandle()).isEqualTo(BETA.handle());
        assertThat(entry.hasLibraryConflict()).isFalse();
    }

    @Test
    void lessSpecificClaimIsIgnored() {
        FileEntry entry = unowned();
        entry.claim(ALPHA, GlobRank.SIMPLE_NAME);

        assertThat(entry.claim(BETA, GlobRank.WILDCARD_NAME)).isEqualTo(FileEntry.ClaimOutcome.IGNORED);
        assertThat(entry.libraryHandle()).isEqualTo(ALPHA.handle());
        assertThat(entry.hasLibraryConflict()).isFalse();
    }

    @Test
    void equalRankKeepsFirstOwnerAndRecordsSecond() {
        FileEntry entry = unowned();
        entry.claim(ALPHA, GlobRank.WILDCARD_NAME);

        assertThat(entry.claim(BETA, GlobRank.WILDCARD_NAME)).isEqualTo(FileEntry.ClaimOutcome.TIED);
        assertThat(entry.libraryHandle()).isEqualTo(ALPHA.handle());
        assertThat(entry.secondLibraryHandle()).isEqualTo(BETA.handle());
    }

    @Test
    void sameLibraryClaimingAgainIsNotAConflict() {
        FileEntry entry = unowned();
        entry.claim(ALPHA, GlobRank.WILDCARD_NAME);

        assertThat(entry.claim(ALPHA, GlobRank.WILDCARD_NAME)).isEqualTo(FileEntry.ClaimOutcome.IGNORED);
        assertThat(entry.hasLibraryConflict()).isFalse();
    }
}
