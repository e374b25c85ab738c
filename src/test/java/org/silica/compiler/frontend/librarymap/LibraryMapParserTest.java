package org.silica.compiler.frontend.librarymap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.frontend.io.SourceBuffer;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LibraryMapParserTest {

    private static LibraryMapDocument parse(String text) {
        return new LibraryMapParser(new SourceBuffer(Path.of("/work/maps/libs.map"), text, null)).parse();
    }

    @Test
    void parsesAllMemberKinds() {
        LibraryMapDocument document = parse("""
                // design libraries
                library rtlLib rtl/*.v, "src/a b.v" -incdir inc;
                include other.map;
                config cfg; design top; endconfig
                ;
                """);

        assertThat(document.diagnostics().hasErrors()).isFalse();
        assertThat(document.members()).hasSize(4);

        LibraryDeclaration library = (LibraryDeclaration) document.members().get(0);
        assertThat(library.name()).isEqualTo("rtlLib");
        assertThat(library.filePaths()).extracting(FilePathSpec::path).containsExactly("rtl/*.v", "src/a b.v");
        assertThat(library.includeDirs()).extracting(FilePathSpec::path).containsExactly("inc");
        assertThat(library.location().lineNumber()).isEqualTo(2);

        LibraryIncludeStatement include = (LibraryIncludeStatement) document.members().get(1);
        assertThat(include.path().path()).isEqualTo("other.map");

        assertThat(((ConfigDeclaration) document.members().get(2)).name()).isEqualTo("cfg");
        assertThat(document.members().get(3)).isInstanceOf(EmptyMember.class);
    }

    @Test
    void directoryIsTheMapFilesParent() {
        assertThat(parse("").directory()).isEqualTo(Path.of("/work/maps"));
    }

    @Test
    void unknownMemberIsReportedAndSkipped() {
        LibraryMapDocument document = parse("bogus stuff;\nlibrary lib a.v;");

        assertThat(document.diagnostics().count(DiagCode.EXPECTED_LIBRARY_MAP_MEMBER)).isEqualTo(1);
        assertThat(document.members()).singleElement().isInstanceOf(LibraryDeclaration.class);
    }

    @Test
    void libraryWithoutNameIsReported() {
        LibraryMapDocument document = parse("library ;");

        assertThat(document.diagnostics().count(DiagCode.EXPECTED_LIBRARY_NAME)).isEqualTo(1);
        assertThat(document.members()).isEmpty();
    }

    @Test
    void includeWithoutPathIsReported() {
        LibraryMapDocument document = parse("include ;");

        assertThat(document.diagnostics().count(DiagCode.EXPECTED_FILE_PATH)).isEqualTo(1);
        assertThat(document.members()).isEmpty();
    }

    @Test
    void unterminatedConfigIsReported() {
        LibraryMapDocument document = parse("config cfg; design top;");

        assertThat(document.diagnostics().count(DiagCode.MISSING_ENDCONFIG)).isEqualTo(1);
        assertThat(document.members()).singleElement().isInstanceOf(ConfigDeclaration.class);
    }

    @Test
    void missingSemicolonIsReported() {
        LibraryMapDocument document = parse("library lib a.v\nlibrary other b.v;");

        assertThat(document.diagnostics().count(DiagCode.EXPECTED_TOKEN)).isEqualTo(1);
    }
}
