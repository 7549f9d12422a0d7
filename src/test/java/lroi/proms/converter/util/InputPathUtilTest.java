package lroi.proms.converter.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for InputPathUtil
 */
class InputPathUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void testExpandInputs_FolderExpandsRecursivelySorted() throws Exception {
        // Given: a folder with supported, unsupported and lock files
        Path folder = Files.createDirectories(tempDir.resolve("exports"));
        Path nested = Files.createDirectories(folder.resolve("2024"));
        Path b = Files.createFile(folder.resolve("b.xlsx"));
        Path a = Files.createFile(folder.resolve("a.csv"));
        Path c = Files.createFile(nested.resolve("c.XLS"));
        Files.createFile(folder.resolve("notes.txt"));
        Files.createFile(folder.resolve("~$b.xlsx"));

        // When
        List<Path> files = InputPathUtil.expandInputs(List.of(folder.toString()));

        // Then
        assertThat(files).containsExactly(
                InputPathUtil.normalize(c), InputPathUtil.normalize(a), InputPathUtil.normalize(b));
    }

    @Test
    void testExpandInputs_DuplicatesRemovedKeepingOrder() throws Exception {
        Path first = Files.createFile(tempDir.resolve("z.xlsx"));
        Path second = Files.createFile(tempDir.resolve("a.xlsx"));

        List<Path> files = InputPathUtil.expandInputs(List.of(
                first.toString(), second.toString(), tempDir.resolve(".").resolve("z.xlsx").toString()));

        assertThat(files).containsExactly(InputPathUtil.normalize(first), InputPathUtil.normalize(second));
    }

    @Test
    void testExpandInputs_ExplicitFileKeptWhateverExtension() throws Exception {
        Path text = Files.createFile(tempDir.resolve("export.txt"));

        assertThat(InputPathUtil.expandInputs(List.of(text.toString())))
                .containsExactly(InputPathUtil.normalize(text));
    }

    @Test
    void testExpandInputs_MissingAndBlankPathsSkipped() {
        List<Path> files = InputPathUtil.expandInputs(Arrays.asList(
                tempDir.resolve("missing.xlsx").toString(), " ", null));

        assertThat(files).isEmpty();
        assertThat(InputPathUtil.expandInputs(null)).isEmpty();
    }

    @Test
    void testExtensionOf() {
        assertThat(InputPathUtil.extensionOf(Path.of("Export.XLSX"))).isEqualTo("xlsx");
        assertThat(InputPathUtil.extensionOf(Path.of("README"))).isEmpty();
        assertThat(InputPathUtil.extensionOf(Path.of("trailing."))).isEmpty();
    }

    @Test
    void testIsSameFile() {
        Path lut = tempDir.resolve("lut.xlsx");

        assertThat(InputPathUtil.isSameFile(lut, tempDir.resolve("sub/../lut.xlsx"))).isTrue();
        assertThat(InputPathUtil.isSameFile(lut, tempDir.resolve("export.xlsx"))).isFalse();
    }
}
