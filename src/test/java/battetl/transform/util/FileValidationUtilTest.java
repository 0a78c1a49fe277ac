package battetl.transform.util;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for FileValidationUtil.
 */
class FileValidationUtilTest {

    private static MultipartFile file(String filename, String content) {
        return new MockMultipartFile("file", filename, "text/csv", content.getBytes());
    }

    // ========== validateFileNotEmpty() Tests ==========

    @Test
    void testValidateFileNotEmpty_WithValidFile_DoesNotThrowException() {
        // Given: a non-empty export
        MultipartFile file = file("maccor.csv", "Cyc#,Step\n1,1");

        // When & Then: validation passes without exception
        FileValidationUtil.validateFileNotEmpty(file, "Test data");
    }

    @Test
    void testValidateFileNotEmpty_WithNullFile_ThrowsException() {
        assertThatThrownBy(() -> FileValidationUtil.validateFileNotEmpty(null, "Test data"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Test data file is empty or not provided");
    }

    @Test
    void testValidateFileNotEmpty_WithEmptyFile_ThrowsException() {
        // Given: an empty file (0 bytes)
        MultipartFile file = file("maccor.csv", "");

        // When & Then: throws IllegalArgumentException naming the part
        assertThatThrownBy(() -> FileValidationUtil.validateFileNotEmpty(file, "Cycle stats"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Cycle stats file is empty or not provided");
    }

    // ========== validateFileExtension() Tests ==========

    @Test
    void testValidateFileExtension_WithAllowedExtension_CaseInsensitive() {
        FileValidationUtil.validateFileExtension(file("ARBIN_EXPORT.CSV", "x"), "Test data", "csv", "txt");
        FileValidationUtil.validateFileExtension(file("maccor.txt", "x"), "Test data", "csv", " txt");
    }

    @Test
    void testValidateFileExtension_WithInvalidExtension_ThrowsException() {
        // Given: a spreadsheet when only delimited text is allowed
        MultipartFile file = file("data.xlsx", "x");

        // When & Then: throws IllegalArgumentException with descriptive message
        assertThatThrownBy(() -> FileValidationUtil.validateFileExtension(file, "Test data", "csv", "txt"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Expected CSV, TXT file")
            .hasMessageContaining("data.xlsx");
    }

    @Test
    void testValidateFileExtension_WithBlankFilename_ThrowsException() {
        MultipartFile file = file("   ", "x");

        assertThatThrownBy(() -> FileValidationUtil.validateFileExtension(file, "Test data", "csv"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Test data file has no name");
    }

    @Test
    void testValidateFileExtension_WithNoAllowedExtensions_AcceptsAnything() {
        FileValidationUtil.validateFileExtension(file("export.res", "x"), "Test data");
    }

    // ========== validateFile() / isPresent() Tests ==========

    @Test
    void testValidateFile_EmptyCheckedBeforeExtension() {
        MultipartFile file = file("data.xlsx", "");

        assertThatThrownBy(() -> FileValidationUtil.validateFile(file, "Test data", "csv"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Test data file is empty or not provided");
    }

    @Test
    void testIsPresent() {
        assertThat(FileValidationUtil.isPresent(null)).isFalse();
        assertThat(FileValidationUtil.isPresent(file("stats.csv", ""))).isFalse();
        assertThat(FileValidationUtil.isPresent(file("stats.csv", "Cycle\n1"))).isTrue();
    }
}
