package battetl.transform.util;

import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Checks applied to uploaded cycler exports before they are read.
 */
public final class FileValidationUtil {

    private FileValidationUtil() {
    }

    /**
     * @param file  the uploaded file
     * @param label request part name, used in messages
     * @throws IllegalArgumentException if the file is missing or empty
     */
    public static void validateFileNotEmpty(MultipartFile file, String label) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException(label + " file is empty or not provided");
        }
    }

    /**
     * @param allowedExtensions extensions without the dot, e.g. "csv", "txt"
     * @throws IllegalArgumentException if the filename is blank or has another extension
     */
    public static void validateFileExtension(MultipartFile file, String label, String... allowedExtensions) {
        String filename = file.getOriginalFilename();
        if (filename == null || filename.trim().isEmpty()) {
            throw new IllegalArgumentException(label + " file has no name");
        }
        if (allowedExtensions.length == 0) {
            return;
        }

        String lowerCaseFilename = filename.toLowerCase(Locale.ROOT);
        boolean isValid = Arrays.stream(allowedExtensions)
                .anyMatch(ext -> lowerCaseFilename.endsWith("." + ext.trim().toLowerCase(Locale.ROOT)));

        if (!isValid) {
            String allowedTypes = Arrays.stream(allowedExtensions)
                    .map(ext -> ext.trim().toUpperCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException(String.format(
                    "Invalid file type for %s. Expected %s file but received '%s'.", label, allowedTypes, filename));
        }
    }

    public static void validateFile(MultipartFile file, String label, String... allowedExtensions) {
        validateFileNotEmpty(file, label);
        validateFileExtension(file, label, allowedExtensions);
    }

    /**
     * Whether an optional part was actually sent.
     */
    public static boolean isPresent(MultipartFile file) {
        return file != null && !file.isEmpty();
    }
}
