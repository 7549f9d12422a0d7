package lroi.proms.converter.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Utility class for turning user supplied input paths into a list of files.
 */
@Slf4j
public final class InputPathUtil {

    public static final List<String> SUPPORTED_EXTENSIONS = List.of("xlsx", "xls", "csv");

    private InputPathUtil() {
        // Private constructor to prevent instantiation
    }

    /**
     * Expand a mixed list of files and folders.
     *
     * - A file is included as given, whatever its extension, so an unreadable
     *   file is reported by the reader rather than silently dropped.
     * - A folder contributes every supported file below it, sorted by path.
     * - Duplicates are removed keeping the first occurrence.
     * - Paths that do not exist are logged and skipped.
     *
     * @param rawInputs file and folder paths
     * @return absolute, normalized file paths
     */
    public static List<Path> expandInputs(List<String> rawInputs) {
        Set<Path> result = new LinkedHashSet<>();
        if (rawInputs == null) {
            return new ArrayList<>();
        }

        for (String raw : rawInputs) {
            if (raw == null || raw.trim().isEmpty()) {
                continue;
            }
            Path path = normalize(Path.of(raw.trim()));
            if (Files.isDirectory(path)) {
                List<Path> files = listSupportedFiles(path);
                if (files.isEmpty()) {
                    log.warn("No .xlsx/.xls/.csv files found in folder: {}", path);
                }
                result.addAll(files);
            } else if (Files.isRegularFile(path)) {
                result.add(path);
            } else {
                log.warn("Path not found, skipping: {}", path);
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * @return true if the file name ends with a supported extension
     */
    public static boolean isSupported(Path path) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(path));
    }

    /**
     * @return lower-case extension without the dot, or "" when there is none
     */
    public static String extensionOf(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int lastDot = name.lastIndexOf('.');
        if (lastDot < 0 || lastDot == name.length() - 1) {
            return "";
        }
        return name.substring(lastDot + 1).toLowerCase(Locale.ROOT);
    }

    public static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /**
     * True when both paths point to the same file after normalization.
     */
    public static boolean isSameFile(Path first, Path second) {
        return normalize(first).equals(normalize(second));
    }

    private static List<Path> listSupportedFiles(Path folder) {
        try (Stream<Path> walk = Files.walk(folder)) {
            return walk.filter(Files::isRegularFile)
                    .filter(InputPathUtil::isSupported)
                    .filter(path -> !path.getFileName().toString().startsWith("~$"))
                    .map(InputPathUtil::normalize)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list folder " + folder, e);
        }
    }
}
