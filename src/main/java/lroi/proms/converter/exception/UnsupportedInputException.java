package lroi.proms.converter.exception;

import java.nio.file.Path;

/**
 * No reader is available for an input file's extension.
 */
public class UnsupportedInputException extends RuntimeException {

    private final transient Path path;

    public UnsupportedInputException(Path path) {
        super("Unsupported input file type: " + path.getFileName());
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
