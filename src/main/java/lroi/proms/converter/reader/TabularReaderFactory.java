package lroi.proms.converter.reader;

import lombok.extern.slf4j.Slf4j;
import lroi.proms.converter.exception.UnsupportedInputException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Picks the reader for an input file by its extension.
 */
@Service
@Slf4j
public class TabularReaderFactory {

    private final List<TabularFileReader> readers;

    public TabularReaderFactory(List<TabularFileReader> readers) {
        this.readers = List.copyOf(readers);
    }

    /**
     * @param path the input file
     * @return the first reader that supports the file (never null)
     * @throws UnsupportedInputException if no reader handles the extension
     */
    public TabularFileReader getReader(Path path) {
        for (TabularFileReader reader : readers) {
            if (reader.supports(path)) {
                log.debug("Using {} for {}", reader.getClass().getSimpleName(), path.getFileName());
                return reader;
            }
        }
        throw new UnsupportedInputException(path);
    }
}
