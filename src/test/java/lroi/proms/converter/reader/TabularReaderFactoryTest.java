package lroi.proms.converter.reader;

import lroi.proms.converter.exception.UnsupportedInputException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TabularReaderFactoryTest {

    private final TabularReaderFactory factory =
            new TabularReaderFactory(List.of(new SpreadsheetReader(), new CsvFileReader()));

    @Test
    void testGetReader_ByExtension() {
        assertThat(factory.getReader(Path.of("a.xlsx"))).isInstanceOf(SpreadsheetReader.class);
        assertThat(factory.getReader(Path.of("a.XLS"))).isInstanceOf(SpreadsheetReader.class);
        assertThat(factory.getReader(Path.of("a.csv"))).isInstanceOf(CsvFileReader.class);
    }

    @Test
    void testGetReader_Unsupported() {
        assertThatThrownBy(() -> factory.getReader(Path.of("notes.txt")))
                .isInstanceOf(UnsupportedInputException.class)
                .hasMessageContaining("notes.txt");
    }
}
