package lroi.proms.converter.service;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.fasterxml.jackson.dataformat.xml.util.DefaultXmlPrettyPrinter;
import lroi.proms.converter.model.OutputDocument;
import lroi.proms.converter.model.OutputRecord;
import org.springframework.stereotype.Service;

import javax.xml.namespace.QName;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes an {@link OutputDocument} to the registry XML layout:
 *
 * <pre>
 * &lt;LROIPROM&gt;
 *   &lt;questionaires&gt;
 *     &lt;questionaire&gt; ...elements in schema order... &lt;/questionaire&gt;
 *   &lt;/questionaires&gt;
 * &lt;/LROIPROM&gt;
 * </pre>
 */
@Service
public class XmlDocumentWriter {

    private final XmlMapper xmlMapper;

    /**
     * @param xmlMapper mapper whose factory decides on the XML declaration
     *                  (see AppConfig)
     */
    public XmlDocumentWriter(XmlMapper xmlMapper) {
        this.xmlMapper = xmlMapper;
    }

    public String serialize(OutputDocument document) throws IOException {
        StringWriter out = new StringWriter();
        try (ToXmlGenerator generator = xmlMapper.getFactory().createGenerator(out)) {
            generator.setPrettyPrinter(new DefaultXmlPrettyPrinter());
            // writes the declaration; only implicit when going through writeValue
            generator.initGenerator();
            generator.setNextName(new QName(OutputDocument.ROOT_ELEMENT));
            generator.writeStartObject();

            generator.writeFieldName(OutputDocument.COLLECTION_ELEMENT);
            generator.writeStartObject();
            for (OutputRecord record : document.getRecords()) {
                generator.writeFieldName(OutputDocument.RECORD_ELEMENT);
                generator.writeStartObject();
                for (OutputRecord.Element element : record.getElements()) {
                    generator.writeStringField(element.getName(), element.getValue());
                }
                generator.writeEndObject();
            }
            generator.writeEndObject();

            generator.writeEndObject();
        }
        return out.toString();
    }

    public void write(String xml, Path outputFile) throws IOException {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputFile, xml, StandardCharsets.UTF_8);
    }
}
