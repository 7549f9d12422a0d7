package lroi.proms.converter.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application configuration for the Jackson mappers used by the converter
 */
@Configuration
public class AppConfig {

    /**
     * XML mapper for the registry document.
     * The declaration has to be enabled on the mapper: generators pick it up at creation.
     */
    @Bean
    public XmlMapper xmlMapper() {
        return XmlMapper.builder()
                .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
                .build();
    }

    /**
     * TOML mapper for the declarative mapping file
     */
    @Bean
    public TomlMapper tomlMapper() {
        return new TomlMapper();
    }
}
