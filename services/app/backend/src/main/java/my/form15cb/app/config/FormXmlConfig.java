package my.form15cb.app.config;

import my.form15cb.app.validation.FormValidator;
import my.form15cb.app.xml.Form15cbXmlGenerator;
import my.form15cb.app.xml.Form15cbXmlParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;

@Configuration
public class FormXmlConfig {
	@Bean
	public Form15cbXmlGenerator form15cbXmlGenerator(AppProperties properties, ResourceLoader resourceLoader) {
		return new Form15cbXmlGenerator(
				resourceLoader.getResource(properties.form().template()),
				Path.of(properties.form().outputDir()).toAbsolutePath().normalize()
		);
	}

	@Bean
	public Form15cbXmlParser form15cbXmlParser() {
		return new Form15cbXmlParser();
	}

	@Bean
	public FormValidator formValidator() {
		return new FormValidator();
	}
}
