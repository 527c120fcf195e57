package my.form15cb.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FormApplication {
	public static void main(String[] args) {
		SpringApplication.run(FormApplication.class, args);
	}
}
