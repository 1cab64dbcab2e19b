package app.ankillm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class AnkiLlmApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(AnkiLlmApplication.class, args)));
	}

}
