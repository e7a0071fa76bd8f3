package com.ella.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StatementAnalyzerApplication {

	public static void main(String[] args) {
		SpringApplication.run(StatementAnalyzerApplication.class, args);
	}

}
