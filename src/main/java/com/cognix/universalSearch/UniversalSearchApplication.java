package com.cognix.universalSearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UniversalSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(UniversalSearchApplication.class, args);
    }
}
