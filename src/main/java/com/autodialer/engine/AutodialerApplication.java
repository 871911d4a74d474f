package com.autodialer.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AutodialerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutodialerApplication.class, args);
    }
}
