package com.yava.intent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IntentClassifierApplication {
    public static void main(String[] args) {
        SpringApplication.run(IntentClassifierApplication.class, args);
    }
}
