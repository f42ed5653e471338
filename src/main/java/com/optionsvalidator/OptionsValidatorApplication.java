package com.optionsvalidator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionsValidatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionsValidatorApplication.class, args);
    }
}
