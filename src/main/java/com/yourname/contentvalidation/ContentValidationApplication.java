package com.yourname.contentvalidation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentValidationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentValidationApplication.class, args);
    }
}
