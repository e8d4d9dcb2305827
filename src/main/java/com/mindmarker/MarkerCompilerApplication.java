package com.mindmarker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarkerCompilerApplication {
    public static void main(String[] args) {
        SpringApplication.run(MarkerCompilerApplication.class, args);
    }
}
