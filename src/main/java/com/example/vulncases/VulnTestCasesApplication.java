package com.example.vulncases;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VulnTestCasesApplication {

    public static void main(String[] args) {
        SpringApplication.run(VulnTestCasesApplication.class, args);
    }
}
