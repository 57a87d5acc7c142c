package com.purchasingpower.codegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeGraphApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CodeGraphApplication.class, args)));
    }
}
