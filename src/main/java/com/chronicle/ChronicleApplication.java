package com.chronicle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChronicleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChronicleApplication.class, args);
    }
}
