package com.futuresdca;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FuturesDcaApplication {

    public static void main(String[] args) {
        SpringApplication.run(FuturesDcaApplication.class, args);
    }
}
