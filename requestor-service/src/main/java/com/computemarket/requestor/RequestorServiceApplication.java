package com.computemarket.requestor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RequestorServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RequestorServiceApplication.class, args);
    }
}
