package com.flowys.flowys_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowysBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowysBackendApplication.class, args);
    }
}
