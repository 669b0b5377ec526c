package com.wakecycle.tools.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WakeToolsApplication {

    public static void main(String[] args) {
        SpringApplication.run(WakeToolsApplication.class, args);
    }
}
