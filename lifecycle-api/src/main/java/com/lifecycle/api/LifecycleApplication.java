package com.lifecycle.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the lifecycle event store.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.lifecycle.api",
    "com.lifecycle.engine"
})
public class LifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(LifecycleApplication.class, args);
    }
}
