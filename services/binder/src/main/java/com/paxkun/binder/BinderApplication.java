package com.paxkun.binder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 📚 Binder Application Entry Point
 *
 * Spring Boot application that merges CBZ and ZIP chapter archives into a single CBZ.
 */
@SpringBootApplication
public class BinderApplication {
    public static void main(String[] args) {
        SpringApplication.run(BinderApplication.class, args);
    }
}
