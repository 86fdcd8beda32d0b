package com.dealsim;

import org.springframework.beans.factory.annotation.Configurable;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Simulation queue service entry point. Sits in the top-level package so every module is scanned.
 *
 * @author dealsim
 * @since 2026-03-02
 */
@SpringBootApplication
@EnableScheduling
@Configurable
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
