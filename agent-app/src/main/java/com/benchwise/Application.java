package com.benchwise;

import org.springframework.beans.factory.annotation.Configurable;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Legal agent service entry point. Sits in the root package so component scanning
 * reaches every module.
 *
 * @author benchwise
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
