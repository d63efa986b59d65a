package com.opinion.builder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OpinionBuilderApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpinionBuilderApplication.class, args);
    }
}
