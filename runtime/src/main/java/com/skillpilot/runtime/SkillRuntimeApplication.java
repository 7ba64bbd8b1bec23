package com.skillpilot.runtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkillRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillRuntimeApplication.class, args);
    }
}
