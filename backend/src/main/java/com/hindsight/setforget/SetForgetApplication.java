package com.hindsight.setforget;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SetForgetApplication {
    public static void main(String[] args) {
        SpringApplication.run(SetForgetApplication.class, args);
    }
}
