package com.enterprise.jobly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JoblyApplication {

    public static void main(String[] args) {
        SpringApplication.run(JoblyApplication.class, args);
    }
}
