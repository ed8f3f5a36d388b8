package com.eainde.policylens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PolicyLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicyLensApplication.class, args);
    }
}
