package com.zzf.coder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoderAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoderAgentApplication.class, args);
    }
}
