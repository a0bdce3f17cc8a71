package com.scidbshim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShimApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShimApplication.class, args);
    }
}
