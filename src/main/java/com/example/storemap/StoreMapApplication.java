package com.example.storemap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StoreMapApplication {
    public static void main(String[] args) {
        SpringApplication.run(StoreMapApplication.class, args);
    }
}
