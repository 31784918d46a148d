package com.nei10u.panchanga;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PanchangaApplication {

    public static void main(String[] args) {
        SpringApplication.run(PanchangaApplication.class, args);
    }
}
