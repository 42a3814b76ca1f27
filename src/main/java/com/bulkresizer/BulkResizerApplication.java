package com.bulkresizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BulkResizerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(BulkResizerApplication.class, args)));
    }
}
