package com.agilab.model_ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModelIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelIngestionApplication.class, args);
    }
}
