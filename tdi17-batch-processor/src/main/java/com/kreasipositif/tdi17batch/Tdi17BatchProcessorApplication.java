package com.kreasipositif.tdi17batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class Tdi17BatchProcessorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(Tdi17BatchProcessorApplication.class, args)));
    }
}
