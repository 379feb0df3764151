package com.id.gridseries;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GridSeriesApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridSeriesApplication.class, args);
    }

}
