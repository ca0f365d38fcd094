package com.xbleey.grafanareporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GrafanaReporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(GrafanaReporterApplication.class, args);
    }

}
