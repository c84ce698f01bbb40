package com.beamcut;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BeamCutApplication {

    public static void main(String[] args) {
        SpringApplication.run(BeamCutApplication.class, args);
    }
}
