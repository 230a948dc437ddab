package com.missionmind;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MissionMindApplication {

    public static void main(String[] args) {
        SpringApplication.run(MissionMindApplication.class, args);
    }
}
