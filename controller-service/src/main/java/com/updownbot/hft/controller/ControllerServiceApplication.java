package com.updownbot.hft.controller;

import com.updownbot.hft.controller.runner.ControllerCommandLine;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.updownbot.hft")
@ConfigurationPropertiesScan("com.updownbot.hft")
public class ControllerServiceApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(ControllerServiceApplication.class, ControllerCommandLine.translate(args))));
    }
}
