package com.linlay.taskagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskAgentApplication.class, args);
    }
}
