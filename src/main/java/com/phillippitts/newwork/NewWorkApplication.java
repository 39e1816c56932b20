package com.phillippitts.newwork;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.newwork.config.properties.BackendProperties.class,
        com.phillippitts.newwork.config.properties.RecoveryProperties.class,
        com.phillippitts.newwork.config.properties.ThreadPoolProperties.class
})
@EnableScheduling
public class NewWorkApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewWorkApplication.class, args);
    }

}
