package org.example.storybook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StorybookApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorybookApplication.class, args);
    }
}
