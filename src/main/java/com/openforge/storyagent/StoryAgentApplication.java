package com.openforge.storyagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StoryAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoryAgentApplication.class, args);
    }
}
