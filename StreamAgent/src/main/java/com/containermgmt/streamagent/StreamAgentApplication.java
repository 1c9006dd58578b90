package com.containermgmt.streamagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StreamAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamAgentApplication.class, args);
    }

}
