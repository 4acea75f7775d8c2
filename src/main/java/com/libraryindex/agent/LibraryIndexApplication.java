package com.libraryindex.agent;

import com.libraryindex.agent.config.LlmProperties;
import com.libraryindex.agent.config.ResearchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties({ResearchProperties.class, LlmProperties.class})
public class LibraryIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibraryIndexApplication.class, args);
    }
}
