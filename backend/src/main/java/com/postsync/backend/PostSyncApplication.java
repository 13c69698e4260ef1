package com.postsync.backend;

import com.postsync.backend.config.PostSyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(PostSyncProperties.class)
public class PostSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(PostSyncApplication.class, args);
    }
}
