package com.cloudsync.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CloudSyncServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloudSyncServerApplication.class, args);
    }

}
