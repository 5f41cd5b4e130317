package com.example.tieredcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TieredCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(TieredCacheApplication.class, args);
    }
}
