package com.example.ratecontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;

/**
 * Redis connectivity is configured by {@link com.example.ratecontrol.config.RedisConfig} only when store
 * credentials are present, so Spring Boot's default localhost connection is switched off.
 */
@SpringBootApplication(exclude = {RedisAutoConfiguration.class, RedisRepositoriesAutoConfiguration.class})
public class RateControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(RateControlApplication.class, args);
    }
}
