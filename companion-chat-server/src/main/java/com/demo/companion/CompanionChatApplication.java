package com.demo.companion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;

/**
 * Redis is wired by {@code BackboneConnection} from a single optional URL, so
 * Boot's own Redis auto-configuration stays off.
 */
@SpringBootApplication(exclude = {
        RedisAutoConfiguration.class,
        RedisRepositoriesAutoConfiguration.class
})
public class CompanionChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompanionChatApplication.class, args);
    }
}
