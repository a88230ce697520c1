package com.httpcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class: a cache-aware WebClient plus the cache admin API.
 */
@SpringBootApplication
public class HttpCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(HttpCacheApplication.class, args);
    }
}
