package com.example.memo;

import com.example.memo.config.MemoProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MemoProperties.class)
public class MemoCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoCacheApplication.class, args);
    }
}
