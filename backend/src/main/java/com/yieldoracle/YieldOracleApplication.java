package com.yieldoracle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class YieldOracleApplication {

    public static void main(String[] args) {
        SpringApplication.run(YieldOracleApplication.class, args);
    }
}
