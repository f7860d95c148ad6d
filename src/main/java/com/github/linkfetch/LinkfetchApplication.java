package com.github.linkfetch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LinkfetchApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkfetchApplication.class, args);
    }
}
