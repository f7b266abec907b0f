package com.kmg.pageocr;

import com.kmg.pageocr.config.PageOcrProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PageOcrProperties.class)
public class PageOcrApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PageOcrApplication.class, args)));
    }
}
