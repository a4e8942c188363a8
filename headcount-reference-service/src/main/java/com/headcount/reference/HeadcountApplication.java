package com.headcount.reference;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"com.headcount"})
public class HeadcountApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeadcountApplication.class, args);
    }
}
