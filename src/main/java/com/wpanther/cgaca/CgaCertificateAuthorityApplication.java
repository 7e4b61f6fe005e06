package com.wpanther.cgaca;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CgaCertificateAuthorityApplication {

    public static void main(String[] args) {
        SpringApplication.run(CgaCertificateAuthorityApplication.class, args);
    }
}
