package com.example.dbconsole;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DbConsoleApplication {
    public static void main(String[] args) {
        SpringApplication.run(DbConsoleApplication.class, args);
    }
}
