package com.example.unvoidchess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UnvoidChessApplication {

    public static void main(String[] args) {
        SpringApplication.run(UnvoidChessApplication.class, args);
    }

}
