package com.photohunt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhotoHuntApplication {
    public static void main(String[] args) {
        SpringApplication.run(PhotoHuntApplication.class, args);
    }
}
