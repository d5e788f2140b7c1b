package com.blockmorph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlockMorphApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlockMorphApplication.class, args);
    }
}
