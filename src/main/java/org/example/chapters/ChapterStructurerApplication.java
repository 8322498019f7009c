package org.example.chapters;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChapterStructurerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChapterStructurerApplication.class, args);
    }
}
