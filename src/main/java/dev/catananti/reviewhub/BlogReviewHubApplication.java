package dev.catananti.reviewhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BlogReviewHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlogReviewHubApplication.class, args);
    }
}
