package br.com.topiccards.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApiTopicCardsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiTopicCardsApplication.class, args);
    }

}
