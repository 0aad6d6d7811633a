package com.example.summarizer_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SummarizerBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(SummarizerBackendApplication.class, args);
	}

}
