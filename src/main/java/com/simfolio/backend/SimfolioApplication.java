package com.simfolio.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SimfolioApplication {
	public static void main(String[] args) {
		SpringApplication.run(SimfolioApplication.class, args);
	}
}
