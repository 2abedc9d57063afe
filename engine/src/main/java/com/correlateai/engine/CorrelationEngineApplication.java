package com.correlateai.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CorrelationEngineApplication {
	public static void main(String[] args) {
		SpringApplication.run(CorrelationEngineApplication.class, args);
	}
}
