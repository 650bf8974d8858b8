package com.intent.vision.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntentvisionApplication {

	public static void main(String[] args) {
		SpringApplication.run(IntentvisionApplication.class, args);
	}

}
