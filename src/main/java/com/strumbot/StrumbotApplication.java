package com.strumbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StrumbotApplication {

	public static void main(String[] args) {
		SpringApplication.run(StrumbotApplication.class, args);
	}

}
