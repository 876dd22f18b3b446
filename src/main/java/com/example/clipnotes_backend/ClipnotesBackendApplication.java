package com.example.clipnotes_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClipnotesBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClipnotesBackendApplication.class, args);
	}

}
