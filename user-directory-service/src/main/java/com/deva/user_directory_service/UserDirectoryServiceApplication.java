package com.deva.user_directory_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UserDirectoryServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(UserDirectoryServiceApplication.class, args);
	}

}
