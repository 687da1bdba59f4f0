package com.authgate.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuthgateApplication {

	public static void main(String[] args) {
		// Session and account timestamps are stored and rendered in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(AuthgateApplication.class, args);
	}

}
