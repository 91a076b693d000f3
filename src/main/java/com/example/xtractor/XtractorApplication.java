package com.example.xtractor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point. Boots the Spring context that exposes the upload page and the
 * extraction endpoints defined under the interfaces layer.
 */
@SpringBootApplication
public class XtractorApplication {

	public static void main(String[] args) {
		SpringApplication.run(XtractorApplication.class, args);
	}

}
