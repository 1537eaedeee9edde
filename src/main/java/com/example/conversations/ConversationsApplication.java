package com.example.conversations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Conversations service.
 *
 * <p>Bootstraps the Spring Boot context, binds the {@code conversations.*}
 * configuration and starts the embedded web server.</p>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ConversationsApplication {

	/**
	 * Starts the Spring Boot application.
	 *
	 * @param args command-line arguments passed to the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(ConversationsApplication.class, args);
	}

}
