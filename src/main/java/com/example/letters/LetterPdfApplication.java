package com.example.letters;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the letter PDF service.
 * This class lives in the bootstrap layer and only wires the application context before handing over to Spring.
 */
@SpringBootApplication
public class LetterPdfApplication {

	/**
	 * Boots the Spring container and exposes the HTTP endpoints defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(LetterPdfApplication.class, args);
	}

}
