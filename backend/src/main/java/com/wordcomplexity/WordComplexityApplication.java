package com.wordcomplexity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * WCM - ARPABET syllabification and Word Complexity Measure service.
 */
@SpringBootApplication
public class WordComplexityApplication {

	public static void main(String[] args) {
		SpringApplication.run(WordComplexityApplication.class, args);
	}

}
