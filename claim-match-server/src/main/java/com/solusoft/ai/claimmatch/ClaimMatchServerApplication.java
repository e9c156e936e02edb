package com.solusoft.ai.claimmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClaimMatchServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClaimMatchServerApplication.class, args);
	}

}
