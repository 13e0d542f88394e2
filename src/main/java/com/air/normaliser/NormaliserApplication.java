package com.air.normaliser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NormaliserApplication {

	public static void main(String[] args) {
		SpringApplication.run(NormaliserApplication.class, args);
	}

}
