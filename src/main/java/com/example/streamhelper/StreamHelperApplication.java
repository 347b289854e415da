package com.example.streamhelper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StreamHelperApplication {

	public static void main(String[] args) {
		SpringApplication.run(StreamHelperApplication.class, args);
	}

}
