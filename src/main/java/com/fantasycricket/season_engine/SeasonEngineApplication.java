package com.fantasycricket.season_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeasonEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(SeasonEngineApplication.class, args);
	}

}
