package com.tony.gamePredictor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GamePredictorApplication {

	public static void main(String[] args) {
		SpringApplication.run(GamePredictorApplication.class, args);
	}

}
