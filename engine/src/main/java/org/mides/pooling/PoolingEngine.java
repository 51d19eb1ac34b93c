package org.mides.pooling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PoolingEngine {

	public static void main(String[] args) {
		SpringApplication.run(PoolingEngine.class, args);
	}
}
