package dev.citadel.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the MCP Citadel gateway.
 */
@SpringBootApplication
public class GatewayApplication {

	/**
	 * Bootstrap the Spring Boot application.
	 * @param args application arguments passed from the command line
	 */
	public static void main(String[] args) {
		SpringApplication.run(GatewayApplication.class, args);
	}

}
