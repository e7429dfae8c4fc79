package com.example.waterrights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point of the water rights report parser.
 * Wires the application context and exposes the HTTP endpoints defined under the interfaces layer.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class WaterRightsApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(WaterRightsApplication.class, args);
	}

}
