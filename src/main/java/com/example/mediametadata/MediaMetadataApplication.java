package com.example.mediametadata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point for the capture metadata subsystem.
 * This class only wires the application context; the extraction beans are consumed by the media catalog.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MediaMetadataApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(MediaMetadataApplication.class, args);
	}

}
