package com.micronote.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MicroNoteApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC so stored timestamps and token expiries line up
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(MicroNoteApplication.class, args);
	}

}

/*
Must stay in the root package: component scanning starts here and would miss
global/ and modules/ if this class moved into a sub-package.
 */
