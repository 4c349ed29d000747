package com.warehouse.requisitions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RequisitionsApplication {

	public static void main(String[] args) {
		SpringApplication.run(RequisitionsApplication.class, args);
	}

}
