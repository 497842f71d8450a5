package com.di.jobcost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobCostApplication {

	public static void main(String[] args) {
		SpringApplication.run(JobCostApplication.class, args);
	}
}
