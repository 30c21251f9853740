package com.expenseflow.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ExpenseFlowApplication {

	public static void main(String[] args) {
		// Ledger timestamps and audit rows are all recorded in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(ExpenseFlowApplication.class, args);
	}

}

/*
Keep this class in the root package: component scanning starts here, so moving it into a
sub-package would hide every module outside that package from the application context.
 */
