package com.flagship.admissions_payment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AdmissionsPaymentApplication {

	public static void main(String[] args) {
		SpringApplication.run(AdmissionsPaymentApplication.class, args);
	}

}
