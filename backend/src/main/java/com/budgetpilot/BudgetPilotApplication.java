package com.budgetpilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BudgetPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(BudgetPilotApplication.class, args);
    }
}
