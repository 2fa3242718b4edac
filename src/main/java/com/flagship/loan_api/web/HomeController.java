package com.flagship.loan_api.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HomeController {

    static final String WELCOME = "Welcome to the Loan Application API";

    @GetMapping("/")
    public String home() {
        return WELCOME;
    }
}
