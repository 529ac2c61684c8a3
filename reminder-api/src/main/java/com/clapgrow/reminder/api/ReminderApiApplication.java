package com.clapgrow.reminder.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.web.reactive.WebFluxAutoConfiguration;

@SpringBootApplication(exclude = {
    WebFluxAutoConfiguration.class  // WebClient only, the server stays on MVC
})
public class ReminderApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReminderApiApplication.class, args);
    }
}
