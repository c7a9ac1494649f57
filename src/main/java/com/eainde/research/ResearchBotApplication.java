package com.eainde.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

@SpringBootApplication
public class ResearchBotApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(ResearchBotApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.run(translateArgs(args));
    }

    /**
     * {@code --debug} means debug artifacts here, not Spring Boot's debug report.
     */
    static String[] translateArgs(String[] args) {
        return Arrays.stream(args)
                .map(arg -> "--debug".equals(arg) ? "--research.debug.enabled=true" : arg)
                .toArray(String[]::new);
    }
}
