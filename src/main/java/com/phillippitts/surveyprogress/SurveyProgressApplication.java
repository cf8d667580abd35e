package com.phillippitts.surveyprogress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.surveyprogress.config.properties.SurveyProgressProperties.class,
        com.phillippitts.surveyprogress.config.properties.SurveyCatalogProperties.class
})
@EnableScheduling
public class SurveyProgressApplication {

    public static void main(String[] args) {
        SpringApplication.run(SurveyProgressApplication.class, args);
    }

}
