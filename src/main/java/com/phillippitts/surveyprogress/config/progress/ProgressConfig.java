package com.phillippitts.surveyprogress.config.progress;

import com.phillippitts.surveyprogress.config.properties.SurveyCatalogProperties;
import com.phillippitts.surveyprogress.config.properties.SurveyProgressProperties;
import com.phillippitts.surveyprogress.service.metrics.ProgressMetrics;
import com.phillippitts.surveyprogress.service.progress.SurveyProgressController;
import com.phillippitts.surveyprogress.service.question.InMemoryQuestionListProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the survey progress controller and its question source explicitly.
 */
@Configuration
public class ProgressConfig {

    /**
     * The progress controller. One instance per application: it supports a single active session.
     */
    @Bean
    public SurveyProgressController surveyProgressController(@Qualifier("progressExecutor") Executor progressExecutor,
                                                             ApplicationEventPublisher publisher,
                                                             ProgressMetrics metrics,
                                                             SurveyProgressProperties properties) {
        return new SurveyProgressController(progressExecutor, publisher, metrics, properties.getDrainBatchSize());
    }

    /**
     * Question source seeded from {@code survey.catalog.questions}.
     */
    @Bean
    public InMemoryQuestionListProvider catalogQuestionListProvider(SurveyCatalogProperties catalog) {
        return new InMemoryQuestionListProvider(catalog.toSurveyQuestions());
    }

    /**
     * Starts a session from the catalog at startup. Active when survey.progress.auto-start=true.
     */
    @Bean
    @ConditionalOnProperty(prefix = "survey.progress", name = "auto-start", havingValue = "true")
    public SurveyAutoStarter surveyAutoStarter(SurveyProgressController controller,
                                               InMemoryQuestionListProvider catalogQuestionListProvider) {
        return new SurveyAutoStarter(controller, catalogQuestionListProvider);
    }
}
