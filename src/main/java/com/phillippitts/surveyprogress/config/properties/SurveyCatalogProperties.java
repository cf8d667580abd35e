package com.phillippitts.surveyprogress.config.properties;

import com.phillippitts.surveyprogress.domain.SurveyQuestion;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Questions seeded into the in-memory question list provider.
 *
 * <pre>
 * survey.catalog.questions[0].question-id=user-type
 * survey.catalog.questions[0].question-name=USER_TYPE
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "survey.catalog")
public class SurveyCatalogProperties {

    @Valid
    private List<QuestionDefinition> questions = new ArrayList<>();

    public List<QuestionDefinition> getQuestions() {
        return questions;
    }

    public void setQuestions(List<QuestionDefinition> questions) {
        this.questions = questions;
    }

    /**
     * Converts the configured definitions into domain questions, preserving order.
     */
    public List<SurveyQuestion> toSurveyQuestions() {
        return questions.stream()
                .map(q -> new SurveyQuestion(q.getQuestionId(), q.getQuestionName()))
                .toList();
    }

    /**
     * A single configured question.
     */
    public static class QuestionDefinition {
        @NotBlank
        private String questionId;
        @NotBlank
        private String questionName;

        public String getQuestionId() {
            return questionId;
        }

        public void setQuestionId(String questionId) {
            this.questionId = questionId;
        }

        public String getQuestionName() {
            return questionName;
        }

        public void setQuestionName(String questionName) {
            this.questionName = questionName;
        }
    }
}
