package com.phillippitts.surveyprogress.testutil;

import com.phillippitts.surveyprogress.domain.SurveyQuestion;

import java.util.ArrayList;
import java.util.List;

/**
 * Question fixtures shared by progress tests.
 */
public final class TestQuestions {

    public static final SurveyQuestion Q0 = new SurveyQuestion("q0", "USER_TYPE");
    public static final SurveyQuestion Q1 = new SurveyQuestion("q1", "MARKET_FIT");
    public static final SurveyQuestion Q2 = new SurveyQuestion("q2", "NPS");

    private TestQuestions() {}

    public static List<SurveyQuestion> threeQuestions() {
        return List.of(Q0, Q1, Q2);
    }

    /**
     * Builds {@code count} questions whose ids start with {@code prefix}.
     */
    public static List<SurveyQuestion> questions(String prefix, int count) {
        List<SurveyQuestion> questions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            questions.add(new SurveyQuestion(prefix + i, prefix.toUpperCase() + "_" + i));
        }
        return questions;
    }
}
