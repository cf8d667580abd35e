package com.phillippitts.surveyprogress.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SurveyQuestionTest {

    @Test
    void shouldCompareByIdAndName() {
        assertThat(new SurveyQuestion("nps", "NPS")).isEqualTo(new SurveyQuestion("nps", "NPS"));
        assertThat(new SurveyQuestion("nps", "NPS")).isNotEqualTo(new SurveyQuestion("nps", "NPS_V2"));
    }

    @Test
    void shouldRejectBlankId() {
        assertThatThrownBy(() -> new SurveyQuestion(" ", "NPS"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SurveyQuestion(null, "NPS"))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldRejectNullName() {
        assertThatThrownBy(() -> new SurveyQuestion("nps", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void ephemeralQuestionShouldWrapQuestion() {
        SurveyQuestion q = new SurveyQuestion("nps", "NPS");

        assertThat(new EphemeralSurveyQuestion(q).question()).isSameAs(q);
        assertThat(new EphemeralSurveyQuestion(q)).isEqualTo(new EphemeralSurveyQuestion(q));
    }
}
