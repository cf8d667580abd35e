package com.phillippitts.surveyprogress.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the survey progress controller.
 */
@Validated
@ConfigurationProperties(prefix = "survey.progress")
public class SurveyProgressProperties {

    /**
     * Maximum number of commands a session worker applies before handing its thread back to the pool.
     */
    @Min(1)
    private final int drainBatchSize;

    /**
     * Begin a session from the configured question catalog at startup.
     */
    private final boolean autoStart;

    @ConstructorBinding
    public SurveyProgressProperties(Integer drainBatchSize, Boolean autoStart) {
        this.drainBatchSize = drainBatchSize == null ? 64 : drainBatchSize;
        this.autoStart = autoStart != null && autoStart;
    }

    public int getDrainBatchSize() {
        return drainBatchSize;
    }

    public boolean isAutoStart() {
        return autoStart;
    }
}
