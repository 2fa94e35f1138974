package com.trainingplan.generator.distribution;

import com.trainingplan.generator.model.PaceMethod;

import lombok.experimental.UtilityClass;

/**
 * Attaches the pace-method note to workout pace guidance.
 */
@UtilityClass
public class PaceGuidance {

    public static String withMethod(String guidance, PaceMethod method) {
        if (method == null) {
            return guidance;
        }
        return guidance + " " + method.guidanceNote();
    }

    /**
     * Swaps the note of {@code previous} for the note of {@code current}, leaving the rest of the text intact.
     */
    public static String rewrite(String guidance, PaceMethod previous, PaceMethod current) {
        String stripped = previous == null ? guidance : guidance.replace(" " + previous.guidanceNote(), "");
        return withMethod(stripped, current);
    }
}
