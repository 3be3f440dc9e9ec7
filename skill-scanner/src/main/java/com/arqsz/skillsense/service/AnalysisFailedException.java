package com.arqsz.skillsense.service;

import com.arqsz.skillsense.constants.ReportConstants;
import com.arqsz.skillsense.util.TextUtils;

/**
 * Thrown when an analysis unit aborts because its validation step failed.
 * The message is truncated so it can be recorded as-is.
 */
public class AnalysisFailedException extends Exception {

    public AnalysisFailedException(String message, Throwable cause) {
        super(truncate(message), cause);
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return TextUtils.truncate(message, ReportConstants.ERROR_MESSAGE_MAX_LENGTH);
    }
}
