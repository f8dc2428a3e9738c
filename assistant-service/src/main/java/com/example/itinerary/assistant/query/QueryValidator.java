package com.example.itinerary.assistant.query;

import com.example.itinerary.assistant.error.QueryValidationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

@Component
public class QueryValidator {

    public static final int MAX_QUESTION_LENGTH = 500;

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("ignore previous instructions", Pattern.CASE_INSENSITIVE),
            Pattern.compile("system:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("assistant:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("forget everything", Pattern.CASE_INSENSITIVE),
            Pattern.compile("disregard", Pattern.CASE_INSENSITIVE)
    );

    public void validate(String question) {
        if (question == null || question.isBlank()) {
            throw new QueryValidationException("Question must be a non-empty string");
        }
        if (question.length() > MAX_QUESTION_LENGTH) {
            throw new QueryValidationException("Question too long (max 500 characters)");
        }
        for (Pattern p : INJECTION_PATTERNS) {
            if (p.matcher(question).find()) {
                throw new QueryValidationException("Invalid question format");
            }
        }
    }
}
