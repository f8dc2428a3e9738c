package com.example.itinerary.assistant.query;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Strips markdown images and script blocks from model answers and caps their length.
 */
@Component
public class ResponseSanitizer {

    public static final int MAX_ANSWER_LENGTH = 2000;

    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[.*?]\\(.*?\\)", Pattern.DOTALL);
    private static final Pattern SCRIPT_TAG = Pattern.compile("<script.*?</script>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public String sanitize(String answer) {
        if (answer == null) return "";
        String out = MARKDOWN_IMAGE.matcher(answer).replaceAll("");
        out = SCRIPT_TAG.matcher(out).replaceAll("");
        return out.length() > MAX_ANSWER_LENGTH ? out.substring(0, MAX_ANSWER_LENGTH) : out;
    }
}
