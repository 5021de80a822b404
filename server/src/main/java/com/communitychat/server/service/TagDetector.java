package com.communitychat.server.service;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds moderator-attention markers ({@code @issue}, {@code @request}, {@code @query}) in message text.
 */
@Component
public class TagDetector {

    // not preceded by a word character, not followed by one
    private static final Pattern TAG_PATTERN =
            Pattern.compile("(?<![\\w@])@(issue|request|query)(?!\\w)", Pattern.CASE_INSENSITIVE);

    public TagScan scan(String text) {
        if (text == null || text.isEmpty()) {
            return TagScan.NONE;
        }
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = TAG_PATTERN.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return found.isEmpty() ? TagScan.NONE : new TagScan(new ArrayList<>(found));
    }

    @Value
    public static class TagScan {

        static final TagScan NONE = new TagScan(List.of());

        List<String> tags;

        public boolean isTagged() {
            return !tags.isEmpty();
        }
    }
}
