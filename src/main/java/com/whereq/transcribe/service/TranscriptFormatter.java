package com.whereq.transcribe.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.transcribe.exception.EmptyResultException;
import com.whereq.transcribe.model.TranscriptionJob;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw generation result into the transcript document.
 * <p>
 * Transcripts carry framework component tags such as {@code [2b]}, speaker labels
 * such as {@code [Speaker 1:]} and timestamps such as {@code [04:31]}.
 */
@Component
public class TranscriptFormatter {

    private static final Pattern COMPONENT_TAG = Pattern.compile("\\[([1-4][a-f])\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPEAKER_LABEL = Pattern.compile("\\[Speaker (\\d+):\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIMESTAMP = Pattern.compile("\\[(\\d{2}:\\d{2})\\]");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern REPEATED_SPACES = Pattern.compile("[ \\t]{2,}");

    static final int MAX_TAG_EXCERPT = 500;

    /**
     * Extract transcript text from a generation result
     *
     * @throws EmptyResultException if the result carries no text
     */
    public String extractText(JsonNode result) {
        if (result == null || result.isNull() || result.isMissingNode()) {
            throw new EmptyResultException("No result returned by the transcription service");
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : result.path("candidates").path(0).path("content").path("parts")) {
            JsonNode partText = part.get("text");
            if (partText != null && partText.isTextual()) {
                text.append(partText.asText());
            }
        }

        if (text.toString().isBlank()) {
            throw new EmptyResultException("No transcription text found in result");
        }
        return text.toString();
    }

    /**
     * Put component tags, speaker labels and timestamps on their own lines
     */
    public String clean(String rawText) {
        String text = COMPONENT_TAG.matcher(rawText).replaceAll("\n\n[$1] ");
        text = SPEAKER_LABEL.matcher(text).replaceAll("\n\n**Speaker $1:** ");
        text = TIMESTAMP.matcher(text).replaceAll("\n*[$1]* ");
        text = REPEATED_SPACES.matcher(text).replaceAll(" ");
        text = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.trim();
    }

    /**
     * Group the text following each component tag by component
     */
    public Map<String, List<String>> componentTags(String rawText) {
        Map<String, List<String>> tags = new LinkedHashMap<>();
        Matcher matcher = COMPONENT_TAG.matcher(rawText);

        String component = null;
        int segmentStart = 0;
        while (matcher.find()) {
            if (component != null) {
                addExcerpt(tags, component, rawText.substring(segmentStart, matcher.start()));
            }
            component = matcher.group(1).toLowerCase(Locale.ROOT);
            segmentStart = matcher.end();
        }
        if (component != null) {
            addExcerpt(tags, component, rawText.substring(segmentStart));
        }
        return tags;
    }

    public String renderDocument(TranscriptionJob job, String rawText, Instant transcribedAt) {
        StringBuilder doc = new StringBuilder();
        doc.append("# Transcript: ").append(job.getCorrelationRef()).append("\n\n");
        doc.append("- Job: ").append(job.getJobId()).append('\n');
        if (job.getResource() != null) {
            doc.append("- Recording: ").append(job.getResource().getResourceId())
                .append(" (").append(job.getResource().getMimeType()).append(")\n");
        }
        doc.append("- Transcribed: ").append(transcribedAt).append("\n\n");

        doc.append("## Transcript\n\n").append(clean(rawText)).append("\n");

        Map<String, List<String>> tags = componentTags(rawText);
        if (!tags.isEmpty()) {
            doc.append("\n## Components\n");
            tags.forEach((tag, excerpts) -> {
                doc.append("\n### ").append(tag).append("\n\n");
                excerpts.forEach(excerpt -> doc.append("- ").append(excerpt).append('\n'));
            });
        }
        return doc.toString();
    }

    private static void addExcerpt(Map<String, List<String>> tags, String component, String segment) {
        List<String> excerpts = tags.computeIfAbsent(component, key -> new ArrayList<>());
        String excerpt = segment.trim();
        if (!excerpt.isEmpty()) {
            excerpts.add(excerpt.length() > MAX_TAG_EXCERPT ? excerpt.substring(0, MAX_TAG_EXCERPT) : excerpt);
        }
    }
}
