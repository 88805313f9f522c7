package com.autonomous.pipeline.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Redacts credentials from agent output before it is written to a stage log.
 * Agents routinely echo their environment or paste tokens into transcripts.
 */
@Component
public class LogSanitizer {

    private static final String ENV_NAMES =
        "OPENAI_API_KEY|ANTHROPIC_API_KEY|GITHUB_TOKEN|GEMINI_API_KEY|GOOGLE_API_KEY|OPENROUTER_KEY";

    private static final List<Redaction> REDACTIONS = List.of(
        new Redaction("sk-proj-[A-Za-z0-9_-]{20,}", "[REDACTED_OPENAI_PROJECT_KEY]"),
        new Redaction("sk-or-v1-[A-Za-z0-9_-]{20,}", "[REDACTED_OPENROUTER_KEY]"),
        new Redaction("sk-ant-[A-Za-z0-9_-]{20,}", "[REDACTED_ANTHROPIC_KEY]"),
        new Redaction("sk-[A-Za-z0-9]{48,}", "[REDACTED_OPENAI_KEY]"),
        new Redaction("ghp_[A-Za-z0-9]{36,}", "[REDACTED_GITHUB_PAT]"),
        new Redaction("gho_[A-Za-z0-9]{36,}", "[REDACTED_GITHUB_OAUTH]"),
        new Redaction("ghs_[A-Za-z0-9]{36,}", "[REDACTED_GITHUB_APP]"),
        new Redaction("github_pat_[A-Za-z0-9_]{20,}", "[REDACTED_GITHUB_FINE_GRAINED]"),
        new Redaction("AIza[A-Za-z0-9_-]{35,}", "[REDACTED_GOOGLE_KEY]"),
        new Redaction("AKIA[A-Z0-9]{16}", "[REDACTED_AWS_ACCESS_KEY]"),
        new Redaction("(" + ENV_NAMES + ")=[^\\s\"']+", "$1=[REDACTED]")
    );

    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Redaction redaction : REDACTIONS) {
            result = redaction.pattern().matcher(result).replaceAll(redaction.replacement());
        }
        return result;
    }

    private record Redaction(Pattern pattern, String replacement) {
        Redaction(String regex, String replacement) {
            this(Pattern.compile(regex), replacement);
        }
    }
}
