package com.phillippitts.meetingscribe.service.stream;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Recently delivered transcript text of one session, shared by all of its streams.
 *
 * <p>Each recognition request carries it as a prompt and as a sentence history so the
 * recognizer sees what every speaker said before. Only text is kept; segment audio is
 * unaffected. The history holds at most {@code historySize} sentences, oldest dropped first.
 *
 * <p>Thread-safe: individual-mode streams drain on different workers.
 */
public final class ConversationContext {

    /** Splits after '.' or '?' followed by whitespace, except in abbreviations like "e.g." or "Mr.". */
    private static final Pattern SENTENCE_BREAK =
            Pattern.compile("(?<!\\w\\.\\w.)(?<![A-Z][a-z]\\.)(?<=\\.|\\?)\\s");

    private static final ConversationContext DISABLED = new ConversationContext(0);

    private final int historySize;
    private final Deque<String> sentences = new ArrayDeque<>();

    public ConversationContext(int historySize) {
        if (historySize < 0) {
            throw new IllegalArgumentException("historySize must be >= 0, got: " + historySize);
        }
        this.historySize = historySize;
    }

    /** Context that records nothing; requests go out with an empty prompt and history. */
    public static ConversationContext disabled() {
        return DISABLED;
    }

    /**
     * Appends delivered transcript text, split into sentences.
     */
    public synchronized void record(String text) {
        if (historySize == 0 || text == null || text.isBlank()) {
            return;
        }
        for (String sentence : SENTENCE_BREAK.split(text.strip())) {
            if (!sentence.isBlank()) {
                sentences.addLast(sentence.strip());
            }
        }
        while (sentences.size() > historySize) {
            sentences.removeFirst();
        }
    }

    /** Retained sentences, oldest first. */
    public synchronized List<String> history() {
        return List.copyOf(sentences);
    }

    /** Retained sentences joined with single spaces; empty when nothing was delivered yet. */
    public synchronized String prompt() {
        return String.join(" ", sentences);
    }

    public synchronized int size() {
        return sentences.size();
    }

    public int historySize() {
        return historySize;
    }
}
