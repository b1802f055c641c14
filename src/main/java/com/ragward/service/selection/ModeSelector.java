package com.ragward.service.selection;

import com.ragward.config.RagwardProperties;
import com.ragward.exception.InputException;
import com.ragward.model.QueryMode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies an incoming question into a query mode before dispatch.
 *
 * Policy (first match wins):
 * 1. Blank text - input error, never routed
 * 2. Caller-pinned mode - used as is
 * 3. Text no longer than the short-text threshold - BYPASS
 * 4. Text containing a bypass keyword as a whole word (case-insensitive) - BYPASS
 * 5. HYBRID
 *
 * Rule 4 deliberately favours speed over completeness: a real question that contains a
 * greeting or test marker ("hello, what does chapter 2 say?") is answered without retrieval.
 * Ambiguous short input always resolves toward BYPASS.
 */
@Slf4j
public class ModeSelector {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final List<String> bypassKeywords;
    private final int shortTextLength;

    public ModeSelector(RagwardProperties.SelectorConfig config) {
        this.bypassKeywords = config.getBypassKeywords().stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .filter(keyword -> !keyword.isBlank())
                .toList();
        this.shortTextLength = config.getShortTextLength();
    }

    /**
     * Select a mode for unpinned text.
     *
     * @param rawText question text
     * @return selected mode
     * @throws InputException if the text is null, empty or whitespace only
     */
    public QueryMode select(String rawText) {
        return select(rawText, null);
    }

    /**
     * Select a mode, honouring a caller-pinned mode.
     *
     * @param rawText    question text
     * @param pinnedMode mode pinned by the caller, or {@code null}
     * @return selected mode
     * @throws InputException if the text is null, empty or whitespace only
     */
    public QueryMode select(String rawText, QueryMode pinnedMode) {
        if (rawText == null || rawText.isBlank()) {
            throw new InputException("Question text must not be empty");
        }

        if (pinnedMode != null) {
            return pinnedMode;
        }

        String text = rawText.strip();
        if (text.length() <= shortTextLength) {
            log.debug("Selected BYPASS mode: short text ({} chars)", text.length());
            return QueryMode.BYPASS;
        }

        Set<String> words = Arrays.stream(WORD_SEPARATOR.split(text.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toSet());
        for (String keyword : bypassKeywords) {
            if (words.contains(keyword)) {
                log.debug("Selected BYPASS mode: matched keyword '{}'", keyword);
                return QueryMode.BYPASS;
            }
        }

        return QueryMode.HYBRID;
    }
}
