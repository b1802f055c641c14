package com.ragward.service;

import com.ragward.model.ModelParameters;
import com.ragward.model.QueryMode;
import com.ragward.provider.TextProvider;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Builds a prompt from the question and retrieved context and sends it to the text provider.
 * BYPASS questions go to the provider as they are, without retrieval.
 */
@Slf4j
public class PromptingQueryExecutor implements QueryExecutor {

    private static final String PROMPT_TEMPLATE =
            "Answer the question using the document context below. "
                    + "If the context does not contain the answer, say so.\n\n"
                    + "---Context (%s retrieval)---\n%s\n\n"
                    + "---Question---\n%s\n";

    private final TextProvider textProvider;
    private final ContextRetriever contextRetriever;

    public PromptingQueryExecutor(TextProvider textProvider, ContextRetriever contextRetriever) {
        this.textProvider = textProvider;
        this.contextRetriever = contextRetriever;
    }

    @Override
    public String getProviderName() {
        return textProvider.getName();
    }

    @Override
    public Mono<String> execute(String question, QueryMode mode, ModelParameters parameters) {
        if (mode == QueryMode.BYPASS) {
            return textProvider.invokeText(question, parameters);
        }

        return contextRetriever.retrieve(question, mode)
                .defaultIfEmpty("")
                .map(context -> buildPrompt(question, mode, context))
                .flatMap(prompt -> textProvider.invokeText(prompt, parameters));
    }

    private String buildPrompt(String question, QueryMode mode, String context) {
        if (context.isBlank()) {
            log.debug("No context retrieved for {} query", mode.wireName());
        }
        return String.format(PROMPT_TEMPLATE, mode.wireName(), context.isBlank() ? "(none)" : context, question);
    }
}
