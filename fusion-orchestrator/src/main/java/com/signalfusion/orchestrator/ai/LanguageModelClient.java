package com.signalfusion.orchestrator.ai;

import reactor.core.publisher.Mono;

/**
 * Language-model completion. The tier is chosen by {@link ModelTierRouter} from the task
 * descriptor; implementations record usage with the router.
 */
public interface LanguageModelClient {

    /**
     * @return the completion text, or empty when no model is configured or the call failed;
     *         callers fall back to rule-based text
     */
    Mono<String> complete(String prompt, TaskDescriptor task);
}
