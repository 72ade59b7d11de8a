package com.redline.core.target;

/**
 * Sends one prompt to the model under test. Implementations block until the target
 * answers and may be called from several threads at once; callers bound the concurrency.
 */
public interface TargetClient {

    /**
     * @param prompt the attack prompt
     * @param target model name or endpoint label
     * @return the raw response text
     * @throws TargetUnavailableException on transport errors or a missing response
     */
    String send(String prompt, String target);
}
