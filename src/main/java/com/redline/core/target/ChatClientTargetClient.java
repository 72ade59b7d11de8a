package com.redline.core.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link TargetClient} backed by Spring AI's {@link ChatClient}, pointed at any
 * OpenAI-compatible endpoint (LM Studio, vLLM, OpenAI). The target identifier is passed
 * through as the model name.
 */
@Service
public class ChatClientTargetClient implements TargetClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientTargetClient.class);

    private final ChatClient chatClient;
    private final String baseUrl;

    public ChatClientTargetClient(ChatClient.Builder builder,
                                  @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.baseUrl = baseUrl;
        log.info("Target client initialized, OpenAI base-url: {}", baseUrl);
    }

    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public String send(String prompt, String target) {
        long start = System.currentTimeMillis();
        String content;
        try {
            content = chatClient.prompt()
                    .user(prompt)
                    .options(ChatOptions.builder().model(target).build())
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new TargetUnavailableException("Target " + target + " unavailable: " + e.getMessage(), e);
        }
        log.debug("Target {} answered in {}ms", target, System.currentTimeMillis() - start);
        if (content == null) {
            throw new TargetUnavailableException("Target " + target + " returned no content");
        }
        return content;
    }
}
