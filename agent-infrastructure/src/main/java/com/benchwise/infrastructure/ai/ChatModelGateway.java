package com.benchwise.infrastructure.ai;

import com.benchwise.domain.agent.adapter.gateway.IModelGateway;
import com.benchwise.infrastructure.ai.config.ModelGatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Spring AI backed model gateway.
 * <p>
 * Each call is bounded by a concurrency cap and a timeout. Any failure, including an
 * unconfigured model, returns empty so callers switch to their rule-based path.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-08
 */
@Slf4j
@Component
public class ChatModelGateway implements IModelGateway {

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final ModelGatewayProperties properties;
    private final ExecutorService executor;
    private final Semaphore permits;

    private volatile ChatClient chatClient;

    public ChatModelGateway(ObjectProvider<ChatModel> chatModelProvider,
                            ModelGatewayProperties properties,
                            @Qualifier("modelGatewayExecutor") ExecutorService executor) {
        this.chatModelProvider = chatModelProvider;
        this.properties = properties;
        this.executor = executor;
        this.permits = new Semaphore(Math.max(properties.getMaxConcurrency(), 1));
    }

    @Override
    public boolean isAvailable() {
        return properties.isEnabled() && chatModelProvider.getIfAvailable() != null;
    }

    @Override
    public Optional<String> complete(String prompt) {
        if (StringUtils.isBlank(prompt) || !isAvailable()) {
            return Optional.empty();
        }
        long timeoutMs = Math.max(properties.getTimeoutMs(), 1L);
        boolean acquired = false;
        Future<String> future = null;
        try {
            acquired = permits.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("Model gateway saturated, no permit within {}ms", timeoutMs);
                return Optional.empty();
            }
            ChatClient client = resolveClient();
            future = executor.submit(() -> client.prompt().user(prompt).call().content());
            String content = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return StringUtils.isBlank(content) ? Optional.empty() : Optional.of(content);
        } catch (TimeoutException ex) {
            log.warn("Model call timed out after {}ms", timeoutMs);
            future.cancel(true);
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            return Optional.empty();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("Model call failed: {}", cause.getMessage());
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.warn("Model call rejected: {}", ex.getMessage());
            return Optional.empty();
        } finally {
            if (acquired) {
                permits.release();
            }
        }
    }

    private ChatClient resolveClient() {
        ChatClient client = chatClient;
        if (client == null) {
            synchronized (this) {
                client = chatClient;
                if (client == null) {
                    ChatModel chatModel = chatModelProvider.getObject();
                    ChatOptions.Builder options = ChatOptions.builder();
                    if (StringUtils.isNotBlank(properties.getModel())) {
                        options.model(properties.getModel());
                    }
                    if (properties.getTemperature() != null) {
                        options.temperature(properties.getTemperature());
                    }
                    client = ChatClient.builder(chatModel)
                            .defaultOptions(options.build())
                            .build();
                    chatClient = client;
                }
            }
        }
        return client;
    }
}
