package chatwire.client;

import chatwire.ChatRequest;
import chatwire.ChatResponse;

import java.util.concurrent.CompletableFuture;

public interface OpenAiClient
{
    ChatResponse chat(ChatRequest request) throws ChatException;

    /**
     * Completes exceptionally with a {@link ChatException}. Cancelling
     * the returned future aborts the HTTP call.
     */
    CompletableFuture<ChatResponse> chatAsync(ChatRequest request);
}
