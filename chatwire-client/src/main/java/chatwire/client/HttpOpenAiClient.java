package chatwire.client;

import chatwire.ChatRequest;
import chatwire.ChatResponse;
import chatwire.JsonBinding;
import chatwire.Usage;
import jakarta.json.JsonException;
import jakarta.json.bind.Jsonb;
import jakarta.json.bind.JsonbException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Calls the chat completions endpoint once per request: no retries, no
 * streaming, and the transport's own timeouts. Closing the client
 * releases its JSON-B instance.
 *
 * @see <a href="https://platform.openai.com/docs/api-reference/chat"/>
 */
public class HttpOpenAiClient
        implements OpenAiClient, AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiClient.class);

    private final String apiKey;
    private final URI endpoint;
    private final HttpTransport transport;
    private final Jsonb jsonb = JsonBinding.jsonb();

    public static HttpOpenAiClient create() {
        return new HttpOpenAiClient(
                ClientSettings.fromEnvironment(System.getenv()),
                HttpTransport.using(HttpClient.newHttpClient()));
    }

    public HttpOpenAiClient(String apiKey) {
        this(new ClientSettings(apiKey), HttpTransport.using(HttpClient.newHttpClient()));
    }

    public HttpOpenAiClient(
            ClientSettings settings,
            HttpTransport transport
    ) {
        this.apiKey = settings.apiKey();
        this.endpoint = settings.endpoint();
        this.transport = transport;
    }

    @Override
    public ChatResponse chat(ChatRequest request)
    throws ChatException {
        CompletableFuture<ChatResponse> call = chatAsync(request);
        try {
            return call.get();
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for chat completion", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ChatException chatException)
                throw chatException;
            throw new TransportException(e.getCause());
        }
    }

    @Override
    public CompletableFuture<ChatResponse> chatAsync(ChatRequest request) {
        String json = jsonb.toJson(request);
        LOG.debug("Sending JSON to chat completion API:\n" + json);
        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, UTF_8))
                .build();

        CompletableFuture<HttpResponse<String>> exchange = transport.send(httpRequest);
        CompletableFuture<ChatResponse> result = exchange.handle((response, failure) -> {
            try {
                if (failure != null)
                    throw new TransportException(unwrap(failure));
                return toChatResponse(response);
            } catch (ChatException e) {
                throw new CompletionException(e);
            }
        });
        result.whenComplete((response, failure) -> {
            if (failure instanceof CancellationException)
                exchange.cancel(true);
        });
        return result;
    }

    private ChatResponse toChatResponse(HttpResponse<String> response)
    throws ChatException {
        int status = response.statusCode();
        String body = response.body();
        if (status < 200 || status >= 300)
            throw new ApiException(status, body);

        ChatResponse chat;
        try {
            chat = jsonb.fromJson(body, ChatResponse.class);
        } catch (JsonbException | JsonException e) {
            throw new DeserializationException(body, e);
        }
        if (chat == null)
            throw new DeserializationException(body, new JsonException("Empty chat completion body"));

        Usage usage = chat.usage();
        LOG.debug(String.format(
                "Prompt tokens: %d, completion tokens: %d, total tokens: %d",
                usage.promptTokens(),
                usage.completionTokens(),
                usage.totalTokens()));
        return chat;
    }

    @Override
    public void close()
    throws Exception {
        jsonb.close();
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null)
            return failure.getCause();
        return failure;
    }
}
