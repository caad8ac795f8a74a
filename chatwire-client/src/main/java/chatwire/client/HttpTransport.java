package chatwire.client;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Sends one HTTP request and hands back the whole body as text.
 * Cancelling the returned future must abort the exchange.
 */
@FunctionalInterface
public interface HttpTransport
{
    CompletableFuture<HttpResponse<String>> send(HttpRequest request);

    static HttpTransport using(HttpClient client) {
        return request -> client.sendAsync(request, HttpResponse.BodyHandlers.ofString(UTF_8));
    }
}
