package chatwire.client;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

public record ClientSettings(
        String apiKey,
        URI endpoint
)
{
    public static final URI DEFAULT_ENDPOINT =
            URI.create("https://api.openai.com/v1/chat/completions");

    public ClientSettings {
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(endpoint, "endpoint");
    }

    public ClientSettings(String apiKey) {
        this(apiKey, DEFAULT_ENDPOINT);
    }

    /**
     * Reads {@code OPENAI_API_KEY} and, optionally, {@code OPENAI_CHAT_URL}.
     *
     * @throws IllegalStateException if the API key is not set
     */
    public static ClientSettings fromEnvironment(Map<String, String> env) {
        String apiKey = env.get("OPENAI_API_KEY");
        if (apiKey == null || apiKey.isBlank())
            throw new IllegalStateException("OPENAI_API_KEY must be set in environment");
        String url = env.get("OPENAI_CHAT_URL");
        return new ClientSettings(
                apiKey,
                url != null && !url.isBlank() ? URI.create(url) : DEFAULT_ENDPOINT);
    }

    @Override
    public String toString() {
        return "ClientSettings[apiKey=****, endpoint=" + endpoint + "]";
    }
}
