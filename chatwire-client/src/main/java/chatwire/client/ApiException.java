package chatwire.client;

/**
 * The API answered with a non-2xx status. The body is kept as raw text
 * since its shape is up to the provider.
 */
public class ApiException
        extends ChatException
{
    private final int statusCode;
    private final String body;

    public ApiException(
            int statusCode,
            String body
    ) {
        super("OpenAI API error (HTTP " + statusCode + "): " + body, null);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }
}
