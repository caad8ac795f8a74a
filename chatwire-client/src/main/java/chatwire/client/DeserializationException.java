package chatwire.client;

/**
 * The API accepted the call but its body is not a chat completion.
 */
public class DeserializationException
        extends ChatException
{
    private final String body;

    public DeserializationException(
            String body,
            Throwable cause
    ) {
        super("Unexpected chat completion body: " + cause.getMessage(), cause);
        this.body = body;
    }

    public String body() {
        return body;
    }
}
