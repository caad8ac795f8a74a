package chatwire.client;

/**
 * The exchange failed before an HTTP status was received.
 */
public class TransportException
        extends ChatException
{
    public TransportException(
            String message,
            Throwable cause
    ) {
        super(message, cause);
    }

    public TransportException(Throwable cause) {
        this("Chat completion call failed: " + cause, cause);
    }
}
