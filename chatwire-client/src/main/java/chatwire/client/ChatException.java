package chatwire.client;

/**
 * Failure of a chat completion call.
 */
public abstract class ChatException
        extends Exception
{
    protected ChatException(
            String message,
            Throwable cause
    ) {
        super(message, cause);
    }
}
