package chatwire;

public class InvalidRoleException
        extends IllegalArgumentException
{
    private final String label;

    public InvalidRoleException(String label) {
        super("Invalid role: " + label);
        this.label = label;
    }

    public String label() {
        return label;
    }
}
