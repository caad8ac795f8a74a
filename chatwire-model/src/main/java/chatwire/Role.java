package chatwire;

public enum Role
{
    developer,
    system,
    user,
    assistant,
    tool,
    function;

    public static Role fromLabel(String label) {
        for (Role role : values()) {
            if (role.name().equals(label))
                return role;
        }
        throw new InvalidRoleException(label);
    }
}
