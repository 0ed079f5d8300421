package io.callregistry;

/**
 * Thrown when a key has registrations but none of their signatures accepts
 * the supplied arguments.
 */
public final class NoMatchException extends CallableRegistryException {

    private final String key;
    private final Arguments arguments;

    public NoMatchException(String key, Arguments arguments, int candidates) {
        super("No registration of '" + key + "' accepts arguments " + arguments
                + " (" + candidates + " candidate(s) checked)");
        this.key = key;
        this.arguments = arguments;
    }

    public String key() {
        return key;
    }

    public Arguments arguments() {
        return arguments;
    }
}
