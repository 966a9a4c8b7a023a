package io.github.manjago.gtm.core;

/**
 * A generic definition refers to a bare name that is neither one of its parameters nor a state.
 */
public class UndeclaredPlaceholderException extends ProgramException {

    private final String state;
    private final String placeholder;

    public UndeclaredPlaceholderException(String state, String placeholder, int line) {
        super(String.format("'%s' is not a parameter of '%s' and no state of that name exists",
                placeholder, state), line);
        this.state = state;
        this.placeholder = placeholder;
    }

    public String getState() {
        return state;
    }

    public String getPlaceholder() {
        return placeholder;
    }
}
