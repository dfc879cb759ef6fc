package io.github.yok.nntpchan.validation;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Thrown when the front-end settings contain one or more errors. Carries every error found, not
 * just the first.
 *
 * @author Yasuharu.Okawauchi
 */
public class SettingsValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    /**
     * Creates an exception from the collected errors.
     *
     * @param errors error messages; must not be empty
     */
    public SettingsValidationException(List<String> errors) {
        super("Invalid front-end settings: " + String.join("; ", errors));
        this.errors = ImmutableList.copyOf(errors);
    }

    /**
     * Returns the collected error messages.
     *
     * @return immutable list of errors
     */
    public List<String> getErrors() {
        return errors;
    }
}
