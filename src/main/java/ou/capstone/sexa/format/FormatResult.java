package ou.capstone.sexa.format;

import java.util.Objects;
import java.util.Optional;

import ou.capstone.sexa.exceptions.FormatError;

/**
 * Output of one formatting call.
 * <p>
 * The text is always present. On a value overflow it is a run of
 * asterisks and {@link #error()} says why; on a specification error it is
 * a diagnostic such as {@code %!q(BADVERB)}.
 */
public final class FormatResult {
    private final String text;
    private final FormatError error;
    private final boolean specError;

    private FormatResult(final String text, final FormatError error, final boolean specError) {
        this.text = text;
        this.error = error;
        this.specError = specError;
    }

    public static FormatResult success(final String text) {
        return new FormatResult(text, null, false);
    }

    public static FormatResult overflow(final String asterisks, final FormatError error) {
        return new FormatResult(asterisks, Objects.requireNonNull(error, "error"), false);
    }

    public static FormatResult invalidSpec(final String diagnostic) {
        return new FormatResult(diagnostic, null, true);
    }

    /** True when the value was rendered normally. */
    public boolean isOk() {
        return error == null && !specError;
    }

    public String text() {
        return text;
    }

    public Optional<FormatError> error() {
        return Optional.ofNullable(error);
    }

    public boolean isSpecError() {
        return specError;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormatResult other)) {
            return false;
        }
        return specError == other.specError
                && text.equals(other.text)
                && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, error, specError);
    }

    @Override
    public String toString() {
        if (error != null) {
            return text + " (" + error.message() + ")";
        }
        return text;
    }
}
