package me.christianrobert.onig2js.transformer.context;

import java.util.Objects;

/**
 * A non-fatal conversion problem.
 */
public class ConversionWarning {

    private final WarningCategory category;
    private final String message;

    public ConversionWarning(WarningCategory category, String message) {
        if (category == null) {
            throw new IllegalArgumentException("Warning category cannot be null");
        }
        this.category = category;
        this.message = message != null ? message : "";
    }

    public WarningCategory getCategory() {
        return category;
    }

    /**
     * Stable string form of the category, e.g. {@code nested-negative-set}.
     */
    public String getCategoryCode() {
        return category.getCode();
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConversionWarning)) {
            return false;
        }
        ConversionWarning that = (ConversionWarning) o;
        return category == that.category && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, message);
    }

    @Override
    public String toString() {
        return category.getCode() + ": " + message;
    }
}
