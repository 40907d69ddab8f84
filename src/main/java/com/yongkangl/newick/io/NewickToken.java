package com.yongkangl.newick.io;

public final class NewickToken {
    private final String text;
    private final boolean separator;

    public NewickToken(String text, boolean separator) {
        this.text = text;
        this.separator = separator;
    }

    public String getText() {
        return text;
    }

    /**
     * A separator token holds a run of one or more separator characters, e.g. {@code "),("}.
     */
    public boolean isSeparator() {
        return separator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NewickToken)) return false;
        NewickToken other = (NewickToken) o;
        return separator == other.separator && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return 31 * text.hashCode() + (separator ? 1 : 0);
    }

    @Override
    public String toString() {
        return (separator ? "SEP" : "VAL") + "[" + text + "]";
    }
}
