package com.yongkangl.newick.io;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Splits a Newick string into alternating runs of separator characters and values.
 * Values are anything between separators: labels, lengths, comment text and whitespace.
 */
public class NewickTokenizer implements Iterator<NewickToken> {
    public static final String SEPARATORS = "(),:;'[]";

    private final String input;
    private int position;

    public NewickTokenizer(String input) {
        this.input = input;
        this.position = 0;
    }

    public static boolean isSeparator(char c) {
        return SEPARATORS.indexOf(c) >= 0;
    }

    @Override
    public boolean hasNext() {
        return position < input.length();
    }

    @Override
    public NewickToken next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens at position " + position);
        }
        int start = position;
        boolean separator = isSeparator(input.charAt(position));
        while (position < input.length() && isSeparator(input.charAt(position)) == separator) {
            position++;
        }
        return new NewickToken(input.substring(start, position), separator);
    }
}
