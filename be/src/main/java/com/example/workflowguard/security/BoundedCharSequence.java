package com.example.workflowguard.security;

/**
 * Char sequence that stops a regex match once it has read more characters than its budget allows.
 * Backtracking-heavy patterns read the same characters many times, so the budget caps matching cost.
 */
final class BoundedCharSequence implements CharSequence {

    private final CharSequence text;
    private final long budget;
    private long reads;

    BoundedCharSequence(CharSequence text, long budget) {
        this.text = text;
        this.budget = budget;
    }

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public char charAt(int index) {
        if (++reads > budget) {
            throw new MatchBudgetExceededException(budget);
        }
        return text.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return text.subSequence(start, end);
    }

    @Override
    public String toString() {
        return text.toString();
    }

    static final class MatchBudgetExceededException extends RuntimeException {

        MatchBudgetExceededException(long budget) {
            super("Pattern match exceeded budget of " + budget + " character reads");
        }
    }
}
