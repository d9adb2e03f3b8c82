package io.rtmmirror.model;

/**
 * Test case step. {@code stepUid} is assigned by the store; callers may leave it null.
 */
public record Step(int groupNo, int orderNo, String action, String input, String expected, String stepUid) {
    public Step {
        action = action == null ? "" : action;
        input = input == null ? "" : input;
        expected = expected == null ? "" : expected;
    }

    public Step(int groupNo, int orderNo, String action, String input, String expected) {
        this(groupNo, orderNo, action, input, expected, null);
    }

    public Step withStepUid(String value) {
        return new Step(groupNo, orderNo, action, input, expected, value);
    }

    public boolean sameContent(Step other) {
        return other != null
                && action.equals(other.action)
                && input.equals(other.input)
                && expected.equals(other.expected);
    }
}
