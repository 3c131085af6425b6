package io.issuebridge.client;

public class TransitionNotFoundException extends TrackerException {
    private final String issueKey;
    private final String requested;

    public TransitionNotFoundException(String issueKey, String requested) {
        super(
                Kind.TRANSITION_NOT_FOUND,
                "Transition '" + requested + "' not found for issue " + issueKey,
                400,
                false
        );
        this.issueKey = issueKey;
        this.requested = requested;
    }

    public String issueKey() {
        return issueKey;
    }

    public String requested() {
        return requested;
    }
}
