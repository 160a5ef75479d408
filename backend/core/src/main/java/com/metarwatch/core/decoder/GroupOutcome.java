package com.metarwatch.core.decoder;

/**
 * What a group decoder did with the current token: whether it consumed it and how many
 * group kinds the dispatcher should move past.
 */
record GroupOutcome(boolean consumed, int groupAdvance) {
    static final GroupOutcome NO_MATCH = new GroupOutcome(false, 1);
    static final GroupOutcome CONSUMED = new GroupOutcome(true, 1);
    static final GroupOutcome CONSUMED_REPEAT = new GroupOutcome(true, 0);

    GroupOutcome {
        if (groupAdvance < 0) {
            throw new IllegalArgumentException("groupAdvance must not be negative");
        }
        if (!consumed && groupAdvance == 0) {
            throw new IllegalArgumentException("an outcome must consume a token or advance the group");
        }
    }

    static GroupOutcome consumedSkipping(int groupAdvance) {
        return new GroupOutcome(true, groupAdvance);
    }
}
