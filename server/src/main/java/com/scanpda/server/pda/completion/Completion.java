package com.scanpda.server.pda.completion;

import com.scanpda.server.grammar.Terminal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Completion {
    private final List<Terminal> suffix;
    private final List<Terminal> completedSequence;
    private final boolean verified;

    public Completion(List<Terminal> suffix, List<Terminal> completedSequence, boolean verified) {
        this.suffix = Collections.unmodifiableList(new ArrayList<>(suffix));
        this.completedSequence = Collections.unmodifiableList(new ArrayList<>(completedSequence));
        this.verified = verified;
    }

    public List<Terminal> getSuffix() {
        return suffix;
    }

    public List<Terminal> getCompletedSequence() {
        return completedSequence;
    }

    /** True when the completed sequence was accepted on re-run. */
    public boolean isVerified() {
        return verified;
    }

    @Override
    public String toString() {
        return "Completion{suffix=" + suffix + ", verified=" + verified + '}';
    }
}
