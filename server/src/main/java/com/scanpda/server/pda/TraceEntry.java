package com.scanpda.server.pda;

import com.scanpda.server.grammar.Nonterminal;
import com.scanpda.server.grammar.Requirement;
import com.scanpda.server.grammar.Terminal;

/**
 * One step of a derivation.
 * <ul>
 * <li>PUSH: {@code nonterminal} is the frame opened, {@code parent} the frame below it.</li>
 * <li>POP: {@code nonterminal} is the frame closed, {@code parent} the frame it returns to.</li>
 * <li>SHIFT: {@code consumed} was matched inside the {@code nonterminal} frame.</li>
 * <li>SKIP: {@code nonterminal} is the occurrence passed over inside {@code parent}.</li>
 * </ul>
 * {@code depth} is the stack depth after the step.
 */
public class TraceEntry {

    private final int index;
    private final int inputPosition;
    private final Terminal consumed;
    private final Action action;
    private final Nonterminal nonterminal;
    private final Nonterminal parent;
    private final Requirement requirement;
    private final int depth;

    public TraceEntry(int index, int inputPosition, Terminal consumed, Action action, Nonterminal nonterminal,
            Nonterminal parent, Requirement requirement, int depth) {
        this.index = index;
        this.inputPosition = inputPosition;
        this.consumed = consumed;
        this.action = action;
        this.nonterminal = nonterminal;
        this.parent = parent;
        this.requirement = requirement;
        this.depth = depth;
    }

    public int getIndex() {
        return index;
    }

    public int getInputPosition() {
        return inputPosition;
    }

    public Terminal getConsumed() {
        return consumed;
    }

    public Action getAction() {
        return action;
    }

    public Nonterminal getNonterminal() {
        return nonterminal;
    }

    public Nonterminal getParent() {
        return parent;
    }

    public Requirement getRequirement() {
        return requirement;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%3d @%-3d %-5s", index, inputPosition, action));
        switch (action) {
            case SHIFT:
                sb.append(' ').append(consumed).append(" in ").append(nonterminal);
                break;
            case SKIP:
                sb.append(' ').append(nonterminal).append(" (").append(requirement).append(") in ").append(parent);
                break;
            default:
                sb.append(' ').append(nonterminal);
        }
        sb.append(" depth=").append(depth);
        return sb.toString();
    }
}
