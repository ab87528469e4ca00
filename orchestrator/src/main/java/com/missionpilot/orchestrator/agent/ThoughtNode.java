package com.missionpilot.orchestrator.agent;

import com.missionpilot.orchestrator.reasoning.Thought;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * A node of the Tree-of-Thoughts search. Ephemeral: lives for one search.
 */
public final class ThoughtNode {

    private final int         id;
    private final ThoughtNode parent;
    private final Thought     thought;
    private final double      score;
    private final int         depth;
    private boolean           executed;
    private StepResult        outcome;

    private ThoughtNode(int id, ThoughtNode parent, Thought thought, double score, int depth) {
        this.id      = id;
        this.parent  = parent;
        this.thought = thought;
        this.score   = score;
        this.depth   = depth;
    }

    static ThoughtNode root() {
        return new ThoughtNode(0, null, null, 0.0, 0);
    }

    ThoughtNode child(int id, Thought thought, double score) {
        return new ThoughtNode(id, this, thought, score, depth + 1);
    }

    public int         id()       { return id; }
    public Integer     parentId() { return parent == null ? null : parent.id; }
    public Thought     thought()  { return thought; }
    public String      text()     { return thought == null ? "(root)" : thought.text(); }
    public double      score()    { return score; }
    public int         depth()    { return depth; }
    public boolean     executed() { return executed; }
    public StepResult  outcome()  { return outcome; }

    /**
     * Claim this node for execution.
     *
     * @return false if it was executed before; each node runs its action at most once
     */
    boolean markExecuted() {
        if (executed) return false;
        executed = true;
        return true;
    }

    void recordOutcome(StepResult result) {
        this.outcome = result;
    }

    /** Nodes from the first level down to this one (the root excluded). */
    public List<ThoughtNode> path() {
        Deque<ThoughtNode> out = new ArrayDeque<>();
        for (ThoughtNode n = this; n != null && n.parent != null; n = n.parent) {
            out.addFirst(n);
        }
        return List.copyOf(out);
    }

    List<Thought> thoughtPath() {
        return path().stream().map(ThoughtNode::thought).toList();
    }

    @Override
    public String toString() {
        return "ThoughtNode#" + id + "(depth " + depth + ", score " + score + ")";
    }
}
