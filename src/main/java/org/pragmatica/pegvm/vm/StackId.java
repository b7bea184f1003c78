package org.pragmatica.pegvm.vm;

/**
 * The two machine stacks an instruction can name.
 */
public enum StackId {
    /**
     * Saved input cursor positions, for backtracking.
     */
    POSITION(0, "pstack"),
    /**
     * Return addresses and repetition counters.
     */
    CALL(1, "cstack");

    private final int id;
    private final String shortName;

    StackId(int id, String shortName) {
        this.id = id;
        this.shortName = shortName;
    }

    public int id() {
        return id;
    }

    public String shortName() {
        return shortName;
    }

    public static StackId fromId(int id) {
        for (var stack : values()) {
            if (stack.id == id) {
                return stack;
            }
        }
        throw new IllegalArgumentException("Unknown stack id " + id);
    }
}
