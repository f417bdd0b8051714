package com.whosly.converter.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A column data type: a (possibly multi-word) name plus its arguments.
 *
 * Arguments are kept as text, so {@code VARCHAR(100 CHAR)} has the single argument {@code 100 CHAR}.
 */
public class DataTypeNode extends DdlNode {

    private final String name;
    private final List<String> arguments;

    public DataTypeNode(String name, List<String> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public DataTypeNode(String name) {
        this(name, Collections.emptyList());
    }

    public String getName() {
        return name;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public boolean hasArguments() {
        return !arguments.isEmpty();
    }

    public DataTypeNode withArguments(List<String> newArguments) {
        return new DataTypeNode(name, newArguments);
    }

    /**
     * Returns the leading integer of the first argument, e.g. 5000 for {@code VARCHAR(5000)}
     * or 100 for {@code VARCHAR(100 CHAR)}.
     *
     * @return the size, or null when the type has no numeric first argument
     */
    public Long getSize() {
        if (arguments.isEmpty()) {
            return null;
        }
        String first = arguments.get(0).trim();
        int end = 0;
        while (end < first.length() && Character.isDigit(first.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return null;
        }
        try {
            return Long.parseLong(first.substring(0, end));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return name;
        }
        return name + "(" + String.join(",", arguments) + ")";
    }
}
