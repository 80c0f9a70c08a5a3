package agentic.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Handle to a value that only exists in the external runtime. Every access step returns a
 * new handle with the path extended; the handle itself never changes.
 */
public record RuntimeVar(String name, List<String> path) {
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public RuntimeVar {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IrValidationException("Invalid runtime variable name: '" + name + "'");
        }
        path = List.copyOf(path);
    }

    public static RuntimeVar of(String name) {
        return new RuntimeVar(name, List.of());
    }

    public RuntimeVar field(String field) {
        List<String> next = new ArrayList<>(path);
        next.add(field);
        return new RuntimeVar(name, next);
    }

    public RuntimeVar index(int index) {
        if (index < 0) {
            throw new IrValidationException("Negative index " + index + " on runtime variable " + name);
        }
        return field(Integer.toString(index));
    }

    /** {@code .data.items[0].name}; numeric segments render as indices with no separator. */
    public String renderPath() {
        StringBuilder sb = new StringBuilder();
        for (String segment : path) {
            if (isIndex(segment)) sb.append('[').append(segment).append(']');
            else sb.append('.').append(segment);
        }
        return sb.toString();
    }

    /** Shell-style reference used in prose: {@code $CTX.user.name}. */
    public String reference() {
        return "$" + name + renderPath();
    }

    /** jq extraction of the path from the variable's JSON value. */
    public String jq() {
        String p = path.isEmpty() ? "." : renderPath();
        return "$(echo \"$" + name + "\" | jq -r '" + p + "')";
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty()) return false;
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) return false;
        }
        return true;
    }
}
