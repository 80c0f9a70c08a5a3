package agentic.ir;

import java.util.regex.Pattern;

/**
 * Shell assignment of a declared variable. {@code content} is the command for {@link Source#BASH},
 * the literal for {@link Source#VALUE} and the environment variable name for {@link Source#ENV}.
 * {@code blankBefore} only matters inside an {@link AssignGroupNode}.
 */
public record AssignNode(RuntimeVar variable, Source source, String content, String comment, boolean blankBefore)
        implements CommandContent, AgentContent, SubComponentContent {
    private static final Pattern ENV_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public enum Source { BASH, VALUE, ENV }

    public AssignNode {
        if (variable == null || !variable.path().isEmpty()) {
            throw new IrValidationException("Assign target must be a whole variable");
        }
        if (source == null || content == null) {
            throw new IrValidationException("Assign to " + variable.name() + " requires a source");
        }
        if (source == Source.BASH && content.isBlank()) {
            throw new IrValidationException("Assign to " + variable.name() + " has an empty bash command");
        }
        if (source == Source.ENV && !ENV_NAME.matcher(content).matches()) {
            throw new IrValidationException("Invalid environment variable name: '" + content + "'");
        }
    }

    public AssignNode withBlankBefore() {
        return new AssignNode(variable, source, content, comment, true);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGN;
    }
}
