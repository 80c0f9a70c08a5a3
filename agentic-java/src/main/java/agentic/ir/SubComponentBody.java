package agentic.ir;

import java.util.ArrayList;
import java.util.List;

/** Content returned by a composed component, restricted to {@link SubComponentContent}. */
public record SubComponentBody(List<SubComponentContent> children) {
    public SubComponentBody {
        children = List.copyOf(children);
        ContentContext.SUB_COMPONENT.validate(children);
    }

    public static SubComponentBody of(List<? extends BlockNode> nodes) {
        ContentContext.SUB_COMPONENT.validate(nodes);
        List<SubComponentContent> typed = new ArrayList<>(nodes.size());
        for (BlockNode n : nodes) {
            typed.add((SubComponentContent) n);
        }
        return new SubComponentBody(typed);
    }
}
