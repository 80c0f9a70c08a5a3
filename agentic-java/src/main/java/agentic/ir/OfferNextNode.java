package agentic.ir;

import java.util.List;

public record OfferNextNode(List<Route> routes) implements CommandContent, AgentContent, SubComponentContent {

    /** {@code description} and {@code path} may be null. */
    public record Route(String name, String description, String path) {
        public Route {
            if (name == null || name.isEmpty()) {
                throw new IrValidationException("OfferNext route requires a name");
            }
        }
    }

    public OfferNextNode {
        routes = List.copyOf(routes);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OFFER_NEXT;
    }
}
