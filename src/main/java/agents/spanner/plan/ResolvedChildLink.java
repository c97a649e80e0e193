package agents.spanner.plan;

/**
 * A child link of a plan row, resolved to the short description of the child it points at.
 */
public class ResolvedChildLink {

    private final String variableName;
    private final String childDescription;

    public ResolvedChildLink(String variableName, String childDescription) {
        this.variableName = variableName != null ? variableName : "";
        this.childDescription = childDescription != null ? childDescription : "";
    }

    /**
     * Binding name under which the child's result is exposed to the parent, empty if unbound
     */
    public String getVariableName() {
        return variableName;
    }

    public String getChildDescription() {
        return childDescription;
    }

    @Override
    public String toString() {
        return "ResolvedChildLink{variableName='" + variableName + "', childDescription='" + childDescription + "'}";
    }
}
