package smv.model.smv.builder;

public abstract class SectionContributionVisitor<T, E extends Throwable> {
	public abstract T visit(SectionContribution.Text text) throws E;
	public abstract T visit(SectionContribution.Mapping mapping) throws E;
	public abstract T visit(SectionContribution.Listing listing) throws E;
	public abstract T visit(SectionContribution.Single single) throws E;
}
