package mixfix.trans.passes.pattern;

import mixfix.elaborator.Elaborator;
import mixfix.elaborator.GlobalEnvironment;
import mixfix.errors.Issue;
import mixfix.errors.IssueContext;
import mixfix.model.notation.NotationVariable;
import mixfix.model.term.MetaCollectingVisitor;
import mixfix.model.term.Term;
import mixfix.model.term.TermMeta;

import java.util.*;

/**
 * Compiles a notation's example term, written with the holes as ordinary variables, into a {@link MacroPattern}.
 * The example is elaborated once, here; applying the pattern later is plain substitution.
 */
public class MacroPatternBuildingPass {
	private MacroPatternBuildingPass() {}

	public static Optional<MacroPattern> perform(IssueContext ctx, Elaborator elaborator, GlobalEnvironment env,
	                                             Term example, List<NotationVariable> holes) {
		Set<Integer> metas = new TreeSet<>();
		example.accept(new MetaCollectingVisitor(metas));
		if (!metas.isEmpty()) {
			ctx.error(new UnexpectedMetavariableIssue(new TermMeta(metas.iterator().next())));
			return Optional.empty();
		}

		List<String> names = new ArrayList<>();
		Map<String, Integer> indices = new LinkedHashMap<>();
		for (NotationVariable hole : holes) {
			names.add(hole.getName());
			indices.put(hole.getName(), hole.getIndex());
		}

		Term resolved;
		Term interpretation;
		HoleToMetaRewritingVisitor rewriter = new HoleToMetaRewritingVisitor(indices);
		try {
			resolved = elaborator.elaborate(env, names, example);
			interpretation = resolved.accept(rewriter);
		} catch (Issue issue) {
			ctx.error(issue);
			return Optional.empty();
		}

		boolean unbound = false;
		for (String name : names) {
			if (!rewriter.getUsed().contains(name)) {
				ctx.error(new UnboundHoleIssue(name));
				unbound = true;
			}
		}
		if (unbound) {
			return Optional.empty();
		}
		return Optional.of(new MacroPattern(interpretation, elaborator.reify(env, interpretation)));
	}
}
