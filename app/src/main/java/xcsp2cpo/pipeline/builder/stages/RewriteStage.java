package xcsp2cpo.pipeline.builder.stages;

import java.util.Objects;
import xcsp2cpo.core.TargetVocabulary;
import xcsp2cpo.pipeline.builder.TransformContext;
import xcsp2cpo.pipeline.builder.TransformStage;
import xcsp2cpo.rewrite.ExpressionRewriter;

/** Canonicalizes every expression of the decomposed instance. */
public final class RewriteStage implements TransformStage {
  public static final String NAME = "rewrite";

  private final ExpressionRewriter rewriter;

  public RewriteStage(TargetVocabulary vocabulary) {
    this(new ExpressionRewriter(vocabulary));
  }

  public RewriteStage(ExpressionRewriter rewriter) {
    this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void execute(TransformContext context) {
    Objects.requireNonNull(context, "context");
    context.applyRewrite(rewriter.rewrite(context.instance()));
  }
}
