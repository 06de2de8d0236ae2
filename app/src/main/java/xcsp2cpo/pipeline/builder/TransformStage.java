package xcsp2cpo.pipeline.builder;

/**
 * Step of the transformation run by {@link TransformBuilder} over the mutable {@link
 * TransformContext}.
 */
public interface TransformStage {

  /** Key under which the stage's duration is reported. */
  String name();

  void execute(TransformContext context);
}
