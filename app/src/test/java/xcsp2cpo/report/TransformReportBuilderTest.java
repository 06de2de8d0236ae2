package xcsp2cpo.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xcsp2cpo.testing.TestInstances.intVar;
import static xcsp2cpo.testing.TestInstances.refs;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.List;
import org.junit.jupiter.api.Test;
import xcsp2cpo.core.TransformResult;
import xcsp2cpo.core.constraint.AllDifferentConstraint;
import xcsp2cpo.core.constraint.UnsupportedConstraint;
import xcsp2cpo.core.expr.ArraySlice;
import xcsp2cpo.core.model.Domain;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.core.model.VariableArray;
import xcsp2cpo.pipeline.Pipeline;

final class TransformReportBuilderTest {

  @Test
  void reportSummarizesResultAndDiagnostics() {
    Instance instance =
        Instance.builder()
            .addVariable(intVar("s", 0, 1))
            .addArray(VariableArray.of("x", Domain.range(0, 2), 3))
            .addConstraint(AllDifferentConstraint.of(List.of(ArraySlice.of("x"))))
            .addConstraint(
                new UnsupportedConstraint("r1", "regular", refs(List.of(intVar("s", 0, 1)))))
            .build();
    TransformResult result = new Pipeline().transform(instance);

    JsonObject report =
        JsonParser.parseString(new TransformReportBuilder().build(result)).getAsJsonObject();

    JsonObject meta = report.getAsJsonObject("meta");
    assertEquals("full", meta.get("mode").getAsString(), "Mode");
    assertEquals("CSP", meta.get("problem_type").getAsString(), "No objective");
    assertEquals(4, meta.get("variable_count").getAsInt(), "Scalar plus three cells");
    assertTrue(report.get("incomplete").getAsBoolean(), "regular is unsupported");

    JsonObject variables = report.getAsJsonObject("variables");
    assertEquals(1, variables.get("scalars").getAsInt(), "One scalar");
    assertEquals(
        3, variables.getAsJsonObject("array_cells").get("x").getAsInt(), "Cells grouped by array");

    JsonObject kinds = report.getAsJsonObject("constraint_kinds");
    assertEquals(1, kinds.get("allDifferent").getAsInt(), "allDifferent counted");
    assertEquals(1, kinds.get("unsupported").getAsInt(), "Unsupported counted");

    JsonArray diagnostics = report.getAsJsonArray("diagnostics");
    assertEquals(1, diagnostics.size(), "One diagnostic");
    JsonObject diagnostic = diagnostics.get(0).getAsJsonObject();
    assertEquals("r1", diagnostic.get("ref").getAsString(), "Reference");
    assertEquals("UNSUPPORTED_CONSTRAINT", diagnostic.get("kind").getAsString(), "Kind");
    assertEquals(
        "regular",
        diagnostic.getAsJsonObject("attributes").get("rawKind").getAsString(),
        "Raw kind attribute");
    assertTrue(report.getAsJsonObject("stages_ms").has("rewrite"), "Stage timings present");
  }

  @Test
  void completeRunsOmitDiagnostics() {
    Instance instance = Instance.builder().addVariable(intVar("a", 0, 1)).build();

    TransformResult result = new Pipeline().transform(instance);

    JsonObject report =
        JsonParser.parseString(new TransformReportBuilder().build(result)).getAsJsonObject();

    assertFalse(report.has("diagnostics"), "No diagnostics section");
    assertFalse(report.get("incomplete").getAsBoolean(), "Complete");
  }
}
