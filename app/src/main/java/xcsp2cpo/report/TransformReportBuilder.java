package xcsp2cpo.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import xcsp2cpo.core.TransformResult;
import xcsp2cpo.core.constraint.Constraint;
import xcsp2cpo.core.diagnostics.Diagnostic;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.normalize.CellNames;
import xcsp2cpo.normalize.CellNames.CellAddress;

/** Renders a {@link TransformResult} as a JSON document for logs and tooling. */
public final class TransformReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  public String build(TransformResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(result));
    root.put("incomplete", result.incomplete());
    root.put("variables", variables(result.instance()));
    root.put("constraint_kinds", constraintKinds(result.instance()));
    root.put("stages_ms", result.stageMillis());
    if (result.hasDiagnostics()) {
      root.put("diagnostics", diagnosticSummaries(result.diagnostics()));
    }
    return gson.toJson(root);
  }

  private Map<String, Object> meta(TransformResult result) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("mode", result.mode().name().toLowerCase(Locale.ROOT));
    meta.put("time_ms", result.elapsedMillis());
    meta.put("problem_type", result.instance().problemType().name());
    meta.put("variable_count", result.instance().variables().size());
    meta.put("constraint_count", result.instance().constraints().size());
    return meta;
  }

  /** Scalar variables, and array cells counted per originating array. */
  private Map<String, Object> variables(Instance instance) {
    int scalars = 0;
    Map<String, Integer> cells = new LinkedHashMap<>();
    for (String id : instance.variables().keySet()) {
      Optional<CellAddress> address = CellNames.parse(id);
      if (address.isPresent()) {
        cells.merge(address.get().arrayId(), 1, Integer::sum);
      } else {
        scalars++;
      }
    }
    Map<String, Object> variables = new LinkedHashMap<>();
    variables.put("scalars", scalars);
    variables.put("array_cells", cells);
    return variables;
  }

  private Map<String, Integer> constraintKinds(Instance instance) {
    Map<String, Integer> counts = new TreeMap<>();
    for (Constraint constraint : instance.constraints()) {
      counts.merge(constraint.kind().xcspName(), 1, Integer::sum);
    }
    return counts;
  }

  private List<Map<String, Object>> diagnosticSummaries(List<Diagnostic> diagnostics) {
    List<Map<String, Object>> summaries = new ArrayList<>();
    for (Diagnostic diagnostic : diagnostics) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("ref", diagnostic.constraintRef());
      map.put("kind", diagnostic.kind().name());
      map.put("message", diagnostic.message());
      if (!diagnostic.attributes().isEmpty()) {
        map.put("attributes", new TreeMap<>(diagnostic.attributes()));
      }
      summaries.add(map);
    }
    return summaries;
  }
}
