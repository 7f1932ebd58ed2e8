package last.transmission.optimizer;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import last.transmission.TestUtils;
import last.transmission.input.CalibratorDataset;
import last.transmission.model.ParameterSet;
import last.transmission.solver.ExitStatus;
import last.transmission.solver.SolverDiagnostics;
import last.transmission.stage.SolverMethod;
import org.junit.Test;

public class OptimizerStateTest {

  private static OptimizationResult result(String stage, ParameterSet optimal, ExitStatus status,
      CalibratorDataset dataset) {
    double[] residuals = new double[dataset.size()];
    return new OptimizationResult(stage, SolverMethod.NONLINEAR, optimal, ParameterSet.empty(),
        0., status, SolverDiagnostics.builder().message("test").build(), residuals, residuals,
        dataset);
  }

  @Test
  public void afterStage_successMergesLaterWins() {
    CalibratorDataset dataset = TestUtils.datasetWithFluxes(new double[]{1., 2., 3.});
    OptimizerState state = OptimizerState.initial(dataset)
        .afterStage(result("A", ParameterSet.of("Norm_", 0.7), ExitStatus.CONVERGED, dataset),
            false)
        .afterStage(result("B", ParameterSet.of("Norm_", 0.8).with("Center", 560.),
            ExitStatus.CONVERGED_WITH_CLIPPING, dataset), false);

    assertEquals(2, state.getStageIndex());
    assertEquals(0.8, state.getAccumulatedParams().get("Norm_"), 0.);
    assertEquals(560., state.getAccumulatedParams().get("Center"), 0.);
    List<OptimizationResult> history = state.export().getPerStageResults();
    assertEquals(2, history.size());
    assertEquals("A", history.get(0).getStageName());
    assertEquals("B", history.get(1).getStageName());
    assertTrue(state.getFailedResults().isEmpty());
    assertFalse(state.export().hasFailures());
  }

  @Test
  public void afterStage_failureKeepsEarlierValues() {
    CalibratorDataset dataset = TestUtils.datasetWithFluxes(new double[]{1., 2., 3.});
    OptimizerState state = OptimizerState.initial(dataset)
        .afterStage(result("Offset", ParameterSet.of("kx0", 0.02), ExitStatus.CONVERGED,
            dataset), false)
        .afterStage(result("Degenerate", ParameterSet.of("kx0", 0.).with("ky0", 0.),
            ExitStatus.FAILED, dataset), false)
        .afterStage(result("Budget", ParameterSet.of("Norm_", 0.9),
            ExitStatus.MAX_EVALUATIONS, dataset), false);

    ParameterSet accumulated = state.getAccumulatedParams();
    assertEquals(0.02, accumulated.get("kx0"), 0.);
    assertEquals(0., accumulated.get("ky0"), 0.);
    assertEquals(0.9, accumulated.get("Norm_"), 0.);
    assertEquals(2, state.getFailedResults().size());

    OptimizationExport export = state.export();
    assertEquals(Arrays.asList("Degenerate", "Budget"), export.getFailedStages());
    assertTrue(export.hasFailures());
    assertEquals(accumulated, export.getFinalParameterSet());
  }

  @Test
  public void afterStage_budgetExhausted_overwritesAccumulatedValue() {
    CalibratorDataset dataset = TestUtils.datasetWithFluxes(new double[]{1., 2., 3.});
    OptimizerState state = OptimizerState.initial(dataset)
        .afterStage(result("First", ParameterSet.of("Norm_", 0.7).with("kx0", 0.02),
            ExitStatus.CONVERGED, dataset), false)
        .afterStage(result("Refine", ParameterSet.of("Norm_", 0.85),
            ExitStatus.MAX_EVALUATIONS, dataset), false)
        .afterStage(result("Degenerate", ParameterSet.of("Norm_", 0.).with("kx0", 0.),
            ExitStatus.FAILED, dataset), false);

    assertEquals(0.85, state.getAccumulatedParams().get("Norm_"), 0.);
    assertEquals(0.02, state.getAccumulatedParams().get("kx0"), 0.);
    assertEquals(Arrays.asList("Refine", "Degenerate"), state.export().getFailedStages());
  }

  @Test
  public void afterStage_datasetReplacedOnlyWhenClipping() {
    CalibratorDataset full = TestUtils.datasetWithFluxes(new double[]{1., 2., 3.});
    CalibratorDataset clipped = full.filter(new boolean[]{false, true, false});
    OptimizerState initial = OptimizerState.initial(full);

    OptimizerState unclipped = initial.afterStage(
        result("A", ParameterSet.of("Norm_", 1.), ExitStatus.CONVERGED, clipped), false);
    assertSame(full, unclipped.getDataset());

    OptimizerState reduced = initial.afterStage(
        result("A", ParameterSet.of("Norm_", 1.), ExitStatus.CONVERGED_WITH_CLIPPING, clipped),
        true);
    assertSame(clipped, reduced.getDataset());
    assertSame(clipped, reduced.export().getFinalCalibratorDataset());

    // transitions never modify the source state
    assertEquals(0, initial.getStageIndex());
    assertTrue(initial.getAccumulatedParams().isEmpty());
    assertSame(full, initial.getDataset());
  }

  @Test
  public void empty_hasNoCalibrators() {
    OptimizerState state = OptimizerState.empty();
    assertTrue(state.getDataset().isEmpty());
    assertTrue(state.getResults().isEmpty());
    assertTrue(state.export().getFailedStages().isEmpty());
  }

}
