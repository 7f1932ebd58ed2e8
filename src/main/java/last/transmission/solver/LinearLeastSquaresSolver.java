package last.transmission.solver;

import java.util.List;
import last.transmission.input.Calibrator;
import last.transmission.input.CalibratorDataset;
import last.transmission.model.DetectorGeometry;
import last.transmission.model.FieldCorrection;
import last.transmission.model.ModelEvaluation;
import last.transmission.model.ParameterSet;
import last.transmission.model.TransmissionParameter;
import last.transmission.optimizer.StageConfigurationException;
import last.transmission.stage.SolverMethod;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.log4j.Logger;

/**
 * Closed-form stage solver for the additive field-correction coefficients.
 *
 * Those coefficients add to each calibrator's magnitude difference through a known basis, so
 * with every free coefficient at zero the model gives a base residual vector b, and with
 * coefficients x the residuals are A x + b, where column j of the design matrix A is the basis
 * function of free coefficient j evaluated at each calibrator's normalized detector position.
 * This solver minimizes ||A x + b||^2 + lambda ||x||^2:
 * <ul>
 *   <li>lambda = 0: least squares through the singular value decomposition of A. A
 *   rank-deficient A, or one whose condition number exceeds {@link #MAX_CONDITION_NUMBER},
 *   gives {@link ExitStatus#FAILED} and zero coefficients.</li>
 *   <li>lambda &gt; 0: the regularized normal equations (A^T A + lambda I) x = -A^T b, by
 *   Cholesky decomposition with LU decomposition as a fallback.</li>
 * </ul>
 * The condition number of A is reported in either case. Fixed field terms keep their values in
 * the base residual.
 */
public class LinearLeastSquaresSolver extends ClippingStageSolver {

  private static final Logger logger = Logger.getLogger(LinearLeastSquaresSolver.class);

  /**
   * Condition number above which an unregularized design matrix is treated as rank deficient
   */
  public static final double MAX_CONDITION_NUMBER = 1e12;

  @Override
  protected SolverMethod getMethod() {
    return SolverMethod.LINEAR;
  }

  /**
   * Reject any free parameter that is not an additive field-correction term
   *
   * @param args Stage arguments
   * @throws StageConfigurationException If a free name is outside the linear vocabulary
   */
  @Override
  public void validate(SolverArgs args) {
    for (String name : args.getFreeNames()) {
      if (!TransmissionParameter.isLinearFieldTerm(name)) {
        throw new StageConfigurationException("Stage " + args.getStageName()
            + ": linear solver cannot optimize " + name
            + "; allowed parameters are " + FieldCorrection.additiveTerms());
      }
    }
  }

  @Override
  protected StageFit fit(SolverArgs args, CalibratorDataset dataset, ParameterSet start) {
    List<String> freeNames = args.getFreeNames();
    ParameterSet zeros = ParameterSet.fromArray(freeNames, new double[freeNames.size()]);

    ModelEvaluation base = evaluate(args, zeros, dataset);
    if (base == null) {
      return new StageFit(zeros, ExitStatus.FAILED, 0, 1, Double.NaN, -1, Double.NaN,
          "base residuals could not be evaluated");
    }
    RealVector b = new ArrayRealVector(base.getResiduals(), false);
    RealMatrix designMatrix = designMatrix(freeNames, dataset, args.getGeometry());
    int columns = freeNames.size();

    SingularValueDecomposition svd = new SingularValueDecomposition(designMatrix);
    double conditionNumber = svd.getConditionNumber();
    int rank = svd.getRank();
    double lambda = args.getRegularization();

    RealVector solution;
    if (lambda == 0.) {
      if (rank < columns || !(conditionNumber <= MAX_CONDITION_NUMBER)) {
        String message = "rank-deficient design matrix (rank " + rank + " of " + columns
            + ", condition number " + conditionNumber + ")";
        logger.warn(args.getStageName() + ": " + message);
        return new StageFit(zeros, ExitStatus.FAILED, 1, 1, conditionNumber, rank, Double.NaN,
            message);
      }
      solution = svd.getSolver().solve(b.mapMultiply(-1.));
    } else {
      RealMatrix normal = designMatrix.transpose().multiply(designMatrix)
          .add(MatrixUtils.createRealIdentityMatrix(columns).scalarMultiply(lambda));
      RealVector rhs = designMatrix.transpose().operate(b).mapMultiply(-1.);
      try {
        solution = new CholeskyDecomposition(normal).getSolver().solve(rhs);
      } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
        logger.debug(args.getStageName() + ": Cholesky failed, using LU (" + e.getMessage()
            + ")");
        try {
          solution = new LUDecomposition(normal).getSolver().solve(rhs);
        } catch (SingularMatrixException singular) {
          String message = "singular regularized normal equations";
          logger.warn(args.getStageName() + ": " + message);
          return new StageFit(zeros, ExitStatus.FAILED, 1, 1, conditionNumber, rank, Double.NaN,
              message);
        }
      }
    }

    RealVector fitted = designMatrix.operate(solution).add(b);
    double penalizedCost = fitted.dotProduct(fitted) + lambda * solution.dotProduct(solution);
    ParameterSet params = ParameterSet.fromArray(freeNames, solution.toArray());
    logger.debug(args.getStageName() + ": solved " + params + ", condition number "
        + conditionNumber);
    return new StageFit(params, ExitStatus.CONVERGED, 1, 1, conditionNumber, rank,
        penalizedCost, "");
  }

  /**
   * Build the design matrix of the additive field-correction basis
   *
   * @param freeNames Coefficient names, one column each
   * @param dataset Calibrators, one row each
   * @param geometry Detector geometry used to normalize positions
   * @return Matrix of basis values
   */
  public static RealMatrix designMatrix(List<String> freeNames, CalibratorDataset dataset,
      DetectorGeometry geometry) {
    double[][] rows = new double[dataset.size()][freeNames.size()];
    for (int i = 0; i < rows.length; ++i) {
      Calibrator calibrator = dataset.get(i);
      double x = geometry.normalize(calibrator.getX());
      double y = geometry.normalize(calibrator.getY());
      for (int j = 0; j < freeNames.size(); ++j) {
        rows[i][j] = FieldCorrection.basisValue(freeNames.get(j), x, y);
      }
    }
    return new Array2DRowRealMatrix(rows, false);
  }

}
