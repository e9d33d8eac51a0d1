package com.github.micycle1.deblend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.deblend.data.MultibandData;
import com.github.micycle1.deblend.footprint.BBox;
import com.github.micycle1.deblend.footprint.Footprint;
import com.github.micycle1.deblend.footprint.TemplateImage;

/**
 * <p>
 * Deblends one footprint: shifts the data to non-negative values, seeds (W, H)
 * from the supplied templates, builds the symmetry penalty operators of the
 * constrained peaks, runs the configured update rule for a fixed number of
 * iterations and reconstructs per-source templates.
 * </p>
 *
 * <p>
 * Key usage pattern:
 * </p>
 * <ol>
 * <li>Construct with {@link DeblendParameters}.</li>
 * <li>Call {@link #deblend(Footprint, MultibandData, TemplateSource)} once per
 * footprint.</li>
 * <li>Read colors, intensities and templates from the {@link DeblendResult}.</li>
 * </ol>
 *
 * <p>
 * A deblender keeps no state between footprints, so independent footprints may
 * be deblended concurrently with one instance.
 * </p>
 */
public class NmfDeblender {

	private static final Logger LOGGER = LoggerFactory.getLogger(NmfDeblender.class);

	private final DeblendParameters parameters;

	public NmfDeblender(DeblendParameters parameters) {
		this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
	}

	public DeblendParameters getParameters() {
		return parameters;
	}

	public DeblendResult deblend(Footprint footprint, MultibandData data, TemplateSource templates) {
		Objects.requireNonNull(footprint, "footprint must not be null");
		Objects.requireNonNull(data, "data must not be null");
		Objects.requireNonNull(templates, "templates must not be null");
		return deblend(footprint, data, embedTemplates(footprint, data.getBandCount(), templates));
	}

	/**
	 * @param profiles per peak, its per-band profiles flattened over the
	 *                 footprint's bounding box
	 * @throws UnsupportedOperationException if the PSF operator or a monotonicity
	 *                                       constraint is requested
	 */
	public DeblendResult deblend(Footprint footprint, MultibandData data, List<double[][]> profiles) {
		Objects.requireNonNull(footprint, "footprint must not be null");
		Objects.requireNonNull(data, "data must not be null");
		Objects.requireNonNull(profiles, "profiles must not be null");
		if (parameters.isUsePsf()) {
			throw new UnsupportedOperationException("The PSF operator is not yet implemented");
		}
		BBox bbox = footprint.getBBox();
		if (data.getHeight() != bbox.getHeight() || data.getWidth() != bbox.getWidth()) {
			throw new IllegalArgumentException("Data is " + data.getWidth() + "x" + data.getHeight() + " but the footprint box is " + bbox.getWidth()
					+ "x" + bbox.getHeight());
		}
		final int peakCount = footprint.getPeaks().size();
		if (profiles.size() != peakCount) {
			throw new IllegalArgumentException("Got templates for " + profiles.size() + " peaks, footprint has " + peakCount);
		}

		List<Constraint> constraints = Constraint.parse(parameters.getConstraints(), peakCount);
		Map<Integer, DMatrixSparseCSC> diffOps = penaltyOperators(footprint, constraints);

		MultibandData fitData = parameters.isOffsetData() ? data.withPositivityOffset() : data;
		final double offset = fitData.getOffset();
		LOGGER.debug("Data offset {}", offset);
		DMatrixRMaj a = fitData.getData();

		final boolean bkg = parameters.isIncludeBackground();
		Factorization initial = InitialEstimator.estimate(a, profiles, bkg, offset);

		UpdateContext context = UpdateContext.of(parameters.getBeta(), diffOps, bkg);
		SolverState start = new SolverState(initial, parameters.getStepW(), parameters.getStepH());
		SolveResult solved = new FactorizationSolver(a, parameters.getUpdateRule(), context).solve(start, parameters.getIterations());

		Reconstruction reconstruction = new Reconstruction(solved.getFactorization(), a, offset, bkg, bbox);
		for (BandDiagnostics d : reconstruction.diagnostics()) {
			LOGGER.info("{} ({})", d, data.getBands().get(d.getBand()));
		}

		DMatrixRMaj variance = fitData.maskedVariance(parameters.getBadPixelBits()).orElse(null);
		return new DeblendResult(footprint, parameters, constraints, initial, solved, reconstruction, variance);
	}

	/**
	 * Penalty operators for the symmetry-constrained peaks, keyed by peak index.
	 *
	 * @throws UnsupportedOperationException for a monotonicity constraint
	 */
	static Map<Integer, DMatrixSparseCSC> penaltyOperators(Footprint footprint, List<Constraint> constraints) {
		BBox bbox = footprint.getBBox();
		Map<Integer, DMatrixSparseCSC> ops = new TreeMap<>();
		for (int k = 0; k < constraints.size(); k++) {
			switch (constraints.get(k)) {
				case SYMMETRY:
					DMatrixSparseCSC s = SymmetryOperators.peakOperator(bbox.getHeight(), bbox.getWidth(), footprint.relativeX(k), footprint.relativeY(k));
					ops.put(k, SymmetryOperators.diffOperator(s));
					break;
				case MONOTONICITY:
					throw new UnsupportedOperationException("The monotonicity operator is not yet implemented");
				case NONE:
				default:
					break;
			}
		}
		return ops;
	}

	static List<double[][]> embedTemplates(Footprint footprint, int bands, TemplateSource templates) {
		BBox bbox = footprint.getBBox();
		List<double[][]> profiles = new ArrayList<>();
		for (int k = 0; k < footprint.getPeaks().size(); k++) {
			List<TemplateImage> perBand = templates.templates(footprint, k);
			if (perBand == null || perBand.size() != bands) {
				throw new IllegalArgumentException("Peak " + k + " needs " + bands + " band templates, got " + (perBand == null ? 0 : perBand.size()));
			}
			double[][] flat = new double[bands][];
			for (int b = 0; b < bands; b++) {
				flat[b] = perBand.get(b).embedInto(bbox);
			}
			profiles.add(flat);
		}
		return Collections.unmodifiableList(profiles);
	}
}
