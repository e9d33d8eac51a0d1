package com.github.micycle1.deblend;

import java.util.Objects;
import java.util.Properties;

import com.github.micycle1.deblend.data.MaskPlane;

/**
 * Immutable settings for one {@link NmfDeblender} run. Build with
 * {@link #builder()} or load from {@link Properties} with keys prefixed
 * {@value #PREFIX}.
 */
public final class DeblendParameters {

	public static final String PREFIX = "deblend.";

	private final int iterations;
	private final double beta;
	private final UpdateRule updateRule;
	private final boolean includeBackground;
	private final boolean offsetData;
	private final double stepW;
	private final double stepH;
	private final String constraints;
	private final boolean usePsf;
	private final int badPixelBits;

	private DeblendParameters(Builder b) {
		this.iterations = b.iterations;
		this.beta = b.beta;
		this.updateRule = b.updateRule;
		this.includeBackground = b.includeBackground;
		this.offsetData = b.offsetData;
		this.stepW = b.stepW;
		this.stepH = b.stepH;
		this.constraints = b.constraints;
		this.usePsf = b.usePsf;
		this.badPixelBits = b.badPixelBits;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static DeblendParameters defaults() {
		return builder().build();
	}

	/**
	 * Reads {@code deblend.iterations}, {@code deblend.beta},
	 * {@code deblend.updateRule}, {@code deblend.includeBackground},
	 * {@code deblend.offsetData}, {@code deblend.stepW}, {@code deblend.stepH},
	 * {@code deblend.constraints}, {@code deblend.usePsf} and
	 * {@code deblend.badPixelBits}. Missing keys keep their defaults.
	 *
	 * @throws IllegalArgumentException if a value cannot be parsed
	 */
	public static DeblendParameters fromProperties(Properties properties) {
		Objects.requireNonNull(properties, "properties must not be null");
		Builder b = builder();
		String v;
		if ((v = get(properties, "iterations")) != null) {
			b.iterations(parseInt("iterations", v));
		}
		if ((v = get(properties, "beta")) != null) {
			b.beta(parseDouble("beta", v));
		}
		if ((v = get(properties, "updateRule")) != null) {
			b.updateRule(UpdateRule.parse(v));
		}
		if ((v = get(properties, "includeBackground")) != null) {
			b.includeBackground(parseBoolean("includeBackground", v));
		}
		if ((v = get(properties, "offsetData")) != null) {
			b.offsetData(parseBoolean("offsetData", v));
		}
		if ((v = get(properties, "stepW")) != null) {
			b.stepW(parseDouble("stepW", v));
		}
		if ((v = get(properties, "stepH")) != null) {
			b.stepH(parseDouble("stepH", v));
		}
		if ((v = properties.getProperty(PREFIX + "constraints")) != null) {
			b.constraints(v); // not trimmed: ' ' is a valid constraint
		}
		if ((v = get(properties, "usePsf")) != null) {
			b.usePsf(parseBoolean("usePsf", v));
		}
		if ((v = get(properties, "badPixelBits")) != null) {
			b.badPixelBits(parseInt("badPixelBits", v));
		}
		return b.build();
	}

	private static String get(Properties p, String key) {
		String v = p.getProperty(PREFIX + key);
		return v == null ? null : v.trim();
	}

	private static int parseInt(String key, String v) {
		try {
			return Integer.parseInt(v);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": '" + v + "'", e);
		}
	}

	private static double parseDouble(String key, String v) {
		try {
			return Double.parseDouble(v);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": '" + v + "'", e);
		}
	}

	private static boolean parseBoolean(String key, String v) {
		if ("true".equalsIgnoreCase(v)) {
			return true;
		}
		if ("false".equalsIgnoreCase(v)) {
			return false;
		}
		throw new IllegalArgumentException("Invalid boolean for " + PREFIX + key + ": '" + v + "'");
	}

	public int getIterations() {
		return iterations;
	}

	public double getBeta() {
		return beta;
	}

	public UpdateRule getUpdateRule() {
		return updateRule;
	}

	public boolean isIncludeBackground() {
		return includeBackground;
	}

	public boolean isOffsetData() {
		return offsetData;
	}

	public double getStepW() {
		return stepW;
	}

	public double getStepH() {
		return stepH;
	}

	public String getConstraints() {
		return constraints;
	}

	public boolean isUsePsf() {
		return usePsf;
	}

	public int getBadPixelBits() {
		return badPixelBits;
	}

	public Builder toBuilder() {
		return builder().iterations(iterations).beta(beta).updateRule(updateRule).includeBackground(includeBackground).offsetData(offsetData)
				.stepW(stepW).stepH(stepH).constraints(constraints).usePsf(usePsf).badPixelBits(badPixelBits);
	}

	@Override
	public String toString() {
		return "DeblendParameters{iterations=" + iterations + ", beta=" + beta + ", updateRule=" + updateRule + ", includeBackground="
				+ includeBackground + ", offsetData=" + offsetData + ", stepW=" + stepW + ", stepH=" + stepH + ", constraints='" + constraints
				+ "', usePsf=" + usePsf + ", badPixelBits=" + badPixelBits + "}";
	}

	public static final class Builder {

		private int iterations = 200;
		private double beta = 0;
		private UpdateRule updateRule = UpdateRule.MULTIPLICATIVE;
		private boolean includeBackground = true;
		private boolean offsetData = true;
		private double stepW = SolverState.DEFAULT_STEP;
		private double stepH = SolverState.DEFAULT_STEP;
		private String constraints = "S";
		private boolean usePsf = false;
		private int badPixelBits = MaskPlane.badPixelBits();

		private Builder() {
		}

		public Builder iterations(int iterations) {
			this.iterations = iterations;
			return this;
		}

		public Builder beta(double beta) {
			this.beta = beta;
			return this;
		}

		public Builder updateRule(UpdateRule updateRule) {
			this.updateRule = updateRule;
			return this;
		}

		public Builder includeBackground(boolean includeBackground) {
			this.includeBackground = includeBackground;
			return this;
		}

		public Builder offsetData(boolean offsetData) {
			this.offsetData = offsetData;
			return this;
		}

		public Builder stepW(double stepW) {
			this.stepW = stepW;
			return this;
		}

		public Builder stepH(double stepH) {
			this.stepH = stepH;
			return this;
		}

		public Builder constraints(String constraints) {
			this.constraints = constraints;
			return this;
		}

		public Builder usePsf(boolean usePsf) {
			this.usePsf = usePsf;
			return this;
		}

		public Builder badPixelBits(int badPixelBits) {
			this.badPixelBits = badPixelBits;
			return this;
		}

		public DeblendParameters build() {
			if (iterations < 0) {
				throw new IllegalArgumentException("iterations must be >= 0, got " + iterations);
			}
			if (!(beta >= 0) || Double.isInfinite(beta)) {
				throw new IllegalArgumentException("beta must be finite and >= 0, got " + beta);
			}
			if (!(stepW > 0) || !(stepH > 0)) {
				throw new IllegalArgumentException("step sizes must be > 0, got " + stepW + ", " + stepH);
			}
			Objects.requireNonNull(updateRule, "updateRule must not be null");
			if (constraints == null || constraints.isEmpty()) {
				throw new IllegalArgumentException("constraints must not be empty");
			}
			return new DeblendParameters(this);
		}
	}
}
