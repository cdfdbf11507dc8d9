package com.liquiditysentinel.core.derived;

import com.liquiditysentinel.core.model.TimeSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Maps a value series onto labelled bands and a continuous 0-100 score.
 *
 * <h3>Labelling</h3>
 * <p>
 * Bands are ordered by increasing lower bound. A value takes the label of the
 * last band whose lower bound it reaches, so at a shared boundary the higher
 * band wins. Values below the first bound fall into the first band.
 * </p>
 *
 * <h3>Scoring</h3>
 * <p>
 * Within its band a value is rescaled linearly from
 * {@code [lowerBound, nextLowerBound)} onto {@code [scoreFloor, scoreCeiling]};
 * the last band runs up to {@code upperBound}. The result is clamped to the
 * band's score range. Missing values yield no label and a {@code NaN} score.
 * </p>
 *
 * @since 1.0.0
 */
public final class PiecewiseScorer {

    private final List<ScoreBand> bands;
    private final double upperBound;

    /**
     * @param bands      bands in strictly increasing lower-bound order
     * @param upperBound value mapped to the last band's score ceiling
     * @throws IllegalArgumentException if no band is given, bounds are not
     *                                  increasing, or {@code upperBound} does
     *                                  not exceed the last lower bound
     */
    public PiecewiseScorer(List<ScoreBand> bands, double upperBound) {
        Objects.requireNonNull(bands, "bands must not be null");
        if (bands.isEmpty()) {
            throw new IllegalArgumentException("At least one band is required");
        }
        for (int i = 1; i < bands.size(); i++) {
            if (!(bands.get(i).getLowerBound() > bands.get(i - 1).getLowerBound())) {
                throw new IllegalArgumentException("Band lower bounds must be strictly increasing: "
                        + bands.get(i - 1) + " -> " + bands.get(i));
            }
        }
        if (!(upperBound > bands.get(bands.size() - 1).getLowerBound())) {
            throw new IllegalArgumentException("Upper bound " + upperBound
                    + " must exceed the last band's lower bound");
        }
        this.bands = List.copyOf(bands);
        this.upperBound = upperBound;
    }

    public List<ScoreBand> getBands() {
        return bands;
    }

    public double getUpperBound() {
        return upperBound;
    }

    /**
     * @param value the value to classify
     * @return index of the band {@code value} falls in, or -1 for {@code NaN}
     */
    public int bandIndex(double value) {
        if (Double.isNaN(value)) {
            return -1;
        }
        int index = 0;
        for (int i = 0; i < bands.size(); i++) {
            if (value >= bands.get(i).getLowerBound()) {
                index = i;
            }
        }
        return index;
    }

    /**
     * @param value the value to classify
     * @return band label, or {@code null} for {@code NaN}
     */
    public String label(double value) {
        int index = bandIndex(value);
        return index < 0 ? null : bands.get(index).getLabel();
    }

    /**
     * @param value the value to score
     * @return score within the band's range, or {@code NaN}
     */
    public double score(double value) {
        int index = bandIndex(value);
        if (index < 0) {
            return Double.NaN;
        }
        ScoreBand band = bands.get(index);
        double lower = band.getLowerBound();
        double upper = index + 1 < bands.size() ? bands.get(index + 1).getLowerBound() : upperBound;
        double span = upper - lower;
        if (!(span > 0)) {
            return Double.NaN;
        }
        double scaled = band.getScoreFloor()
                + (value - lower) / span * (band.getScoreCeiling() - band.getScoreFloor());
        return Math.max(band.getScoreFloor(), Math.min(band.getScoreCeiling(), scaled));
    }

    /**
     * @param series input series
     * @return one label per observation, {@code null} where the value is missing
     */
    public List<String> labels(TimeSeries series) {
        List<String> out = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            out.add(label(series.valueAt(i)));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * @param series input series
     * @param name   name of the score series
     * @return score series on the input's index
     */
    public TimeSeries scores(TimeSeries series, String name) {
        double[] out = new double[series.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = score(series.valueAt(i));
        }
        return series.withValues(name, out);
    }
}
