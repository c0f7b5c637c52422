package cn.edu.zju.daily.metricguard.profiler;

import cn.edu.zju.daily.metricguard.config.Parameters;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ProfilerConfig {

    public static final double[] DEFAULT_QUANTILES = {0.01, 0.05, 0.25, 0.5, 0.75, 0.95, 0.99};

    private int sampleSize = 10000;
    private long exactCardinalityThreshold = 10000;
    /** String columns with fewer distinct values than this are profiled as categorical. */
    private long categoricalCeiling = 100;
    private int histogramTopN = 20;
    private int patternSampleSize = 1000;
    private double typeConfidenceThreshold = TypeInferenceEngine.DEFAULT_CONFIDENCE_THRESHOLD;
    private int hllPrecision = 12;
    private int kllK = 200;
    private long seed = 0L;
    private double[] quantiles = DEFAULT_QUANTILES.clone();
    private double outlierIqrMultiplier = 1.5;
    private int maxSampleValues = 10;

    public static ProfilerConfig fromParameters(Parameters params) {
        ProfilerConfig config = new ProfilerConfig();
        config.setSampleSize(params.getProfilerSampleSize());
        config.setExactCardinalityThreshold(params.getExactCardinalityThreshold());
        config.setCategoricalCeiling(params.getCategoricalCeiling());
        config.setHistogramTopN(params.getHistogramTopN());
        config.setPatternSampleSize(params.getPatternSampleSize());
        config.setTypeConfidenceThreshold(params.getTypeConfidenceThreshold());
        config.setHllPrecision(params.getHllPrecision());
        config.setKllK(params.getKllK());
        config.setSeed(params.getRandomSeed());
        if (params.getQuantiles() != null && !params.getQuantiles().isEmpty()) {
            config.setQuantiles(
                    params.getQuantiles().stream().mapToDouble(Number::doubleValue).toArray());
        }
        config.setOutlierIqrMultiplier(params.getOutlierIqrMultiplier());
        config.setMaxSampleValues(params.getMaxSampleValues());
        return config;
    }

    public void validate() {
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("sampleSize must be positive");
        }
        if (histogramTopN <= 0) {
            throw new IllegalArgumentException("histogramTopN must be positive");
        }
        if (patternSampleSize <= 0) {
            throw new IllegalArgumentException("patternSampleSize must be positive");
        }
        for (double q : quantiles) {
            if (q < 0 || q > 1) {
                throw new IllegalArgumentException("Quantile must be in [0, 1], got " + q);
            }
        }
    }
}
