package cn.edu.zju.daily.metricguard.anomaly;

import cn.edu.zju.daily.metricguard.config.Parameters;
import java.time.Duration;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class AnomalyDetectionConfig {

    /** Findings below this confidence are dropped. */
    private double minConfidence = 0.5;

    private Duration historyWindow = Duration.ofDays(30);

    /** Most recent points handed to detectors. */
    private int historyLimit = 100;

    private boolean storeCurrentMetrics = true;

    public static AnomalyDetectionConfig fromParameters(Parameters params) {
        AnomalyDetectionConfig config = new AnomalyDetectionConfig();
        config.setMinConfidence(params.getMinConfidence());
        config.setHistoryWindow(Duration.ofDays(params.getHistoryWindowDays()));
        config.setHistoryLimit(params.getHistoryLimit());
        config.setStoreCurrentMetrics(params.isStoreCurrentMetrics());
        return config;
    }
}
