package cn.edu.zju.daily.metricguard.analyzer.advanced;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.DataTypeState;
import cn.edu.zju.daily.metricguard.profiler.DetectedDataType;
import cn.edu.zju.daily.metricguard.profiler.TypeInferenceEngine;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Share of each detected type among the non-null values of a column. */
public class DataTypeAnalyzer extends AbstractAnalyzer<DataTypeState> {

    public static final String NAME = "data_type";

    private final TypeInferenceEngine inference = new TypeInferenceEngine();

    public DataTypeAnalyzer(String column) {
        super(NAME, column, DataTypeState.class);
    }

    @Override
    public CompletableFuture<DataTypeState> computeState(ExecutionContext context) {
        Map<String, Long> counts = new HashMap<>();
        return scan(
                        context,
                        row -> {
                            if (row[0] != null) {
                                DetectedDataType type = inference.classify(row[0]);
                                if (type != DetectedDataType.UNKNOWN) {
                                    counts.merge(type.name(), 1L, Long::sum);
                                }
                            }
                        })
                .thenApply(n -> new DataTypeState(counts));
    }

    @Override
    public DataTypeState emptyState() {
        return DataTypeState.EMPTY;
    }
}
