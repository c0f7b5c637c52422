package cn.edu.zju.daily.metricguard.profiler;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public final class ProfilerProgress {
    private final int pass;
    private final int totalPasses;
    private final String column;
    private final String message;
}
