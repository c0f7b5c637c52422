package cn.edu.zju.daily.metricguard.profiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/** Profiles of the columns that could be profiled and errors for the others. */
@Getter
@ToString
public final class ProfilingReport {

    private final String table;
    private final List<ColumnProfile> profiles;
    private final List<ColumnProfileError> errors;

    public ProfilingReport(
            String table, List<ColumnProfile> profiles, List<ColumnProfileError> errors) {
        this.table = table;
        this.profiles = Collections.unmodifiableList(new ArrayList<>(profiles));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public Optional<ColumnProfile> getProfile(String column) {
        return profiles.stream().filter(p -> p.getColumnName().equals(column)).findFirst();
    }

    public List<ColumnProfileError> getErrors(String column) {
        List<ColumnProfileError> result = new ArrayList<>();
        for (ColumnProfileError error : errors) {
            if (error.getColumn().equals(column)) {
                result.add(error);
            }
        }
        return result;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
