package cn.edu.zju.daily.metricguard.incremental;

import cn.edu.zju.daily.metricguard.config.Parameters;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class StateStores {

    /**
     * A {@link FileSystemStateStore} under {@code stateStoreDirectory}, or an {@link
     * InMemoryStateStore} when the directory is unset.
     */
    public static StateStore fromParameters(Parameters params) {
        String directory = params.getStateStoreDirectory();
        if (StringUtils.isBlank(directory)) {
            LOG.info("No state store directory configured, keeping states in memory");
            return new InMemoryStateStore();
        }
        LOG.info("Keeping states under {}", directory);
        return new FileSystemStateStore(Paths.get(directory.trim()));
    }
}
